package com.github.ylgrgyq.phsp;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * An existing file opened for read-modify-write of fixed-width regions. It never creates, truncates or
 * extends the file. Reads and writes are positional, so the channel position is never used.
 */
final class PatchableFile implements Closeable {
    static PatchableFile open(Path path, int maxRegionWidth) throws IOException {
        final FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        return new PatchableFile(path, channel, maxRegionWidth);
    }

    private final Path path;
    private final FileChannel channel;
    private final ByteBuffer regionBuffer;

    private PatchableFile(Path path, FileChannel channel, int maxRegionWidth) {
        this.path = path;
        this.channel = channel;
        this.regionBuffer = ByteBuffer.allocate(maxRegionWidth).order(ByteOrder.LITTLE_ENDIAN);
    }

    long size() throws IOException {
        return channel.size();
    }

    /**
     * Read {@code width} bytes at {@code offset}.
     *
     * @throws TruncatedException if the file ends before {@code offset + width}
     */
    ByteBuffer read(long offset, int width, String description) throws IOException {
        final ByteBuffer region = prepareRegion(width);
        ChannelUtils.readFullyOrFail(channel, region, offset, description);
        region.flip();
        return region;
    }

    /**
     * Read the {@code width} bytes at {@code offset}, let {@code patch} mutate them, and write them back
     * to the same offset.
     *
     * @throws TruncatedException if the file ends before {@code offset + width}
     */
    void patch(long offset, int width, RegionPatch patch) throws IOException {
        final ByteBuffer region = read(offset, width, "patch region at " + offset);
        patch.apply(region);
        region.rewind();
        ChannelUtils.writeFully(channel, region, offset);
    }

    void flush() throws IOException {
        channel.force(true);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "PatchableFile{" +
                "path=" + path +
                '}';
    }

    private ByteBuffer prepareRegion(int width) {
        if (width <= 0 || width > regionBuffer.capacity()) {
            throw new IllegalArgumentException("width: " + width +
                    " (expect: between 1 and " + regionBuffer.capacity() + ")");
        }
        regionBuffer.clear();
        regionBuffer.limit(width);
        return regionBuffer;
    }
}
