package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;

/**
 * A record chunk input stream backed by a {@link FileChannel}. It reuses one buffer of
 * {@code chunkSize} records for every read, so a returned {@link RecordChunk} is only valid until the
 * next call to {@link #nextChunk()}.
 */
final class FileRecordChunkInputStream implements RecordChunkInputStream {
    private static final Logger logger = LoggerFactory.getLogger(FileRecordChunkInputStream.class);

    private final FileChannel channel;
    private final PhspFormat format;
    private final long declaredRecords;
    private final ByteBuffer chunkBuffer;
    private final int chunkSize;
    private long position;
    private long nextIndex;
    private long trailingBytes = -1;

    /**
     * Create a new chunk input stream over the FileChannel
     *
     * @param channel         Underlying channel, only positional reads are used on it
     * @param format          Layout of every record in the channel
     * @param declaredRecords Number of records the header declares
     * @param chunkSize       Maximum number of records read at once
     */
    FileRecordChunkInputStream(FileChannel channel, PhspFormat format, long declaredRecords, int chunkSize) {
        assert chunkSize > 0 : "chunkSize: " + chunkSize;
        this.channel = channel;
        this.format = format;
        this.declaredRecords = declaredRecords;
        this.chunkSize = chunkSize;
        this.chunkBuffer = ByteBuffer.allocate(chunkSize * format.recordSize()).order(ByteOrder.LITTLE_ENDIAN);
        this.position = format.recordRegionStart();
    }

    @Nullable
    @Override
    public RecordChunk nextChunk() throws IOException {
        if (nextIndex >= declaredRecords) {
            if (trailingBytes < 0) {
                trailingBytes = Math.max(0, channel.size() - position);
                logger.debug("Finished reading {} records, {} bytes left at end of file", nextIndex, trailingBytes);
            }
            return null;
        }

        final long recordsToRead = Math.min(chunkSize, declaredRecords - nextIndex);
        chunkBuffer.clear();
        chunkBuffer.limit((int) recordsToRead * format.recordSize());
        final int read = ChannelUtils.readFully(channel, chunkBuffer, position);
        final int completeRecords = read / format.recordSize();
        if (completeRecords == 0) {
            throw new RecordCountMismatchException(declaredRecords, nextIndex);
        }

        chunkBuffer.flip();
        chunkBuffer.limit(completeRecords * format.recordSize());
        final RecordChunk chunk = new RecordChunk(chunkBuffer, format, nextIndex);
        position += chunkBuffer.limit();
        nextIndex += completeRecords;
        return chunk;
    }

    /**
     * Number of bytes found after the last declared record, or -1 when not every declared record has been read.
     */
    long trailingBytes() {
        return trailingBytes;
    }
}
