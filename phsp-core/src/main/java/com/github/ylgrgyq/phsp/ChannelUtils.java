package com.github.ylgrgyq.phsp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

final class ChannelUtils {
    private ChannelUtils() {}

    /**
     * Read from {@code channel} at {@code position} until {@code destinationBuffer} is full or end of
     * file is reached. The position of the channel itself is left untouched.
     *
     * @return the number of bytes read
     */
    static int readFully(FileChannel channel, ByteBuffer destinationBuffer, long position) throws IOException {
        if (position < 0) {
            throw new IllegalArgumentException("The file channel position cannot be negative, but it is " + position);
        }
        final int expectedReadBytes = destinationBuffer.remaining();
        long currentPosition = position;
        int bytesRead;
        do {
            bytesRead = channel.read(destinationBuffer, currentPosition);
            currentPosition += bytesRead;
        } while (bytesRead != -1 && destinationBuffer.hasRemaining());
        return expectedReadBytes - destinationBuffer.remaining();
    }

    /**
     * Like {@link #readFully(FileChannel, ByteBuffer, long)} but fails when end of file is reached
     * before {@code destinationBuffer} is full.
     *
     * @throws TruncatedException if the file ends before enough bytes were read
     */
    static void readFullyOrFail(FileChannel channel, ByteBuffer destinationBuffer, long position,
                                String description) throws IOException {
        final int expectedReadBytes = destinationBuffer.remaining();
        final int read = readFully(channel, destinationBuffer, position);
        if (read < expectedReadBytes) {
            throw new TruncatedException(description, expectedReadBytes, read);
        }
    }

    static void writeFully(FileChannel channel, ByteBuffer sourceBuffer, long position) throws IOException {
        if (position < 0) {
            throw new IllegalArgumentException("The file channel position cannot be negative, but it is " + position);
        }
        long currentPosition = position;
        while (sourceBuffer.hasRemaining()) {
            currentPosition += channel.write(sourceBuffer, currentPosition);
        }
    }

    static void writeFully(FileChannel channel, ByteBuffer sourceBuffer) throws IOException {
        while (sourceBuffer.hasRemaining()) {
            channel.write(sourceBuffer);
        }
    }
}
