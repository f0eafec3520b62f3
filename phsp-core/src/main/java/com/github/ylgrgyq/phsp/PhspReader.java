package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * Streaming reader of a phase-space file.
 * <p>
 * The header is decoded when the reader is opened. Records are exposed as a lazy, forward-only,
 * single-pass sequence which reads and decodes at most {@code chunkSize} records per read, so memory
 * use does not depend on the size of the file. A second call to {@link #iterator()} fails, re-open the
 * file to read it again.
 * <p>
 * The reader owns its file until the sequence is exhausted, a read fails, or {@link #close()} is called,
 * whichever comes first. Abandoning the sequence early is fine as long as the reader is closed.
 */
public final class PhspReader implements Iterable<PhspRecord>, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(PhspReader.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024;

    public static PhspReader open(Path path) throws IOException {
        return open(path, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Open a phase-space file and decode its tag and header.
     *
     * @param path      the file to read
     * @param chunkSize maximum number of records read and decoded at once
     * @return the reader positioned before the first record
     * @throws IllegalArgumentException if {@code chunkSize} is not positive or too large for one buffer
     * @throws IOException              if any I/O error occur
     * @throws UnrecognizedTagException if the file does not start with a known tag
     * @throws TruncatedException       if the file ends inside its tag or header
     */
    public static PhspReader open(Path path, int chunkSize) throws IOException {
        requireNonNull(path, "path");
        PhspFilesBuilder.checkChunkSize("chunkSize", chunkSize);

        logger.debug("Reading {}", path);
        final FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            final ByteBuffer tagBuffer = ByteBuffer.allocate(PhspConstants.TAG_LENGTH);
            ChannelUtils.readFullyOrFail(channel, tagBuffer, PhspConstants.TAG_OFFSET, "tag");
            final PhspFormat format = PhspFormat.detect(tagBuffer.array());
            logger.debug("Found {} file", format.tagName());

            final ByteBuffer headerBuffer = ByteBuffer.allocate(format.paddedHeaderSize());
            ChannelUtils.readFullyOrFail(channel, headerBuffer, PhspConstants.HEADER_OFFSET, "header");
            headerBuffer.flip();
            final PhspHeader header = PhspHeader.decode(headerBuffer, format);
            logger.debug("Found header {}", header);

            return new PhspReader(path, channel, format, header, chunkSize);
        } catch (IOException | RuntimeException ex) {
            closeOnFailure(channel, ex);
            throw ex;
        }
    }

    private static void closeOnFailure(Closeable closeable, Throwable cause) {
        try {
            closeable.close();
        } catch (IOException ex) {
            cause.addSuppressed(ex);
        }
    }

    private final Path path;
    private final FileChannel channel;
    private final PhspFormat format;
    private final PhspHeader header;
    private final FileRecordChunkInputStream inputStream;
    private boolean iterated;

    private PhspReader(Path path, FileChannel channel, PhspFormat format, PhspHeader header, int chunkSize) {
        this.path = path;
        this.channel = channel;
        this.format = format;
        this.header = header;
        this.inputStream = new FileRecordChunkInputStream(channel, format, header.totalParticles(), chunkSize);
    }

    public Path path() {
        return path;
    }

    public PhspFormat format() {
        return format;
    }

    public PhspHeader header() {
        return header;
    }

    /**
     * Number of bytes found after the last declared record. Only known once the sequence is exhausted,
     * -1 before.
     */
    public long trailingBytes() {
        return inputStream.trailingBytes();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * Get the single-pass sequence of records of this file.
     * <p>
     * {@link RecordCountMismatchException} is thrown from {@link Iterator#hasNext()} or {@link Iterator#next()}
     * when the record which is missing is asked for, not before. An I/O error while reading is thrown as a
     * {@link PhspRuntimeException} wrapping the {@link IOException}.
     *
     * @throws IllegalStateException if the sequence was already asked for
     */
    @Override
    public Iterator<PhspRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("records of " + path + " can only be iterated once");
        }
        iterated = true;
        return new RecordIterator();
    }

    /**
     * The same single-pass sequence as {@link #iterator()} as a sequential {@link Stream}.
     * Closing the stream closes this reader.
     */
    public Stream<PhspRecord> stream() {
        // not SIZED: the declared count is not trusted until every record was read
        final Spliterator<PhspRecord> spliterator = Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE);
        return StreamSupport.stream(spliterator, false).onClose(() -> {
            try {
                close();
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
            logger.debug("Closed {}", path);
        }
    }

    @Override
    public String toString() {
        return "PhspReader{" +
                "path=" + path +
                ", format=" + format +
                ", header=" + header +
                '}';
    }

    private final class RecordIterator extends AbstractIterator<PhspRecord> {
        private final Iterator<RecordChunk> chunks = new RecordChunkIterator(inputStream);
        @Nullable
        private Iterator<PhspRecord> records;

        @Override
        protected PhspRecord makeNext() {
            try {
                while (records == null || !records.hasNext()) {
                    if (!chunks.hasNext()) {
                        close();
                        return allDone();
                    }
                    records = chunks.next().iterator();
                }
                return records.next();
            } catch (IOException ex) {
                throw new PhspRuntimeException("close " + path + " failed", ex);
            } catch (RuntimeException ex) {
                closeOnFailure(PhspReader.this, ex);
                throw ex;
            }
        }
    }
}
