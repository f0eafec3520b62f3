package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/**
 * Writes a phase-space file: tag, header and padding when created, then records in bounded chunks as they
 * are appended, so the records to write never need to be in memory all at once.
 * <p>
 * The writer encodes exactly what it is given. It does not check that the number of appended records
 * matches {@link PhspHeader#totalParticles()}.
 */
public final class PhspWriter implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(PhspWriter.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024;

    public static PhspWriter create(Path path, PhspHeader header, PhspFormat format) throws IOException {
        return create(path, header, format, DEFAULT_CHUNK_SIZE, false, MissingZlastPolicy.Reject, 0f);
    }

    /**
     * Create or truncate a file and write the tag and the padded header to it.
     *
     * @param path               the file to write
     * @param header             the header to write
     * @param format             the layout of the file
     * @param chunkSize          maximum number of records buffered before they are written
     * @param syncOnClose        force written bytes to the storage device on close
     * @param missingZlastPolicy what to do with a record without zlast in an {@link PhspFormat#Extended} file
     * @param defaultZlast       zlast written under {@link MissingZlastPolicy#FillDefault}
     * @return a writer positioned after the header
     * @throws IllegalArgumentException if {@code chunkSize} is not positive or too large for one buffer,
     *                                  checked before {@code path} is touched
     * @throws IOException              if any I/O error occur
     */
    public static PhspWriter create(Path path,
                                    PhspHeader header,
                                    PhspFormat format,
                                    int chunkSize,
                                    boolean syncOnClose,
                                    MissingZlastPolicy missingZlastPolicy,
                                    float defaultZlast) throws IOException {
        requireNonNull(path, "path");
        requireNonNull(header, "header");
        requireNonNull(format, "format");
        requireNonNull(missingZlastPolicy, "missingZlastPolicy");
        PhspFilesBuilder.checkChunkSize("chunkSize", chunkSize);

        logger.debug("Writing {} file to {}", format.tagName(), path);
        final FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        try {
            final ByteBuffer prefix = ByteBuffer.allocate((int) format.recordRegionStart()).order(ByteOrder.LITTLE_ENDIAN);
            prefix.put(format.tag());
            header.writeTo(prefix, format);
            prefix.flip();
            ChannelUtils.writeFully(channel, prefix);
            return new PhspWriter(path, channel, format, chunkSize, syncOnClose, missingZlastPolicy, defaultZlast);
        } catch (IOException | RuntimeException ex) {
            try {
                channel.close();
            } catch (IOException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
    }

    private final Path path;
    private final FileChannel channel;
    private final PhspFormat format;
    private final ByteBuffer chunkBuffer;
    private final boolean syncOnClose;
    private final MissingZlastPolicy missingZlastPolicy;
    private final float defaultZlast;
    private long written;

    private PhspWriter(Path path,
                       FileChannel channel,
                       PhspFormat format,
                       int chunkSize,
                       boolean syncOnClose,
                       MissingZlastPolicy missingZlastPolicy,
                       float defaultZlast) {
        this.path = path;
        this.channel = channel;
        this.format = format;
        this.chunkBuffer = ByteBuffer.allocate(chunkSize * format.recordSize()).order(ByteOrder.LITTLE_ENDIAN);
        this.syncOnClose = syncOnClose;
        this.missingZlastPolicy = missingZlastPolicy;
        this.defaultZlast = defaultZlast;
    }

    public PhspFormat format() {
        return format;
    }

    /**
     * Number of records appended so far, including those still buffered.
     */
    public long written() {
        return written;
    }

    public void append(PhspRecord record) throws IOException {
        requireNonNull(record, "record");
        if (!channel.isOpen()) {
            throw new IllegalStateException("writer for " + path + " is closed");
        }

        PhspRecord toWrite = record;
        if (format.hasZlast() && !record.hasZlast()) {
            if (missingZlastPolicy == MissingZlastPolicy.Reject) {
                throw new IllegalArgumentException("record " + written + " has no zlast but " + path +
                        " is written as " + format.tagName());
            }
            toWrite = record.withZlast(defaultZlast);
        }

        toWrite.writeTo(chunkBuffer, format);
        ++written;
        // flush when buffer is full
        if (!chunkBuffer.hasRemaining()) {
            flush();
        }
    }

    /**
     * Append every record the iterator yields.
     *
     * @return the number of records appended by this call
     */
    public long appendAll(Iterator<PhspRecord> records) throws IOException {
        long count = 0;
        while (records.hasNext()) {
            append(records.next());
            ++count;
        }
        return count;
    }

    public long appendAll(Iterable<PhspRecord> records) throws IOException {
        return appendAll(records.iterator());
    }

    public void flush() throws IOException {
        chunkBuffer.flip();
        ChannelUtils.writeFully(channel, chunkBuffer);
        chunkBuffer.clear();
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            try {
                flush();
                if (syncOnClose) {
                    channel.force(true);
                }
            } finally {
                channel.close();
            }
            logger.debug("Finished writing {} records to {}", written, path);
        }
    }

    @Override
    public String toString() {
        return "PhspWriter{" +
                "path=" + path +
                ", format=" + format +
                ", written=" + written +
                '}';
    }
}
