package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Entry point to read, write, combine and translate phase-space files with one set of options.
 * Create it with {@link PhspFilesBuilder}. Instances hold no open file and can be shared.
 */
public final class PhspFiles {
    private static final Logger logger = LoggerFactory.getLogger(PhspFiles.class);

    /**
     * Pack latch sub-fields, see {@link Latch#encode(boolean, Charge, boolean, int, int)}.
     */
    public static int encodeLatch(boolean crossedMoreThanOnce,
                                  Charge charge,
                                  boolean bremsstrahlungOrAnnihilation,
                                  int regionMask,
                                  int creatingRegion) {
        return Latch.encode(crossedMoreThanOnce, charge, bremsstrahlungOrAnnihilation, regionMask, creatingRegion);
    }

    public static Latch decodeLatch(int latch) {
        return Latch.decode(latch);
    }

    private final int readChunkSize;
    private final int writeChunkSize;
    private final boolean syncOnClose;
    private final MissingZlastPolicy missingZlastPolicy;
    private final float defaultZlast;

    PhspFiles(PhspFilesBuilder builder) {
        this.readChunkSize = builder.readChunkSize();
        this.writeChunkSize = builder.writeChunkSize();
        this.syncOnClose = builder.syncOnClose();
        this.missingZlastPolicy = builder.missingZlastPolicy();
        this.defaultZlast = builder.defaultZlast();
    }

    /**
     * Open a file for streaming read. The caller closes the returned reader.
     *
     * @see PhspReader#open(Path, int)
     */
    public PhspReader read(Path path) throws IOException {
        return PhspReader.open(path, readChunkSize);
    }

    /**
     * Create or truncate a file and return a writer positioned after its header. The caller closes the
     * returned writer.
     *
     * @see PhspWriter#create(Path, PhspHeader, PhspFormat, int, boolean, MissingZlastPolicy, float)
     */
    public PhspWriter newWriter(Path path, PhspHeader header, PhspFormat format) throws IOException {
        return PhspWriter.create(path, header, format, writeChunkSize, syncOnClose, missingZlastPolicy, defaultZlast);
    }

    /**
     * Write a whole file. Records are pulled from {@code records} one chunk at a time, so a lazy
     * iterator is never materialized.
     *
     * @return number of records written
     */
    public long write(Path path, PhspHeader header, PhspFormat format, Iterator<PhspRecord> records)
            throws IOException {
        requireNonNull(records, "records");
        try (PhspWriter writer = newWriter(path, header, format)) {
            return writer.appendAll(records);
        }
    }

    public long write(Path path, PhspHeader header, PhspFormat format, Iterable<PhspRecord> records)
            throws IOException {
        requireNonNull(records, "records");
        return write(path, header, format, records.iterator());
    }

    /**
     * Write a whole file, choosing its layout from the first record: {@link PhspFormat#Extended} when it
     * has a zlast, {@link PhspFormat#Standard} otherwise.
     *
     * @return number of records written
     */
    public long write(Path path, PhspHeader header, List<PhspRecord> records) throws IOException {
        requireNonNull(records, "records");
        final PhspFormat format = PhspFormat.forFirstRecord(records.isEmpty() ? null : records.get(0));
        return write(path, header, format, records.iterator());
    }

    /**
     * Combine several files. The caller closes the returned {@link CombinedPhsp}.
     *
     * @see PhspCombiner#combine(List, int)
     */
    public CombinedPhsp combine(List<Path> sources) throws IOException {
        return PhspCombiner.combine(sources, readChunkSize);
    }

    /**
     * Combine several files and write the result to {@code output} in {@code format}. Records from a
     * source of another layout are re-encoded under the configured zlast policy.
     *
     * @return the header written to {@code output}
     */
    public PhspHeader combine(List<Path> sources, Path output, PhspFormat format) throws IOException {
        requireNonNull(output, "output");
        try (CombinedPhsp combined = combine(sources)) {
            final long written = write(output, combined.header(), format, combined);
            logger.debug("Combined {} records from {} sources into {}", written, sources.size(), output);
            return combined.header();
        }
    }

    /**
     * Shift x and y of every record of an existing file in place.
     *
     * @see XyTranslator#translate(Path, float, float, boolean)
     */
    public void translateXY(Path path, float dx, float dy) throws IOException {
        XyTranslator.translate(path, dx, dy, syncOnClose);
    }
}
