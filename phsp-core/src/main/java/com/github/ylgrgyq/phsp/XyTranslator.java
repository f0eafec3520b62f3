package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

import static com.github.ylgrgyq.phsp.PhspConstants.*;
import static java.util.Objects.requireNonNull;

/**
 * Shifts the position of every record of an existing phase-space file in place.
 * <p>
 * Only the 8 bytes holding x and y of each record are read and rewritten, one record at a time, so
 * neither the file length nor any other byte changes and the records are never all in memory.
 * The result equals reading every record, applying {@link PhspRecord#translated(float, float)} and
 * writing them all back.
 * <p>
 * No other writer may touch the file while it is translated. This is not checked.
 */
public final class XyTranslator {
    private static final Logger logger = LoggerFactory.getLogger(XyTranslator.class);

    private XyTranslator() {}

    public static void translate(Path path, float dx, float dy) throws IOException {
        translate(path, dx, dy, false);
    }

    /**
     * Add {@code dx} to x and {@code dy} to y of every record declared in the header of {@code path}.
     *
     * @param path        an existing phase-space file, opened for read and write
     * @param dx          offset added to x in cm
     * @param dy          offset added to y in cm
     * @param syncOnClose force the patched bytes to the storage device before returning
     * @throws IOException                   if any I/O error occur
     * @throws UnrecognizedTagException      if the file does not start with a known tag
     * @throws TruncatedException            if the file ends inside its tag or header
     * @throws RecordCountMismatchException if the file is too short to hold every declared record,
     *                                       in which case nothing was modified
     */
    public static void translate(Path path, float dx, float dy, boolean syncOnClose) throws IOException {
        requireNonNull(path, "path");

        try (PatchableFile file = PatchableFile.open(path, XY_LENGTH)) {
            final byte[] tag = new byte[TAG_LENGTH];
            file.read(TAG_OFFSET, TAG_LENGTH, "tag").get(tag);
            final PhspFormat format = PhspFormat.detect(tag);
            final int totalParticles = file.read(HEADER_OFFSET + TOTAL_PARTICLES_OFFSET, Integer.BYTES, "header")
                    .getInt(0);

            final long declared = Math.max(0, totalParticles);
            final long fileSize = file.size();
            if (fileSize < format.recordOffset(declared)) {
                final long available = Math.max(0, fileSize - format.recordRegionStart()) / format.recordSize();
                throw new RecordCountMismatchException(declared, available);
            }

            logger.debug("Translating {} records of {} file {} by ({}, {})", declared, format.tagName(), path, dx, dy);
            final RegionPatch shift = xy -> {
                xy.putFloat(0, xy.getFloat(0) + dx);
                xy.putFloat(Float.BYTES, xy.getFloat(Float.BYTES) + dy);
            };
            for (long i = 0; i < declared; i++) {
                file.patch(format.recordOffset(i) + X_CM_OFFSET, XY_LENGTH, shift);
            }

            if (syncOnClose) {
                file.flush();
            }
        }
    }
}
