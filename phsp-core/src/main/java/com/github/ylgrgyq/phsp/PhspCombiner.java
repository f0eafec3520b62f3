package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Merges several phase-space files into one aggregated header and one lazily concatenated record sequence.
 * <p>
 * Particle, photon and source particle counts are summed, the maximum energy is the largest one of all
 * sources and the minimum energy the smallest one. Records keep the layout of the file they come from,
 * so sources may mix {@link PhspFormat#Standard} and {@link PhspFormat#Extended}.
 */
public final class PhspCombiner {
    private static final Logger logger = LoggerFactory.getLogger(PhspCombiner.class);

    /**
     * Seed of the minimum energy. Finding it in a combined header means no source lowered it.
     */
    public static final float MIN_ENERGY_SENTINEL = Float.MAX_VALUE;

    private PhspCombiner() {}

    public static CombinedPhsp combine(List<Path> sources) throws IOException {
        return combine(sources, PhspReader.DEFAULT_CHUNK_SIZE);
    }

    /**
     * Open every source and aggregate their headers. Records are not read until the returned sequence
     * is iterated.
     *
     * @param sources   files to combine, in the order their records are concatenated
     * @param chunkSize maximum number of records read at once from each source
     * @return the combined header and records, to be closed by the caller
     * @throws IllegalArgumentException if {@code sources} is empty
     * @throws IOException              if any source failed to open, every source opened so far is closed
     * @throws PhspFormatException      if any source has a bad tag or header, every source opened so far is closed
     */
    public static CombinedPhsp combine(List<Path> sources, int chunkSize) throws IOException {
        requireNonNull(sources, "sources");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("sources: [] (expect: at least one source to combine)");
        }

        final List<PhspReader> readers = new ArrayList<>(sources.size());
        try {
            int totalParticles = 0;
            int totalPhotons = 0;
            float maxEnergy = Float.NEGATIVE_INFINITY;
            float minEnergy = MIN_ENERGY_SENTINEL;
            float totalParticlesInSource = 0f;
            for (Path source : sources) {
                final PhspReader reader = PhspReader.open(source, chunkSize);
                readers.add(reader);

                final PhspHeader header = reader.header();
                totalParticles = addCount(totalParticles, header.totalParticles(), "particles");
                totalPhotons = addCount(totalPhotons, header.totalPhotons(), "photons");
                maxEnergy = Math.max(maxEnergy, header.maxEnergy());
                minEnergy = Math.min(minEnergy, header.minEnergy());
                totalParticlesInSource += header.totalParticlesInSource();
            }

            final boolean minEnergyAnomaly = minEnergy >= MIN_ENERGY_SENTINEL;
            if (minEnergyAnomaly) {
                logger.warn("Minimum energy of combined sources {} was never lowered below the sentinel {}",
                        sources, MIN_ENERGY_SENTINEL);
            }

            final PhspHeader header = new PhspHeader(totalParticles, totalPhotons, maxEnergy, minEnergy,
                    totalParticlesInSource);
            logger.debug("Combined {} sources into header {}", sources.size(), header);
            return new CombinedPhsp(header, readers, minEnergyAnomaly);
        } catch (IOException | RuntimeException ex) {
            for (PhspReader reader : readers) {
                try {
                    reader.close();
                } catch (IOException closeEx) {
                    ex.addSuppressed(closeEx);
                }
            }
            throw ex;
        }
    }

    private static int addCount(int sum, int count, String name) {
        try {
            return Math.addExact(sum, count);
        } catch (ArithmeticException ex) {
            throw new PhspRuntimeException("combined number of " + name + " overflows a 32 bits counter", ex);
        }
    }
}
