package com.github.ylgrgyq.phsp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The result of {@link PhspCombiner#combine(List)}: an aggregated header and the single-pass concatenation
 * of the records of every source, in source order.
 */
public final class CombinedPhsp implements Iterable<PhspRecord>, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(CombinedPhsp.class);

    private final PhspHeader header;
    private final List<PhspReader> readers;
    private final boolean minEnergyAnomaly;
    private boolean iterated;

    CombinedPhsp(PhspHeader header, List<PhspReader> readers, boolean minEnergyAnomaly) {
        this.header = header;
        this.readers = Collections.unmodifiableList(readers);
        this.minEnergyAnomaly = minEnergyAnomaly;
    }

    public PhspHeader header() {
        return header;
    }

    /**
     * Readers of every source, in source order.
     */
    public List<PhspReader> sources() {
        return readers;
    }

    /**
     * Whether the minimum energy was left at {@link PhspCombiner#MIN_ENERGY_SENTINEL}, meaning no source
     * reported a lower one. The combination is still usable.
     */
    public boolean minEnergyAnomaly() {
        return minEnergyAnomaly;
    }

    /**
     * Get the concatenated records. Each source is closed as soon as its records are exhausted.
     *
     * @throws IllegalStateException if the records were already asked for
     */
    @Override
    public Iterator<PhspRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("combined records can only be iterated once");
        }
        iterated = true;

        final Iterator<PhspReader> sources = readers.iterator();
        return new AbstractIterator<PhspRecord>() {
            @Nullable
            private Iterator<PhspRecord> records;

            @Override
            protected PhspRecord makeNext() {
                while (records == null || !records.hasNext()) {
                    if (!sources.hasNext()) {
                        return allDone();
                    }
                    records = sources.next().iterator();
                }
                return records.next();
            }
        };
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (PhspReader reader : readers) {
            try {
                reader.close();
            } catch (IOException ex) {
                logger.warn("Close source {} failed.", reader.path(), ex);
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "CombinedPhsp{" +
                "header=" + header +
                ", sources=" + readers.size() +
                ", minEnergyAnomaly=" + minEnergyAnomaly +
                '}';
    }
}
