package com.github.ylgrgyq.phsp;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A run of consecutive encoded records read in one bounded read. Records are decoded lazily while iterating.
 */
final class RecordChunk implements Iterable<PhspRecord> {
    private final ByteBuffer buffer;
    private final PhspFormat format;
    private final long baseIndex;

    RecordChunk(ByteBuffer buffer, PhspFormat format, long baseIndex) {
        assert buffer.remaining() % format.recordSize() == 0 : "remaining: " + buffer.remaining();
        this.buffer = buffer;
        this.format = format;
        this.baseIndex = baseIndex;
    }

    /**
     * Index in the file of the first record in this chunk.
     */
    long baseIndex() {
        return baseIndex;
    }

    int count() {
        return buffer.remaining() / format.recordSize();
    }

    PhspFormat format() {
        return format;
    }

    @Override
    public Iterator<PhspRecord> iterator() {
        final ByteBuffer records = buffer.duplicate();
        return new Iterator<PhspRecord>() {
            @Override
            public boolean hasNext() {
                return records.hasRemaining();
            }

            @Override
            public PhspRecord next() {
                if (!records.hasRemaining()) {
                    throw new NoSuchElementException();
                }
                return PhspRecord.decode(records, format);
            }
        };
    }

    @Override
    public String toString() {
        return "RecordChunk{" +
                "format=" + format +
                ", records=[" + baseIndex + ", " + (baseIndex + count()) + ")" +
                '}';
    }
}
