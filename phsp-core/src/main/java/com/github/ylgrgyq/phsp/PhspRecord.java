package com.github.ylgrgyq.phsp;

import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static com.github.ylgrgyq.phsp.PhspConstants.*;
import static java.util.Objects.requireNonNull;

/**
 * One particle crossing the scoring plane.
 * <p>
 * Two fields carry extra information in their sign: a negative {@code totalEnergy} marks the first
 * particle scored by a new primary history, and the sign of {@code weight} is the sign of the
 * direction cosine along z. Neither is stored elsewhere, so both are kept exactly as read.
 */
public final class PhspRecord {
    /**
     * Encode a record into a new little-endian buffer holding exactly {@link PhspFormat#recordSize()} bytes.
     *
     * @throws IllegalArgumentException if {@code format} is {@link PhspFormat#Extended} but the record
     *                                  has no {@code zlast}
     */
    public static ByteBuffer encode(PhspRecord record, PhspFormat format) {
        final ByteBuffer buffer = ByteBuffer.allocate(format.recordSize()).order(ByteOrder.LITTLE_ENDIAN);
        record.writeTo(buffer, format);
        buffer.flip();
        return buffer;
    }

    /**
     * Decode one record from the current position of {@code buffer} and advance the position by
     * {@link PhspFormat#recordSize()} bytes.
     *
     * @throws TruncatedException if fewer than {@link PhspFormat#recordSize()} bytes are remaining
     */
    public static PhspRecord decode(ByteBuffer buffer, PhspFormat format) {
        requireNonNull(format, "format");
        if (buffer.remaining() < format.recordSize()) {
            throw new TruncatedException("record", format.recordSize(), buffer.remaining());
        }

        final int start = buffer.position();
        final ByteBuffer in = buffer.order() == ByteOrder.LITTLE_ENDIAN ?
                buffer : buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        final PhspRecord record = new PhspRecord(
                in.getInt(start + LATCH_OFFSET),
                in.getFloat(start + TOTAL_ENERGY_OFFSET),
                in.getFloat(start + X_CM_OFFSET),
                in.getFloat(start + Y_CM_OFFSET),
                in.getFloat(start + X_COS_OFFSET),
                in.getFloat(start + Y_COS_OFFSET),
                in.getFloat(start + WEIGHT_OFFSET),
                format.hasZlast() ? in.getFloat(start + ZLAST_OFFSET) : null);
        buffer.position(start + format.recordSize());
        return record;
    }

    private final int latch;
    private final float totalEnergy;
    private final float xCm;
    private final float yCm;
    private final float xCos;
    private final float yCos;
    private final float weight;
    @Nullable
    private final Float zlast;

    public PhspRecord(int latch, float totalEnergy, float xCm, float yCm, float xCos, float yCos, float weight) {
        this(latch, totalEnergy, xCm, yCm, xCos, yCos, weight, null);
    }

    public PhspRecord(int latch, float totalEnergy, float xCm, float yCm, float xCos, float yCos, float weight,
                      @Nullable Float zlast) {
        this.latch = latch;
        this.totalEnergy = totalEnergy;
        this.xCm = xCm;
        this.yCm = yCm;
        this.xCos = xCos;
        this.yCos = yCos;
        this.weight = weight;
        this.zlast = zlast;
    }

    /**
     * The packed status word, an unsigned 32 bits value. Use {@link Integer#toUnsignedLong(int)} to
     * get its numeric value or {@link #decodedLatch()} to get its sub-fields.
     */
    public int latch() {
        return latch;
    }

    public Latch decodedLatch() {
        return Latch.decode(latch);
    }

    public float totalEnergy() {
        return totalEnergy;
    }

    public float energy() {
        return Math.abs(totalEnergy);
    }

    /**
     * Whether this is the first particle scored by a new primary history.
     */
    public boolean isNewHistory() {
        return Float.floatToRawIntBits(totalEnergy) < 0;
    }

    public float xCm() {
        return xCm;
    }

    public float yCm() {
        return yCm;
    }

    public float xCos() {
        return xCos;
    }

    public float yCos() {
        return yCos;
    }

    /**
     * Direction cosine along z. It is not stored, but derived from the other two cosines and takes the
     * sign of {@link #weight()}.
     */
    public float zCos() {
        final double squared = 1.0 - (double) xCos * xCos - (double) yCos * yCos;
        final float magnitude = (float) Math.sqrt(Math.max(0.0, squared));
        return Math.copySign(magnitude, weight);
    }

    public float weight() {
        return weight;
    }

    public float absoluteWeight() {
        return Math.abs(weight);
    }

    public boolean hasZlast() {
        return zlast != null;
    }

    /**
     * @throws IllegalStateException if this record has no zlast
     */
    public float zlast() {
        if (zlast == null) {
            throw new IllegalStateException("record has no zlast");
        }
        return zlast;
    }

    public PhspRecord withZlast(@Nullable Float zlast) {
        return new PhspRecord(latch, totalEnergy, xCm, yCm, xCos, yCos, weight, zlast);
    }

    /**
     * Return a copy of this record with its position shifted by {@code (dx, dy)}.
     */
    public PhspRecord translated(float dx, float dy) {
        return new PhspRecord(latch, totalEnergy, xCm + dx, yCm + dy, xCos, yCos, weight, zlast);
    }

    void writeTo(ByteBuffer buffer, PhspFormat format) {
        if (format.hasZlast() && zlast == null) {
            throw new IllegalArgumentException("record without zlast can not be written as " + format.tagName());
        }

        final ByteBuffer out = buffer.order() == ByteOrder.LITTLE_ENDIAN ?
                buffer : buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        final int start = buffer.position();
        out.putInt(start + LATCH_OFFSET, latch);
        out.putFloat(start + TOTAL_ENERGY_OFFSET, totalEnergy);
        out.putFloat(start + X_CM_OFFSET, xCm);
        out.putFloat(start + Y_CM_OFFSET, yCm);
        out.putFloat(start + X_COS_OFFSET, xCos);
        out.putFloat(start + Y_COS_OFFSET, yCos);
        out.putFloat(start + WEIGHT_OFFSET, weight);
        if (format.hasZlast()) {
            out.putFloat(start + ZLAST_OFFSET, zlast);
        }
        buffer.position(start + format.recordSize());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PhspRecord that = (PhspRecord) o;
        return latch == that.latch &&
                Float.compare(that.totalEnergy, totalEnergy) == 0 &&
                Float.compare(that.xCm, xCm) == 0 &&
                Float.compare(that.yCm, yCm) == 0 &&
                Float.compare(that.xCos, xCos) == 0 &&
                Float.compare(that.yCos, yCos) == 0 &&
                Float.compare(that.weight, weight) == 0 &&
                Objects.equals(zlast, that.zlast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(latch, totalEnergy, xCm, yCm, xCos, yCos, weight, zlast);
    }

    @Override
    public String toString() {
        return "PhspRecord{" +
                "latch=" + Integer.toUnsignedString(latch) +
                ", totalEnergy=" + totalEnergy +
                ", xCm=" + xCm +
                ", yCm=" + yCm +
                ", xCos=" + xCos +
                ", yCos=" + yCos +
                ", weight=" + weight +
                (zlast != null ? ", zlast=" + zlast : "") +
                '}';
    }
}
