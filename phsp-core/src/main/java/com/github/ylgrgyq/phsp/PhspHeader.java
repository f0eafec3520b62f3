package com.github.ylgrgyq.phsp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static com.github.ylgrgyq.phsp.PhspConstants.*;
import static java.util.Objects.requireNonNull;

/**
 * The header of a phase-space file. The codec is permissive: it does not check that
 * {@code totalParticles >= totalPhotons >= 0}, that is left to callers.
 */
public final class PhspHeader {
    /**
     * Encode a header with the zero padding the format requires. The returned buffer is
     * little-endian, positioned at 0 and has exactly {@link PhspFormat#paddedHeaderSize()} bytes remaining.
     */
    public static ByteBuffer encode(PhspHeader header, PhspFormat format) {
        final ByteBuffer buffer = ByteBuffer.allocate(format.paddedHeaderSize()).order(ByteOrder.LITTLE_ENDIAN);
        header.writeTo(buffer, format);
        buffer.flip();
        return buffer;
    }

    /**
     * Decode a header from the current position of {@code buffer}. The padding after the header fields
     * is skipped without being looked at. On return the position of {@code buffer} is just past the padding.
     *
     * @param buffer a buffer with at least {@link PhspFormat#paddedHeaderSize()} bytes remaining,
     *               its byte order is ignored, fields are always read as little-endian
     * @param format the format of the file the header comes from
     * @return the decoded header
     * @throws TruncatedException if fewer bytes than the header and its padding are remaining
     */
    public static PhspHeader decode(ByteBuffer buffer, PhspFormat format) {
        requireNonNull(format, "format");
        if (buffer.remaining() < format.paddedHeaderSize()) {
            throw new TruncatedException("header", format.paddedHeaderSize(), buffer.remaining());
        }

        final ByteBuffer in = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
        final PhspHeader header = new PhspHeader(
                in.getInt(TOTAL_PARTICLES_OFFSET),
                in.getInt(TOTAL_PHOTONS_OFFSET),
                in.getFloat(MAX_ENERGY_OFFSET),
                in.getFloat(MIN_ENERGY_OFFSET),
                in.getFloat(TOTAL_PARTICLES_IN_SOURCE_OFFSET));
        buffer.position(buffer.position() + format.paddedHeaderSize());
        return header;
    }

    private final int totalParticles;
    private final int totalPhotons;
    private final float maxEnergy;
    private final float minEnergy;
    private final float totalParticlesInSource;

    public PhspHeader(int totalParticles, int totalPhotons, float maxEnergy, float minEnergy,
                      float totalParticlesInSource) {
        this.totalParticles = totalParticles;
        this.totalPhotons = totalPhotons;
        this.maxEnergy = maxEnergy;
        this.minEnergy = minEnergy;
        this.totalParticlesInSource = totalParticlesInSource;
    }

    public int totalParticles() {
        return totalParticles;
    }

    public int totalPhotons() {
        return totalPhotons;
    }

    public float maxEnergy() {
        return maxEnergy;
    }

    public float minEnergy() {
        return minEnergy;
    }

    public float totalParticlesInSource() {
        return totalParticlesInSource;
    }

    /**
     * Return a copy of this header with another particle count.
     */
    public PhspHeader withTotalParticles(int totalParticles) {
        return new PhspHeader(totalParticles, totalPhotons, maxEnergy, minEnergy, totalParticlesInSource);
    }

    void writeTo(ByteBuffer buffer, PhspFormat format) {
        final ByteBuffer out = buffer.order() == ByteOrder.LITTLE_ENDIAN ?
                buffer : buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        final int start = buffer.position();
        out.putInt(start + TOTAL_PARTICLES_OFFSET, totalParticles);
        out.putInt(start + TOTAL_PHOTONS_OFFSET, totalPhotons);
        out.putFloat(start + MAX_ENERGY_OFFSET, maxEnergy);
        out.putFloat(start + MIN_ENERGY_OFFSET, minEnergy);
        out.putFloat(start + TOTAL_PARTICLES_IN_SOURCE_OFFSET, totalParticlesInSource);
        for (int i = HEADER_SIZE; i < format.paddedHeaderSize(); i++) {
            out.put(start + i, (byte) 0);
        }
        buffer.position(start + format.paddedHeaderSize());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PhspHeader that = (PhspHeader) o;
        return totalParticles == that.totalParticles &&
                totalPhotons == that.totalPhotons &&
                Float.compare(that.maxEnergy, maxEnergy) == 0 &&
                Float.compare(that.minEnergy, minEnergy) == 0 &&
                Float.compare(that.totalParticlesInSource, totalParticlesInSource) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalParticles, totalPhotons, maxEnergy, minEnergy, totalParticlesInSource);
    }

    @Override
    public String toString() {
        return "PhspHeader{" +
                "totalParticles=" + totalParticles +
                ", totalPhotons=" + totalPhotons +
                ", maxEnergy=" + maxEnergy +
                ", minEnergy=" + minEnergy +
                ", totalParticlesInSource=" + totalParticlesInSource +
                '}';
    }
}
