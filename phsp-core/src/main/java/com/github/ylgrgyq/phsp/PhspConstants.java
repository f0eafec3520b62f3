package com.github.ylgrgyq.phsp;

/**
 * Byte layout of a phase-space file. All numeric fields are little-endian.
 * <p>
 * Tag: 5 ASCII bytes
 * Header: TotalParticles Int32, TotalPhotons Int32, MaxEnergy Float32, MinEnergy Float32,
 * TotalParticlesInSource Float32
 * Padding: 3 (MODE0) or 7 (MODE2) bytes
 * Records: [Record]
 * <p>
 * Record: Latch UInt32, TotalEnergy Float32, X Float32, Y Float32, U Float32, V Float32, Weight Float32,
 * and in MODE2 only, ZLast Float32
 */
final class PhspConstants {
    private PhspConstants() {}

    static final int TAG_OFFSET = 0;
    static final int TAG_LENGTH = 5;

    static final int HEADER_OFFSET = TAG_OFFSET + TAG_LENGTH;
    static final int TOTAL_PARTICLES_OFFSET = 0;
    static final int TOTAL_PHOTONS_OFFSET = TOTAL_PARTICLES_OFFSET + Integer.BYTES;
    static final int MAX_ENERGY_OFFSET = TOTAL_PHOTONS_OFFSET + Integer.BYTES;
    static final int MIN_ENERGY_OFFSET = MAX_ENERGY_OFFSET + Float.BYTES;
    static final int TOTAL_PARTICLES_IN_SOURCE_OFFSET = MIN_ENERGY_OFFSET + Float.BYTES;
    static final int HEADER_SIZE = TOTAL_PARTICLES_IN_SOURCE_OFFSET + Float.BYTES;

    static final int LATCH_OFFSET = 0;
    static final int TOTAL_ENERGY_OFFSET = LATCH_OFFSET + Integer.BYTES;
    static final int X_CM_OFFSET = TOTAL_ENERGY_OFFSET + Float.BYTES;
    static final int Y_CM_OFFSET = X_CM_OFFSET + Float.BYTES;
    static final int X_COS_OFFSET = Y_CM_OFFSET + Float.BYTES;
    static final int Y_COS_OFFSET = X_COS_OFFSET + Float.BYTES;
    static final int WEIGHT_OFFSET = Y_COS_OFFSET + Float.BYTES;
    static final int ZLAST_OFFSET = WEIGHT_OFFSET + Float.BYTES;
    static final int BASE_RECORD_SIZE = ZLAST_OFFSET;
    static final int ZLAST_RECORD_SIZE = ZLAST_OFFSET + Float.BYTES;

    // x and y are adjacent, so a translation touches one contiguous region per record
    static final int XY_LENGTH = Y_CM_OFFSET + Float.BYTES - X_CM_OFFSET;
}
