package com.github.ylgrgyq.phsp;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Decoded view of the packed 32 bits status word of a record. The bit layout, with bit 0 the least
 * significant, is:
 * <p>
 * bit 0: a bremsstrahlung or positron annihilation event occurred in the history
 * bits 1-23: bit regions the particle has been in or interacted in
 * bits 24-28: bit region number in which a secondary was created, 0 for a primary particle
 * bit 29: positive charge
 * bit 30: negative charge
 * bit 31: the particle crossed the scoring plane more than once
 * <p>
 * Bits 29 and 30 are exclusive by convention. When both are set, {@link #decode(int)} gives bit 30
 * precedence and reports {@link Charge#Negative}; use {@link #hasConflictingChargeBits(int)} to find
 * such data.
 */
public final class Latch {
    static final int BREM_OR_ANNIHILATION_BIT = 1;
    static final int REGION_MASK_BITS = 0x00FF_FFFE;
    static final int CREATING_REGION_SHIFT = 24;
    static final int CREATING_REGION_BITS = 0x1F << CREATING_REGION_SHIFT;
    static final int MAX_CREATING_REGION = 0x1F;
    static final int POSITIVE_BIT = 1 << 29;
    static final int NEGATIVE_BIT = 1 << 30;
    static final int MULTIPLE_CROSSING_BIT = 1 << 31;

    /**
     * Pack the sub-fields into a latch.
     *
     * @param crossedMoreThanOnce          whether the particle crossed the scoring plane more than once
     * @param charge                       charge of the particle
     * @param bremsstrahlungOrAnnihilation whether a bremsstrahlung or positron annihilation event occurred
     * @param regionMask                   bit regions visited, kept in place in bits 1-23
     * @param creatingRegion               bit region number where the particle was created, 0 to 31
     * @return the packed latch, an unsigned 32 bits value held in an {@code int}
     * @throws IllegalArgumentException if {@code regionMask} has bits outside 1-23 or
     *                                  {@code creatingRegion} is outside 0 to 31
     */
    public static int encode(boolean crossedMoreThanOnce,
                             Charge charge,
                             boolean bremsstrahlungOrAnnihilation,
                             int regionMask,
                             int creatingRegion) {
        requireNonNull(charge, "charge");
        if ((regionMask & ~REGION_MASK_BITS) != 0) {
            throw new IllegalArgumentException("regionMask: 0x" + Integer.toHexString(regionMask) +
                    " (expect: only bits 1-23 set)");
        }
        if (creatingRegion < 0 || creatingRegion > MAX_CREATING_REGION) {
            throw new IllegalArgumentException("creatingRegion: " + creatingRegion +
                    " (expect: between 0 and " + MAX_CREATING_REGION + ")");
        }

        int latch = 0;
        if (crossedMoreThanOnce) {
            latch |= MULTIPLE_CROSSING_BIT;
        }
        if (charge == Charge.Negative) {
            latch |= NEGATIVE_BIT;
        } else if (charge == Charge.Positive) {
            latch |= POSITIVE_BIT;
        }
        if (bremsstrahlungOrAnnihilation) {
            latch |= BREM_OR_ANNIHILATION_BIT;
        }
        latch |= regionMask;
        latch |= creatingRegion << CREATING_REGION_SHIFT;
        return latch;
    }

    public static Latch decode(int latch) {
        final Charge charge;
        if ((latch & NEGATIVE_BIT) != 0) {
            charge = Charge.Negative;
        } else if ((latch & POSITIVE_BIT) != 0) {
            charge = Charge.Positive;
        } else {
            charge = Charge.Neutral;
        }

        return new Latch((latch & MULTIPLE_CROSSING_BIT) != 0,
                charge,
                (latch & BREM_OR_ANNIHILATION_BIT) != 0,
                latch & REGION_MASK_BITS,
                (latch & CREATING_REGION_BITS) >>> CREATING_REGION_SHIFT);
    }

    /**
     * Check whether both charge bits of a latch are set, which {@link #decode(int)} resolves to
     * {@link Charge#Negative}.
     */
    public static boolean hasConflictingChargeBits(int latch) {
        return (latch & (NEGATIVE_BIT | POSITIVE_BIT)) == (NEGATIVE_BIT | POSITIVE_BIT);
    }

    private final boolean crossedMoreThanOnce;
    private final Charge charge;
    private final boolean bremsstrahlungOrAnnihilation;
    private final int regionMask;
    private final int creatingRegion;

    public Latch(boolean crossedMoreThanOnce,
                 Charge charge,
                 boolean bremsstrahlungOrAnnihilation,
                 int regionMask,
                 int creatingRegion) {
        // validates every sub-field
        encode(crossedMoreThanOnce, charge, bremsstrahlungOrAnnihilation, regionMask, creatingRegion);
        this.crossedMoreThanOnce = crossedMoreThanOnce;
        this.charge = charge;
        this.bremsstrahlungOrAnnihilation = bremsstrahlungOrAnnihilation;
        this.regionMask = regionMask;
        this.creatingRegion = creatingRegion;
    }

    public int encode() {
        return encode(crossedMoreThanOnce, charge, bremsstrahlungOrAnnihilation, regionMask, creatingRegion);
    }

    public boolean crossedMoreThanOnce() {
        return crossedMoreThanOnce;
    }

    public Charge charge() {
        return charge;
    }

    public boolean bremsstrahlungOrAnnihilation() {
        return bremsstrahlungOrAnnihilation;
    }

    public int regionMask() {
        return regionMask;
    }

    /**
     * Check whether the particle visited a bit region.
     *
     * @param bitRegion bit region, 1 to 23
     */
    public boolean visitedRegion(int bitRegion) {
        if (bitRegion < 1 || bitRegion > 23) {
            throw new IllegalArgumentException("bitRegion: " + bitRegion + " (expect: between 1 and 23)");
        }
        return (regionMask & (1 << bitRegion)) != 0;
    }

    public int creatingRegion() {
        return creatingRegion;
    }

    public boolean isPrimary() {
        return creatingRegion == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Latch latch = (Latch) o;
        return crossedMoreThanOnce == latch.crossedMoreThanOnce &&
                bremsstrahlungOrAnnihilation == latch.bremsstrahlungOrAnnihilation &&
                regionMask == latch.regionMask &&
                creatingRegion == latch.creatingRegion &&
                charge == latch.charge;
    }

    @Override
    public int hashCode() {
        return Objects.hash(crossedMoreThanOnce, charge, bremsstrahlungOrAnnihilation, regionMask, creatingRegion);
    }

    @Override
    public String toString() {
        return "Latch{" +
                "crossedMoreThanOnce=" + crossedMoreThanOnce +
                ", charge=" + charge +
                ", bremsstrahlungOrAnnihilation=" + bremsstrahlungOrAnnihilation +
                ", regionMask=0x" + Integer.toHexString(regionMask) +
                ", creatingRegion=" + creatingRegion +
                '}';
    }
}
