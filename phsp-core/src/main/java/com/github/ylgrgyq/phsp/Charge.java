package com.github.ylgrgyq.phsp;

/**
 * Charge of a particle as carried by bits 29 and 30 of its latch.
 */
public enum Charge {
    Negative(-1),
    Neutral(0),
    Positive(1);

    public static Charge of(int iq) {
        switch (iq) {
            case -1:
                return Negative;
            case 0:
                return Neutral;
            case 1:
                return Positive;
            default:
                throw new IllegalArgumentException("iq: " + iq + " (expect: -1, 0 or 1)");
        }
    }

    private final int iq;

    Charge(int iq) {
        this.iq = iq;
    }

    public int iq() {
        return iq;
    }
}
