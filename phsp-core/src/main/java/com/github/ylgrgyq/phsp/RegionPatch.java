package com.github.ylgrgyq.phsp;

import java.nio.ByteBuffer;

/**
 * Mutates a fixed-width region of a file in place.
 */
@FunctionalInterface
interface RegionPatch {
    /**
     * @param region the current bytes of the region, little-endian, positioned at 0. Changes made with
     *               absolute puts are written back to the file
     */
    void apply(ByteBuffer region);
}
