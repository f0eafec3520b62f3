package com.github.ylgrgyq.phsp.benchmark;

import com.github.ylgrgyq.phsp.Charge;
import com.github.ylgrgyq.phsp.PhspFiles;
import com.github.ylgrgyq.phsp.PhspFormat;
import com.github.ylgrgyq.phsp.PhspHeader;
import com.github.ylgrgyq.phsp.PhspRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

final class TestingDataGenerator {
    private static final Charge[] CHARGES = Charge.values();

    private TestingDataGenerator() {}

    static List<PhspRecord> generate(int numOfRecords, PhspFormat format, long seed) {
        final Random random = new Random(seed);
        final List<PhspRecord> records = new ArrayList<>(numOfRecords);
        for (int i = 0; i < numOfRecords; i++) {
            records.add(generateRecord(random, format.hasZlast()));
        }
        return records;
    }

    static PhspHeader headerFor(List<PhspRecord> records) {
        int photons = 0;
        float maxEnergy = 0f;
        float minEnergy = Float.MAX_VALUE;
        for (PhspRecord record : records) {
            if (record.decodedLatch().charge() == Charge.Neutral) {
                photons++;
            }
            maxEnergy = Math.max(maxEnergy, record.energy());
            minEnergy = Math.min(minEnergy, record.energy());
        }
        return new PhspHeader(records.size(), photons, maxEnergy, minEnergy, records.size() / 10f);
    }

    private static PhspRecord generateRecord(Random random, boolean withZlast) {
        final int latch = PhspFiles.encodeLatch(random.nextBoolean(),
                CHARGES[random.nextInt(CHARGES.length)],
                random.nextBoolean(),
                random.nextInt() & 0x00FF_FFFE,
                random.nextInt(32));
        final float energy = 0.01f + random.nextFloat() * 6f;
        final float u = random.nextFloat() * 0.5f - 0.25f;
        final float v = random.nextFloat() * 0.5f - 0.25f;
        final PhspRecord record = new PhspRecord(latch,
                random.nextInt(10) == 0 ? -energy : energy,
                random.nextFloat() * 40f - 20f,
                random.nextFloat() * 40f - 20f,
                u,
                v,
                random.nextBoolean() ? 1f : -1f);
        return withZlast ? record.withZlast(random.nextFloat() * 100f) : record;
    }
}
