package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Report of one test run. The timer holds one sample per timed operation, usually a chunk of records.
 */
public final class BenchmarkReport {
    private final long testTimeElapsed;
    private final long numOfRecords;
    private final Timer timer;

    public BenchmarkReport(long testTimeElapsed, long numOfRecords, Timer operationTimer) {
        this.testTimeElapsed = testTimeElapsed;
        this.numOfRecords = numOfRecords;
        this.timer = operationTimer;
    }

    public String report() {
        final Snapshot snapshot = timer.getSnapshot();
        return String.format("      time elapsed = %2.2f %s%n", convertDuration(testTimeElapsed), getDurationUnit()) +
                String.format("           records = %d%n", numOfRecords) +
                String.format("       record rate = %2.2f records/%s%n", recordRate(), getRateUnit()) +
                String.format("        operations = %d%n", timer.getCount()) +
                String.format("         mean rate = %2.2f calls/%s%n", timer.getMeanRate(), getRateUnit()) +
                String.format("               min = %2.2f %s%n", convertDuration(snapshot.getMin()), getDurationUnit()) +
                String.format("               max = %2.2f %s%n", convertDuration(snapshot.getMax()), getDurationUnit()) +
                String.format("              mean = %2.2f %s%n", convertDuration(snapshot.getMean()), getDurationUnit()) +
                String.format("            stddev = %2.2f %s%n", convertDuration(snapshot.getStdDev()), getDurationUnit()) +
                String.format("            median = %2.2f %s%n", convertDuration(snapshot.getMedian()), getDurationUnit()) +
                String.format("              75%% <= %2.2f %s%n", convertDuration(snapshot.get75thPercentile()), getDurationUnit()) +
                String.format("              95%% <= %2.2f %s%n", convertDuration(snapshot.get95thPercentile()), getDurationUnit()) +
                String.format("              99%% <= %2.2f %s%n", convertDuration(snapshot.get99thPercentile()), getDurationUnit()) +
                String.format("            99.9%% <= %2.2f %s%n", convertDuration(snapshot.get999thPercentile()), getDurationUnit());
    }

    @Override
    public String toString() {
        return report();
    }

    double recordRate() {
        if (testTimeElapsed <= 0) {
            return 0d;
        }
        return numOfRecords * (double) TimeUnit.SECONDS.toNanos(1) / testTimeElapsed;
    }

    private String getDurationUnit() {
        return TimeUnit.MICROSECONDS.toString().toLowerCase(Locale.US);
    }

    private String getRateUnit() {
        final String s = TimeUnit.SECONDS.toString().toLowerCase(Locale.US);
        return s.substring(0, s.length() - 1);
    }

    private double convertDuration(double duration) {
        return duration / TimeUnit.MICROSECONDS.toNanos(1);
    }
}
