package com.github.ylgrgyq.phsp.benchmark;

import com.github.ylgrgyq.phsp.PhspFiles;
import com.github.ylgrgyq.phsp.PhspFilesBuilder;
import com.github.ylgrgyq.phsp.PhspFormat;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Options shared by every testing command: the phase-space files under test and how many times a
 * test is repeated on them.
 */
@Command()
public class PhspBenchmarkOptions {
    @Option(names = {"-n", "--number-of-records"},
            defaultValue = "1000000",
            description = "Number of records in each testing file.")
    private int numOfRecords;

    @Option(names = {"-k", "--chunk-size"},
            defaultValue = "1024",
            description = "Number of records read or written at once.")
    private int chunkSize;

    @Option(names = {"-F", "--format"},
            defaultValue = "Standard",
            description = "Record layout of the testing files. Valid values is: ${COMPLETION-CANDIDATES}.")
    private PhspFormat format;

    @Option(names = {"--sync-on-close"},
            defaultValue = "false",
            description = "Force written bytes to the storage device before a file is closed.")
    private boolean syncOnClose;

    @Option(names = {"-w", "--warm-up-times"},
            defaultValue = "2",
            description = "Tests run on fresh testing files before the official ones, to warm up the page cache and the JIT.")
    private int warmUpTimes;

    @Option(names = {"-t", "--testing-times"},
            defaultValue = "3",
            description = "Official testing times after warm-up period.")
    private int testingTimes;

    @Option(names = {"-c", "--cool-down-interval-millis"},
            defaultValue = "1000",
            description = "Pause in milliseconds between each tests, to let the testing files of the previous test be deleted.")
    private long coolDownMillis;

    public int getNumOfRecords() {
        return numOfRecords;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public PhspFormat getFormat() {
        return format;
    }

    public boolean isSyncOnClose() {
        return syncOnClose;
    }

    public int getWarmUpTimes() {
        return warmUpTimes;
    }

    public int getTestingTimes() {
        return testingTimes;
    }

    public long getCoolDownMillis() {
        return coolDownMillis;
    }

    PhspFiles buildFiles() {
        return PhspFilesBuilder.newBuilder()
                .readChunkSize(chunkSize)
                .writeChunkSize(chunkSize)
                .syncOnClose(syncOnClose)
                .build();
    }

    String describe() {
        return "number of records per file: " + numOfRecords + "\n" +
                "bytes per file: " + format.recordOffset(numOfRecords) + "\n" +
                "chunk size: " + chunkSize + "\n" +
                "record layout: " + format + " (" + format.tagName() + ")\n" +
                "sync on close: " + syncOnClose;
    }
}
