package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.github.ylgrgyq.phsp.PhspFormat;
import org.junit.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public class BenchmarkRunnerTest {
    @Test
    public void testOrdinalNumber() {
        assertThat(BenchmarkRunner.ordinalNumber(1)).isEqualTo("1st");
        assertThat(BenchmarkRunner.ordinalNumber(2)).isEqualTo("2nd");
        assertThat(BenchmarkRunner.ordinalNumber(3)).isEqualTo("3rd");
        assertThat(BenchmarkRunner.ordinalNumber(4)).isEqualTo("4th");
        assertThat(BenchmarkRunner.ordinalNumber(11)).isEqualTo("11th");
        assertThat(BenchmarkRunner.ordinalNumber(112)).isEqualTo("112th");
        assertThat(BenchmarkRunner.ordinalNumber(21)).isEqualTo("21st");
    }

    @Test
    public void testRecordRate() {
        final Timer timer = new Timer();
        timer.update(10, TimeUnit.MILLISECONDS);
        final BenchmarkReport report = new BenchmarkReport(TimeUnit.SECONDS.toNanos(2), 1000, timer);
        assertThat(report.recordRate()).isEqualTo(500d);
        assertThat(report.report()).contains("records = 1000").contains("operations = 1");
    }

    @Test
    public void testDefaultOptions() {
        final PhspBenchmarkOptions options = new PhspBenchmarkOptions();
        new CommandLine(options).parseArgs();
        assertThat(options.getNumOfRecords()).isEqualTo(1000000);
        assertThat(options.getChunkSize()).isEqualTo(1024);
        assertThat(options.getFormat()).isEqualTo(PhspFormat.Standard);
        assertThat(options.isSyncOnClose()).isFalse();
        assertThat(options.getWarmUpTimes()).isEqualTo(2);
        assertThat(options.getTestingTimes()).isEqualTo(3);
        assertThat(options.getCoolDownMillis()).isEqualTo(1000L);
    }

    @Test
    public void testParseOptions() {
        final PhspBenchmarkOptions options = new PhspBenchmarkOptions();
        new CommandLine(options).parseArgs("-n", "10", "-k", "3", "-F", "Extended", "--sync-on-close",
                "-w", "0", "-t", "1", "-c", "0");
        assertThat(options.getNumOfRecords()).isEqualTo(10);
        assertThat(options.getChunkSize()).isEqualTo(3);
        assertThat(options.getFormat()).isEqualTo(PhspFormat.Extended);
        assertThat(options.isSyncOnClose()).isTrue();
        assertThat(options.getWarmUpTimes()).isZero();
        assertThat(options.getTestingTimes()).isEqualTo(1);
        assertThat(options.getCoolDownMillis()).isZero();
        assertThat(options.describe()).contains("bytes per file: " + PhspFormat.Extended.recordOffset(10));
    }

    @Test
    public void testRunEveryCommand() {
        for (String command : new String[]{"read", "write", "translate", "combine"}) {
            final int exitCode = PhspBenchmarkCommand.newCommandLine()
                    .execute(command, "-n", "100", "-k", "7", "-F", "extended", "-w", "1", "-t", "1", "-c", "0");
            assertThat(exitCode).as(command).isZero();
        }
    }

    @Test
    public void testMissingSubcommand() {
        assertThat(PhspBenchmarkCommand.newCommandLine().execute()).isNotZero();
    }

    @Test
    public void testUnknownFormat() {
        assertThat(PhspBenchmarkCommand.newCommandLine().execute("read", "-F", "MODE1")).isNotZero();
    }

    @Test
    public void testEnvironmentSpecOfMissingDirectory() throws Exception {
        final String spec = EnvironmentInfo.generateEnvironmentSpec(
                Paths.get(System.getProperty("java.io.tmpdir"), "phsp_missing_" + System.nanoTime(), "nested"));
        assertThat(spec).contains("Native byte order: ").contains("Testing file store: ").contains("MB usable");
    }

    @Test
    public void testTestingFilesAreDeleted() throws Exception {
        final PhspBenchmarkOptions options = new PhspBenchmarkOptions();
        new CommandLine(options).parseArgs("-n", "20", "-k", "8");
        final PhspReadBench bench = new PhspReadBench(options);
        new BenchmarkRunner(0, 2, 0).runTest(bench);
        assertThat(bench.testingSpec()).contains("number of records per file: 20");
        try (Stream<Path> left = Files.walk(bench.baseDir())) {
            assertThat(left.filter(Files::isRegularFile).count()).isZero();
        }
    }
}
