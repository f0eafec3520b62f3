package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.github.ylgrgyq.phsp.PhspFiles;
import com.github.ylgrgyq.phsp.PhspHeader;
import com.github.ylgrgyq.phsp.PhspRecord;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

abstract class PhspFileBenchmark {
    final PhspBenchmarkOptions options;
    final PhspFiles files;
    final List<PhspRecord> testingData;
    final PhspHeader testingHeader;
    private final Path baseDir;
    @Nullable
    private Path workDir;
    @Nullable
    private Timer timer;

    PhspFileBenchmark(PhspBenchmarkOptions options) {
        this.options = options;
        this.files = options.buildFiles();
        this.testingData = TestingDataGenerator.generate(options.getNumOfRecords(), options.getFormat(), System.nanoTime());
        this.testingHeader = TestingDataGenerator.headerFor(testingData);
        this.baseDir = Paths.get(System.getProperty("java.io.tmpdir", "/tmp"), "phsp_benchmark_" + System.nanoTime());
    }

    void setup() throws Exception {
        // Use new files and timer every time to prevent interference between each test
        workDir = Files.createDirectories(baseDir.resolve("test_" + System.nanoTime()));
        timer = new Timer();
        prepare(workDir);
    }

    void teardown() throws Exception {
        assert workDir != null;
        try (Stream<Path> paths = Files.walk(workDir)) {
            for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }

    String testingSpec() {
        return "description: " + getTestDescription() + "\n" +
                "storage path: " + baseDir + "\n" +
                options.describe() + extraSpec();
    }

    BenchmarkReport runTest() throws Exception {
        assert workDir != null;
        assert timer != null;
        final long start = System.nanoTime();
        final long records = doTest(workDir, timer);
        return new BenchmarkReport(System.nanoTime() - start, records, timer);
    }

    /**
     * Directory under which every test creates and deletes its own testing files.
     */
    Path baseDir() {
        return baseDir;
    }

    /**
     * Write the files a test reads before it starts. Not timed.
     */
    void prepare(Path workDir) throws IOException {}

    String extraSpec() {
        return "";
    }

    Path writeTestingFile(Path dir, String name) throws IOException {
        final Path path = dir.resolve(name);
        files.write(path, testingHeader, options.getFormat(), testingData);
        return path;
    }

    static void checkProcessed(long expect, long actual) {
        if (expect != actual) {
            throw new RuntimeException(String.format("Testing invariant failed. " +
                    "expectNumOfRecords: %s, actual: %s", expect, actual));
        }
    }

    abstract String getTestDescription();

    /**
     * Run the timed operations.
     *
     * @return number of records processed
     */
    abstract long doTest(Path workDir, Timer timer) throws IOException;
}
