package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;

final class PhspTranslateBench extends PhspFileBenchmark {
    private final int translateTimes;
    private final float dx;
    private final float dy;
    @Nullable
    private Path testingFile;

    PhspTranslateBench(PhspBenchmarkOptions options, int translateTimes, float dx, float dy) {
        super(options);
        this.translateTimes = translateTimes;
        this.dx = dx;
        this.dy = dy;
    }

    @Override
    String getTestDescription() {
        return "Translate x and y of every record of a phase-space file in place test";
    }

    @Override
    String extraSpec() {
        return "\ntranslations per test: " + translateTimes + "\n" +
                "translation: (" + dx + ", " + dy + ")";
    }

    @Override
    void prepare(Path workDir) throws IOException {
        testingFile = writeTestingFile(workDir, "translate");
    }

    @Override
    long doTest(Path workDir, Timer timer) throws IOException {
        assert testingFile != null;
        for (int i = 0; i < translateTimes; i++) {
            final Context cxt = timer.time();
            try {
                files.translateXY(testingFile, dx, dy);
            } finally {
                cxt.stop();
            }
        }
        return (long) translateTimes * testingData.size();
    }
}
