package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;
import com.github.ylgrgyq.phsp.PhspWriter;

import java.io.IOException;
import java.nio.file.Path;

final class PhspWriteBench extends PhspFileBenchmark {
    PhspWriteBench(PhspBenchmarkOptions options) {
        super(options);
    }

    @Override
    String getTestDescription() {
        return "Write records to a new phase-space file test";
    }

    @Override
    long doTest(Path workDir, Timer timer) throws IOException {
        final int chunkSize = options.getChunkSize();
        try (PhspWriter writer = files.newWriter(workDir.resolve("write"), testingHeader, options.getFormat())) {
            for (int from = 0; from < testingData.size(); from += chunkSize) {
                final int to = Math.min(testingData.size(), from + chunkSize);
                final Context cxt = timer.time();
                try {
                    writer.appendAll(testingData.subList(from, to));
                } finally {
                    cxt.stop();
                }
            }
            checkProcessed(testingData.size(), writer.written());
            return writer.written();
        }
    }
}
