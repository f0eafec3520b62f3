package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;
import com.github.ylgrgyq.phsp.PhspReader;
import com.github.ylgrgyq.phsp.PhspRecord;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

final class PhspReadBench extends PhspFileBenchmark {
    @Nullable
    private Path testingFile;

    PhspReadBench(PhspBenchmarkOptions options) {
        super(options);
    }

    @Override
    String getTestDescription() {
        return "Read every record of a phase-space file test";
    }

    @Override
    void prepare(Path workDir) throws IOException {
        testingFile = writeTestingFile(workDir, "read");
    }

    @Override
    long doTest(Path workDir, Timer timer) throws IOException {
        assert testingFile != null;
        final int chunkSize = options.getChunkSize();
        long totalRead = 0;
        try (PhspReader reader = files.read(testingFile)) {
            final Iterator<PhspRecord> it = reader.iterator();
            while (true) {
                final Context cxt = timer.time();
                int read = 0;
                try {
                    while (read < chunkSize && it.hasNext()) {
                        it.next();
                        read++;
                    }
                } finally {
                    cxt.stop();
                }

                totalRead += read;
                if (read < chunkSize) {
                    break;
                }
            }
        }

        checkProcessed(testingData.size(), totalRead);
        return totalRead;
    }
}
