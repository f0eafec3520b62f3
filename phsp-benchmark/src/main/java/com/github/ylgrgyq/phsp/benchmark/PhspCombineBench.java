package com.github.ylgrgyq.phsp.benchmark;

import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;
import com.github.ylgrgyq.phsp.CombinedPhsp;
import com.github.ylgrgyq.phsp.PhspRecord;
import com.github.ylgrgyq.phsp.PhspWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

final class PhspCombineBench extends PhspFileBenchmark {
    private final int numOfSources;
    private final List<Path> sources;

    PhspCombineBench(PhspBenchmarkOptions options, int numOfSources) {
        super(options);
        this.numOfSources = numOfSources;
        this.sources = new ArrayList<>(numOfSources);
    }

    @Override
    String getTestDescription() {
        return "Combine several phase-space files into a new one test";
    }

    @Override
    String extraSpec() {
        return "\nnumber of source files: " + numOfSources;
    }

    @Override
    void prepare(Path workDir) throws IOException {
        sources.clear();
        for (int i = 0; i < numOfSources; i++) {
            sources.add(writeTestingFile(workDir, "source_" + i));
        }
    }

    @Override
    long doTest(Path workDir, Timer timer) throws IOException {
        final int chunkSize = options.getChunkSize();
        try (CombinedPhsp combined = files.combine(sources);
             PhspWriter writer = files.newWriter(workDir.resolve("combined"), combined.header(), options.getFormat())) {
            final Iterator<PhspRecord> it = combined.iterator();
            boolean more = true;
            while (more) {
                final Context cxt = timer.time();
                try {
                    for (int i = 0; i < chunkSize && (more = it.hasNext()); i++) {
                        writer.append(it.next());
                    }
                } finally {
                    cxt.stop();
                }
            }

            checkProcessed((long) numOfSources * testingData.size(), writer.written());
            return writer.written();
        }
    }
}
