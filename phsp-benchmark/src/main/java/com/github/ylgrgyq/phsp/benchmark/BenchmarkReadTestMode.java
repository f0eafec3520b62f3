package com.github.ylgrgyq.phsp.benchmark;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "read",
        showDefaultValues = true,
        sortOptions = false,
        headerHeading = "Usage:%n%n",
        optionListHeading = "%nOptions:%n",
        description = "All the tests in this command is only used to test the read performance " +
                "of phase-space files. During the test setup period, a testing file is written. After that, " +
                "every record of it is decoded chunk by chunk and no more write operations will be issued.",
        synopsisHeading = "%n",
        descriptionHeading = "%nDescription:%n%n",
        parameterListHeading = "%nParameters:%n",
        header = "Test the reading performance of phase-space files."
)
public class BenchmarkReadTestMode implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean usageHelpRequested;

    @Mixin
    private PhspBenchmarkOptions options;

    @Override
    public Integer call() throws Exception {
        if (usageHelpRequested) {
            spec.commandLine().usage(System.out);
            return 0;
        }

        final PhspFileBenchmark test = new PhspReadBench(options);
        final BenchmarkRunner runner = new BenchmarkRunner(options);
        runner.runTest(test);

        return 0;
    }
}
