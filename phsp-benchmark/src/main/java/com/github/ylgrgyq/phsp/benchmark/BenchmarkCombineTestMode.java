package com.github.ylgrgyq.phsp.benchmark;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "combine",
        showDefaultValues = true,
        sortOptions = false,
        headerHeading = "Usage:%n%n",
        optionListHeading = "%nOptions:%n",
        description = "All the tests in this command is only used to test the performance of combining " +
                "several phase-space files into a new one. During the test setup period, every source " +
                "file is written. After that, the combined records are streamed into a new file.",
        synopsisHeading = "%n",
        descriptionHeading = "%nDescription:%n%n",
        parameterListHeading = "%nParameters:%n",
        header = "Test the combining performance of phase-space files."
)
public class BenchmarkCombineTestMode implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean usageHelpRequested;

    @Mixin
    private PhspBenchmarkOptions options;

    @Option(names = {"-S", "--number-of-sources"},
            defaultValue = "4",
            description = "Number of source files to combine for each tests.")
    private int numOfSources;

    @Override
    public Integer call() throws Exception {
        if (usageHelpRequested) {
            spec.commandLine().usage(System.out);
            return 0;
        }

        final PhspFileBenchmark test = new PhspCombineBench(options, numOfSources);
        final BenchmarkRunner runner = new BenchmarkRunner(options);
        runner.runTest(test);

        return 0;
    }
}
