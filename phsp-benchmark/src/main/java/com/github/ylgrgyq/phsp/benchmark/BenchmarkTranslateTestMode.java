package com.github.ylgrgyq.phsp.benchmark;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "translate",
        showDefaultValues = true,
        sortOptions = false,
        headerHeading = "Usage:%n%n",
        optionListHeading = "%nOptions:%n",
        description = "All the tests in this command is only used to test the performance of shifting " +
                "x and y of every record of an existing phase-space file in place. The testing file is " +
                "translated several times in every test.",
        synopsisHeading = "%n",
        descriptionHeading = "%nDescription:%n%n",
        parameterListHeading = "%nParameters:%n",
        header = "Test the in place translating performance of phase-space files."
)
public class BenchmarkTranslateTestMode implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean usageHelpRequested;

    @Mixin
    private PhspBenchmarkOptions options;

    @Option(names = {"--translate-times"},
            defaultValue = "10",
            description = "Number of translations of the testing file for each tests.")
    private int translateTimes;

    @Option(names = {"--dx"},
            defaultValue = "0.5",
            description = "Shift in cm added to x of every record.")
    private float dx;

    @Option(names = {"--dy"},
            defaultValue = "-0.5",
            description = "Shift in cm added to y of every record.")
    private float dy;

    @Override
    public Integer call() throws Exception {
        if (usageHelpRequested) {
            spec.commandLine().usage(System.out);
            return 0;
        }

        final PhspFileBenchmark test = new PhspTranslateBench(options, translateTimes, dx, dy);
        final BenchmarkRunner runner = new BenchmarkRunner(options);
        runner.runTest(test);

        return 0;
    }
}
