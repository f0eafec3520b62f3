package com.github.ylgrgyq.phsp.benchmark;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(name = "benchmark",
        synopsisSubcommandLabel = "COMMAND",
        version = "Phase-space file benchmark tool v1.0-SNAPSHOT",
        description = "This is a dedicated benchmark testing tool for phase-space files. With this " +
                "tool you can measure reading, writing, translating and combining of phase-space files " +
                "with different number of records, chunk sizes and record layouts. Please " +
                "use it on your own machine to know if it meets your performance requirements.",
        commandListHeading = "%nCommands:%n%nThe most commonly used testing commands are:%n",
        mixinStandardHelpOptions = true,
        subcommands = {BenchmarkReadTestMode.class,
                BenchmarkWriteTestMode.class,
                BenchmarkTranslateTestMode.class,
                BenchmarkCombineTestMode.class})
public class PhspBenchmarkCommand implements Runnable {
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * The command line of this tool. Record layout names are matched ignoring case.
     */
    static CommandLine newCommandLine() {
        return new CommandLine(new PhspBenchmarkCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
