package com.fedround.cli;

import ch.qos.logback.classic.Level;
import com.fedround.cli.commands.CoordinatorCommand;
import com.fedround.cli.commands.SimulateCommand;
import com.fedround.cli.commands.VerifyCommand;
import com.fedround.cli.commands.VersionCommand;
import com.fedround.cli.commands.WorkerCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * FedRound CLI - main entry point and command dispatcher.
 * 
 * Root command with global options and one subcommand per process role:
 * coordinator, worker, in-process simulation and setup verification.
 */
@Command(
    name = "fedround",
    description = "FedRound - round-based federated training",
    version = "FedRound v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        CoordinatorCommand.class,
        WorkerCommand.class,
        SimulateCommand.class,
        VerifyCommand.class,
        VersionCommand.class
    }
)
public class FedRoundCli implements Callable<Integer> {

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FedRoundCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Global option, applied before any subcommand runs.
     */
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.fedround");
            root.setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
