package com.branchwork.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Branchwork.
 * Routes to subcommands: run, health.
 */
@Command(
        name = "branchwork",
        mixinStandardHelpOptions = true,
        version = "Branchwork 0.1.0",
        description = "Parallel sub-task orchestration over isolated execution branches",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BranchworkCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
