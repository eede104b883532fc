package com.quartermaster.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Quartermaster.
 * Routes to subcommands: ready, validate, agent.
 */
@Command(
        name = "quartermaster",
        mixinStandardHelpOptions = true,
        version = "Quartermaster 0.1.0",
        description = "Runs coding agents against a PRD/Epic/Task backlog in isolated git worktrees",
        subcommands = {
                ReadyCommand.class,
                ValidateCommand.class,
                AgentCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class QuartermasterCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
