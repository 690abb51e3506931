package com.parley.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "parley",
        mixinStandardHelpOptions = true,
        version = "Parley 0.1.0",
        description = "Routes conversations to containerised agent workers",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                TasksCommand.class,
                NamespacesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ParleyCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
