package com.vulnconsole.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for vulnconsole.
 */
@Command(
        name = "vulnconsole",
        mixinStandardHelpOptions = true,
        version = "vulnconsole 0.1.0",
        description = "Browse, start and stop vulnerable docker-compose environments",
        subcommands = {
                ListCommand.class,
                StatsCommand.class,
                StartCommand.class,
                StopCommand.class,
                PullCommand.class,
                RefreshCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConsoleCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
