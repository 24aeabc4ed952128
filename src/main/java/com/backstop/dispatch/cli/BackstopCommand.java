package com.backstop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Backstop.
 * Routes to subcommands: status, diagnose, validate, health, serve.
 */
@Command(
        name = "backstop",
        mixinStandardHelpOptions = true,
        version = "Backstop 0.1.0",
        description = "Adaptive fallback and resilience engine for UI components",
        subcommands = {
                StatusCommand.class,
                DiagnoseCommand.class,
                ValidateCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BackstopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
