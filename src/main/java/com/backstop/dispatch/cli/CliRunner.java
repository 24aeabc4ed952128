package com.backstop.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 * In serve mode picocli is skipped and the embedded web server keeps the JVM alive.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BackstopCommand backstopCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(BackstopCommand backstopCommand, IFactory factory) {
        this.backstopCommand = backstopCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(backstopCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
