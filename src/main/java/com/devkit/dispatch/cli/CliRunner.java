package com.devkit.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DevkitCommand devkitCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DevkitCommand devkitCommand, IFactory factory) {
        this.devkitCommand = devkitCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(devkitCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
