package com.parley.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the one-shot Parley subcommands (health, tasks, namespaces) and hands their
 * exit code to Spring Boot. {@code serve} is left to the web server and orchestrator.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ParleyCommand parleyCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ParleyCommand parleyCommand, IFactory factory) {
        this.parleyCommand = parleyCommand;
        this.factory = factory;
    }

    /**
     * True when the first non-option argument is {@code serve}, so options such as
     * {@code --verbose serve} still start the server but {@code tasks serve} does not.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) throws Exception {
        // picocli would return at once and let the JVM exit before Tomcat is up
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(parleyCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
