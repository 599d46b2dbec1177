package com.switchboard.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code switchboard} command line once the Spring context is up and hands
 * picocli's exit code back to {@link com.switchboard.SwitchboardApplication}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final SwitchboardCommand switchboardCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwitchboardCommand switchboardCommand, IFactory factory) {
        this.switchboardCommand = switchboardCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(switchboardCommand, factory).execute(args);
        log.debug("switchboard {} finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
