package com.docweaver.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Entry point for one-shot CLI invocations. Serve mode never reaches picocli; see
 * {@link #isServeMode(String...)}.
 */
@Component
public class DocweaverCli {

    private static final Logger log = LoggerFactory.getLogger(DocweaverCli.class);

    private final DocweaverCommand rootCommand;
    private final IFactory factory;

    public DocweaverCli(DocweaverCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    /**
     * True when the first subcommand is {@code serve} and no help was asked for. Options
     * such as {@code --server.port=9090} may come first.
     */
    public static boolean isServeMode(String... args) {
        String subcommand = null;
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return false;
            }
            if (subcommand == null && !arg.startsWith("-")) {
                subcommand = arg;
            }
        }
        return "serve".equals(subcommand);
    }

    /**
     * Parses and runs one command.
     *
     * @return the process exit code: 0 on success, 1 when the command or its task failed,
     *         2 on a usage error
     */
    public int execute(String... args) {
        CommandLine commandLine = new CommandLine(rootCommand, factory)
                .setExecutionExceptionHandler(this::onCommandFailure);
        return commandLine.execute(args);
    }

    private int onCommandFailure(Exception e, CommandLine commandLine, ParseResult parseResult) {
        String command = commandLine.getCommandName();
        log.error("Command '{}' failed", command, e);
        ConsoleOutput.error(command + " failed: "
                + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
