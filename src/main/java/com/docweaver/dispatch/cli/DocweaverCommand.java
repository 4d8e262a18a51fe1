package com.docweaver.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Docweaver.
 * Routes to subcommands: generate, status, stages, serve.
 */
@Command(
        name = "docweaver",
        mixinStandardHelpOptions = true,
        version = "Docweaver 0.1.0",
        description = "Research-to-document generation pipeline",
        subcommands = {
                GenerateCommand.class,
                StatusCommand.class,
                StagesCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DocweaverCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
