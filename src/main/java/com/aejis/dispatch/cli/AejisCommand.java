package com.aejis.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for aejis.
 * Routes to subcommands: analyze, health, pool, processors, results.
 */
@Command(
        name = "aejis",
        mixinStandardHelpOptions = true,
        version = "aejis 0.1.0",
        description = "Isolated execution engine for previewing and probing untrusted files",
        subcommands = {
                AnalyzeCommand.class,
                HealthCommand.class,
                PoolCommand.class,
                ProcessorsCommand.class,
                ResultsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AejisCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
