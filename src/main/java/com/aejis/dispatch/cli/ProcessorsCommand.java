package com.aejis.dispatch.cli;

import com.aejis.processor.Processor;
import com.aejis.processor.ProcessorRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.TreeSet;

/**
 * CLI command: aejis processors
 */
@Command(name = "processors", mixinStandardHelpOptions = true, description = "List registered processors")
@Component
public class ProcessorsCommand implements Runnable {

    private final ProcessorRegistry registry;

    public ProcessorsCommand(ProcessorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (Processor p : registry.all()) {
            boolean fallback = p == registry.fallback();
            String flags = (fallback ? " (fallback)" : "") + (p.isolationSensitive() ? " (ephemeral only)" : "");
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|bold " + String.format("%-12s", p.id()) + "|@" + flags));
            if (!p.criteria().extensions().isEmpty()) {
                System.out.println("      " + String.join(" ", new TreeSet<>(p.criteria().extensions())));
            }
        }
        System.out.println(ConsoleOutput.SEPARATOR);
        ConsoleOutput.info(registry.all().size() + " processors registered");
    }
}
