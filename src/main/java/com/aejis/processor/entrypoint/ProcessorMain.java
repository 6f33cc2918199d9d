package com.aejis.processor.entrypoint;

import com.aejis.archive.ArchiveLimitExceededException;
import com.aejis.archive.ArchiveLimits;
import com.aejis.core.model.OperationKind;
import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.ScoringAggregator;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.Artifact;
import com.aejis.processor.ProcessingContext;
import com.aejis.processor.Processor;
import com.aejis.processor.ProcessorRegistry;
import com.aejis.processor.support.BehavioralProbe;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Entrypoint executed inside the sandbox container for every job.
 *
 * <p>Reads the staged artifact from the scratch mount, runs one processor and prints
 * exactly one JSON object on stdout. Processor failures are reported inside that
 * object with {@code success=false} and exit code 0; a non-zero exit means the
 * entrypoint itself could not produce a result.
 */
@Command(name = "aejis-process", mixinStandardHelpOptions = true,
        description = "Process one staged artifact and print a JSON result")
public class ProcessorMain implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessorMain.class);

    public static final String DEFAULT_INPUT = "/scratch/input";
    static final long MAX_INPUT_BYTES = 200L * 1024 * 1024;

    @Option(names = "--processor", description = "Processor id; resolved from the artifact when omitted")
    String processorId;

    @Option(names = "--operation", defaultValue = "preview", description = "preview or behavioral")
    String operation;

    @Option(names = "--extension", defaultValue = "", description = "Declared extension, e.g. .pdf")
    String extension;

    @Option(names = "--mime", description = "Declared MIME type")
    String mime;

    @Option(names = "--input", defaultValue = DEFAULT_INPUT, description = "Path of the staged artifact")
    Path input;

    @Option(names = "--max-entries", defaultValue = "10000")
    int maxEntries;

    @Option(names = "--max-entry-size", defaultValue = "104857600")
    long maxEntrySize;

    @Option(names = "--max-total-size", defaultValue = "524288000")
    long maxTotalSize;

    @Option(names = "--max-depth", defaultValue = "3")
    int maxDepth;

    private final PrintStream out;
    private final ProcessorRegistry registry;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScoringAggregator scoring = new ScoringAggregator();

    public ProcessorMain(PrintStream out) {
        this(out, ProcessorRegistry.defaults());
    }

    public ProcessorMain(PrintStream out, ProcessorRegistry registry) {
        this.out = out;
        this.registry = registry;
    }

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        System.exit(new CommandLine(new ProcessorMain(System.out)).execute(args));
    }

    @Override
    public Integer call() throws JsonProcessingException {
        long started = System.nanoTime();
        ProcessingResult result = run();
        result = scoring.rescore(result)
                .withExecutionTime(Math.round((System.nanoTime() - started) / 1_000_000.0) / 1000.0);
        out.println(objectMapper.writeValueAsString(result));
        out.flush();
        return 0;
    }

    ProcessingResult run() {
        byte[] data;
        try {
            long size = Files.size(input);
            if (size > MAX_INPUT_BYTES) {
                return ProcessingResult.failure("binary", "Input exceeds " + MAX_INPUT_BYTES + " bytes", "INPUT_TOO_LARGE");
            }
            data = Files.readAllBytes(input);
        } catch (IOException e) {
            log.warn("Staged input {} unreadable: {}", input, e.getMessage());
            return ProcessingResult.failure("binary", "Input not readable: " + e.getMessage(), "INPUT_UNREADABLE");
        }

        var artifact = new Artifact(data, extension, mime);
        Processor processor = processorId != null
                ? registry.get(processorId).orElseThrow(
                        () -> new CommandLine.ParameterException(new CommandLine(this), "Unknown processor: " + processorId))
                : registry.resolve(artifact.extension(), mime, artifact.header(ProcessorRegistry.HEADER_BYTES));
        OperationKind kind = OperationKind.fromString(operation);
        var context = new ProcessingContext(kind,
                new ArchiveLimits(maxEntries, maxEntrySize, maxTotalSize, maxDepth));

        ProcessingResult result;
        try {
            result = processor.process(artifact, context);
        } catch (ArchiveLimitExceededException e) {
            log.warn("Archive limit exceeded: {}", e.getMessage());
            result = ProcessingResult.builder(processor.id())
                    .behavior(SignalCategory.ARCHIVE_RISK.tag("archive limit exceeded (" + e.getLimit() + ")"))
                    .indicator(SignalCategory.ARCHIVE_RISK.tag("archive limit exceeded (" + e.getLimit() + ")"))
                    .metadata("limit", e.getLimit().name())
                    .metadata("threshold", e.getThreshold())
                    .metadata("observed", e.getObserved())
                    .error(e.getMessage(), "ARCHIVE_LIMIT_EXCEEDED")
                    .build();
        } catch (IOException | RuntimeException e) {
            log.warn("Processor {} failed: {}", processor.id(), e.toString());
            result = ProcessingResult.failure(processor.id(), processor.id() + " processing failed: " + e.getMessage(),
                    "PROCESSOR_ERROR");
        }

        if (kind == OperationKind.BEHAVIORAL) {
            result = result.mergeFindings("behavioral_probe", BehavioralProbe.probe(data));
        }
        return result;
    }
}
