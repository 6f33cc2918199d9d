package com.aejis.dispatch.cli;

import com.aejis.core.engine.TaskDispatcher;
import com.aejis.core.events.EventBus;
import com.aejis.core.model.Job;
import com.aejis.core.model.JobResult;
import com.aejis.core.model.OperationKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: aejis analyze &lt;file&gt;
 * <p>
 * Reads the file as opaque bytes, submits it to the dispatcher and prints the
 * sandboxed verdict. The file is never parsed on the host.
 * <p>
 * Exit codes: 0 verdict available, 1 job failed or timed out, 2 container runtime
 * unavailable (no verdict), 3 file unreadable.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Preview or probe an untrusted file inside the sandbox")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_DOCKER_REQUIRED = 2;
    static final int EXIT_UNREADABLE = 3;

    @Parameters(index = "0", description = "Path of the file to analyze")
    private Path file;

    @Option(names = {"--mode", "-m"}, description = "Operation: preview or behavioral", defaultValue = "preview")
    private String mode;

    @Option(names = "--ext", description = "Declared extension, overrides the file name's")
    private String extension;

    @Option(names = "--mime", description = "Declared MIME type")
    private String mime;

    @Option(names = "--json", description = "Print the job result as JSON")
    private boolean json;

    @Option(names = {"--watch", "-w"}, description = "Stream job and container events while the job runs")
    private boolean watch;

    private final TaskDispatcher dispatcher;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(TaskDispatcher dispatcher,
                          @Autowired(required = false) EventBus eventBus,
                          @Autowired(required = false) ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper().findAndRegisterModules();
    }

    @Override
    public Integer call() {
        OperationKind kind;
        try {
            kind = OperationKind.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid mode: " + mode + ". Valid modes: preview, behavioral");
            return EXIT_FAILED;
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        Job job = Job.of(bytes, fileName, kind);
        if (extension != null) {
            job = new Job(job.id(), bytes, fileName, extension, null, kind, null);
        }
        if (mime != null) {
            job = job.withDeclaredMime(mime);
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Submitting " + fileName + " (" + bytes.length + " bytes, " + kind + ") as " + job.id());
        }

        EventBus.Subscription subscription = null;
        if (watch && eventBus != null && !json) {
            String jobId = job.id();
            subscription = eventBus.subscribeAll(event -> {
                if (event.jobId() == null || jobId.equals(event.jobId())) {
                    ConsoleOutput.watchEvent(event);
                }
            });
        }

        JobResult result;
        try {
            result = dispatcher.submit(job);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(objectMapper.copy()
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .writerWithDefaultPrettyPrinter()
                        .writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot serialize result: " + e.getOriginalMessage());
                return EXIT_FAILED;
            }
        } else {
            ConsoleOutput.jobResult(result);
        }
        return exitCode(result);
    }

    static int exitCode(JobResult result) {
        if (result.dockerRequired()) return EXIT_DOCKER_REQUIRED;
        return result.verdictAvailable() ? EXIT_OK : EXIT_FAILED;
    }
}
