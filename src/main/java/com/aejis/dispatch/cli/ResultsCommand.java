package com.aejis.dispatch.cli;

import com.aejis.core.model.JobResult;
import com.aejis.core.store.ResultStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: aejis results [jobId]
 * <p>
 * Lists results still held by the store, newest first, or shows one in full.
 * Only results produced by this process are visible.
 */
@Command(name = "results", mixinStandardHelpOptions = true, description = "Show recent job results")
@Component
public class ResultsCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Job id to show in full")
    private String jobId;

    private final ResultStore resultStore;

    public ResultsCommand(ResultStore resultStore) {
        this.resultStore = resultStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (jobId != null) {
            resultStore.get(jobId).ifPresentOrElse(
                    ConsoleOutput::jobResult,
                    () -> ConsoleOutput.error("No result for " + jobId + " (unknown or expired)"));
            return;
        }

        List<JobResult> recent = resultStore.recent();
        if (recent.isEmpty()) {
            ConsoleOutput.info("No results stored");
            return;
        }
        System.out.printf("  %-14s %-10s %-22s %-10s %6s  %s%n", "JOB", "STATE", "REASON", "PROCESSOR", "SCORE", "FILE");
        for (JobResult r : recent) {
            System.out.printf("  %-14s %-10s %-22s %-10s %6s  %s%n", r.jobId(), r.state(), r.reason(),
                    r.processor(), r.result() != null ? r.behavioralScore() : "-", r.fileName());
        }
    }
}
