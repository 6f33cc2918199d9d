package com.aejis.dispatch.cli;

import com.aejis.core.events.AejisEvent;
import com.aejis.core.model.JobResult;
import com.aejis.core.model.ProcessingResult;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the aejis CLI.
 */
public class ConsoleOutput {

    static final String SEPARATOR = "──────────────────────────────────";

    private static final int MAX_CONTENT_LINES = 20;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AEJIS v0.1.0|@"));
        System.out.println(SEPARATOR);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AEJIS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    /**
     * Human-readable summary of one job outcome. Content produced inside the container
     * is printed as plain text, never interpreted as markup.
     */
    public static void jobResult(JobResult jr) {
        System.out.println(SEPARATOR);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Job " + jr.jobId() + "|@ (" + jr.fileName() + ")"));
        System.out.println("  Processor: " + jr.processor());
        if (jr.membership() != null) {
            System.out.println("  Container: " + shortId(jr.containerId()) + " (" + jr.membership() + ")");
        }
        System.out.println("  Duration:  " + formatDuration(jr.elapsedMs()));

        if (jr.dockerRequired()) {
            error("Container runtime unavailable: no verdict (docker_required)");
            return;
        }

        ProcessingResult result = jr.result();
        if (result != null) {
            System.out.println("  Preview:   " + result.previewType());
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  Score:     " + score(result.behavioralScore())));
            findings("Threat indicators", result.threatIndicators(), "fg(red)");
            findings("Behaviors", result.behaviors(), "fg(yellow)");
            metadata(result.metadata());
            if (result.thumbnail() != null) {
                System.out.println("  Thumbnail: " + result.thumbnail().length() + " chars (data URI)");
            }
            content(result.content());
        }

        switch (jr.state()) {
            case COMPLETED -> success("Completed" + (jr.secureProcessing() ? " in sandbox" : ""));
            case TIMED_OUT -> error("Timed out (" + jr.reason() + "); container force-killed");
            default -> error("Failed (" + jr.reason() + ")"
                    + (jr.diagnostic() != null ? ": " + firstLine(jr.diagnostic()) : ""));
        }
    }

    public static void watchEvent(AejisEvent event) {
        String prefix = switch (event.eventType()) {
            case "job.submitted" -> "@|fg(cyan) [JOB]|@";
            case "container.acquired" -> "@|fg(magenta) [CONTAINER]|@";
            case "job.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "job.timed_out" -> "@|fg(red),bold [TIMEOUT]|@";
            case "job.failed" -> "@|fg(red),bold [FAILED]|@";
            case "pool.degraded", "pool.recovered" -> "@|bold,fg(yellow) [POOL]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix) + " " + event.payload());
    }

    static String score(int score) {
        String color = score >= 90 ? "fg(green)" : score >= 60 ? "fg(yellow)" : "fg(red)";
        return "@|" + color + " " + score + "/100|@";
    }

    static String shortId(String id) {
        if (id == null) return "-";
        return id.length() > 12 ? id.substring(0, 12) : id;
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static void findings(String title, List<String> values, String color) {
        if (values.isEmpty()) return;
        System.out.println("  " + title + ":");
        for (String value : values) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|" + color + " -|@ ") + value);
        }
    }

    private static void metadata(Map<String, Object> metadata) {
        if (metadata.isEmpty()) return;
        System.out.println("  Metadata:");
        metadata.forEach((k, v) -> {
            if (!(v instanceof Map) && !(v instanceof List)) {
                System.out.println("    " + k + ": " + v);
            }
        });
    }

    private static void content(String content) {
        if (content == null || content.isBlank()) return;
        System.out.println("  Content:");
        String[] lines = content.split("\n", MAX_CONTENT_LINES + 1);
        for (int i = 0; i < Math.min(lines.length, MAX_CONTENT_LINES); i++) {
            System.out.println("    | " + lines[i]);
        }
        if (lines.length > MAX_CONTENT_LINES) {
            System.out.println("    | ...");
        }
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl >= 0 ? text.substring(0, nl) : text;
    }
}
