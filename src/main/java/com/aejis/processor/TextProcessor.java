package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.TextDecoding;

import java.util.List;
import java.util.Set;

/**
 * Plain text, markup, configuration and source files.
 */
public class TextProcessor implements Processor {

    static final int PREVIEW_CHARS = 5000;
    private static final double MAX_CONTROL_RATIO = 0.1;

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(
            ".ps1", ".psm1", ".bat", ".cmd", ".vbs", ".vbe", ".js", ".jse", ".wsf", ".hta", ".sh", ".bash");

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".txt", ".log", ".md", ".csv", ".tsv", ".json", ".xml", ".ini", ".cfg", ".conf",
                    ".yaml", ".yml", ".toml", ".properties", ".html", ".htm", ".css", ".svg",
                    ".js", ".ts", ".py", ".java", ".c", ".h", ".cpp", ".cs", ".go", ".rs", ".rb", ".php",
                    ".sql", ".sh", ".bash", ".ps1", ".psm1", ".bat", ".cmd", ".vbs", ".vbe", ".jse",
                    ".wsf", ".hta"),
            Set.of("text/*", "application/json", "application/xml", "application/javascript",
                    "application/x-sh", "image/svg+xml"),
            List.of());

    @Override
    public String id() {
        return "text";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("text");
        byte[] data = artifact.data();

        if (!startsWithBom(data) && controlRatio(data, 8192) > MAX_CONTROL_RATIO) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                    "binary content declared as text (" + artifact.extension() + ")");
        }

        TextDecoding.Decoded decoded = TextDecoding.decode(data);
        String text = decoded.text();
        boolean truncated = text.length() > PREVIEW_CHARS;

        result.content(truncated ? text.substring(0, PREVIEW_CHARS) : text)
                .metadata("encoding", decoded.charset().name())
                .metadata("bom", decoded.bom())
                .metadata("size", data.length)
                .metadata("char_count", text.length())
                .metadata("line_count", text.isEmpty() ? 0 : text.split("\r\n|\r|\n", -1).length)
                .metadata("word_count", countWords(text))
                .metadata("truncated", truncated);

        if (SCRIPT_EXTENSIONS.contains(artifact.extension())) {
            result.metadata("script", true);
            Findings.report(result, SignalCategory.INFO, "script source (" + artifact.extension() + ")");
        }

        List<String> findings = ContentSignals.scan(text);
        Findings.reportAll(result, findings);
        if (!findings.isEmpty()) {
            result.metadata("signal_summary", ContentSignals.summarize(findings));
        }
        result.log("Scanned " + text.length() + " characters as " + decoded.charset().name());
        return result.build();
    }

    private static boolean startsWithBom(byte[] data) {
        return data.length >= 2 && ((data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xFE
                || (data[0] & 0xFF) == 0xFE && (data[1] & 0xFF) == 0xFF);
    }

    /** Share of control bytes other than whitespace; bytes above 0x7F count as text. */
    static double controlRatio(byte[] data, int limit) {
        int n = Math.min(limit, data.length);
        if (n == 0) {
            return 0.0;
        }
        int control = 0;
        for (int i = 0; i < n; i++) {
            int c = data[i] & 0xFF;
            if (c < 0x20 && c != '\n' && c != '\r' && c != '\t' && c != '\f' || c == 0x7F) {
                control++;
            }
        }
        return (double) control / n;
    }

    static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
