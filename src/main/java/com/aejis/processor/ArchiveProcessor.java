package com.aejis.processor;

import com.aejis.archive.ArchiveSafetyExtractor;
import com.aejis.archive.ExtractedFile;
import com.aejis.archive.ExtractionReport;
import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.PrintableStrings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * ZIP, TAR (plain, gzip, bzip2, xz), 7z and gzip. Expansion goes through the
 * {@link ArchiveSafetyExtractor}, whose limit violations propagate to the caller.
 */
public class ArchiveProcessor implements Processor {

    static final int LISTED_ENTRIES = 20;
    static final double RATIO_THRESHOLD = 100.0;
    private static final double TEXT_SAMPLE_RATIO = 0.9;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".zip", ".jar", ".war", ".ear", ".apk", ".tar", ".tgz", ".tar.gz", ".tar.bz2", ".tbz2",
                    ".tar.xz", ".txz", ".7z", ".gz"),
            Set.of("application/zip", "application/x-zip-compressed", "application/x-tar", "application/gzip",
                    "application/x-gzip", "application/x-7z-compressed", "application/java-archive"),
            List.of(MagicBytes.ZIP, MagicBytes.ZIP_EMPTY, MagicBytes.SEVEN_Z, MagicBytes.GZIP, MagicBytes.USTAR))
            .withPriority(1);

    private static final Set<String> EXECUTABLE_EXTENSIONS = Set.of(
            ".exe", ".dll", ".scr", ".com", ".msi", ".cpl", ".sys", ".elf", ".so", ".dylib");
    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(
            ".js", ".jse", ".vbs", ".vbe", ".ps1", ".bat", ".cmd", ".hta", ".wsf", ".lnk", ".sh");
    private static final Pattern DOUBLE_EXTENSION = Pattern.compile(
            "(?i)\\.(pdf|docx?|xlsx?|pptx?|txt|jpe?g|png|gif|mp3|mp4)\\.(exe|scr|com|bat|cmd|js|vbs|hta|lnk|ps1)$");

    private final ArchiveSafetyExtractor extractor;

    public ArchiveProcessor() {
        this(new ArchiveSafetyExtractor());
    }

    public ArchiveProcessor(ArchiveSafetyExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String id() {
        return "archive";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException {
        var result = ProcessingResult.builder("archive");
        ExtractionReport report = extractor.extract(artifact.data(), artifact.nominalName(), context.archiveLimits());
        List<ExtractedFile> files = report.files();

        double ratio = artifact.size() == 0 ? 0.0 : (double) report.totalBytes() / artifact.size();
        result.metadata("format", report.format())
                .metadata("entry_count", report.entryCount())
                .metadata("file_count", files.size())
                .metadata("compressed_size", artifact.size())
                .metadata("uncompressed_size", report.totalBytes())
                .metadata("compression_ratio", Math.round(ratio * 100) / 100.0)
                .metadata("max_depth", report.maxDepth())
                .metadata("files", listing(files))
                .metadata("file_types", typeHistogram(files));

        Findings.reportAll(result, report.findings());
        if (ratio > RATIO_THRESHOLD) {
            Findings.report(result, SignalCategory.ARCHIVE_RISK,
                    "compression ratio " + Math.round(ratio) + ":1");
        }
        for (ExtractedFile file : files) {
            inspect(file, result);
        }

        var content = new StringBuilder();
        content.append(report.format()).append(" archive, ").append(files.size()).append(" file(s), ")
                .append(report.totalBytes()).append(" bytes uncompressed\n");
        files.stream().limit(LISTED_ENTRIES)
                .forEach(f -> content.append("  ").append(f.path()).append(" (").append(f.size()).append(" bytes)\n"));
        if (files.size() > LISTED_ENTRIES) {
            content.append("  ... ").append(files.size() - LISTED_ENTRIES).append(" more\n");
        }
        result.content(content.toString());
        result.log("Expanded " + report.entryCount() + " entries to depth " + report.maxDepth());
        return result.build();
    }

    private static void inspect(ExtractedFile file, ProcessingResult.Builder result) {
        String extension = file.extension();
        if (MagicBytes.isExecutable(file.sample()) || EXECUTABLE_EXTENSIONS.contains(extension)) {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, "executable inside archive: " + file.path());
        } else if (SCRIPT_EXTENSIONS.contains(extension)) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "script inside archive: " + file.path());
        }
        if (DOUBLE_EXTENSION.matcher(file.path()).find()) {
            Findings.report(result, SignalCategory.SOCIAL_ENGINEERING, "double extension: " + file.path());
        }
        if (file.sample().length > 0 && PrintableStrings.printableRatio(file.sample(), file.sample().length)
                >= TEXT_SAMPLE_RATIO) {
            Findings.reportAll(result, ContentSignals.scan(new String(file.sample(), StandardCharsets.UTF_8)));
        }
    }

    private static List<Map<String, Object>> listing(List<ExtractedFile> files) {
        var listing = new ArrayList<Map<String, Object>>();
        for (ExtractedFile file : files.subList(0, Math.min(LISTED_ENTRIES, files.size()))) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", file.path());
            entry.put("size", file.size());
            entry.put("depth", file.depth());
            listing.add(entry);
        }
        return listing;
    }

    static Map<String, Integer> typeHistogram(List<ExtractedFile> files) {
        var histogram = new TreeMap<String, Integer>();
        for (ExtractedFile file : files) {
            String extension = file.extension();
            histogram.merge(extension.isEmpty() ? "(none)" : extension, 1, Integer::sum);
        }
        return histogram;
    }
}
