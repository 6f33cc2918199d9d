package com.aejis.archive;

import java.util.List;

/**
 * @param format        format of the outer archive
 * @param files         regular files, in archive order, nested ones included
 * @param entryCount    all entries seen, directories and rejected names included
 * @param totalBytes    uncompressed bytes read across all levels
 * @param maxDepth      deepest nesting level actually expanded
 * @param findings      tagged findings raised while walking the archive
 */
public record ExtractionReport(
    String format,
    List<ExtractedFile> files,
    int entryCount,
    long totalBytes,
    int maxDepth,
    List<String> findings
) {
    public ExtractionReport {
        files = List.copyOf(files);
        findings = List.copyOf(findings);
    }
}
