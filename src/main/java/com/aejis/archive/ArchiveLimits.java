package com.aejis.archive;

/**
 * Expansion thresholds for one archive, including everything nested inside it.
 * Checked incrementally while entries are read, never only at the end.
 *
 * @param maxEntries   maximum number of entries across all nesting levels
 * @param maxEntrySize maximum uncompressed size of a single entry, in bytes
 * @param maxTotalSize maximum uncompressed size of all entries together, in bytes
 * @param maxDepth     deepest nesting level that is still expanded (the outer archive is level 1)
 */
public record ArchiveLimits(int maxEntries, long maxEntrySize, long maxTotalSize, int maxDepth) {

    private static final long MB = 1024L * 1024;

    public ArchiveLimits {
        if (maxEntries <= 0 || maxEntrySize <= 0 || maxTotalSize <= 0 || maxDepth <= 0) {
            throw new IllegalArgumentException("archive limits must be positive");
        }
    }

    public static ArchiveLimits defaults() {
        return new ArchiveLimits(10_000, 100 * MB, 500 * MB, 3);
    }
}
