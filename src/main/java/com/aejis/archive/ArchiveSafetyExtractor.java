package com.aejis.archive;

import com.aejis.core.scoring.SignalCategory;
import org.apache.commons.compress.archivers.zip.UnsupportedZipFeatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Limit-checked, in-memory archive expansion.
 *
 * <p>Before each entry is read the running entry count is checked, then the entry's
 * declared size against {@link ArchiveLimits#maxEntrySize()} and the running total.
 * The copy itself is bounded as well, so an entry whose header understates its size is
 * stopped at the threshold. Nested archives are expanded with the same budget, which is
 * shared across all levels, down to {@link ArchiveLimits#maxDepth()}.
 *
 * <p>Entry names are sanitized. Absolute paths and {@code ..} segments are reported as
 * findings and the entry is skipped; nothing is ever written to disk.
 */
public class ArchiveSafetyExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveSafetyExtractor.class);

    static final int SAMPLE_BYTES = 64 * 1024;
    private static final int HEADER_BYTES = 512;
    private static final int COPY_BUFFER = 8192;

    private final List<ArchiveEntryReader> readers;

    public ArchiveSafetyExtractor() {
        this(defaultReaders());
    }

    public ArchiveSafetyExtractor(List<ArchiveEntryReader> readers) {
        this.readers = List.copyOf(readers);
    }

    /** Readers in match order: compressed tarballs before the bare gzip reader. */
    public static List<ArchiveEntryReader> defaultReaders() {
        return List.of(
                new ZipEntryReader(),
                new SevenZEntryReader(),
                new TarEntryReader(TarEntryReader.Compression.GZIP),
                new TarEntryReader(TarEntryReader.Compression.BZIP2),
                new TarEntryReader(TarEntryReader.Compression.XZ),
                new TarEntryReader(TarEntryReader.Compression.NONE),
                new GzipEntryReader());
    }

    public Optional<ArchiveEntryReader> readerFor(String name, byte[] data) {
        String lower = name != null ? name.toLowerCase(Locale.ROOT) : "";
        byte[] header = Arrays.copyOf(data, Math.min(HEADER_BYTES, data.length));
        return readers.stream().filter(r -> r.supports(lower, header)).findFirst();
    }

    public boolean isArchive(String name, byte[] data) {
        return readerFor(name, data).isPresent();
    }

    /**
     * @throws ArchiveLimitExceededException the instant any threshold is crossed
     * @throws IOException                   if the outer archive is unreadable or of no supported format
     */
    public ExtractionReport extract(byte[] data, String name, ArchiveLimits limits) throws IOException {
        ArchiveEntryReader reader = readerFor(name, data)
                .orElseThrow(() -> new IOException("Unsupported archive format: " + name));
        var walk = new Walk(limits);
        walk.expand(reader, data, "", 1);
        log.debug("Extracted {} files ({} entries, {} bytes) from {}",
                walk.files.size(), walk.entries, walk.totalBytes, name);
        return new ExtractionReport(reader.format(), walk.files, walk.entries, walk.totalBytes,
                walk.deepest, walk.findings);
    }

    /**
     * Normalizes an entry name to a relative forward-slash path.
     *
     * @return the sanitized path, or empty if the name is absolute or escapes the root
     */
    static Optional<String> sanitize(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String path = name.replace('\\', '/');
        if (path.startsWith("/") || path.matches("^[A-Za-z]:.*")) {
            return Optional.empty();
        }
        var parts = new ArrayList<String>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                return Optional.empty();
            }
            parts.add(segment);
        }
        return parts.isEmpty() ? Optional.empty() : Optional.of(String.join("/", parts));
    }

    private final class Walk {

        private final ArchiveLimits limits;
        private final List<ExtractedFile> files = new ArrayList<>();
        private final List<String> findings = new ArrayList<>();
        private int entries;
        private long totalBytes;
        private int deepest;

        Walk(ArchiveLimits limits) {
            this.limits = limits;
        }

        void expand(ArchiveEntryReader reader, byte[] data, String prefix, int depth) throws IOException {
            deepest = Math.max(deepest, depth);
            try (ArchiveEntryReader.EntryCursor cursor = reader.open(data, limits)) {
                ArchiveEntryReader.EntryInfo entry;
                while ((entry = cursor.next()) != null) {
                    entries++;
                    if (entries > limits.maxEntries()) {
                        throw new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.ENTRY_COUNT,
                                limits.maxEntries(), entries, prefix + entry.name());
                    }

                    Optional<String> safe = sanitize(entry.name());
                    if (safe.isEmpty()) {
                        findings.add(SignalCategory.ARCHIVE_RISK.tag("unsafe entry path '" + entry.name() + "'"));
                        continue;
                    }
                    if (entry.directory()) {
                        continue;
                    }

                    String path = prefix + safe.get();
                    checkDeclared(entry.declaredSize(), path);
                    byte[] content;
                    try {
                        content = boundedRead(cursor.stream(), path);
                    } catch (UnsupportedZipFeatureException e) {
                        findings.add(SignalCategory.SUSPICIOUS_STRUCTURE.tag(
                                "unreadable entry " + path + " (" + e.getFeature() + ")"));
                        break;
                    }

                    if (depth < limits.maxDepth()) {
                        Optional<ArchiveEntryReader> nested = readerFor(safe.get(), content);
                        if (nested.isPresent()) {
                            files.add(fileOf(path, content, depth));
                            expandNested(nested.get(), content, path, depth + 1);
                            continue;
                        }
                    } else if (isArchive(safe.get(), content)) {
                        findings.add(SignalCategory.ARCHIVE_RISK.tag(
                                "archive nested deeper than " + limits.maxDepth() + " levels: " + path));
                    }
                    files.add(fileOf(path, content, depth));
                }
            }
        }

        private void expandNested(ArchiveEntryReader reader, byte[] content, String path, int depth)
                throws IOException {
            try {
                expand(reader, content, path + "!/", depth);
            } catch (ArchiveLimitExceededException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                log.debug("Nested archive {} unreadable: {}", path, e.getMessage());
                findings.add(SignalCategory.SUSPICIOUS_STRUCTURE.tag("corrupt nested archive " + path));
            }
        }

        private void checkDeclared(long declared, String path) {
            if (declared < 0) {
                return;
            }
            if (declared > limits.maxEntrySize()) {
                throw new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.ENTRY_SIZE,
                        limits.maxEntrySize(), declared, path);
            }
            if (totalBytes + declared > limits.maxTotalSize()) {
                throw new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.TOTAL_SIZE,
                        limits.maxTotalSize(), totalBytes + declared, path);
            }
        }

        private byte[] boundedRead(InputStream in, String path) throws IOException {
            var out = new ByteArrayOutputStream();
            byte[] buffer = new byte[COPY_BUFFER];
            long entryBytes = 0;
            int n;
            while ((n = in.read(buffer)) != -1) {
                entryBytes += n;
                totalBytes += n;
                if (entryBytes > limits.maxEntrySize()) {
                    throw new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.ENTRY_SIZE,
                            limits.maxEntrySize(), entryBytes, path);
                }
                if (totalBytes > limits.maxTotalSize()) {
                    throw new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.TOTAL_SIZE,
                            limits.maxTotalSize(), totalBytes, path);
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }

        private ExtractedFile fileOf(String path, byte[] content, int depth) {
            return new ExtractedFile(path, content.length, depth,
                    Arrays.copyOf(content, Math.min(SAMPLE_BYTES, content.length)));
        }
    }
}
