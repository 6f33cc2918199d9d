package com.aejis.archive;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.aejis.archive.ArchiveFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ArchiveSafetyExtractorTest {

    private static final long KB = 1024;
    private static final long MB = 1024 * KB;

    private final ArchiveSafetyExtractor extractor = new ArchiveSafetyExtractor();

    @Nested
    @DisplayName("Regular extraction")
    class Regular {

        @Test
        void extractsZipEntriesInOrder() throws IOException {
            byte[] zip = zip(entries("docs/readme.txt", "hello", "docs/", "", "data.csv", "a,b\n1,2"));

            ExtractionReport report = extractor.extract(zip, "bundle.zip", ArchiveLimits.defaults());

            assertEquals("zip", report.format());
            assertEquals(List.of("docs/readme.txt", "data.csv"),
                    report.files().stream().map(ExtractedFile::path).toList());
            assertEquals(3, report.entryCount());
            assertEquals(12, report.totalBytes());
            assertEquals(1, report.maxDepth());
            assertTrue(report.findings().isEmpty());
        }

        @Test
        void extractsTarGz() throws IOException {
            byte[] tgz = tarGz(entries("a.txt", "alpha", "b/c.txt", "gamma"));

            ExtractionReport report = extractor.extract(tgz, "release.tar.gz", ArchiveLimits.defaults());

            assertEquals("tar.gz", report.format());
            assertEquals(2, report.files().size());
            assertEquals("alpha", new String(report.files().get(0).sample(), StandardCharsets.UTF_8));
        }

        @Test
        void plainTarDetectedByHeader() {
            byte[] tar = tar(entries("x.txt", "x"));
            assertEquals("tar", extractor.readerFor("upload.bin", tar).orElseThrow().format());
        }

        @Test
        void nestedArchivesAreExpanded() throws IOException {
            byte[] inner = zip(entries("inner.txt", "inside"));
            byte[] outer = zip(entries("outer.txt", "outside", "inner.zip", inner));

            ExtractionReport report = extractor.extract(outer, "outer.zip", ArchiveLimits.defaults());

            assertEquals(List.of("outer.txt", "inner.zip", "inner.zip!/inner.txt"),
                    report.files().stream().map(ExtractedFile::path).toList());
            assertEquals(2, report.maxDepth());
            assertEquals(2, report.files().get(2).depth());
        }

        @Test
        void unsupportedFormatIsAnIoError() {
            byte[] notAnArchive = "just text".getBytes(StandardCharsets.UTF_8);
            assertThrows(IOException.class,
                    () -> extractor.extract(notAnArchive, "notes.txt", ArchiveLimits.defaults()));
        }

        @Test
        void samplesAreCapped() throws IOException {
            byte[] big = new byte[ArchiveSafetyExtractor.SAMPLE_BYTES * 2];
            ExtractionReport report = extractor.extract(zip(entries("big.bin", big)), "b.zip",
                    ArchiveLimits.defaults());

            ExtractedFile file = report.files().get(0);
            assertEquals(big.length, file.size());
            assertEquals(ArchiveSafetyExtractor.SAMPLE_BYTES, file.sample().length);
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("50,000 zero-byte entries are rejected at the entry limit")
        void zipBombByEntryCount() {
            byte[] bomb = zipOfEmptyEntries(50_000);
            ArchiveLimits limits = ArchiveLimits.defaults();

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> extractor.extract(bomb, "bomb.zip", limits));

            assertEquals(ArchiveLimitExceededException.Limit.ENTRY_COUNT, ex.getLimit());
            assertEquals(limits.maxEntries(), ex.getThreshold());
            assertEquals(limits.maxEntries() + 1, ex.getObserved(), "stopped at the first entry past the limit");
        }

        @Test
        void entrySizeLimit() {
            byte[] zip = zip(entries("huge.bin", new byte[(int) (2 * MB)]));
            var limits = new ArchiveLimits(100, MB, 10 * MB, 3);

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> extractor.extract(zip, "z.zip", limits));

            assertEquals(ArchiveLimitExceededException.Limit.ENTRY_SIZE, ex.getLimit());
        }

        @Test
        void totalSizeLimit() {
            byte[] chunk = new byte[(int) (400 * KB)];
            byte[] zip = zip(entries("a.bin", chunk, "b.bin", chunk, "c.bin", chunk));
            var limits = new ArchiveLimits(100, MB, MB, 3);

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> extractor.extract(zip, "z.zip", limits));

            assertEquals(ArchiveLimitExceededException.Limit.TOTAL_SIZE, ex.getLimit());
        }

        @Test
        @DisplayName("a 7z whose dictionary exceeds the decoder memory cap is rejected before decoding")
        void sevenZDecoderMemoryLimit() {
            byte[] archive = sevenZ(entries("notes.txt", "small payload"));
            var limits = new ArchiveLimits(100, MB, MB, 3);

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> extractor.extract(archive, "a.7z", limits));

            assertEquals(ArchiveLimitExceededException.Limit.DECODER_MEMORY, ex.getLimit());
            assertEquals(MB, ex.getThreshold());
            assertTrue(ex.getObserved() > MB);
        }

        @Test
        void sevenZWithinDecoderMemoryIsExtracted() throws IOException {
            byte[] archive = sevenZ(entries("notes.txt", "small payload"));

            ExtractionReport report = extractor.extract(archive, "a.7z", ArchiveLimits.defaults());

            assertEquals("7z", report.format());
            assertEquals(List.of("notes.txt"), report.files().stream().map(ExtractedFile::path).toList());
        }

        @Test
        void decoderMemoryCapFollowsTotalBudget() {
            assertEquals(1024, SevenZEntryReader.decoderMemoryLimitKb(new ArchiveLimits(10, MB, MB, 3)));
            assertEquals(SevenZEntryReader.MAX_DECODER_MEMORY_KB,
                    SevenZEntryReader.decoderMemoryLimitKb(ArchiveLimits.defaults()));
            assertEquals(1, SevenZEntryReader.decoderMemoryLimitKb(new ArchiveLimits(10, 10, 10, 3)));
        }

        @Test
        @DisplayName("a header that understates the entry size is caught during the copy")
        void lyingDeclaredSize() {
            var stream = new CountingZeroStream(50 * MB);
            var lying = new SingleEntryReader("liar.bin", 10, stream);
            var ext = new ArchiveSafetyExtractor(List.of(lying));
            var limits = new ArchiveLimits(10, MB, 5 * MB, 3);

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> ext.extract(new byte[]{1}, "liar.fake", limits));

            assertEquals(ArchiveLimitExceededException.Limit.ENTRY_SIZE, ex.getLimit());
            assertTrue(stream.consumed <= MB + 8192, "read " + stream.consumed + " bytes before stopping");
        }

        @Test
        @DisplayName("declared sizes are checked before any byte is read")
        void declaredSizeCheckedUpFront() {
            var stream = new CountingZeroStream(10);
            var honest = new SingleEntryReader("big.bin", 20 * MB, stream);
            var ext = new ArchiveSafetyExtractor(List.of(honest));

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> ext.extract(new byte[]{1}, "x.fake", new ArchiveLimits(10, MB, 5 * MB, 3)));

            assertEquals(ArchiveLimitExceededException.Limit.ENTRY_SIZE, ex.getLimit());
            assertEquals(0, stream.consumed);
        }

        @Test
        @DisplayName("the entry budget is shared across nesting levels")
        void budgetSharedAcrossLevels() {
            byte[] inner = zipOfEmptyEntries(6);
            byte[] outer = zip(entries("a.zip", inner, "b.zip", inner));

            var ex = assertThrows(ArchiveLimitExceededException.class,
                    () -> extractor.extract(outer, "outer.zip", new ArchiveLimits(10, MB, MB, 3)));

            assertEquals(ArchiveLimitExceededException.Limit.ENTRY_COUNT, ex.getLimit());
            assertTrue(ex.getMessage().contains("b.zip!/"));
        }

        @Test
        @DisplayName("archives nested past max depth are listed but not expanded")
        void depthLimit() throws IOException {
            byte[] deep = nestedZip(5);

            ExtractionReport report = extractor.extract(deep, "deep.zip", new ArchiveLimits(100, MB, 10 * MB, 3));

            assertEquals(3, report.maxDepth());
            assertTrue(report.findings().stream()
                    .anyMatch(f -> f.startsWith("ARCHIVE_RISK:") && f.contains("nested deeper than 3")));
            assertTrue(report.files().stream().noneMatch(f -> f.path().endsWith("payload.txt")));
        }

        @Test
        @DisplayName("crafted nested bombs never exceed the configured limits")
        void randomizedNestedBombs() {
            var random = new Random(42);
            for (int round = 0; round < 25; round++) {
                int innerEntries = 1 + random.nextInt(40);
                int innerCopies = 1 + random.nextInt(8);
                int entrySize = random.nextInt(4096);
                var limits = new ArchiveLimits(20 + random.nextInt(200), 2048 + random.nextInt(4096),
                        8 * KB + random.nextInt((int) (64 * KB)), 1 + random.nextInt(3));

                var innerMap = new java.util.LinkedHashMap<String, byte[]>();
                for (int i = 0; i < innerEntries; i++) {
                    innerMap.put("e" + i + ".bin", new byte[entrySize]);
                }
                byte[] inner = zip(innerMap);
                var outerMap = new java.util.LinkedHashMap<String, byte[]>();
                for (int i = 0; i < innerCopies; i++) {
                    outerMap.put("copy" + i + ".zip", inner);
                }
                byte[] bomb = zip(outerMap);

                try {
                    ExtractionReport report = extractor.extract(bomb, "bomb.zip", limits);
                    assertTrue(report.entryCount() <= limits.maxEntries(), "round " + round);
                    assertTrue(report.totalBytes() <= limits.maxTotalSize(), "round " + round);
                    assertTrue(report.files().stream().allMatch(f -> f.size() <= limits.maxEntrySize()));
                    assertTrue(report.maxDepth() <= limits.maxDepth());
                } catch (ArchiveLimitExceededException e) {
                    assertTrue(e.getObserved() > e.getThreshold(), "round " + round);
                } catch (IOException e) {
                    fail("round " + round + ": " + e);
                }
            }
        }
    }

    @Nested
    @DisplayName("Entry names")
    class EntryNames {

        @Test
        void traversalAndAbsolutePathsAreFindings() throws IOException {
            byte[] zip = zip(entries("../../evil.sh", "rm -rf /", "/etc/passwd", "root", "ok.txt", "fine"));

            ExtractionReport report = extractor.extract(zip, "t.zip", ArchiveLimits.defaults());

            assertEquals(List.of("ok.txt"), report.files().stream().map(ExtractedFile::path).toList());
            assertEquals(2, report.findings().size());
            assertTrue(report.findings().stream().allMatch(f -> f.startsWith("ARCHIVE_RISK: unsafe entry path")));
        }

        @Test
        void sanitizeNormalizes() {
            assertEquals(Optional.of("a/b.txt"), ArchiveSafetyExtractor.sanitize("./a//b.txt"));
            assertEquals(Optional.of("dir/file"), ArchiveSafetyExtractor.sanitize("dir\\file"));
            assertEquals(Optional.empty(), ArchiveSafetyExtractor.sanitize("a/../../b"));
            assertEquals(Optional.empty(), ArchiveSafetyExtractor.sanitize("/abs"));
            assertEquals(Optional.empty(), ArchiveSafetyExtractor.sanitize("C:\\Windows\\x.dll"));
            assertEquals(Optional.empty(), ArchiveSafetyExtractor.sanitize("   "));
        }
    }

    /** Emits zeros and counts how many bytes were pulled. */
    private static final class CountingZeroStream extends InputStream {

        private final long length;
        long consumed;

        CountingZeroStream(long length) {
            this.length = length;
        }

        @Override
        public int read() {
            if (consumed >= length) return -1;
            consumed++;
            return 0;
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (consumed >= length) return -1;
            int n = (int) Math.min(len, length - consumed);
            java.util.Arrays.fill(b, off, off + n, (byte) 0);
            consumed += n;
            return n;
        }
    }

    /** Reader for a made-up format with one entry whose declared size is whatever the test says. */
    private static final class SingleEntryReader implements ArchiveEntryReader {

        private final String name;
        private final long declared;
        private final InputStream content;

        SingleEntryReader(String name, long declared, InputStream content) {
            this.name = name;
            this.declared = declared;
            this.content = content;
        }

        @Override
        public String format() {
            return "fake";
        }

        @Override
        public boolean supports(String fileName, byte[] header) {
            return fileName.endsWith(".fake");
        }

        @Override
        public EntryCursor open(byte[] data) {
            return new EntryCursor() {
                private boolean served;

                @Override
                public EntryInfo next() {
                    if (served) return null;
                    served = true;
                    return new EntryInfo(name, declared, false);
                }

                @Override
                public InputStream stream() {
                    return content;
                }

                @Override
                public void close() {
                }
            };
        }
    }
}
