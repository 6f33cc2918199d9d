package com.aejis.processor.support;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Format-agnostic inspection of raw bytes: entropy, embedded executable images and
 * content signals in printable strings. Used as the body of the binary fallback and
 * merged into every result when a job asks for behavioral analysis.
 */
public final class BehavioralProbe {

    static final int MAX_STRINGS = 2000;
    static final int MIN_HIGH_ENTROPY_SIZE = 1024;

    private static final byte[] DOS_STUB = "This program cannot be run in DOS mode".getBytes(StandardCharsets.US_ASCII);

    private BehavioralProbe() {}

    public static ProcessingResult probe(byte[] data) {
        var result = ProcessingResult.builder("behavioral");
        inspect(data, result);
        return result.build();
    }

    /** Adds entropy, embedded executable and string findings to {@code result}. */
    public static void inspect(byte[] data, ProcessingResult.Builder result) {
        double overall = Entropy.round(Entropy.of(data));
        Entropy.ChunkStats chunks = Entropy.chunked(data);
        result.metadata("entropy", overall)
                .metadata("chunk_entropy_average", Entropy.round(chunks.average()))
                .metadata("chunk_entropy_max", Entropy.round(chunks.max()))
                .metadata("high_entropy_chunks", chunks.highChunks() + "/" + chunks.chunks());
        if (data.length >= MIN_HIGH_ENTROPY_SIZE && (overall > Entropy.HIGH_THRESHOLD || chunks.mostlyHigh())) {
            Findings.report(result, SignalCategory.HIGH_ENTROPY, "encrypted or packed content (" + overall + " bits/byte)");
        }

        int stub = indexOf(data, DOS_STUB, 1);
        if (stub > 0 && !MagicBytes.MZ.matches(data)) {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, "embedded PE image near offset " + stub);
        }

        List<String> strings = PrintableStrings.extract(data, MAX_STRINGS);
        result.metadata("strings_count", strings.size());
        Findings.reportAll(result, ContentSignals.scan(String.join("\n", strings)));
    }

    static int indexOf(byte[] data, byte[] needle, int from) {
        outer:
        for (int i = Math.max(0, from); i <= data.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
