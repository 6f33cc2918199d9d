package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.BehavioralProbe;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.Hashes;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.PrintableStrings;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fallback for anything no other processor claims: hashes, entropy, magic detection,
 * printable strings and a hex dump of the leading bytes.
 */
public class BinaryForensicsProcessor implements Processor {

    public static final String ID = "binary";
    static final int HEX_PREVIEW_BYTES = 256;
    static final int LISTED_STRINGS = 50;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".bin", ".dat", ".rar", ".iso", ".img"),
            Set.of("application/octet-stream", "application/vnd.rar", "application/x-rar-compressed"),
            List.of(MagicBytes.RAR));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("binary");
        byte[] data = artifact.data();
        Optional<String> detected = MagicBytes.detect(data);
        result.metadata("size", data.length)
                .metadata("hashes", Hashes.all(data))
                .metadata("detected_type", detected.orElse("unknown"));

        if (detected.isPresent() && MagicBytes.isExecutable(data)) {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, detected.get() + " header in generic binary");
        }
        if (MagicBytes.RAR.matches(data)) {
            Findings.report(result, SignalCategory.INFO, "RAR archive not expanded");
        }

        BehavioralProbe.inspect(data, result);
        List<String> strings = PrintableStrings.extract(data, LISTED_STRINGS);
        result.metadata("strings", strings)
                .content(hexDump(data, HEX_PREVIEW_BYTES));
        return result.build();
    }

    static String hexDump(byte[] data, int limit) {
        int n = Math.min(limit, data.length);
        var out = new StringBuilder();
        for (int row = 0; row < n; row += 16) {
            out.append(String.format(Locale.ROOT, "%08x  ", row));
            var ascii = new StringBuilder();
            for (int i = row; i < row + 16; i++) {
                if (i < n) {
                    int b = data[i] & 0xFF;
                    out.append(String.format(Locale.ROOT, "%02x ", b));
                    ascii.append(b >= 0x20 && b < 0x7F ? (char) b : '.');
                } else {
                    out.append("   ");
                }
                if (i == row + 7) {
                    out.append(' ');
                }
            }
            out.append(" |").append(ascii).append("|\n");
        }
        return out.toString();
    }
}
