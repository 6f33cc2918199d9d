package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.IsoBmff;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * TrueType, OpenType and WOFF fonts: table directory validation plus the name and head
 * tables. WOFF2 tables are Brotli-compressed and only the header is described.
 */
public class FontProcessor implements Processor {

    static final int MAX_TABLES = 64;
    private static final int MAX_TABLE_BYTES = 16 * 1024 * 1024;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".ttf", ".otf", ".woff", ".woff2"),
            Set.of("font/*", "application/font-woff", "application/x-font-ttf", "application/x-font-otf"),
            List.of(MagicBytes.TRUETYPE, MagicBytes.OPENTYPE, MagicBytes.TRUETYPE_MAC,
                    MagicBytes.WOFF, MagicBytes.WOFF2));

    private static final Map<Integer, String> NAME_IDS = Map.of(
            0, "copyright", 1, "family", 2, "subfamily", 4, "full_name", 5, "version", 6, "postscript_name");

    record Table(String tag, long offset, long length, byte[] data) {}

    @Override
    public String id() {
        return "font";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("font");
        byte[] data = artifact.data();
        var reader = new ByteReader(data);
        result.metadata("size", data.length);
        try {
            List<Table> tables;
            String flavor;
            if (MagicBytes.WOFF2.matches(data)) {
                result.metadata("format", "woff2")
                        .metadata("flavor", reader.ascii(4, 4))
                        .metadata("table_count", reader.u16be(12))
                        .metadata("sfnt_size", reader.u32be(16))
                        .content("WOFF2 font, " + reader.u16be(12) + " tables (compressed data not decoded)");
                return result.build();
            } else if (MagicBytes.WOFF.matches(data)) {
                flavor = flavorName(reader.ascii(4, 4));
                result.metadata("format", "woff");
                tables = readWoffTables(reader, result);
            } else {
                flavor = flavorName(reader.ascii(0, 4));
                result.metadata("format", "sfnt");
                tables = readSfntTables(reader, result);
            }
            result.metadata("flavor", flavor)
                    .metadata("table_count", tables.size())
                    .metadata("tables", tables.stream().map(Table::tag).toList());

            Map<String, String> names = new LinkedHashMap<>();
            for (Table table : tables) {
                if (table.data() == null) {
                    continue;
                }
                if ("name".equals(table.tag())) {
                    names = readNames(new ByteReader(table.data()));
                } else if ("head".equals(table.tag())) {
                    readHead(new ByteReader(table.data()), result);
                }
            }
            result.metadata("names", names);
            Findings.reportAll(result, ContentSignals.scan(String.join("\n", names.values())));
            String family = names.getOrDefault("full_name", names.getOrDefault("family", "unnamed"));
            result.content("Font: " + family + " (" + flavor + "), " + tables.size() + " tables");
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed font: " + e.getMessage());
            result.content("Malformed font file");
        }
        return result.build();
    }

    private static String flavorName(String tag) {
        return switch (tag) {
            case "OTTO" -> "OpenType/CFF";
            case "true" -> "TrueType (Mac)";
            default -> "TrueType";
        };
    }

    private static List<Table> readSfntTables(ByteReader reader, ProcessingResult.Builder result) {
        int count = reader.u16be(4);
        checkCount(count, result);
        var tables = new ArrayList<Table>();
        for (int i = 0; i < Math.min(count, MAX_TABLES); i++) {
            long record = 12 + 16L * i;
            String tag = reader.ascii(record, 4);
            long offset = reader.u32be(record + 8);
            long length = reader.u32be(record + 12);
            byte[] body = null;
            if (!reader.has(offset, length)) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "table '" + tag.trim() + "' out of bounds");
            } else if (length <= MAX_TABLE_BYTES) {
                body = reader.slice(offset, (int) length);
            }
            tables.add(new Table(tag, offset, length, body));
        }
        return tables;
    }

    private static List<Table> readWoffTables(ByteReader reader, ProcessingResult.Builder result) {
        int count = reader.u16be(12);
        checkCount(count, result);
        var tables = new ArrayList<Table>();
        for (int i = 0; i < Math.min(count, MAX_TABLES); i++) {
            long record = 44 + 20L * i;
            String tag = reader.ascii(record, 4);
            long offset = reader.u32be(record + 4);
            long compressed = reader.u32be(record + 8);
            long original = reader.u32be(record + 12);
            byte[] body = null;
            if (!reader.has(offset, compressed) || original > MAX_TABLE_BYTES || compressed > original) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "table '" + tag.trim() + "' out of bounds");
            } else if (compressed == original) {
                body = reader.slice(offset, (int) original);
            } else {
                body = inflate(reader.slice(offset, (int) compressed), (int) original, tag, result);
            }
            tables.add(new Table(tag, offset, original, body));
        }
        return tables;
    }

    private static void checkCount(int count, ProcessingResult.Builder result) {
        if (count == 0 || count > MAX_TABLES) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "implausible table count " + count);
        }
    }

    /** Inflates at most {@code expected} bytes; anything beyond that is reported. */
    static byte[] inflate(byte[] compressed, int expected, String tag, ProcessingResult.Builder result) {
        var inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            var out = new ByteArrayOutputStream(expected);
            byte[] buffer = new byte[8192];
            while (!inflater.finished() && out.size() <= expected) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                out.write(buffer, 0, n);
            }
            if (out.size() != expected) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                        "table '" + tag.trim() + "' inflates to " + out.size() + " bytes, declared " + expected);
                return null;
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "table '" + tag.trim() + "' is not valid zlib");
            return null;
        } finally {
            inflater.end();
        }
    }

    static Map<String, String> readNames(ByteReader reader) {
        var names = new LinkedHashMap<String, String>();
        int count = reader.u16be(2);
        int storage = reader.u16be(4);
        for (int i = 0; i < Math.min(count, 512); i++) {
            long record = 6 + 12L * i;
            int platform = reader.u16be(record);
            int nameId = reader.u16be(record + 6);
            int length = reader.u16be(record + 8);
            int offset = reader.u16be(record + 10);
            String key = NAME_IDS.get(nameId);
            if (key == null || names.containsKey(key) || !reader.has(storage + offset, length)) {
                continue;
            }
            byte[] raw = reader.slice(storage + offset, length);
            String value = platform == 3 || platform == 0
                    ? new String(raw, StandardCharsets.UTF_16BE)
                    : new String(raw, StandardCharsets.ISO_8859_1);
            names.put(key, value.strip());
        }
        return names;
    }

    private static void readHead(ByteReader reader, ProcessingResult.Builder result) {
        int unitsPerEm = reader.u16be(18);
        result.metadata("units_per_em", unitsPerEm)
                .metadata("created", macDate(reader.u64be(20)))
                .metadata("modified", macDate(reader.u64be(28)));
        if (reader.u32be(12) != 0x5F0F3CF5L) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "head table magic mismatch");
        }
        if (unitsPerEm < 16 || unitsPerEm > 16384) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "unitsPerEm out of range");
        }
    }

    private static String macDate(long seconds) {
        long epoch = seconds - IsoBmff.MAC_EPOCH_OFFSET;
        return epoch > -IsoBmff.MAC_EPOCH_OFFSET && epoch < 32_503_680_000L ? Instant.ofEpochSecond(epoch).toString() : null;
    }
}
