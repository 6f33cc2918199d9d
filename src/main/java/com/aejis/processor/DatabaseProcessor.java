package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SQLite and Microsoft Access files. SQLite schema is read directly from the
 * {@code sqlite_master} b-tree rooted at page 1; no database engine is opened.
 */
public class DatabaseProcessor implements Processor {

    static final int MAX_SCHEMA_ENTRIES = 500;
    private static final int MAX_PAGES_VISITED = 1000;
    private static final int MAX_SQL_CHARS = 500;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".db", ".sqlite", ".sqlite3", ".db3", ".mdb", ".accdb"),
            Set.of("application/x-sqlite3", "application/vnd.sqlite3", "application/x-msaccess"),
            List.of(MagicBytes.SQLITE, MagicBytes.ACCESS, MagicBytes.ACCESS_ACE));

    /** One row of {@code sqlite_master}. */
    record SchemaEntry(String type, String name, String sql) {}

    @Override
    public String id() {
        return "database";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("database");
        byte[] data = artifact.data();
        result.metadata("size", data.length);
        try {
            if (MagicBytes.SQLITE.matches(data)) {
                describeSqlite(new ByteReader(data), result);
            } else if (MagicBytes.ACCESS.matches(data) || MagicBytes.ACCESS_ACE.matches(data)) {
                boolean ace = MagicBytes.ACCESS_ACE.matches(data);
                result.metadata("format", ace ? "access-ace" : "access-jet")
                        .metadata("engine_version", data.length > 0x14 ? data[0x14] & 0xFF : null)
                        .content("Microsoft Access database (" + (ace ? "ACE" : "Jet") + ")");
            } else {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                        "no database header for " + artifact.extension());
                result.content("Unrecognized database file");
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed database: " + e.getMessage());
            result.content("Malformed database file");
        }
        return result.build();
    }

    private void describeSqlite(ByteReader reader, ProcessingResult.Builder result) {
        int rawPageSize = reader.u16be(16);
        int pageSize = rawPageSize == 1 ? 65536 : rawPageSize;
        if (pageSize < 512 || Integer.bitCount(pageSize) != 1) {
            throw new MalformedStructureException("invalid page size " + rawPageSize);
        }
        int reserved = reader.u8(20);
        long pageCount = reader.u32be(28);
        long encoding = reader.u32be(56);
        Charset charset = encoding == 2 ? StandardCharsets.UTF_16LE
                : encoding == 3 ? StandardCharsets.UTF_16BE : StandardCharsets.UTF_8;
        long version = reader.u32be(96);

        result.metadata("format", "sqlite3")
                .metadata("page_size", pageSize)
                .metadata("page_count", pageCount)
                .metadata("text_encoding", charset.name())
                .metadata("user_version", reader.u32be(60))
                .metadata("application_id", reader.u32be(68))
                .metadata("sqlite_version", version / 1_000_000 + "." + (version / 1000) % 1000 + "." + version % 1000);
        if (pageCount > 0 && pageCount * pageSize != reader.length()) {
            result.metadata("size_mismatch", true);
        }

        var schema = new SchemaReader(reader, pageSize, pageSize - reserved, charset);
        schema.readTable(1, 0);
        List<SchemaEntry> entries = schema.entries;

        Map<String, List<String>> byType = new LinkedHashMap<>();
        var sqlText = new StringBuilder();
        for (SchemaEntry entry : entries) {
            byType.computeIfAbsent(entry.type(), t -> new ArrayList<>()).add(entry.name());
            if (entry.sql() != null) {
                sqlText.append(entry.sql()).append('\n');
            }
        }
        byType.forEach((type, names) -> result.metadata(type + "s", names));
        result.metadata("schema_entries", entries.size());

        String sql = sqlText.toString();
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.contains("load_extension")) {
            Findings.report(result, SignalCategory.NETWORK_EXPLOIT, "schema calls load_extension");
        }
        if (byType.containsKey("trigger")) {
            Findings.report(result, SignalCategory.INFO, "database defines triggers");
        }
        Findings.reportAll(result, ContentSignals.scan(sql));

        var content = new StringBuilder("SQLite database, ")
                .append(byType.getOrDefault("table", List.of()).size()).append(" table(s)\n");
        sql.lines().limit(40).forEach(line -> content.append(line).append('\n'));
        result.content(content.toString());
    }

    /** Walks the table b-tree holding the schema, following overflow chains. */
    private static final class SchemaReader {

        private final ByteReader reader;
        private final int pageSize;
        private final int usable;
        private final Charset charset;
        private final Set<Long> visited = new HashSet<>();
        private final List<SchemaEntry> entries = new ArrayList<>();

        SchemaReader(ByteReader reader, int pageSize, int usable, Charset charset) {
            this.reader = reader;
            this.pageSize = pageSize;
            this.usable = usable;
            this.charset = charset;
        }

        void readTable(long page, int depth) {
            if (depth > 20 || !visited.add(page) || visited.size() > MAX_PAGES_VISITED
                    || entries.size() >= MAX_SCHEMA_ENTRIES) {
                return;
            }
            long pageStart = (page - 1) * pageSize;
            long header = page == 1 ? 100 : pageStart;
            int type = reader.u8(header);
            int cells = reader.u16be(header + 3);
            boolean interior = type == 0x05;
            if (!interior && type != 0x0D) {
                throw new MalformedStructureException("unexpected b-tree page type " + type + " on page " + page);
            }
            long pointers = header + (interior ? 12 : 8);
            for (int i = 0; i < cells; i++) {
                long cell = pageStart + reader.u16be(pointers + 2L * i);
                if (interior) {
                    readTable(reader.u32be(cell), depth + 1);
                } else {
                    readLeafCell(cell);
                }
            }
            if (interior) {
                readTable(reader.u32be(header + 8), depth + 1);
            }
        }

        private void readLeafCell(long cell) {
            long[] payloadLength = varint(cell);
            long[] rowId = varint(cell + payloadLength[1]);
            long payloadStart = cell + payloadLength[1] + rowId[1];
            byte[] payload = payload(payloadStart, payloadLength[0]);
            var record = new ByteReader(payload);

            long[] headerSize = varint(record, 0);
            long offset = headerSize[1];
            long body = headerSize[0];
            var values = new ArrayList<Object>();
            while (offset < headerSize[0] && values.size() < 5) {
                long[] serial = varint(record, offset);
                offset += serial[1];
                int size = serialSize(serial[0]);
                values.add(serial[0] >= 13 && serial[0] % 2 == 1 && record.has(body, size)
                        ? new String(record.slice(body, size), charset) : null);
                body += size;
            }
            if (values.size() >= 2 && values.get(0) instanceof String type && values.get(1) instanceof String name) {
                String sql = values.size() >= 5 && values.get(4) instanceof String s ? truncate(s) : null;
                entries.add(new SchemaEntry(type, name, sql));
            }
        }

        private byte[] payload(long start, long length) {
            int maxLocal = usable - 35;
            if (length <= maxLocal) {
                return reader.slice(start, (int) length);
            }
            int minLocal = ((usable - 12) * 32 / 255) - 23;
            long local = minLocal + ((length - minLocal) % (usable - 4));
            if (local > maxLocal) {
                local = minLocal;
            }
            var out = new ByteArrayOutputStream();
            out.writeBytes(reader.slice(start, (int) local));
            long next = reader.u32be(start + local);
            long remaining = length - local;
            int hops = 0;
            while (next != 0 && remaining > 0 && hops++ < MAX_PAGES_VISITED) {
                long pageStart = (next - 1) * pageSize;
                int chunk = (int) Math.min(remaining, usable - 4);
                out.writeBytes(reader.slice(pageStart + 4, chunk));
                remaining -= chunk;
                next = reader.u32be(pageStart);
            }
            return out.toByteArray();
        }

        private long[] varint(long offset) {
            return varint(reader, offset);
        }

        /** SQLite varint: {value, encoded length}. */
        static long[] varint(ByteReader source, long offset) {
            long value = 0;
            for (int i = 0; i < 9; i++) {
                int b = source.u8(offset + i);
                if (i == 8) {
                    return new long[]{(value << 8) | b, 9};
                }
                value = (value << 7) | (b & 0x7F);
                if ((b & 0x80) == 0) {
                    return new long[]{value, i + 1};
                }
            }
            throw new MalformedStructureException("unterminated varint at " + offset);
        }

        static int serialSize(long serial) {
            if (serial >= 12) {
                return (int) ((serial - (serial % 2 == 0 ? 12 : 13)) / 2);
            }
            return switch ((int) serial) {
                case 1 -> 1;
                case 2 -> 2;
                case 3 -> 3;
                case 4 -> 4;
                case 5 -> 6;
                case 6, 7 -> 8;
                default -> 0;
            };
        }

        private static String truncate(String sql) {
            return sql.length() > MAX_SQL_CHARS ? sql.substring(0, MAX_SQL_CHARS) + "..." : sql;
        }
    }
}
