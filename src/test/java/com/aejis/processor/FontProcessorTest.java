package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;

import static org.junit.jupiter.api.Assertions.*;

class FontProcessorTest {

    private final FontProcessor processor = new FontProcessor();

    /** A name table holding one Windows-platform full name record. */
    private static byte[] nameTable(String fullName) {
        byte[] text = fullName.getBytes(StandardCharsets.UTF_16BE);
        var table = ByteBuffer.allocate(18 + text.length);
        table.putShort((short) 0).putShort((short) 1).putShort((short) 18);
        table.putShort((short) 3).putShort((short) 1).putShort((short) 0x409)
                .putShort((short) 4).putShort((short) text.length).putShort((short) 0);
        table.put(text);
        return table.array();
    }

    /** A single-table TrueType file; {@code declaredLength} may lie about the table size. */
    private static byte[] sfnt(byte[] name, int declaredLength) {
        var font = ByteBuffer.allocate(28 + name.length);
        font.putInt(0x00010000).putShort((short) 1).putShort((short) 16).putShort((short) 0).putShort((short) 0);
        font.put("name".getBytes(StandardCharsets.US_ASCII)).putInt(0).putInt(28).putInt(declaredLength);
        font.put(name);
        return font.array();
    }

    private static byte[] deflate(byte[] data) {
        var deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        byte[] buffer = new byte[data.length + 64];
        int n = deflater.deflate(buffer);
        deflater.end();
        return java.util.Arrays.copyOf(buffer, n);
    }

    @Test
    void trueTypeNamesAreRead() throws IOException {
        byte[] name = nameTable("Test Sans");

        ProcessingResult result = processor.process(new Artifact(sfnt(name, name.length), ".ttf", "font/ttf"),
                ProcessingContext.preview());

        assertTrue(result.success());
        assertEquals("sfnt", result.metadata().get("format"));
        assertEquals("TrueType", result.metadata().get("flavor"));
        assertEquals(List.of("name"), result.metadata().get("tables"));
        assertEquals("Test Sans", ((Map<?, ?>) result.metadata().get("names")).get("full_name"));
        assertEquals("Font: Test Sans (TrueType), 1 tables", result.content());
        assertTrue(result.behaviors().isEmpty());
    }

    @Test
    void tableBeyondTheFileIsReported() throws IOException {
        byte[] name = nameTable("Test Sans");

        ProcessingResult result = processor.process(new Artifact(sfnt(name, 1 << 20), ".ttf", null),
                ProcessingContext.preview());

        assertTrue(result.behaviors().contains("SUSPICIOUS_STRUCTURE: table 'name' out of bounds"));
        assertEquals("Font: unnamed (TrueType), 1 tables", result.content());
    }

    @Test
    void woff2IsDescribedFromItsHeader() throws IOException {
        var header = ByteBuffer.allocate(48);
        header.put("wOF2".getBytes(StandardCharsets.US_ASCII)).put("OTTO".getBytes(StandardCharsets.US_ASCII))
                .putInt(48).putShort((short) 9).putShort((short) 0).putInt(4096);

        ProcessingResult result = processor.process(new Artifact(header.array(), ".woff2", null),
                ProcessingContext.preview());

        assertEquals("woff2", result.metadata().get("format"));
        assertEquals(9, result.metadata().get("table_count"));
        assertTrue(result.content().startsWith("WOFF2 font, 9 tables"));
    }

    @Test
    void inflateChecksDeclaredSize() {
        byte[] original = "glyph data ".repeat(20).getBytes(StandardCharsets.US_ASCII);
        byte[] compressed = deflate(original);

        var ok = ProcessingResult.builder("font");
        assertArrayEquals(original, FontProcessor.inflate(compressed, original.length, "glyf", ok));
        assertTrue(ok.build().behaviors().isEmpty());

        var lying = ProcessingResult.builder("font");
        assertNull(FontProcessor.inflate(compressed, 10, "glyf", lying));
        assertFalse(lying.build().behaviors().isEmpty());

        var garbage = ProcessingResult.builder("font");
        assertNull(FontProcessor.inflate(new byte[]{1, 2, 3, 4}, 10, "glyf", garbage));
        assertTrue(garbage.build().behaviors().contains("SUSPICIOUS_STRUCTURE: table 'glyf' is not valid zlib"));
    }
}
