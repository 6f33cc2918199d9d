package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VideoProcessorTest {

    private final VideoProcessor processor = new VideoProcessor();

    private static byte[] box(String type, byte[]... children) {
        var payload = new ByteArrayOutputStream();
        for (byte[] child : children) {
            payload.writeBytes(child);
        }
        return ByteBuffer.allocate(8 + payload.size())
                .putInt(8 + payload.size())
                .put(type.getBytes(StandardCharsets.US_ASCII))
                .put(payload.toByteArray())
                .array();
    }

    private static byte[] mp4(int timescale, int duration, int width, int height) {
        byte[] ftyp = box("ftyp", "isom".getBytes(StandardCharsets.US_ASCII), new byte[4],
                "isommp42".getBytes(StandardCharsets.US_ASCII));
        byte[] mvhd = box("mvhd", ByteBuffer.allocate(100).putInt(12, timescale).putInt(16, duration).array());
        byte[] tkhd = box("tkhd", ByteBuffer.allocate(84).putInt(76, width << 16).putInt(80, height << 16).array());
        byte[] hdlr = box("hdlr", ByteBuffer.allocate(24).put(8, "vide".getBytes(StandardCharsets.US_ASCII)).array());
        byte[] trak = box("trak", tkhd, box("mdia", hdlr));
        return concat(ftyp, box("moov", mvhd, trak));
    }

    private static byte[] avi(int microsPerFrame, int frames, int width, int height) {
        var avih = ByteBuffer.allocate(56).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(0, microsPerFrame).putInt(16, frames).putInt(24, 1).putInt(32, width).putInt(36, height);
        int listSize = 4 + 8 + 56;
        var riff = ByteBuffer.allocate(12 + 8 + listSize).order(ByteOrder.LITTLE_ENDIAN);
        riff.put("RIFF".getBytes(StandardCharsets.US_ASCII)).putInt(4 + 8 + listSize)
                .put("AVI ".getBytes(StandardCharsets.US_ASCII))
                .put("LIST".getBytes(StandardCharsets.US_ASCII)).putInt(listSize)
                .put("hdrl".getBytes(StandardCharsets.US_ASCII))
                .put("avih".getBytes(StandardCharsets.US_ASCII)).putInt(56)
                .put(avih.array());
        return riff.array();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    @Test
    void mp4DurationAndDimensions() {
        ProcessingResult result = processor.process(new Artifact(mp4(600, 1500, 640, 360), ".mp4", "video/mp4"),
                ProcessingContext.preview());

        assertTrue(result.success());
        assertEquals("iso-bmff", result.metadata().get("format"));
        assertEquals("isom", result.metadata().get("major_brand"));
        assertEquals(List.of("isom", "mp42"), result.metadata().get("compatible_brands"));
        assertEquals(2.5, (Double) result.metadata().get("duration_seconds"), 0.0001);
        assertEquals("640x360", result.metadata().get("dimensions"));
        assertEquals(1, result.metadata().get("track_count"));
        assertEquals(List.of("vide"), result.metadata().get("track_handlers"));
        assertEquals("Video: isom, 2.5 s, 640x360", result.content());
        assertTrue(result.behaviors().isEmpty());
    }

    @Test
    void overrunningBoxIsMalformed() {
        byte[] data = mp4(600, 1500, 640, 360);
        data[0] = (byte) 0x7F;

        ProcessingResult result = processor.process(new Artifact(data, ".mp4", null), ProcessingContext.preview());

        assertEquals("Malformed video container", result.content());
        assertTrue(result.behaviors().get(0).startsWith("SUSPICIOUS_STRUCTURE: malformed container: box 'ftyp'"));
    }

    @Test
    void aviMainHeader() {
        ProcessingResult result = processor.process(new Artifact(avi(40_000, 250, 320, 240), ".avi", null),
                ProcessingContext.preview());

        assertEquals("avi", result.metadata().get("format"));
        assertEquals(250L, result.metadata().get("frames"));
        assertEquals("320x240", result.metadata().get("dimensions"));
        assertEquals("Video: avi, 10.0 s, 320x240", result.content());
        assertTrue(result.behaviors().isEmpty());
    }

    @Test
    void bytesAfterRiffChunkAreReported() {
        byte[] data = concat(avi(40_000, 25, 320, 240), new byte[]{'M', 'Z', 0, 0});

        ProcessingResult result = processor.process(new Artifact(data, ".avi", null), ProcessingContext.preview());

        assertTrue(result.behaviors().contains("SUSPICIOUS_STRUCTURE: 4 bytes after the RIFF chunk"));
    }

    @Test
    void webmDocTypeAndDuration() {
        var data = ByteBuffer.allocate(4 + 1 + 7 + 3 + 8);
        data.put(new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3, (byte) 0x87})
                .put(new byte[]{0x42, (byte) 0x82, (byte) 0x84}).put("webm".getBytes(StandardCharsets.US_ASCII))
                .put(new byte[]{0x44, (byte) 0x89, (byte) 0x88}).putDouble(5000.0);

        ProcessingResult result = processor.process(new Artifact(data.array(), ".webm", null),
                ProcessingContext.preview());

        assertEquals("webm", result.metadata().get("format"));
        assertEquals(5.0, (Double) result.metadata().get("duration_seconds"), 0.0001);
        assertEquals("Video: webm, 5.0 s", result.content());
    }

    @Test
    void unrecognizedContainer() {
        byte[] data = "just some text pretending to be a movie".getBytes(StandardCharsets.US_ASCII);

        ProcessingResult result = processor.process(new Artifact(data, ".mp4", null), ProcessingContext.preview());

        assertTrue(result.behaviors().contains("SUSPICIOUS_STRUCTURE: no video container signature for .mp4"));
        assertEquals("Unrecognized video container", result.content());
    }
}
