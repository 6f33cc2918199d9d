package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.ScoringAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ExecutableProcessorTest {

    private final ExecutableProcessor processor = new ExecutableProcessor();

    @Test
    @DisplayName("MZ bytes with an .exe name are reported as executable content")
    void mzStub() {
        byte[] data = {'M', 'Z', (byte) 0x90, 0, 3, 0, 0, 0, 4, 0};

        ProcessingResult result = processor.process(new Artifact(data, ".exe", null), ProcessingContext.preview());

        assertEquals("executable", result.previewType());
        assertFalse(result.threatIndicators().isEmpty());
        assertTrue(result.threatIndicators().stream().allMatch(i -> !i.isBlank()));
        assertTrue(new ScoringAggregator().rescore(result).behavioralScore() <= 85);
    }

    @Test
    void minimalPeHeader() {
        ByteBuffer pe = ByteBuffer.allocate(512).order(ByteOrder.LITTLE_ENDIAN);
        pe.put(0, (byte) 'M').put(1, (byte) 'Z');
        pe.putInt(0x3C, 0x80);
        pe.put(0x80, (byte) 'P').put(0x81, (byte) 'E');
        pe.putShort(0x84, (short) 0x8664);
        pe.putShort(0x86, (short) 0);
        pe.putShort(0x94, (short) 0xF0);
        pe.putShort(0x98, (short) 0x20B);
        pe.putShort(0x98 + 68, (short) 3);
        byte[] data = pe.array();
        byte[] api = "CreateRemoteThread".getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(api, 0, data, 300, api.length);

        ProcessingResult result = processor.process(new Artifact(data, ".exe", null), ProcessingContext.preview());

        assertEquals("PE32+", result.metadata().get("format"));
        assertEquals("x86_64", result.metadata().get("machine"));
        assertEquals("console", result.metadata().get("subsystem"));
        assertTrue(result.threatIndicators().contains("EXECUTABLE_CONTENT: PE32+ executable"));
        assertTrue(result.threatIndicators().contains("MALWARE_KEYWORD: process injection API"));
    }

    @Test
    void executableExtensionWithoutHeader() {
        ProcessingResult result = processor.process(new Artifact("just text".getBytes(), ".exe", null),
                ProcessingContext.preview());

        assertEquals("unknown", result.metadata().get("format"));
        assertTrue(result.threatIndicators().contains("EXECUTABLE_CONTENT: declared executable type (.exe)"));
    }
}
