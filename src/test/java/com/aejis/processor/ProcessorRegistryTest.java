package com.aejis.processor;

import com.aejis.archive.ArchiveFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorRegistryTest {

    private static final byte[] PNG_HEADER = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 13};
    private static final byte[] MZ_HEADER = {'M', 'Z', (byte) 0x90, 0, 3, 0, 0, 0};

    private final ProcessorRegistry registry = ProcessorRegistry.defaults();

    private String resolve(String extension, String mime, byte[] header) {
        return registry.resolve(extension, mime, header).id();
    }

    @Test
    void extensionAlone() {
        assertEquals("text", resolve(".txt", null, "hello".getBytes(StandardCharsets.UTF_8)));
        assertEquals("pdf", resolve(".pdf", null, new byte[0]));
    }

    @Test
    @DisplayName("content signature outweighs a lying extension")
    void signatureBeatsExtension() {
        assertEquals("image", resolve(".txt", "text/plain", PNG_HEADER));
        assertEquals("executable", resolve(".jpg", "image/jpeg", MZ_HEADER));
    }

    @Test
    void mimeWildcard() {
        assertEquals("text", resolve("", "text/x-custom; charset=utf-8", new byte[0]));
    }

    @Test
    @DisplayName("a ZIP with an Office extension goes to the office processor")
    void officeBeatsArchiveOnExtension() {
        byte[] zip = ArchiveFixtures.zip(ArchiveFixtures.entries("word/document.xml", "<w:document/>"));

        assertEquals("office", resolve(".docx", null, zip));
        assertEquals("archive", resolve(".zip", null, zip));
    }

    @Test
    void unknownFallsBackToBinary() {
        assertEquals(BinaryForensicsProcessor.ID, resolve(".xyz", "application/x-nothing", new byte[]{1, 2, 3}));
        assertEquals(BinaryForensicsProcessor.ID, resolve(null, null, null));
    }

    @Test
    void executableIsIsolationSensitive() {
        assertTrue(registry.get("executable").orElseThrow().isolationSensitive());
        assertFalse(registry.get("text").orElseThrow().isolationSensitive());
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessorRegistry(List.of(new TextProcessor(), new TextProcessor()),
                        new BinaryForensicsProcessor()));
    }

    @Test
    void fallbackIsListed() {
        assertTrue(registry.all().contains(registry.fallback()));
        assertEquals(11, registry.all().size());
    }
}
