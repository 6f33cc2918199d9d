package com.aejis.processor;

import com.aejis.archive.ArchiveFixtures;
import com.aejis.archive.ArchiveLimitExceededException;
import com.aejis.archive.ArchiveLimits;
import com.aejis.core.model.OperationKind;
import com.aejis.core.model.ProcessingResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveProcessorTest {

    private final ArchiveProcessor processor = new ArchiveProcessor();

    @Test
    void listsEntriesAndScansTextSamples() throws IOException {
        byte[] zip = ArchiveFixtures.zip(ArchiveFixtures.entries(
                "notes.txt", "the admin password is hunter2",
                "img/logo.png", new byte[]{(byte) 0x89, 'P', 'N', 'G'}));

        ProcessingResult result = processor.process(new Artifact(zip, ".zip", null), ProcessingContext.preview());

        assertEquals("archive", result.previewType());
        assertEquals(2, result.metadata().get("file_count"));
        assertTrue(result.content().contains("notes.txt"));
        assertTrue(result.behaviors().contains("SENSITIVE_DATA: password"));
    }

    @Test
    void flagsExecutablesAndDoubleExtensions() throws IOException {
        byte[] zip = ArchiveFixtures.zip(ArchiveFixtures.entries(
                "invoice.pdf.exe", new byte[]{'M', 'Z', 0, 0}));

        ProcessingResult result = processor.process(new Artifact(zip, ".zip", null), ProcessingContext.preview());

        assertTrue(result.threatIndicators().contains("EXECUTABLE_CONTENT: executable inside archive: invoice.pdf.exe"));
        assertTrue(result.behaviors().contains("SOCIAL_ENGINEERING: double extension: invoice.pdf.exe"));
    }

    @Test
    void tarGzIsExpanded() throws IOException {
        byte[] tgz = ArchiveFixtures.tarGz(ArchiveFixtures.entries("a.txt", "hello", "b/c.txt", "world"));

        ProcessingResult result = processor.process(new Artifact(tgz, ".tar.gz", null), ProcessingContext.preview());

        assertEquals(2, result.metadata().get("file_count"));
    }

    @Test
    void limitsPropagate() {
        var limits = new ArchiveLimits(10, 1024, 1024 * 1024, 3);
        byte[] zip = ArchiveFixtures.zipOfEmptyEntries(50);

        assertThrows(ArchiveLimitExceededException.class,
                () -> processor.process(new Artifact(zip, ".zip", null),
                        new ProcessingContext(OperationKind.PREVIEW, limits)));
    }
}
