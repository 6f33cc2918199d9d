package com.aejis.processor;

import com.aejis.archive.ArchiveFixtures;
import com.aejis.core.model.ProcessingResult;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class OfficeDocumentProcessorTest {

    private final OfficeDocumentProcessor processor = new OfficeDocumentProcessor();

    @Test
    void wordDocumentText() throws IOException {
        byte[] docx;
        try (var document = new XWPFDocument(); var out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("Please verify your account today");
            document.write(out);
            docx = out.toByteArray();
        }

        ProcessingResult result = processor.process(new Artifact(docx, ".docx", null), ProcessingContext.preview());

        assertEquals("office", result.previewType());
        assertEquals("word", result.metadata().get("document_type"));
        assertTrue(result.content().contains("verify your account"));
        assertTrue(result.behaviors().contains("SOCIAL_ENGINEERING: verify your account"));
    }

    @Test
    void spreadsheetWithHiddenSheet() throws IOException {
        byte[] xlsx;
        try (var workbook = new XSSFWorkbook(); var out = new ByteArrayOutputStream()) {
            workbook.createSheet("Visible").createRow(0).createCell(0).setCellValue("total");
            workbook.createSheet("Stash");
            workbook.setSheetHidden(1, true);
            workbook.write(out);
            xlsx = out.toByteArray();
        }

        ProcessingResult result = processor.process(new Artifact(xlsx, ".xlsx", null), ProcessingContext.preview());

        assertEquals("spreadsheet", result.metadata().get("document_type"));
        assertTrue(result.behaviors().contains("SUSPICIOUS_STRUCTURE: hidden worksheet"));
    }

    @Test
    void macroProjectIsIndicator() throws IOException {
        byte[] docx;
        try (var document = new XWPFDocument(); var out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("Enable content to view");
            document.write(out);
            docx = out.toByteArray();
        }
        byte[] docm = withPart(docx, "word/vbaProject.bin", new byte[]{1, 2, 3});

        ProcessingResult result = processor.process(new Artifact(docm, ".docm", null), ProcessingContext.preview());

        assertTrue(result.threatIndicators().stream().anyMatch(i -> i.startsWith("MACRO_CONTENT: VBA macro project")));
        assertTrue(result.behaviors().contains("INFO: macro-enabled document type (.docm)"));
    }

    /** Copies an OOXML package and adds one part, registering a content type for its extension. */
    private static byte[] withPart(byte[] ooxml, String name, byte[] content) throws IOException {
        var entries = new LinkedHashMap<String, byte[]>();
        try (var zip = new ZipInputStream(new ByteArrayInputStream(ooxml))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.put(entry.getName(), zip.readAllBytes());
            }
        }
        String types = new String(entries.get("[Content_Types].xml"), StandardCharsets.UTF_8);
        types = types.replaceFirst("<Default ",
                "<Default Extension=\"bin\" ContentType=\"application/vnd.ms-office.vbaProject\"/><Default ");
        entries.put("[Content_Types].xml", types.getBytes(StandardCharsets.UTF_8));
        entries.put(name, content);
        return ArchiveFixtures.zip(entries);
    }
}
