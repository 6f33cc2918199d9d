package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionJavaScript;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class PdfProcessorTest {

    private final PdfProcessor processor = new PdfProcessor();

    private static byte[] pdf(String text, boolean withJavaScript) throws IOException {
        try (var document = new PDDocument()) {
            var page = new PDPage();
            document.addPage(page);
            try (var content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(text);
                content.endText();
            }
            document.getDocumentInformation().setTitle("Quarterly report");
            if (withJavaScript) {
                document.getDocumentCatalog().setOpenAction(new PDActionJavaScript("app.alert('hi');"));
            }
            var out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void extractsTextAndInfo() throws IOException {
        ProcessingResult result = processor.process(new Artifact(pdf("Revenue grew this quarter", false), ".pdf", null),
                ProcessingContext.preview());

        assertTrue(result.success());
        assertEquals("pdf", result.previewType());
        assertEquals(1, result.metadata().get("pages"));
        assertTrue(result.content().contains("Revenue grew"));
        assertNotNull(result.thumbnail());
        assertTrue(result.behaviors().isEmpty());
    }

    @Test
    @DisplayName("an open action running JavaScript is a threat indicator")
    void javaScriptOpenAction() throws IOException {
        ProcessingResult result = processor.process(new Artifact(pdf("Hello", true), ".pdf", null),
                ProcessingContext.preview());

        assertTrue(result.threatIndicators().contains("NETWORK_EXPLOIT: PDF contains JavaScript"));
    }

    @Test
    void unparseableBytesFail() {
        assertThrows(IOException.class,
                () -> processor.process(new Artifact("garbage".getBytes(), ".pdf", null), ProcessingContext.preview()));
    }

    @Test
    void nameMatchingNeedsDelimiter() {
        assertTrue(PdfProcessor.containsName("<< /JS (x) >>", "/JS"));
        assertFalse(PdfProcessor.containsName("<< /JSON 1 >>", "/JS"));
    }
}
