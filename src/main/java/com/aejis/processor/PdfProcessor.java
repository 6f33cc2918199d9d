package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.Thumbnails;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDDocumentNameDictionary;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.interactive.action.PDAction;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionJavaScript;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionLaunch;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDDestination;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PDF preview through PDFBox: document info, text of the first pages, a first-page
 * thumbnail, and detection of active content (JavaScript, launch actions, embedded files).
 */
public class PdfProcessor implements Processor {

    private static final Logger log = LoggerFactory.getLogger(PdfProcessor.class);

    static final int TEXT_PAGES = 3;
    static final int PREVIEW_CHARS = 5000;
    private static final float THUMBNAIL_DPI = 72f;
    private static final double MAX_RENDER_PIXELS = 20_000_000d;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".pdf"),
            Set.of("application/pdf", "application/x-pdf"),
            List.of(MagicBytes.PDF));

    /** Raw name tokens, matched on the uncompressed object bodies. */
    private static final Map<String, String> ACTIVE_TOKENS = new LinkedHashMap<>();

    static {
        ACTIVE_TOKENS.put("/JavaScript", SignalCategory.NETWORK_EXPLOIT.tag("PDF contains JavaScript"));
        ACTIVE_TOKENS.put("/JS", SignalCategory.NETWORK_EXPLOIT.tag("PDF contains JavaScript"));
        ACTIVE_TOKENS.put("/Launch", SignalCategory.EXECUTABLE_CONTENT.tag("PDF launch action"));
        ACTIVE_TOKENS.put("/EmbeddedFile", SignalCategory.ARCHIVE_RISK.tag("PDF carries embedded files"));
        ACTIVE_TOKENS.put("/OpenAction", SignalCategory.SUSPICIOUS_STRUCTURE.tag("PDF automatic open action"));
        ACTIVE_TOKENS.put("/AA", SignalCategory.SUSPICIOUS_STRUCTURE.tag("PDF additional actions"));
        ACTIVE_TOKENS.put("/RichMedia", SignalCategory.SUSPICIOUS_STRUCTURE.tag("PDF rich media content"));
        ACTIVE_TOKENS.put("/XFA", SignalCategory.SUSPICIOUS_STRUCTURE.tag("PDF XFA form"));
        ACTIVE_TOKENS.put("/SubmitForm", SignalCategory.SUSPICIOUS_STRUCTURE.tag("PDF form submission action"));
    }

    @Override
    public String id() {
        return "pdf";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException {
        var result = ProcessingResult.builder("pdf");
        byte[] data = artifact.data();
        result.metadata("size", data.length);
        if (!MagicBytes.PDF.matches(data)) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "missing %PDF header");
        }
        scanRawTokens(data, result);

        PDDocument document;
        try {
            document = Loader.loadPDF(data);
        } catch (InvalidPasswordException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "password-protected PDF");
            return result.metadata("encrypted", true)
                    .content("Encrypted PDF, content not available without a password")
                    .build();
        }

        try (document) {
            int pages = document.getNumberOfPages();
            result.metadata("pages", pages)
                    .metadata("encrypted", document.isEncrypted())
                    .metadata("version", document.getVersion())
                    .metadata("info", info(document.getDocumentInformation()));

            inspectCatalog(document.getDocumentCatalog(), result);

            String text = "";
            if (pages > 0) {
                var stripper = new PDFTextStripper();
                stripper.setStartPage(1);
                stripper.setEndPage(Math.min(TEXT_PAGES, pages));
                text = stripper.getText(document);
                result.thumbnail(renderFirstPage(document));
            }
            boolean truncated = text.length() > PREVIEW_CHARS;
            result.content(truncated ? text.substring(0, PREVIEW_CHARS) : text)
                    .metadata("text_truncated", truncated);
            Findings.reportAll(result, ContentSignals.scan(text));
            result.log("Extracted text from " + Math.min(TEXT_PAGES, pages) + " of " + pages + " page(s)");
        }
        return result.build();
    }

    private static void scanRawTokens(byte[] data, ProcessingResult.Builder result) {
        String raw = new String(data, StandardCharsets.ISO_8859_1);
        for (Map.Entry<String, String> token : ACTIVE_TOKENS.entrySet()) {
            if (containsName(raw, token.getKey())) {
                Findings.report(result, token.getValue());
            }
        }
    }

    /** A PDF name matches only when followed by a delimiter, so /JS does not match /JSON. */
    static boolean containsName(String raw, String name) {
        int from = 0;
        int at;
        while ((at = raw.indexOf(name, from)) >= 0) {
            int next = at + name.length();
            if (next >= raw.length() || !Character.isLetterOrDigit(raw.charAt(next))) {
                return true;
            }
            from = next;
        }
        return false;
    }

    private static void inspectCatalog(PDDocumentCatalog catalog, ProcessingResult.Builder result) throws IOException {
        PDDocumentNameDictionary names = catalog.getNames();
        if (names != null) {
            if (names.getJavaScript() != null) {
                Findings.report(result, SignalCategory.NETWORK_EXPLOIT, "PDF contains JavaScript");
            }
            if (names.getEmbeddedFiles() != null) {
                Findings.report(result, SignalCategory.ARCHIVE_RISK, "PDF carries embedded files");
            }
        }
        var openAction = catalog.getOpenAction();
        if (openAction instanceof PDActionJavaScript) {
            Findings.report(result, SignalCategory.NETWORK_EXPLOIT, "PDF contains JavaScript");
        } else if (openAction instanceof PDActionLaunch) {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, "PDF launch action");
        } else if (openAction instanceof PDAction) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "PDF automatic open action");
        } else if (openAction instanceof PDDestination) {
            result.metadata("open_destination", true);
        }
        if (catalog.getAcroForm() != null) {
            result.metadata("has_form", true);
        }
    }

    private static Map<String, Object> info(PDDocumentInformation info) {
        var metadata = new LinkedHashMap<String, Object>();
        if (info == null) {
            return metadata;
        }
        putIfPresent(metadata, "title", info.getTitle());
        putIfPresent(metadata, "author", info.getAuthor());
        putIfPresent(metadata, "subject", info.getSubject());
        putIfPresent(metadata, "creator", info.getCreator());
        putIfPresent(metadata, "producer", info.getProducer());
        putIfPresent(metadata, "created", format(info.getCreationDate()));
        putIfPresent(metadata, "modified", format(info.getModificationDate()));
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.strip());
        }
    }

    private static String format(Calendar calendar) {
        return calendar == null ? null
                : DateTimeFormatter.ISO_INSTANT.format(calendar.toInstant());
    }

    private static String renderFirstPage(PDDocument document) {
        try {
            PDRectangle box = document.getPage(0).getMediaBox();
            float dpi = THUMBNAIL_DPI;
            double pixels = (box.getWidth() / 72.0 * dpi) * (box.getHeight() / 72.0 * dpi);
            if (pixels > MAX_RENDER_PIXELS) {
                dpi = (float) (dpi * Math.sqrt(MAX_RENDER_PIXELS / pixels));
            }
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(0, dpi);
            return Thumbnails.pngDataUri(image);
        } catch (IOException | RuntimeException e) {
            log.warn("First page could not be rendered: {}", e.getMessage());
            return null;
        }
    }
}
