package com.aejis.processor;

import com.aejis.archive.ArchiveSafetyExtractor;
import com.aejis.archive.ExtractedFile;
import com.aejis.archive.ExtractionReport;
import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.MagicBytes;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.poifs.filesystem.DirectoryEntry;
import org.apache.poi.poifs.filesystem.Entry;
import org.apache.poi.poifs.filesystem.POIFSFileSystem;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word, PowerPoint and Excel documents, both Office Open XML and legacy OLE2.
 *
 * <p>OOXML packages are ZIP files, so they are first expanded through the
 * {@link ArchiveSafetyExtractor} under the job's archive limits. The part listing from
 * that pass drives macro, embedded object and external reference detection before POI
 * parses the document itself.
 */
public class OfficeDocumentProcessor implements Processor {

    static final int PREVIEW_CHARS = 5000;
    private static final int MAX_SHEETS = 5;
    private static final int MAX_ROWS = 10;
    private static final int MAX_SLIDES = 3;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".docx", ".docm", ".dotx", ".dotm", ".pptx", ".pptm", ".xlsx", ".xlsm", ".xltx",
                    ".doc", ".xls", ".ppt"),
            Set.of("application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                    "application/vnd.openxmlformats-officedocument.presentationml.presentation",
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                    "application/vnd.ms-word.document.macroenabled.12",
                    "application/vnd.ms-excel.sheet.macroenabled.12",
                    "application/msword", "application/vnd.ms-excel", "application/vnd.ms-powerpoint"),
            List.of(MagicBytes.ZIP, MagicBytes.OLE2));

    private static final Set<String> MACRO_EXTENSIONS = Set.of(".docm", ".dotm", ".xlsm", ".pptm");
    private static final Pattern DANGEROUS_FORMULA = Pattern.compile(
            "\\b(WEBSERVICE|CALL|EXEC|REGISTER|FILTERXML)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXTERNAL_TARGET = Pattern.compile(
            "Target=\"(https?://|file:|\\\\\\\\)[^\"]*\"[^>]*TargetMode=\"External\"|TargetMode=\"External\"[^>]*Target=\"(https?://|file:|\\\\\\\\)",
            Pattern.CASE_INSENSITIVE);

    enum Kind { WORD, PRESENTATION, SPREADSHEET, UNKNOWN }

    private final ArchiveSafetyExtractor extractor;

    public OfficeDocumentProcessor() {
        this(new ArchiveSafetyExtractor());
    }

    public OfficeDocumentProcessor(ArchiveSafetyExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String id() {
        return "office";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException {
        var result = ProcessingResult.builder("office");
        byte[] data = artifact.data();
        result.metadata("size", data.length);
        if (MACRO_EXTENSIONS.contains(artifact.extension())) {
            Findings.report(result, SignalCategory.INFO, "macro-enabled document type (" + artifact.extension() + ")");
        }

        if (MagicBytes.OLE2.matches(data)) {
            describeLegacy(data, artifact, result);
            return result.build();
        }

        ExtractionReport parts = extractor.extract(data, ".zip", context.archiveLimits());
        Findings.reportAll(result, parts.findings());
        Kind kind = kindOf(parts.files(), artifact.extension());
        result.metadata("document_type", kind.name().toLowerCase(Locale.ROOT))
                .metadata("part_count", parts.files().size());
        inspectParts(parts.files(), result);

        String text = switch (kind) {
            case WORD -> describeWord(data, result);
            case PRESENTATION -> describePresentation(data, result);
            case SPREADSHEET -> describeSpreadsheet(data, result);
            case UNKNOWN -> {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "ZIP package without an Office main part");
                yield "";
            }
        };
        boolean truncated = text.length() > PREVIEW_CHARS;
        result.content(truncated ? text.substring(0, PREVIEW_CHARS) : text).metadata("text_truncated", truncated);
        Findings.reportAll(result, ContentSignals.scan(text));
        return result.build();
    }

    static Kind kindOf(List<ExtractedFile> parts, String extension) {
        for (ExtractedFile part : parts) {
            switch (part.path()) {
                case "word/document.xml":
                    return Kind.WORD;
                case "ppt/presentation.xml":
                    return Kind.PRESENTATION;
                case "xl/workbook.xml":
                    return Kind.SPREADSHEET;
                default:
                    break;
            }
        }
        return switch (extension) {
            case ".docx", ".docm", ".dotx", ".dotm" -> Kind.WORD;
            case ".pptx", ".pptm" -> Kind.PRESENTATION;
            case ".xlsx", ".xlsm", ".xltx" -> Kind.SPREADSHEET;
            default -> Kind.UNKNOWN;
        };
    }

    private static void inspectParts(List<ExtractedFile> parts, ProcessingResult.Builder result) {
        var embedded = new ArrayList<String>();
        for (ExtractedFile part : parts) {
            String path = part.path();
            String lower = path.toLowerCase(Locale.ROOT);
            if (lower.endsWith("vbaproject.bin")) {
                Findings.report(result, SignalCategory.MACRO_CONTENT, "VBA macro project (" + path + ")");
            } else if (lower.startsWith("xl/macrosheets/")) {
                Findings.report(result, SignalCategory.MACRO_CONTENT, "Excel 4.0 macro sheet");
            } else if (lower.contains("/embeddings/")) {
                embedded.add(path);
                if (MagicBytes.isExecutable(part.sample())) {
                    Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, "embedded executable " + path);
                } else {
                    Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "embedded OLE object");
                }
            } else if (lower.contains("/activex/")) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "ActiveX control");
            } else if (lower.startsWith("xl/externallinks/")
                    && new String(part.sample(), StandardCharsets.UTF_8).contains("ddeLink")) {
                Findings.report(result, SignalCategory.NETWORK_EXPLOIT, "DDE link");
            }
            if (lower.endsWith(".rels")) {
                String rels = new String(part.sample(), StandardCharsets.UTF_8);
                if (EXTERNAL_TARGET.matcher(rels).find()) {
                    Findings.report(result, SignalCategory.NETWORK_EXPLOIT,
                            rels.contains("attachedTemplate") ? "remote template reference" : "external relationship target");
                }
            }
        }
        if (!embedded.isEmpty()) {
            result.metadata("embedded_objects", embedded);
        }
    }

    private static String describeWord(byte[] data, ProcessingResult.Builder result) throws IOException {
        try (var document = new XWPFDocument(new ByteArrayInputStream(data))) {
            List<XWPFParagraph> paragraphs = document.getParagraphs();
            var text = new StringBuilder();
            for (XWPFParagraph paragraph : paragraphs) {
                if (text.length() > PREVIEW_CHARS) {
                    break;
                }
                text.append(paragraph.getText()).append('\n');
            }
            result.metadata("paragraphs", paragraphs.size())
                    .metadata("tables", document.getTables().size())
                    .metadata("properties", coreProperties(document.getProperties()));
            return text.toString();
        }
    }

    private static String describePresentation(byte[] data, ProcessingResult.Builder result) throws IOException {
        try (var slideShow = new XMLSlideShow(new ByteArrayInputStream(data))) {
            List<XSLFSlide> slides = slideShow.getSlides();
            var text = new StringBuilder();
            for (XSLFSlide slide : slides.subList(0, Math.min(MAX_SLIDES, slides.size()))) {
                text.append("--- Slide ").append(slide.getSlideNumber()).append(" ---\n");
                for (XSLFShape shape : slide.getShapes()) {
                    if (shape instanceof XSLFTextShape textShape) {
                        text.append(textShape.getText()).append('\n');
                    }
                }
            }
            var size = slideShow.getPageSize();
            result.metadata("slides", slides.size())
                    .metadata("slide_size", size.width + "x" + size.height)
                    .metadata("properties", coreProperties(slideShow.getProperties()));
            return text.toString();
        }
    }

    private static String describeSpreadsheet(byte[] data, ProcessingResult.Builder result) throws IOException {
        try (var workbook = new XSSFWorkbook(new ByteArrayInputStream(data))) {
            result.metadata("properties", coreProperties(workbook.getProperties()));
            return describeWorkbook(workbook, result);
        }
    }

    private static String describeWorkbook(Workbook workbook, ProcessingResult.Builder result) {
        var formatter = new DataFormatter(Locale.ROOT);
        var sheetNames = new ArrayList<String>();
        var text = new StringBuilder();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            sheetNames.add(workbook.getSheetName(i));
            if (workbook.isSheetHidden(i) || workbook.isSheetVeryHidden(i)) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "hidden worksheet");
            }
        }
        for (int i = 0; i < Math.min(MAX_SHEETS, workbook.getNumberOfSheets()); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            text.append("--- ").append(sheet.getSheetName()).append(" ---\n");
            int rows = 0;
            for (Row row : sheet) {
                if (rows++ >= MAX_ROWS) {
                    break;
                }
                var cells = new ArrayList<String>();
                for (Cell cell : row) {
                    if (cell.getCellType() == CellType.FORMULA) {
                        String formula = cell.getCellFormula();
                        var matcher = DANGEROUS_FORMULA.matcher(formula);
                        if (matcher.find()) {
                            Findings.report(result, SignalCategory.NETWORK_EXPLOIT,
                                    "formula calls " + matcher.group(1).toUpperCase(Locale.ROOT));
                        }
                        cells.add("=" + formula);
                    } else {
                        cells.add(formatter.formatCellValue(cell));
                    }
                }
                text.append(String.join("\t", cells)).append('\n');
            }
        }
        result.metadata("sheets", sheetNames).metadata("sheet_count", sheetNames.size());
        return text.toString();
    }

    private static Map<String, Object> coreProperties(POIXMLProperties properties) {
        var metadata = new LinkedHashMap<String, Object>();
        if (properties == null) {
            return metadata;
        }
        POIXMLProperties.CoreProperties core = properties.getCoreProperties();
        putIfPresent(metadata, "title", core.getTitle());
        putIfPresent(metadata, "creator", core.getCreator());
        putIfPresent(metadata, "last_modified_by", core.getLastModifiedByUser());
        putIfPresent(metadata, "created", format(core.getCreated()));
        putIfPresent(metadata, "modified", format(core.getModified()));
        String application = properties.getExtendedProperties().getApplication();
        putIfPresent(metadata, "application", application);
        return metadata;
    }

    private void describeLegacy(byte[] data, Artifact artifact, ProcessingResult.Builder result) throws IOException {
        try (var filesystem = new POIFSFileSystem(new ByteArrayInputStream(data))) {
            var streams = new ArrayList<String>();
            walk(filesystem.getRoot(), "", streams, result);
            result.metadata("format", "ole2").metadata("streams", streams.size());
            boolean workbook = filesystem.getRoot().hasEntry("Workbook") || filesystem.getRoot().hasEntry("Book");
            if (workbook) {
                try (var hssf = new HSSFWorkbook(filesystem.getRoot(), false)) {
                    result.metadata("document_type", "spreadsheet");
                    String text = describeWorkbook(hssf, result);
                    result.content(text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) : text);
                    Findings.reportAll(result, ContentSignals.scan(text));
                }
            } else {
                String type = filesystem.getRoot().hasEntry("WordDocument") ? "word"
                        : filesystem.getRoot().hasEntry("PowerPoint Document") ? "presentation" : "unknown";
                result.metadata("document_type", type)
                        .content("Legacy " + type + " document (" + artifact.extension() + "), "
                                + streams.size() + " streams");
            }
        }
    }

    private static void walk(DirectoryEntry directory, String prefix, List<String> streams,
                             ProcessingResult.Builder result) {
        for (Entry entry : directory) {
            String path = prefix + entry.getName();
            String name = entry.getName();
            if (name.equals("VBA") || name.equals("_VBA_PROJECT_CUR") || name.equals("Macros")) {
                Findings.report(result, SignalCategory.MACRO_CONTENT, "VBA macro storage (" + path + ")");
            } else if (name.equals("ObjectPool")) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "embedded OLE object");
            }
            if (entry instanceof DirectoryEntry child) {
                if (streams.size() < 1000) {
                    walk(child, path + "/", streams, result);
                }
            } else {
                streams.add(path);
            }
        }
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.strip());
        }
    }

    private static String format(Date date) {
        return date == null ? null : DateTimeFormatter.ISO_INSTANT.format(date.toInstant());
    }
}
