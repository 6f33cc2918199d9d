package com.aejis.core.result;

import com.aejis.core.model.ProcessingResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the single {@link ProcessingResult} a processor writes to stdout, which may
 * be surrounded by unrelated diagnostic text.
 *
 * <p>Candidates are found by a single-pass brace scanner that pairs braces and skips
 * those inside JSON string literals. The first candidate that parses to an object with a
 * {@code success} field wins. If none does, a regex sweep over the whole stream and
 * then over single lines is tried before giving up.
 */
@Component
public class ResultParser {

    private static final Logger log = LoggerFactory.getLogger(ResultParser.class);

    private static final Pattern GREEDY_OBJECT = Pattern.compile("(?s)\\{.*\\}");
    private static final Pattern LINE_OBJECT = Pattern.compile("(?m)^\\s*(\\{.*\\})\\s*$");
    private static final int MAX_CANDIDATES = 64;

    private final ObjectMapper objectMapper;

    public ResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProcessingResult parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            throw new ResultParseException("Container produced no output");
        }

        for (String candidate : balancedSpans(rawOutput)) {
            ProcessingResult result = tryParse(candidate);
            if (result != null) {
                return result;
            }
        }

        log.debug("Brace scan found no result object; falling back to regex sweep");
        Matcher greedy = GREEDY_OBJECT.matcher(rawOutput);
        if (greedy.find()) {
            ProcessingResult result = tryParse(greedy.group());
            if (result != null) {
                return result;
            }
        }
        Matcher line = LINE_OBJECT.matcher(rawOutput);
        while (line.find()) {
            ProcessingResult result = tryParse(line.group(1));
            if (result != null) {
                return result;
            }
        }

        throw new ResultParseException("No JSON result object found in " + rawOutput.length() + " chars of output");
    }

    /**
     * Top-level balanced {@code {...}} spans in order of appearance, found in one pass.
     * Braces inside string literals (including escaped quotes) do not count towards
     * depth, and a raw newline ends any open string since JSON strings cannot hold one.
     * Opening braces that are never closed are abandoned without rescanning the text
     * after them.
     */
    static List<String> balancedSpans(String text) {
        var opens = new ArrayDeque<Integer>();
        var spans = new ArrayList<int[]>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\n') {
                    inString = false;
                    escaped = false;
                } else if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"' && !opens.isEmpty()) {
                inString = true;
            } else if (c == '{') {
                opens.push(i);
            } else if (c == '}' && !opens.isEmpty()) {
                int open = opens.pop();
                // spans closed earlier that start after this brace are nested inside it
                while (!spans.isEmpty() && spans.get(spans.size() - 1)[0] > open) {
                    spans.remove(spans.size() - 1);
                }
                spans.add(new int[]{open, i});
                if (opens.isEmpty() && spans.size() >= MAX_CANDIDATES) {
                    break;
                }
            }
        }
        var result = new ArrayList<String>(Math.min(spans.size(), MAX_CANDIDATES));
        for (int k = 0; k < spans.size() && k < MAX_CANDIDATES; k++) {
            int[] span = spans.get(k);
            result.add(text.substring(span[0], span[1] + 1));
        }
        return result;
    }

    private ProcessingResult tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject() || !node.has("success")) {
                return null;
            }
            return objectMapper.treeToValue(node, ProcessingResult.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.trace("Candidate rejected: {}", e.getMessage());
            return null;
        }
    }
}
