package com.aejis.processor.support;

import java.util.ArrayList;
import java.util.List;

/**
 * ASCII string extraction, like {@code strings(1)}.
 */
public final class PrintableStrings {

    public static final int MIN_LENGTH = 4;

    private PrintableStrings() {}

    public static List<String> extract(byte[] data, int maxStrings) {
        var strings = new ArrayList<String>();
        var current = new StringBuilder();
        for (byte b : data) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F || c == '\t') {
                current.append((char) c);
                continue;
            }
            if (current.length() >= MIN_LENGTH) {
                strings.add(current.toString());
                if (strings.size() >= maxStrings) {
                    return strings;
                }
            }
            current.setLength(0);
        }
        if (current.length() >= MIN_LENGTH && strings.size() < maxStrings) {
            strings.add(current.toString());
        }
        return strings;
    }

    /** Fraction of bytes that are printable ASCII or common whitespace. */
    public static double printableRatio(byte[] data, int limit) {
        int n = Math.min(limit, data.length);
        if (n == 0) {
            return 0.0;
        }
        int printable = 0;
        for (int i = 0; i < n; i++) {
            int c = data[i] & 0xFF;
            if (c >= 0x20 && c < 0x7F || c == '\n' || c == '\r' || c == '\t') {
                printable++;
            }
        }
        return (double) printable / n;
    }
}
