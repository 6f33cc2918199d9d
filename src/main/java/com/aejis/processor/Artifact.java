package com.aejis.processor;

import java.util.Arrays;
import java.util.Locale;

/**
 * The untrusted bytes as seen by a processor inside the container.
 *
 * @param data      full content of the staged file
 * @param extension declared extension, lower case with leading dot, may be empty
 * @param mime      declared MIME type, may be null
 */
public record Artifact(byte[] data, String extension, String mime) {

    public Artifact {
        extension = extension != null ? extension.toLowerCase(Locale.ROOT) : "";
    }

    public int size() {
        return data.length;
    }

    public byte[] header(int n) {
        return Arrays.copyOf(data, Math.min(n, data.length));
    }

    /** Synthetic file name used where a format is recognized by name. */
    public String nominalName() {
        return "input" + extension;
    }
}
