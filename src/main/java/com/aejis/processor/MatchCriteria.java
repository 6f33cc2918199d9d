package com.aejis.processor;

import com.aejis.processor.support.MagicBytes;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * What a processor claims: extensions, MIME types (exact or {@code type/*}) and magic
 * signatures. {@link #score} weighs a signature above an extension above a MIME type,
 * so content that identifies itself wins over what the caller declared.
 */
public record MatchCriteria(
    Set<String> extensions,
    Set<String> mimeTypes,
    List<MagicBytes.Signature> signatures,
    int priority
) {

    static final int SIGNATURE_WEIGHT = 4;
    static final int EXTENSION_WEIGHT = 2;
    static final int MIME_WEIGHT = 1;

    public MatchCriteria {
        extensions = Set.copyOf(extensions);
        mimeTypes = Set.copyOf(mimeTypes);
        signatures = List.copyOf(signatures);
    }

    public static MatchCriteria of(Set<String> extensions, Set<String> mimeTypes,
                                   List<MagicBytes.Signature> signatures) {
        return new MatchCriteria(extensions, mimeTypes, signatures, 0);
    }

    public MatchCriteria withPriority(int priority) {
        return new MatchCriteria(extensions, mimeTypes, signatures, priority);
    }

    /** 0 means no match. */
    public int score(String extension, String mime, byte[] header) {
        int score = 0;
        if (header != null && signatures.stream().anyMatch(s -> s.matches(header))) {
            score += SIGNATURE_WEIGHT;
        }
        if (extension != null && extensions.contains(extension.toLowerCase(Locale.ROOT))) {
            score += EXTENSION_WEIGHT;
        }
        if (mime != null && matchesMime(mime.toLowerCase(Locale.ROOT))) {
            score += MIME_WEIGHT;
        }
        return score;
    }

    private boolean matchesMime(String mime) {
        String base = mime.contains(";") ? mime.substring(0, mime.indexOf(';')).trim() : mime;
        if (mimeTypes.contains(base)) {
            return true;
        }
        int slash = base.indexOf('/');
        return slash > 0 && mimeTypes.contains(base.substring(0, slash) + "/*");
    }
}
