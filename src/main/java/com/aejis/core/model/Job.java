package com.aejis.core.model;

import com.aejis.sandbox.IsolationPolicy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work for the dispatcher. Owned by the dispatcher for its duration and
 * dropped once the {@link JobResult} is returned.
 *
 * @param id                unique job identifier
 * @param artifact          raw bytes of the untrusted file (never parsed on the host)
 * @param fileName          original file name as supplied by the caller, display only
 * @param declaredExtension lower-case extension including the dot, may be empty
 * @param declaredMime      MIME type claimed by the caller, nullable
 * @param operationKind     preview or behavioral
 * @param policyOverride    optional per-job isolation policy, nullable
 */
public record Job(
    String id,
    byte[] artifact,
    String fileName,
    String declaredExtension,
    String declaredMime,
    OperationKind operationKind,
    IsolationPolicy policyOverride
) {

    private static final String[] COMPOUND_EXTENSIONS = {".tar.gz", ".tar.bz2", ".tar.xz"};

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(artifact, "artifact");
        declaredExtension = normalizeExtension(declaredExtension);
        operationKind = operationKind != null ? operationKind : OperationKind.PREVIEW;
    }

    public static Job of(byte[] artifact, String fileName, OperationKind kind) {
        return new Job(newId(), artifact, fileName, extensionOf(fileName), null, kind, null);
    }

    public static String newId() {
        return "JOB-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Job withPolicyOverride(IsolationPolicy policy) {
        return new Job(id, artifact, fileName, declaredExtension, declaredMime, operationKind, policy);
    }

    public Job withDeclaredMime(String mime) {
        return new Job(id, artifact, fileName, declaredExtension, mime, operationKind, policyOverride);
    }

    public int size() {
        return artifact.length;
    }

    /** First {@code n} bytes, used only for signature matching. */
    public byte[] header(int n) {
        return Arrays.copyOf(artifact, Math.min(n, artifact.length));
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) return "";
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String compound : COMPOUND_EXTENSIONS) {
            if (lower.endsWith(compound)) return compound;
        }
        int dot = lower.lastIndexOf('.');
        int slash = Math.max(lower.lastIndexOf('/'), lower.lastIndexOf('\\'));
        return dot > slash && dot >= 0 ? lower.substring(dot) : "";
    }

    static String normalizeExtension(String ext) {
        if (ext == null || ext.isBlank()) return "";
        String trimmed = ext.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    @Override
    public String toString() {
        return "Job[id=" + id + ", fileName=" + fileName + ", ext=" + declaredExtension
                + ", kind=" + operationKind + ", size=" + artifact.length + "]";
    }
}
