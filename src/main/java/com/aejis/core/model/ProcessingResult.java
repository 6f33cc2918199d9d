package com.aejis.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical result of processing one artifact. This is also the wire format of the
 * container entrypoint protocol: the in-container processor writes exactly one of
 * these as a JSON object to stdout, field names in snake_case.
 *
 * <p>{@code behavioral_score} uses one direction everywhere: 100 means no suspicious
 * signal, lower means more suspicious. The host never trusts the value written by
 * the container and recomputes it from the findings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("preview_type") String previewType,
    @JsonProperty("content") String content,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("thumbnail") String thumbnail,
    @JsonProperty("behaviors_detected") @JsonAlias("behaviors") List<String> behaviors,
    @JsonProperty("threat_indicators") List<String> threatIndicators,
    @JsonProperty("behavioral_score") int behavioralScore,
    @JsonProperty("execution_time") double executionTime,
    @JsonProperty("logs") List<String> logs,
    @JsonProperty("secure_processing") boolean secureProcessing,
    @JsonProperty("error") String error,
    @JsonProperty("error_code") String errorCode
) {

    public static final int MAX_SCORE = 100;

    public ProcessingResult {
        previewType = previewType != null ? previewType : "unknown";
        content = content != null ? content : "";
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        behaviors = cleanList(behaviors);
        threatIndicators = cleanList(threatIndicators);
        logs = cleanList(logs);
        behavioralScore = Math.max(0, Math.min(MAX_SCORE, behavioralScore));
    }

    public static Builder builder(String previewType) {
        return new Builder(previewType);
    }

    public static ProcessingResult failure(String previewType, String error, String errorCode) {
        return builder(previewType).error(error, errorCode).build();
    }

    public ProcessingResult withBehavioralScore(int score) {
        return new ProcessingResult(success, previewType, content, metadata, thumbnail, behaviors,
                threatIndicators, score, executionTime, logs, secureProcessing, error, errorCode);
    }

    public ProcessingResult withSecureProcessing(boolean secure) {
        return new ProcessingResult(success, previewType, content, metadata, thumbnail, behaviors,
                threatIndicators, behavioralScore, executionTime, logs, secure, error, errorCode);
    }

    public ProcessingResult withExecutionTime(double seconds) {
        return new ProcessingResult(success, previewType, content, metadata, thumbnail, behaviors,
                threatIndicators, behavioralScore, seconds, logs, secureProcessing, error, errorCode);
    }

    /**
     * Folds another result's findings into this one. Content, preview type and
     * thumbnail stay with this result; metadata keys from {@code other} are nested
     * under {@code key}.
     */
    public ProcessingResult mergeFindings(String key, ProcessingResult other) {
        var mergedMeta = new LinkedHashMap<String, Object>(metadata);
        if (!other.metadata().isEmpty()) {
            mergedMeta.put(key, other.metadata());
        }
        var mergedBehaviors = new LinkedHashSet<>(behaviors);
        mergedBehaviors.addAll(other.behaviors());
        var mergedIndicators = new LinkedHashSet<>(threatIndicators);
        mergedIndicators.addAll(other.threatIndicators());
        var mergedLogs = new ArrayList<>(logs);
        mergedLogs.addAll(other.logs());
        return new ProcessingResult(success && other.success(), previewType, content, mergedMeta, thumbnail,
                new ArrayList<>(mergedBehaviors), new ArrayList<>(mergedIndicators), behavioralScore,
                executionTime, mergedLogs, secureProcessing, error, errorCode);
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Mutable accumulator used by processors while they inspect an artifact.
     */
    public static final class Builder {

        private final String previewType;
        private boolean success = true;
        private String content = "";
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String thumbnail;
        private final LinkedHashSet<String> behaviors = new LinkedHashSet<>();
        private final LinkedHashSet<String> threatIndicators = new LinkedHashSet<>();
        private final List<String> logs = new ArrayList<>();
        private String error;
        private String errorCode;

        private Builder(String previewType) {
            this.previewType = previewType;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            values.forEach(this::metadata);
            return this;
        }

        public Builder thumbnail(String dataUri) {
            this.thumbnail = dataUri;
            return this;
        }

        public Builder behavior(String finding) {
            behaviors.add(finding);
            return this;
        }

        public Builder behaviors(Iterable<String> findings) {
            findings.forEach(behaviors::add);
            return this;
        }

        public Builder indicator(String finding) {
            threatIndicators.add(finding);
            return this;
        }

        public Builder indicators(Iterable<String> findings) {
            findings.forEach(threatIndicators::add);
            return this;
        }

        public Builder log(String line) {
            logs.add(line);
            return this;
        }

        public Builder error(String message, String code) {
            this.success = false;
            this.error = message;
            this.errorCode = code;
            return this;
        }

        public ProcessingResult build() {
            return new ProcessingResult(success, previewType, content, metadata, thumbnail,
                    new ArrayList<>(behaviors), new ArrayList<>(threatIndicators), MAX_SCORE, 0.0,
                    logs, true, error, errorCode);
        }
    }
}
