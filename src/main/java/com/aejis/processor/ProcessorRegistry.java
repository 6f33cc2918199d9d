package com.aejis.processor;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps declared extension, declared MIME type and leading bytes to a {@link Processor}.
 *
 * <p>Each processor's {@link MatchCriteria} is scored; the highest score wins and
 * {@link MatchCriteria#priority()} breaks ties. When nothing scores, the binary
 * forensics fallback is returned, so resolution never fails.
 *
 * <p>The host uses the registry only to pick a processor id and its isolation needs;
 * the bytes it inspects are the first few hundred, compared against fixed signatures.
 */
public class ProcessorRegistry {

    /** Bytes of the artifact considered for signature matching. */
    public static final int HEADER_BYTES = 512;

    private final Map<String, Processor> processors = new LinkedHashMap<>();
    private final Processor fallback;

    public ProcessorRegistry(List<Processor> processors, Processor fallback) {
        for (Processor processor : processors) {
            register(processor);
        }
        this.fallback = fallback;
        register(fallback);
    }

    public static ProcessorRegistry defaults() {
        return new ProcessorRegistry(List.of(
                new TextProcessor(),
                new ImageProcessor(),
                new VideoProcessor(),
                new AudioProcessor(),
                new PdfProcessor(),
                new OfficeDocumentProcessor(),
                new ArchiveProcessor(),
                new ExecutableProcessor(),
                new FontProcessor(),
                new DatabaseProcessor()),
                new BinaryForensicsProcessor());
    }

    private void register(Processor processor) {
        Processor previous = processors.putIfAbsent(processor.id(), processor);
        if (previous != null && previous != processor) {
            throw new IllegalArgumentException("Duplicate processor id: " + processor.id());
        }
    }

    public Processor resolve(String extension, String mime, byte[] header) {
        Processor best = null;
        int bestScore = 0;
        int bestPriority = Integer.MIN_VALUE;
        for (Processor processor : processors.values()) {
            if (processor == fallback) {
                continue;
            }
            int score = processor.criteria().score(extension, mime, header);
            int priority = processor.criteria().priority();
            if (score > bestScore || (score > 0 && score == bestScore && priority > bestPriority)) {
                best = processor;
                bestScore = score;
                bestPriority = priority;
            }
        }
        return best != null ? best : fallback;
    }

    public Optional<Processor> get(String id) {
        return Optional.ofNullable(processors.get(id));
    }

    public Processor fallback() {
        return fallback;
    }

    /** All registered processors, fallback last. */
    public List<Processor> all() {
        return processors.values().stream()
                .sorted(Comparator.comparing((Processor p) -> p == fallback))
                .toList();
    }
}
