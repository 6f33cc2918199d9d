package com.aejis.processor.support;

/**
 * Shannon entropy in bits per byte, 0.0 to 8.0.
 */
public final class Entropy {

    public static final double HIGH_THRESHOLD = 7.5;
    public static final int CHUNK_SIZE = 256;
    public static final int MAX_CHUNKS = 20;

    /**
     * @param average     mean entropy of the sampled chunks
     * @param max         highest chunk entropy
     * @param chunks      chunks sampled
     * @param highChunks  chunks above {@link #HIGH_THRESHOLD}
     */
    public record ChunkStats(double average, double max, int chunks, int highChunks) {

        public boolean mostlyHigh() {
            return chunks > 0 && highChunks * 2 > chunks;
        }
    }

    private Entropy() {}

    public static double of(byte[] data) {
        return of(data, 0, data.length);
    }

    public static double of(byte[] data, int offset, int length) {
        if (length <= 0) {
            return 0.0;
        }
        int[] counts = new int[256];
        int end = Math.min(data.length, offset + length);
        for (int i = offset; i < end; i++) {
            counts[data[i] & 0xFF]++;
        }
        int total = end - offset;
        double entropy = 0.0;
        for (int count : counts) {
            if (count == 0) continue;
            double p = (double) count / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    /** Entropy of the first {@link #MAX_CHUNKS} chunks of {@link #CHUNK_SIZE} bytes. */
    public static ChunkStats chunked(byte[] data) {
        int chunks = Math.min(MAX_CHUNKS, (data.length + CHUNK_SIZE - 1) / CHUNK_SIZE);
        double sum = 0;
        double max = 0;
        int high = 0;
        for (int i = 0; i < chunks; i++) {
            double e = of(data, i * CHUNK_SIZE, CHUNK_SIZE);
            sum += e;
            max = Math.max(max, e);
            if (e > HIGH_THRESHOLD) {
                high++;
            }
        }
        return new ChunkStats(chunks > 0 ? round(sum / chunks) : 0.0, round(max), chunks, high);
    }

    public static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
