package com.aejis.archive;

import com.aejis.sandbox.SandboxException;

/**
 * Thrown the moment an extraction crosses one of its {@link ArchiveLimits}.
 */
public class ArchiveLimitExceededException extends SandboxException {

    public enum Limit {
        ENTRY_COUNT,
        ENTRY_SIZE,
        TOTAL_SIZE,
        /** Decoder working memory, e.g. an LZMA dictionary, declared by the archive. */
        DECODER_MEMORY
    }

    private final Limit limit;
    private final long threshold;
    private final long observed;

    public ArchiveLimitExceededException(Limit limit, long threshold, long observed, String entryName) {
        super("Archive limit " + limit + " exceeded at entry '" + entryName + "': "
                + observed + " > " + threshold);
        this.limit = limit;
        this.threshold = threshold;
        this.observed = observed;
    }

    public Limit getLimit() {
        return limit;
    }

    public long getThreshold() {
        return threshold;
    }

    public long getObserved() {
        return observed;
    }
}
