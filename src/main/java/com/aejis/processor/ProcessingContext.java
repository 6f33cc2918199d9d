package com.aejis.processor;

import com.aejis.archive.ArchiveLimits;
import com.aejis.core.model.OperationKind;

/**
 * Per-invocation settings handed to a processor.
 */
public record ProcessingContext(OperationKind operation, ArchiveLimits archiveLimits) {

    public static ProcessingContext preview() {
        return new ProcessingContext(OperationKind.PREVIEW, ArchiveLimits.defaults());
    }

    public boolean behavioral() {
        return operation == OperationKind.BEHAVIORAL;
    }
}
