package com.aejis.core.result;

import com.aejis.sandbox.SandboxException;

/**
 * Thrown when no JSON object can be recovered from a container's output. Distinct from a
 * processor that ran and reported {@code success=false}.
 */
public class ResultParseException extends SandboxException {

    public ResultParseException(String message) {
        super(message);
    }

    public ResultParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
