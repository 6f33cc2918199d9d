package com.aejis.processor.support;

/**
 * Thrown when an untrusted binary structure points outside its own bytes.
 */
public class MalformedStructureException extends RuntimeException {

    public MalformedStructureException(String message) {
        super(message);
    }
}
