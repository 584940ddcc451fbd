package com.example.roster.service;

/**
 * Unrecoverable failure outside the per-page engine: missing lexicon, unwritable output.
 */
public class RosterExtractionException extends RuntimeException {

    public RosterExtractionException(String message) {
        super(message);
    }

    public RosterExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
