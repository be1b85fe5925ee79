package com.dnobretech.teialigner.exception;

/**
 * The aligner failed or broke its coverage contract. The whole request fails.
 */
public class AlignmentException extends RuntimeException {

    public AlignmentException(String message) {
        super(message);
    }

    public AlignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
