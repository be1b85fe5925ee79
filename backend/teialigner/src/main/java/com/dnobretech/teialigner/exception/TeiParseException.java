package com.dnobretech.teialigner.exception;

/**
 * Input is not well-formed XML. Nothing is returned for the request.
 */
public class TeiParseException extends RuntimeException {

    public TeiParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
