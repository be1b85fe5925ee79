package com.dnobretech.teialigner.exception;

public class AlignmentBusyException extends RuntimeException {

    public AlignmentBusyException(String message) {
        super(message);
    }
}
