package com.dnobretech.teialigner.exception;

// one of the documents has nothing to align
public class DegenerateInputException extends AlignmentException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
