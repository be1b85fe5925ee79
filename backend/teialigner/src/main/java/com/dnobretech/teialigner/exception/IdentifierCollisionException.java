package com.dnobretech.teialigner.exception;

/**
 * A freshly minted identifier already exists in the request. Random UUIDs make this
 * practically unreachable, so it is reported as an internal failure.
 */
public class IdentifierCollisionException extends IllegalStateException {

    public IdentifierCollisionException(String identifier) {
        super("Identifier already in use: " + identifier);
    }
}
