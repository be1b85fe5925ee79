package com.dnobretech.teialigner.annotate;

import org.springframework.stereotype.Component;

import java.util.UUID;

// random (v4) UUIDs: lowercase, hyphenated
@Component
public class UuidIdentifierGenerator implements IdentifierGenerator {

    @Override
    public String next() {
        return UUID.randomUUID().toString();
    }
}
