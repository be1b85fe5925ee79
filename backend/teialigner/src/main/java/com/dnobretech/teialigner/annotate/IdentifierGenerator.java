package com.dnobretech.teialigner.annotate;

public interface IdentifierGenerator {
    String next();
}
