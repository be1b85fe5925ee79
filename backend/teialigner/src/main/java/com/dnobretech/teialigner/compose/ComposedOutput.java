package com.dnobretech.teialigner.compose;

public record ComposedOutput(String xml, int linkCount) {
}
