package com.dnobretech.teialigner.align;

public enum Side {
    SOURCE,
    TARGET
}
