package com.dnobretech.teialigner.tei;

public final class TeiMarkup {

    public static final String TEI_NS = "http://www.tei-c.org/ns/1.0";
    public static final String ID_ATTR = "xml:id";
    public static final String SEG = "seg";
    public static final String UNKNOWN_LANGUAGE = "unknown";

    private TeiMarkup() {
    }

    // "tei:p" -> "p"
    public static String localName(String tagName) {
        int colon = tagName.indexOf(':');
        return colon < 0 ? tagName : tagName.substring(colon + 1);
    }
}
