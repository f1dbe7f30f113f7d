package org.rholang.parser;

public enum GroundType {
    BOOL("Bool"),
    INT("Int"),
    STRING("String"),
    URI("Uri"),
    BYTE_ARRAY("ByteArray");

    public final String keyword;

    GroundType(String keyword) {
        this.keyword = keyword;
    }
}
