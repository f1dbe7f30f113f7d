package org.rholang.parser;

public enum BundleKind {
    READ_ONLY("bundle-"),
    WRITE_ONLY("bundle+"),
    EQUIVALENT("bundle0"),
    READ_WRITE("bundle");

    public final String keyword;

    BundleKind(String keyword) {
        this.keyword = keyword;
    }
}
