package org.rholang.parser;

public enum SendMode {
    SINGLE("!"),
    MULTIPLE("!!");

    public final String symbol;

    SendMode(String symbol) {
        this.symbol = symbol;
    }
}
