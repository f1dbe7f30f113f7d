package org.rholang.parser;

public enum VarRefKind {
    PROC("="),
    NAME("=*");

    public final String symbol;

    VarRefKind(String symbol) {
        this.symbol = symbol;
    }
}
