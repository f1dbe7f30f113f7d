package org.rholang.parser;

public enum UnaryOp {
    NOT("not", NodeKind.NOT),
    NEG("-", NodeKind.NEG),
    NEGATION("~", NodeKind.NEGATION);

    public final String symbol;
    public final NodeKind kind;

    UnaryOp(String symbol, NodeKind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }
}
