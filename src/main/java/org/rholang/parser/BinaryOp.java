package org.rholang.parser;

public enum BinaryOp {
    OR("or", NodeKind.OR),
    AND("and", NodeKind.AND),
    MATCHES("matches", NodeKind.MATCHES),
    EQ("==", NodeKind.EQ),
    NEQ("!=", NodeKind.NEQ),
    LT("<", NodeKind.LT),
    LTE("<=", NodeKind.LTE),
    GT(">", NodeKind.GT),
    GTE(">=", NodeKind.GTE),
    CONCAT("++", NodeKind.CONCAT),
    DIFF("--", NodeKind.DIFF),
    ADD("+", NodeKind.ADD),
    SUB("-", NodeKind.SUB),
    INTERPOLATION("%%", NodeKind.INTERPOLATION),
    MULT("*", NodeKind.MULT),
    DIV("/", NodeKind.DIV),
    MOD("%", NodeKind.MOD),
    DISJUNCTION("\\/", NodeKind.DISJUNCTION),
    CONJUNCTION("/\\", NodeKind.CONJUNCTION);

    public final String symbol;
    public final NodeKind kind;

    BinaryOp(String symbol, NodeKind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    static BinaryOp fromToken(TokenType type) {
        switch (type) {
            case OR: return OR;
            case AND: return AND;
            case MATCHES: return MATCHES;
            case EQUAL_EQUAL: return EQ;
            case BANG_EQUAL: return NEQ;
            case LESS: return LT;
            case LESS_EQUAL: return LTE;
            case GREATER: return GT;
            case GREATER_EQUAL: return GTE;
            case PLUS_PLUS: return CONCAT;
            case MINUS_MINUS: return DIFF;
            case PLUS: return ADD;
            case MINUS: return SUB;
            case PERCENT_PERCENT: return INTERPOLATION;
            case STAR: return MULT;
            case SLASH: return DIV;
            case PERCENT: return MOD;
            case DISJUNCTION: return DISJUNCTION;
            case CONJUNCTION: return CONJUNCTION;
            default:
                throw new IllegalArgumentException("not a binary operator: " + type);
        }
    }
}
