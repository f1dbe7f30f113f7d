package org.rholang.parser;

import com.google.common.collect.ImmutableMap;

/**
 * Grammar construct names and their stable ids. Printers and the builder
 * dispatch on these instead of comparing strings.
 */
public enum NodeKind {
    PAR("par"),
    SEND("send"),
    SEND_SYNC("send_sync"),
    NEW("new"),
    IF_ELSE("ifElse"),
    LET("let"),
    BUNDLE("bundle"),
    MATCH("match"),
    CHOICE("choice"),
    CONTRACT("contract"),
    INPUT("input"),

    OR("or"),
    AND("and"),
    MATCHES("matches"),
    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),
    CONCAT("concat"),
    DIFF("diff"),
    ADD("add"),
    SUB("sub"),
    INTERPOLATION("interpolation"),
    MULT("mult"),
    DIV("div"),
    MOD("mod"),
    DISJUNCTION("disjunction"),
    CONJUNCTION("conjunction"),

    NOT("not"),
    NEG("neg"),
    NEGATION("negation"),
    EVAL("eval"),
    QUOTE("quote"),
    METHOD("method"),
    VAR_REF("var_ref"),

    NIL("nil"),
    BOOL_LITERAL("bool_literal"),
    LONG_LITERAL("long_literal"),
    STRING_LITERAL("string_literal"),
    URI_LITERAL("uri_literal"),
    SIMPLE_TYPE("simple_type"),
    UNIT("unit"),
    VAR("var"),
    WILDCARD("wildcard"),

    LIST("list"),
    TUPLE("tuple"),
    SET("set"),
    MAP("map");

    private static final ImmutableMap<String, NodeKind> byName;
    private static final NodeKind[] byId = values();

    static {
        ImmutableMap.Builder<String, NodeKind> builder = ImmutableMap.builder();
        for (NodeKind kind : byId) {
            builder.put(kind.grammarName, kind);
        }
        byName = builder.build();
    }

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    public String grammarName() {
        return grammarName;
    }

    public int id() {
        return ordinal();
    }

    public static NodeKind resolve(String grammarName) {
        NodeKind kind = byName.get(grammarName);
        if (kind == null) {
            throw new IllegalArgumentException("unknown grammar construct: " + grammarName);
        }
        return kind;
    }

    public static NodeKind fromId(int id) {
        if (id < 0 || id >= byId.length) {
            throw new IllegalArgumentException("unknown node id: " + id);
        }
        return byId[id];
    }

    // Ground terms and collections print as themselves, without surrounding braces.
    public boolean isAtomic() {
        switch (this) {
            case NIL:
            case BOOL_LITERAL:
            case LONG_LITERAL:
            case STRING_LITERAL:
            case URI_LITERAL:
            case SIMPLE_TYPE:
            case UNIT:
            case VAR:
            case WILDCARD:
            case LIST:
            case TUPLE:
            case SET:
            case MAP:
                return true;
            default:
                return false;
        }
    }
}
