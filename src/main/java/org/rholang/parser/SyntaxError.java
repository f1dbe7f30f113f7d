package org.rholang.parser;

public class SyntaxError extends ParserError {
    private final SourceSpan span;
    private final String expected;
    private final String found;

    SyntaxError(SourceSpan span, String expected, String found, int line, int column) {
        super("expected " + expected + " but found " + found, line, column);
        this.span = span;
        this.expected = expected;
        this.found = found;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
