package org.rholang.parser;

/**
 * Base class of the errors raised while turning source text into a tree.
 * The first error stops the parse; there is no recovery.
 */
public abstract class ParserError extends RuntimeException {
    private final int line;
    private final int column;

    protected ParserError(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public abstract SourceSpan getSpan();

    // 1-based
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Text shown to users, e.g. by the command line tool's JSON report.
     */
    public String display() {
        return "Parsing error: " + getMessage() + " at line " + line + ", column " + column;
    }
}
