package org.rholang.parser;

public class LexError extends ParserError {
    private final int offset;
    private final String reason;

    LexError(int offset, String reason, int line, int column) {
        super(reason, line, column);
        this.offset = offset;
        this.reason = reason;
    }

    public int getOffset() {
        return offset;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public SourceSpan getSpan() {
        return new SourceSpan(offset, offset);
    }
}
