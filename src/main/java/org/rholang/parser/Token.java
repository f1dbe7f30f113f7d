package org.rholang.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int start; // offset of the first character
    public final int end;   // offset just past the last character
    public final int line;
    public final int column;

    Token(TokenType type, String lexeme, Object literal, int start, int end, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    public SourceSpan span() {
        return new SourceSpan(start, end);
    }

    public String toString() {
        return type + " " + lexeme + " " + literal;
    }
}
