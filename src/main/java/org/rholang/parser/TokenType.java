package org.rholang.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET, COMMA, DOT, SEMICOLON, COLON,
    PIPE, AMPERSAND, AT, STAR, SLASH, PERCENT, PLUS, MINUS,
    TILDE, BANG, EQUAL, LESS, GREATER,

    // Two-character tokens.
    BANG_BANG, BANG_QUESTION, QUESTION_BANG, BANG_EQUAL,
    EQUAL_EQUAL, ARROW, LESS_EQUAL, GREATER_EQUAL, LEFT_ARROW,
    PLUS_PLUS, MINUS_MINUS, PERCENT_PERCENT, DISJUNCTION, CONJUNCTION,

    // Three-character tokens.
    LEFT_LEFT_ARROW, ELLIPSIS,

    // Literals.
    IDENTIFIER, WILDCARD, STRING, URI, LONG,

    // Keywords.
    NEW, IN, IF, ELSE, LET, MATCH, SELECT, CONTRACT, FOR,
    BUNDLE_READ, BUNDLE_WRITE, BUNDLE_EQUIV, BUNDLE,
    TRUE, FALSE, NIL, NOT, OR, AND, MATCHES,
    BOOL_TYPE, INT_TYPE, STRING_TYPE, URI_TYPE, BYTE_ARRAY_TYPE,

    EOF
}
