package org.rholang.parser;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableMap;

import static org.rholang.parser.TokenType.*;

/**
 * Turns Rholang source into tokens, one at a time. Whitespace and comments
 * are skipped. Once the input is exhausted every further call returns EOF.
 */
public class Lexer {
    private final String source;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokLine = 1;
    private int tokColumn = 1;
    private TokenType lastType = null;

    private static final ImmutableMap<String, TokenType> keywords =
        ImmutableMap.<String, TokenType>builder()
            .put("new",      NEW)
            .put("in",       IN)
            .put("if",       IF)
            .put("else",     ELSE)
            .put("let",      LET)
            .put("match",    MATCH)
            .put("select",   SELECT)
            .put("contract", CONTRACT)
            .put("for",      FOR)
            .put("bundle-",  BUNDLE_READ)
            .put("bundle+",  BUNDLE_WRITE)
            .put("bundle0",  BUNDLE_EQUIV)
            .put("bundle",   BUNDLE)
            .put("true",     TRUE)
            .put("false",    FALSE)
            .put("Nil",      NIL)
            .put("not",      NOT)
            .put("or",       OR)
            .put("and",      AND)
            .put("matches",  MATCHES)
            .put("Bool",     BOOL_TYPE)
            .put("Int",      INT_TYPE)
            .put("String",   STRING_TYPE)
            .put("Uri",      URI_TYPE)
            .put("ByteArray", BYTE_ARRAY_TYPE)
            .build();

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isKeyword(String text) {
        return keywords.containsKey(text);
    }

    public static TokenType keyword(String text) {
        TokenType type = keywords.get(text);
        if (type == null) {
            throw new IllegalArgumentException("unknown keyword: " + text);
        }
        return type;
    }

    public void reset() {
        this.start = 0;
        this.current = 0;
        this.line = 1;
        this.lineStart = 0;
        this.lastType = null;
    }

    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token tok;
        do {
            tok = nextToken();
            tokens.add(tok);
        } while (tok.type != EOF);
        return tokens;
    }

    public Token nextToken() {
        skipTrivia();
        // We are at the beginning of the next lexeme.
        start = current;
        tokLine = line;
        tokColumn = current - lineStart + 1;
        if (isAtEnd()) {
            return addToken(EOF);
        }
        return scanToken();
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return addToken(LEFT_PAREN);
            case ')': return addToken(RIGHT_PAREN);
            case '{': return addToken(LEFT_BRACE);
            case '}': return addToken(RIGHT_BRACE);
            case '[': return addToken(LEFT_BRACKET);
            case ']': return addToken(RIGHT_BRACKET);
            case ',': return addToken(COMMA);
            case ';': return addToken(SEMICOLON);
            case ':': return addToken(COLON);
            case '|': return addToken(PIPE);
            case '&': return addToken(AMPERSAND);
            case '@': return addToken(AT);
            case '~': return addToken(TILDE);
            case '*': return addToken(STAR);
            case '.': {
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    return addToken(ELLIPSIS);
                }
                return addToken(DOT);
            }
            case '/': return addToken(match('\\') ? CONJUNCTION : SLASH);
            case '\\': {
                if (match('/')) {
                    return addToken(DISJUNCTION);
                }
                throw unexpected(c);
            }
            case '%': return addToken(match('%') ? PERCENT_PERCENT : PERCENT);
            case '+': return addToken(match('+') ? PLUS_PLUS : PLUS);
            case '-': {
                if (match('-')) {
                    return addToken(MINUS_MINUS);
                }
                if (isDigit(peek()) && !endsExpression(lastType)) {
                    return number();
                }
                return addToken(MINUS);
            }
            case '!': {
                if (match('!')) return addToken(BANG_BANG);
                if (match('?')) return addToken(BANG_QUESTION);
                if (match('=')) return addToken(BANG_EQUAL);
                return addToken(BANG);
            }
            case '?': {
                if (match('!')) {
                    return addToken(QUESTION_BANG);
                }
                throw unexpected(c);
            }
            case '=': {
                if (match('=')) return addToken(EQUAL_EQUAL);
                if (match('>')) return addToken(ARROW);
                return addToken(EQUAL);
            }
            case '<': {
                if (peek() == '<' && peekNext() == '-') {
                    advance();
                    advance();
                    return addToken(LEFT_LEFT_ARROW);
                }
                if (match('-')) return addToken(LEFT_ARROW);
                if (match('=')) return addToken(LESS_EQUAL);
                return addToken(LESS);
            }
            case '>': return addToken(match('=') ? GREATER_EQUAL : GREATER);
            case '"': return doubleQuotedString();
            case '`': return uri();
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c) || c == '_') {
                    return identifier(c);
                }
                throw unexpected(c);
        }
    }

    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else {
                return;
            }
        }
    }

    // Not nested: the first "*/" closes the comment.
    private void blockComment() {
        int commentStart = current;
        int commentLine = line;
        int commentColumn = current - lineStart + 1;
        advance();
        advance();
        while (true) {
            if (isAtEnd()) {
                throw new LexError(commentStart, "unterminated block comment", commentLine, commentColumn);
            }
            char c = advance();
            if (c == '*' && peek() == '/') {
                advance();
                return;
            }
        }
    }

    private Token doubleQuotedString() {
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated string literal");
            }
            char c = advance();
            if (c == '"') break;
            if (c != '\\') continue;

            int escLine = line;
            int escColumn = current - lineStart;
            if (isAtEnd()) {
                throw error("unterminated string literal");
            }
            char e = advance();
            if (isDigit(e)) {
                while (isDigit(peek())) advance();
            } else if ("nrt\\\"".indexOf(e) < 0) {
                throw new LexError(current - 2, "invalid escape sequence '\\" + e + "'", escLine, escColumn);
            }
        }
        // the literal keeps its escapes as written
        String value = source.substring(start + 1, current - 1);
        return addToken(STRING, value);
    }

    private Token uri() {
        while (!isAtEnd() && peek() != '`') {
            advance();
        }
        if (isAtEnd()) {
            throw error("unterminated URI literal");
        }
        advance();
        if (current - start == 2) {
            throw error("empty URI literal");
        }
        return addToken(URI, source.substring(start + 1, current - 1));
    }

    private Token number() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("long literal out of range");
        }
        return addToken(LONG, value);
    }

    private Token identifier(char first) {
        if (first == '_' && !isIdentifierPart(peek())) {
            return addToken(WILDCARD);
        }
        while (isIdentifierPart(peek())) advance();

        String text = source.substring(start, current);
        if (text.equals("bundle") && (peek() == '-' || peek() == '+')) {
            advance();
            text = source.substring(start, current);
        }
        TokenType type = keywords.get(text);
        if (type == null) type = IDENTIFIER;
        return addToken(type);
    }

    // Tokens after which a '-' is the binary operator rather than the sign of a literal.
    private static boolean endsExpression(TokenType type) {
        if (type == null) return false;
        switch (type) {
            case IDENTIFIER:
            case WILDCARD:
            case LONG:
            case STRING:
            case URI:
            case TRUE:
            case FALSE:
            case NIL:
            case BOOL_TYPE:
            case INT_TYPE:
            case STRING_TYPE:
            case URI_TYPE:
            case BYTE_ARRAY_TYPE:
            case RIGHT_PAREN:
            case RIGHT_BRACKET:
            case RIGHT_BRACE:
                return true;
            default:
                return false;
        }
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierPart(char c) {
        return isAlpha(c) || isDigit(c) || c == '_' || c == '\'';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private Token addToken(TokenType type) {
        return addToken(type, null);
    }

    private Token addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        lastType = type;
        return new Token(type, text, literal, start, current, tokLine, tokColumn);
    }

    private LexError error(String reason) {
        return new LexError(start, reason, tokLine, tokColumn);
    }

    private LexError unexpected(char c) {
        return error("unexpected character '" + c + "'");
    }
}
