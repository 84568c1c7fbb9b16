package org.dxworks.jovialframe.analyzer.lexer;

import org.dxworks.jovialframe.model.Span;

import java.util.Locale;
import java.util.Objects;

/**
 * One lexeme of JOVIAL source. Error tokens carry the message of the lexical problem they stand for.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final Span span;
    private final String errorMessage;
    private final boolean unterminated;

    public Token(TokenKind kind, String text, Span span) {
        this(kind, text, span, null, false);
    }

    private Token(TokenKind kind, String text, Span span, String errorMessage, boolean unterminated) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.span = Objects.requireNonNull(span, "span");
        this.errorMessage = errorMessage;
        this.unterminated = unterminated;
    }

    public static Token error(String text, Span span, String message) {
        return new Token(TokenKind.ERROR, text, span, message, false);
    }

    /**
     * Error token for quoted text with no closing delimiter. Its extent depends on the whole rest of
     * the input, which {@link IncrementalRelexer} has to know about.
     */
    public static Token unterminated(String text, Span span, String message) {
        return new Token(TokenKind.ERROR, text, span, message, true);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public Span getSpan() {
        return span;
    }

    public int getStart() {
        return span.getStartOffset();
    }

    public int getEnd() {
        return span.getEndOffset();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isUnterminated() {
        return unterminated;
    }

    /**
     * Upper-case form used for keyword and name comparisons (JOVIAL is case-insensitive).
     */
    public String key() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && key().equals(keyword);
    }

    public boolean isPunctuation(String punctuation) {
        return kind == TokenKind.PUNCTUATION && text.equals(punctuation);
    }

    /**
     * Same token moved to {@code span}; used when reusing tokens after an edit.
     */
    public Token movedTo(Span newSpan) {
        return new Token(kind, text, newSpan, errorMessage, unterminated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return kind == token.kind && text.equals(token.text) && span.equals(token.span)
                && Objects.equals(errorMessage, token.errorMessage) && unterminated == token.unterminated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, span, errorMessage, unterminated);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span;
    }
}
