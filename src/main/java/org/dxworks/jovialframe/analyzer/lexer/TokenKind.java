package org.dxworks.jovialframe.analyzer.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    FIXED_LITERAL,
    BIT_STRING_LITERAL,
    QUOTED_TEXT,
    PUNCTUATION,
    ERROR,
    END_OF_INPUT;

    public boolean isNumeric() {
        return this == INTEGER_LITERAL || this == FLOAT_LITERAL || this == FIXED_LITERAL;
    }
}
