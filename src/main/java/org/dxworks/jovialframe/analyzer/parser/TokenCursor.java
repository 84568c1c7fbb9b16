package org.dxworks.jovialframe.analyzer.parser;

import org.dxworks.jovialframe.analyzer.lexer.Token;
import org.dxworks.jovialframe.analyzer.lexer.TokenKind;

import java.util.BitSet;
import java.util.List;

/**
 * Walks a token list for the parser.
 *
 * <p>Error tokens are always skipped, their problem has been reported by the lexer already. Quoted
 * text is skipped as a comment by {@link #peek()} and {@link #advance()}; the operand variants
 * return it so the parser can take it as a string literal, and remember that they did.</p>
 */
final class TokenCursor {

    private final List<Token> tokens;
    private final BitSet literals = new BitSet();
    private int index;
    private Token previous;

    TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.END_OF_INPUT)) {
            throw new IllegalArgumentException("token list must end with END_OF_INPUT");
        }
        this.tokens = tokens;
    }

    Token peek() {
        return tokens.get(significant(index, false, 0));
    }

    /**
     * Significant token {@code ahead} positions after the next one.
     */
    Token peek(int ahead) {
        return tokens.get(significant(index, false, ahead));
    }

    Token peekOperand() {
        return tokens.get(significant(index, true, 0));
    }

    int peekIndex() {
        return significant(index, false, 0);
    }

    Token advance() {
        return consume(significant(index, false, 0));
    }

    Token advanceOperand() {
        int at = significant(index, true, 0);
        if (tokens.get(at).is(TokenKind.QUOTED_TEXT)) {
            literals.set(at);
        }
        return consume(at);
    }

    /**
     * Next raw token, quoted text included; used for directive arguments.
     */
    Token advanceRaw() {
        int at = index;
        while (tokens.get(at).is(TokenKind.ERROR)) {
            at++;
        }
        if (tokens.get(at).is(TokenKind.QUOTED_TEXT)) {
            literals.set(at);
        }
        return consume(at);
    }

    Token peekRaw() {
        int at = index;
        while (tokens.get(at).is(TokenKind.ERROR)) {
            at++;
        }
        return tokens.get(at);
    }

    /**
     * Last consumed token, or null before the first one.
     */
    Token previous() {
        return previous;
    }

    int position() {
        return index;
    }

    boolean atEnd() {
        return peek().is(TokenKind.END_OF_INPUT);
    }

    Token raw(int at) {
        return tokens.get(at);
    }

    int size() {
        return tokens.size();
    }

    boolean isLiteral(int at) {
        return literals.get(at);
    }

    private Token consume(int at) {
        Token token = tokens.get(at);
        if (!token.is(TokenKind.END_OF_INPUT)) {
            index = at + 1;
            previous = token;
        }
        return token;
    }

    private int significant(int from, boolean operand, int ahead) {
        int at = from;
        int remaining = ahead;
        while (true) {
            Token token = tokens.get(at);
            if (token.is(TokenKind.END_OF_INPUT)) {
                return at;
            }
            boolean skipped = token.is(TokenKind.ERROR) || (!operand && token.is(TokenKind.QUOTED_TEXT));
            if (!skipped) {
                if (remaining == 0) {
                    return at;
                }
                remaining--;
            }
            at++;
        }
    }
}
