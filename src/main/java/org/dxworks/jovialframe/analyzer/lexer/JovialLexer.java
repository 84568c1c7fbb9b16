package org.dxworks.jovialframe.analyzer.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Context-free J73 tokenizer.
 *
 * <p>The lexer never throws on malformed input. Lexical problems become {@link TokenKind#ERROR}
 * tokens carrying their message, and scanning continues right after them. Both {@code "..."} and
 * {@code '...'} spans are emitted as {@link TokenKind#QUOTED_TEXT}; whether such a span is a
 * comment or a string literal is decided by the parser.</p>
 *
 * <p>Scanning a token only looks at the text from its start onwards, so {@link #scanFrom(int)} can
 * restart anywhere a token started before.</p>
 */
public final class JovialLexer {

    private static final Set<String> TWO_CHAR_PUNCTUATION = Set.of(":=", "<>", "<=", ">=", "**");
    private static final String SINGLE_CHAR_PUNCTUATION = ";,():=<>+-*/.@!";

    private final String text;
    private final int length;
    private final LineIndex lineIndex;

    public JovialLexer(String text) {
        this(text, new LineIndex(text));
    }

    public JovialLexer(String text, LineIndex lineIndex) {
        this.text = text == null ? "" : text;
        this.length = this.text.length();
        this.lineIndex = lineIndex;
    }

    public LineIndex getLineIndex() {
        return lineIndex;
    }

    /**
     * Tokens of the whole text; the list always ends with {@link TokenKind#END_OF_INPUT}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        while (true) {
            Token token = scanFrom(position);
            tokens.add(token);
            if (token.is(TokenKind.END_OF_INPUT)) {
                return tokens;
            }
            position = token.getEnd();
        }
    }

    /**
     * Skips whitespace from {@code offset} and scans the next token.
     */
    public Token scanFrom(int offset) {
        int pos = offset;
        while (pos < length && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        if (pos >= length) {
            return new Token(TokenKind.END_OF_INPUT, "", lineIndex.span(length, length));
        }

        char c = text.charAt(pos);
        if (isIdentifierStart(c)) {
            return identifier(pos);
        }
        if (isDigit(c)) {
            return number(pos);
        }
        if (c == '"' || c == '\'') {
            return quoted(pos, c);
        }
        return punctuation(pos);
    }

    private Token identifier(int start) {
        int i = start + 1;
        while (i < length) {
            char c = text.charAt(i);
            if (isIdentifierPart(c)) {
                i++;
            } else if (c == '\'' && i + 1 < length && isIdentifierPart(text.charAt(i + 1))) {
                // word separator inside a name, e.g. MAX'SIZE
                i += 2;
            } else {
                break;
            }
        }
        String word = text.substring(start, i);
        TokenKind kind = Keywords.RESERVED.contains(word.toUpperCase(Locale.ROOT))
                ? TokenKind.KEYWORD
                : TokenKind.IDENTIFIER;
        return token(kind, start, i);
    }

    private Token number(int start) {
        int i = skipDigits(start);

        if (i + 1 < length && (text.charAt(i) == 'B' || text.charAt(i) == 'b') && text.charAt(i + 1) == '\'') {
            return bitString(start, i);
        }

        TokenKind kind = TokenKind.INTEGER_LITERAL;
        if (i + 1 < length && text.charAt(i) == '.' && isDigit(text.charAt(i + 1))) {
            i = skipDigits(i + 1);
            kind = TokenKind.FLOAT_LITERAL;
        }
        if (i < length && (text.charAt(i) == 'E' || text.charAt(i) == 'e')) {
            int exponent = signedDigitsStart(i + 1);
            if (exponent < 0) {
                return malformedNumber(start, i);
            }
            i = skipDigits(exponent);
            kind = TokenKind.FLOAT_LITERAL;
        }
        if (i < length && (text.charAt(i) == 'A' || text.charAt(i) == 'a')) {
            int scale = signedDigitsStart(i + 1);
            if (scale < 0) {
                return malformedNumber(start, i);
            }
            i = skipDigits(scale);
            kind = TokenKind.FIXED_LITERAL;
        }
        if (i < length && isIdentifierPart(text.charAt(i))) {
            return malformedNumber(start, i);
        }
        return token(kind, start, i);
    }

    private Token bitString(int start, int beadMarker) {
        int contentStart = beadMarker + 2;
        int i = contentStart;
        while (i < length && text.charAt(i) != '\'' && text.charAt(i) != '\n') {
            i++;
        }
        if (i >= length || text.charAt(i) != '\'') {
            return Token.error(text.substring(start, i), lineIndex.span(start, i), "unterminated bit-string literal");
        }
        int end = i + 1;
        String lexeme = text.substring(start, end);
        if (!validBeads(text.substring(start, beadMarker), text.substring(contentStart, i))) {
            return Token.error(lexeme, lineIndex.span(start, end), "malformed bit-string literal " + lexeme);
        }
        return token(TokenKind.BIT_STRING_LITERAL, start, end);
    }

    private static boolean validBeads(String beadSizeText, String beads) {
        int beadSize;
        try {
            beadSize = Integer.parseInt(beadSizeText);
        } catch (NumberFormatException e) {
            return false;
        }
        if (beadSize < 1 || beadSize > 5 || beads.isEmpty()) {
            return false;
        }
        int radix = 1 << beadSize;
        for (int k = 0; k < beads.length(); k++) {
            int digit = Character.digit(beads.charAt(k), 32);
            if (digit < 0 || digit >= radix) {
                return false;
            }
        }
        return true;
    }

    private Token malformedNumber(int start, int from) {
        int i = from;
        while (i < length) {
            char c = text.charAt(i);
            if (isIdentifierPart(c) || (c == '.' && i + 1 < length && isDigit(text.charAt(i + 1)))) {
                i++;
            } else {
                break;
            }
        }
        if (i == from) {
            // a dangling exponent or scale marker followed by a sign
            i = Math.min(length, from + 1);
        }
        String lexeme = text.substring(start, i);
        return Token.error(lexeme, lineIndex.span(start, i), "malformed numeric literal " + lexeme);
    }

    private Token quoted(int start, char delimiter) {
        int i = start + 1;
        while (i < length) {
            if (text.charAt(i) == delimiter) {
                if (i + 1 < length && text.charAt(i + 1) == delimiter) {
                    i += 2;
                    continue;
                }
                return token(TokenKind.QUOTED_TEXT, start, i + 1);
            }
            i++;
        }
        int lineEnd = text.indexOf('\n', start);
        int end = lineEnd < 0 ? length : lineEnd;
        return Token.unterminated(text.substring(start, end), lineIndex.span(start, end), "unterminated quoted text");
    }

    private Token punctuation(int start) {
        if (start + 1 < length && TWO_CHAR_PUNCTUATION.contains(text.substring(start, start + 2))) {
            return token(TokenKind.PUNCTUATION, start, start + 2);
        }
        char c = text.charAt(start);
        if (SINGLE_CHAR_PUNCTUATION.indexOf(c) >= 0) {
            return token(TokenKind.PUNCTUATION, start, start + 1);
        }
        String lexeme = text.substring(start, start + 1);
        return Token.error(lexeme, lineIndex.span(start, start + 1), "unexpected character '" + lexeme + "'");
    }

    private int skipDigits(int from) {
        int i = from;
        while (i < length && isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Start of the digits of an optionally signed exponent or scale, or -1 when no digit follows.
     */
    private int signedDigitsStart(int from) {
        int i = from;
        if (i < length && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            i++;
        }
        return i < length && isDigit(text.charAt(i)) ? i : -1;
    }

    private Token token(TokenKind kind, int start, int end) {
        return new Token(kind, text.substring(start, end), lineIndex.span(start, end));
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '$';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
