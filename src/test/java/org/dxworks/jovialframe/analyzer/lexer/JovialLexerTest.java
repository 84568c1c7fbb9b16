package org.dxworks.jovialframe.analyzer.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JovialLexerTest {

    @Test
    void tokenizesItemDeclaration() {
        List<Token> tokens = new JovialLexer("ITEM MAX'SIZE S 16;").tokenize();

        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER,
                TokenKind.INTEGER_LITERAL, TokenKind.PUNCTUATION, TokenKind.END_OF_INPUT), kinds(tokens));
        assertEquals("MAX'SIZE", tokens.get(1).getText());
    }

    @Test
    void keywordsAreCaseInsensitive() {
        Token token = new JovialLexer("item").tokenize().get(0);

        assertTrue(token.is(TokenKind.KEYWORD));
        assertTrue(token.isKeyword("ITEM"));
        assertEquals("item", token.getText());
    }

    @Test
    void classifiesNumericLiterals() {
        List<Token> tokens = new JovialLexer("42 3.14 1E5 12A3 4B'7F'").tokenize();

        assertEquals(List.of(TokenKind.INTEGER_LITERAL, TokenKind.FLOAT_LITERAL, TokenKind.FLOAT_LITERAL,
                TokenKind.FIXED_LITERAL, TokenKind.BIT_STRING_LITERAL, TokenKind.END_OF_INPUT), kinds(tokens));
    }

    @Test
    void malformedNumberBecomesErrorTokenAndScanningContinues() {
        List<Token> tokens = new JovialLexer("12X := 1;").tokenize();

        assertTrue(tokens.get(0).is(TokenKind.ERROR));
        assertEquals("12X", tokens.get(0).getText());
        assertEquals("malformed numeric literal 12X", tokens.get(0).getErrorMessage());
        assertTrue(tokens.get(1).isPunctuation(":="));
    }

    @Test
    void bitStringWithBeadOutOfRangeIsAnError() {
        Token token = new JovialLexer("1B'2'").tokenize().get(0);

        assertTrue(token.is(TokenKind.ERROR));
        assertEquals("malformed bit-string literal 1B'2'", token.getErrorMessage());
    }

    @Test
    void quotedTextKeepsDoubledDelimiters() {
        List<Token> tokens = new JovialLexer("'it''s' \"say \"\"hi\"\"\"").tokenize();

        assertEquals(List.of(TokenKind.QUOTED_TEXT, TokenKind.QUOTED_TEXT, TokenKind.END_OF_INPUT), kinds(tokens));
        assertEquals("'it''s'", tokens.get(0).getText());
    }

    @Test
    void unterminatedQuotedTextStopsAtEndOfLine() {
        List<Token> tokens = new JovialLexer("\"no end\nITEM A S 8;").tokenize();

        Token error = tokens.get(0);
        assertTrue(error.is(TokenKind.ERROR));
        assertTrue(error.isUnterminated());
        assertEquals("\"no end", error.getText());
        assertTrue(tokens.get(1).isKeyword("ITEM"));
        assertEquals(1, tokens.get(1).getSpan().getStartLine());
    }

    @Test
    void twoCharacterOperatorsWinOverSingleOnes() {
        List<String> texts = new JovialLexer("A := B ** 2 <= C <> D").tokenize().stream()
                .filter(token -> token.is(TokenKind.PUNCTUATION))
                .map(Token::getText)
                .collect(Collectors.toList());

        assertEquals(List.of(":=", "**", "<=", "<>"), texts);
    }

    @Test
    void unexpectedCharacterIsReported() {
        List<Token> tokens = new JovialLexer("A # B").tokenize();

        assertEquals("unexpected character '#'", tokens.get(1).getErrorMessage());
        assertFalse(tokens.get(1).isUnterminated());
        assertTrue(tokens.get(2).is(TokenKind.IDENTIFIER));
    }

    @Test
    void spansCarryLinesAndColumns() {
        List<Token> tokens = new JovialLexer("ITEM A S 8;\n  B := 1;").tokenize();

        Token b = tokens.get(5);
        assertEquals("B", b.getText());
        assertEquals(1, b.getSpan().getStartLine());
        assertEquals(2, b.getSpan().getStartColumn());
        assertEquals(14, b.getStart());
    }

    @Test
    void emptyTextGivesOnlyEndOfInput() {
        List<Token> tokens = new JovialLexer("").tokenize();

        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenKind.END_OF_INPUT));
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::getKind).collect(Collectors.toList());
    }
}
