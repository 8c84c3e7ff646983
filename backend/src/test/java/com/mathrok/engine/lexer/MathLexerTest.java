package com.mathrok.engine.lexer;

import com.mathrok.engine.exception.ErrorType;
import com.mathrok.engine.exception.LexException;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathLexerTest {

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }

    @Test
    void tokenize_numbersAndOperators() {
        List<Token> tokens = new MathLexer("2 + 3.5e-2").tokenize();

        assertEquals(List.of(TokenKind.NUMBER, TokenKind.OPERATOR, TokenKind.NUMBER, TokenKind.EOF), kinds(tokens));
        assertEquals("3.5e-2", tokens.get(2).text());
        assertEquals(new Span(4, 10), tokens.get(2).span());
    }

    @Test
    void tokenize_scientificNotationWithUppercaseExponent() {
        List<Token> tokens = new MathLexer("1E+5").tokenize();

        assertEquals(2, tokens.size());
        assertEquals("1E+5", tokens.get(0).text());
    }

    @Test
    void tokenize_multiCharacterOperatorsAreGreedy() {
        List<Token> tokens = new MathLexer("sin(x) <= 2**y").tokenize();

        assertEquals(List.of(TokenKind.FUNCTION, TokenKind.LEFT_PAREN, TokenKind.VARIABLE, TokenKind.RIGHT_PAREN,
                TokenKind.COMPARISON, TokenKind.NUMBER, TokenKind.OPERATOR, TokenKind.VARIABLE, TokenKind.EOF),
                kinds(tokens));
        assertEquals("<=", tokens.get(4).text());
        assertEquals("**", tokens.get(6).text());
    }

    @Test
    void tokenize_notEqualsIsComparisonButBangIsOperator() {
        List<Token> tokens = new MathLexer("3! != 6").tokenize();

        assertTrue(tokens.get(1).isOperator("!"));
        assertEquals(TokenKind.COMPARISON, tokens.get(2).kind());
        assertEquals("!=", tokens.get(2).text());
    }

    @Test
    void tokenize_doubleEqualsIsOneEqualsToken() {
        List<Token> tokens = new MathLexer("x == 1").tokenize();

        assertEquals(TokenKind.EQUALS, tokens.get(1).kind());
        assertEquals("==", tokens.get(1).text());
    }

    @Test
    void tokenize_constantsAreVariables() {
        List<Token> tokens = new MathLexer("pi + e").tokenize();

        assertEquals(TokenKind.VARIABLE, tokens.get(0).kind());
        assertEquals(TokenKind.VARIABLE, tokens.get(2).kind());
    }

    @Test
    void tokenize_customFunctionNames() {
        assertEquals(TokenKind.VARIABLE, new MathLexer("f(x)").tokenize().get(0).kind());
        assertEquals(TokenKind.FUNCTION, new MathLexer("f(x)", Set.of("f")).tokenize().get(0).kind());
    }

    @Test
    void tokenize_newlineAdvancesLineAndResetsColumn() {
        List<Token> tokens = new MathLexer("x\n+ 1").tokenize();

        assertEquals(1, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
        assertEquals(2, tokens.get(1).line());
        assertEquals(1, tokens.get(1).column());
        assertEquals(3, tokens.get(2).column());
    }

    @Test
    void tokenize_emptySourceYieldsOnlyEof() {
        List<Token> tokens = new MathLexer("").tokenize();

        assertEquals(List.of(TokenKind.EOF), kinds(tokens));
    }

    @Test
    void tokenize_exponentWithoutDigitsFails() {
        LexException e = assertThrows(LexException.class, () -> new MathLexer("1e").tokenize());

        assertEquals(ErrorType.LEX_ERROR, e.getType());
        assertThrows(LexException.class, () -> new MathLexer("2.5e+").tokenize());
    }

    @Test
    void tokenize_unknownCharacterReportsPosition() {
        LexException e = assertThrows(LexException.class, () -> new MathLexer("2 $ 3").tokenize());

        assertEquals(2, e.getPosition());
        assertTrue(e.getMessage().contains("'$'"));
    }
}
