package com.deeplearningdsl.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.deeplearningdsl.dsl.Scanner;
import com.deeplearningdsl.dsl.Token;
import com.deeplearningdsl.dsl.TokenType;

import static com.deeplearningdsl.dsl.TokenType.*;

public class ScannerTest {

    @Test
    public void testEmptySrc() {
        List<Token> tokens = Scanner.tokenize("");
        assertEquals(1, tokens.size());
        assertEquals(EOF, tokens.get(0).type);
    }

    @Test
    public void testAssignment() {
        assertEquals(Arrays.asList(IDENTIFIER, EQUAL, FLOAT, SEMICOLON, EOF),
                     types("x = 3.5;"));
    }

    @Test
    public void testNumberLiterals() {
        List<Token> tokens = Scanner.tokenize("42 0.25");
        assertEquals(NUMBER, tokens.get(0).type);
        assertEquals(42.0, (Double)tokens.get(0).literal, 0.0);
        assertEquals(FLOAT, tokens.get(1).type);
        assertEquals(0.25, (Double)tokens.get(1).literal, 0.0);
    }

    @Test
    public void testStringLiteral() {
        Token tok = Scanner.tokenize("\"data.csv\"").get(0);
        assertEquals(STRING, tok.type);
        assertEquals("\"data.csv\"", tok.lexeme);
        assertEquals("data.csv", tok.literal);
    }

    @Test
    public void testKeywordsAndIdentifiers() {
        assertEquals(Arrays.asList(KMEANS, IDENTIFIER, PRINT, IDENTIFIER, TRANSPOSE, SQRT, EOF),
                     types("kmeans kmeans2 print printer transpose sqrt"));
        assertTrue(Scanner.isKeyword("reconstruction_error"));
        assertFalse(Scanner.isKeyword("my_model"));
    }

    @Test
    public void testOperators() {
        assertEquals(Arrays.asList(LESS_EQUAL, GREATER_EQUAL, EQUAL_EQUAL, BANG_EQUAL,
                                   LESS, GREATER, EQUAL, PERCENT, CARET, SLASH, EOF),
                     types("<= >= == != < > = % ^ /"));
    }

    @Test
    public void testCommentsAreSkipped() {
        List<Token> tokens = Scanner.tokenize("x // the rest is ignored ;;\ny");
        assertEquals(3, tokens.size());
        assertEquals("x", tokens.get(0).lexeme);
        Token y = tokens.get(1);
        assertEquals("y", y.lexeme);
        assertEquals(2, y.line);
        assertEquals(1, y.column);
    }

    @Test
    public void testTokenPositions() {
        List<Token> tokens = Scanner.tokenize("a = 1;\n  bb = 22;");
        Token bb = tokens.get(4);
        assertEquals("bb", bb.lexeme);
        assertEquals(2, bb.line);
        assertEquals(3, bb.column);
        assertEquals("2:3", bb.position());
    }

    @Test
    public void testTrailingDotIsLexError() {
        try {
            Scanner.tokenize("3.");
            fail("expected LexError");
        } catch (Scanner.LexError err) {
            assertEquals('.', err.unexpectedChar);
            assertEquals(1, err.line);
            assertEquals(2, err.column);
        }
    }

    @Test
    public void testLoneBangIsLexError() {
        try {
            Scanner.tokenize("x = !y;");
            fail("expected LexError");
        } catch (Scanner.LexError err) {
            assertEquals('!', err.unexpectedChar);
            assertEquals(5, err.column);
        }
    }

    @Test
    public void testUnexpectedCharacter() {
        try {
            Scanner.tokenize("x = 1;\ny = #;");
            fail("expected LexError");
        } catch (Scanner.LexError err) {
            assertEquals('#', err.unexpectedChar);
            assertEquals(2, err.line);
            assertEquals("[line 2:5] Unexpected character '#'.", err.getMessage());
        }
    }

    @Test
    public void testUnterminatedString() {
        try {
            Scanner.tokenize("x = \"abc");
            fail("expected LexError");
        } catch (Scanner.LexError err) {
            assertEquals(5, err.column);
        }
    }

    @Test
    public void testInBlockCountsOpenBraces() {
        Scanner scanner = new Scanner("");
        scanner.appendSrc("def f(a) {");
        scanner.scanUntilEnd();
        assertEquals(1, scanner.inBlock);
        scanner.appendSrc("return a; }");
        scanner.scanUntilEnd();
        assertEquals(0, scanner.inBlock);
    }

    private static List<TokenType> types(String src) {
        List<TokenType> ret = new ArrayList<>();
        for (Token tok : Scanner.tokenize(src)) {
            ret.add(tok.type);
        }
        return ret;
    }
}
