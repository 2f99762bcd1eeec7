package com.deeplearningdsl.dsl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.deeplearningdsl.dsl.TokenType.*;

public class Scanner {
    public static class LexError extends RuntimeException {
        public final int line;
        public final int column;
        public final char unexpectedChar;

        LexError(int line, int column, char unexpectedChar, String message) {
            super("[line " + line + ":" + column + "] " + message);
            this.line = line;
            this.column = column;
            this.unexpectedChar = unexpectedChar;
        }
    }

    private String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int lineStart = 0; // index of the first char of the current line
    public int line = 1;
    public int inBlock = 0;

    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("if",     IF);
        keywords.put("else",   ELSE);
        keywords.put("for",    FOR);
        keywords.put("while",  WHILE);
        keywords.put("def",    DEF);
        keywords.put("return", RETURN);

        keywords.put("linear_regression",    LINEAR_REGRESSION);
        keywords.put("mlp_classifier",       MLP_CLASSIFIER);
        keywords.put("neural_network",       NEURAL_NETWORK);
        keywords.put("predict",              PREDICT);
        keywords.put("train",                TRAIN);
        keywords.put("kmeans",               KMEANS);
        keywords.put("fit_predict",          FIT_PREDICT);
        keywords.put("get_centroids",        GET_CENTROIDS);
        keywords.put("autoencoder",          AUTOENCODER);
        keywords.put("encode",               ENCODE);
        keywords.put("decode",               DECODE);
        keywords.put("reconstruct",          RECONSTRUCT);
        keywords.put("reconstruction_error", RECONSTRUCTION_ERROR);

        keywords.put("transpose", TRANSPOSE);
        keywords.put("inverse",   INVERSE);
        keywords.put("matmult",   MATMULT);
        keywords.put("matadd",    MATADD);
        keywords.put("matsub",    MATSUB);

        keywords.put("read_file",  READ_FILE);
        keywords.put("write_file", WRITE_FILE);
        keywords.put("print",      PRINT);

        keywords.put("plot",      PLOT);
        keywords.put("scatter",   SCATTER);
        keywords.put("histogram", HISTOGRAM);

        keywords.put("sin",  SIN);
        keywords.put("cos",  COS);
        keywords.put("tan",  TAN);
        keywords.put("sqrt", SQRT);
    }

    public Scanner(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Scanner(source).scanTokens();
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> scanTokens() {
        scanUntilEnd();
        addEOF();
        return tokens;
    }

    public List<Token> scanUntilEnd() {
        while (!isAtEnd()) {
            // We are at the beginning of the next lexeme.
            start = current;
            scanToken();
        }
        return tokens;
    }

    // REPL input arrives one line at a time
    public void appendSrc(String src) {
        this.source += src + "\n";
    }

    public void addEOF() {
        tokens.add(new Token(EOF, "", null, line, current - lineStart + 1));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(LEFT_PAREN); break;
            case ')': addToken(RIGHT_PAREN); break;
            case '{': addToken(LEFT_BRACE); inBlock++; break;
            case '}': addToken(RIGHT_BRACE); inBlock--; break;
            case '[': addToken(LEFT_BRACKET); break;
            case ']': addToken(RIGHT_BRACKET); break;
            case ',': addToken(COMMA); break;
            case ';': addToken(SEMICOLON); break;
            case '+': addToken(PLUS); break;
            case '-': addToken(MINUS); break;
            case '*': addToken(STAR); break;
            case '%': addToken(PERCENT); break;
            case '^': addToken(CARET); break;
            case '=': addToken(match('=') ? EQUAL_EQUAL : EQUAL); break;
            case '<': addToken(match('=') ? LESS_EQUAL : LESS); break;
            case '>': addToken(match('=') ? GREATER_EQUAL : GREATER); break;
            case '!': {
                if (match('=')) {
                    addToken(BANG_EQUAL);
                    break;
                }
                throw error(c, "Unexpected character '!'.");
            }
            case '/': {
                if (match('/')) { // single-line comment (// ...)
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(SLASH);
                }
                break;
            }
            case ' ':
            case '\r':
            case '\t':
                // Ignore whitespace.
                break;

            case '\n':
                newline();
                break;
            case '"': string(); break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error(c, "Unexpected character '" + c + "'.");
                }
                break;
        }
    }

    private char advance() {
        current++;
        return source.charAt(current-1);
    }

    private void newline() {
        line++;
        lineStart = current;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);

        TokenType ttype = keywords.get(text);
        if (ttype == null) {
            ttype = IDENTIFIER;
        }
        addToken(ttype);
    }

    // no escape sequences, the first '"' closes the string
    private void string() {
        int startLine = line;
        int startColumn = start - lineStart + 1;
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                advance();
                newline();
            } else {
                advance();
            }
        }

        if (isAtEnd()) {
            throw new LexError(startLine, startColumn, '"', "Unterminated string.");
        }

        // The closing ".
        advance();

        String value = source.substring(start + 1, current - 1);
        tokens.add(new Token(STRING, source.substring(start, current), value, startLine, startColumn));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // A fraction needs at least one digit after the '.', so "3." leaves
        // the '.' behind as an unexpected character.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(FLOAT, Double.parseDouble(source.substring(start, current)));
            return;
        }

        addToken(NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void addToken(TokenType ttype) {
        addToken(ttype, null);
    }

    private void addToken(TokenType ttype, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(ttype, text, literal, line, start - lineStart + 1));
    }

    private LexError error(char c, String message) {
        return new LexError(line, start - lineStart + 1, c, message);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        } else {
            return source.charAt(current);
        }
    }

    private char peekNext() {
        if ((current + 1) >= source.length()) {
            return '\0';
        } else {
            return source.charAt(current+1);
        }
    }

    private boolean match(char c) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != c) return false;
        current++;
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
