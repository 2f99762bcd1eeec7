package com.deeplearningdsl.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.deeplearningdsl.dsl.TokenType.*;

/*
 * Grammar:
 * low prec
 * to
 * high prec
 *
 * program        : statement* EOF ;
 * statement      : assignment ";"
 *                | ifStmt
 *                | forStmt
 *                | whileStmt
 *                | funDecl
 *                | expression ";" ;
 *
 * assignment     : IDENTIFIER "=" expression ;
 * ifStmt         : "if" "(" condition ")" block ( "else" block )? ;
 * forStmt        : "for" "(" assignment ";" condition ";" assignment ")" block ;
 * whileStmt      : "while" "(" condition ")" block ;
 * funDecl        : "def" IDENTIFIER "(" parameterList? ")" "{" statement* returnStmt "}" ;
 * returnStmt     : "return" expression ";" ;
 * block          : "{" statement* "}" ;
 * parameterList  : IDENTIFIER ( "," IDENTIFIER )* ;
 *
 * condition      : expression ( ( "==" | "!=" | "<" | "<=" | ">" | ">=" ) expression )? ;
 * expression     : term ( ( "+" | "-" ) term )* ;
 * term           : factor ( ( "*" | "/" | "%" ) factor )* ;
 * factor         : base ( "^" base )* ;
 * base           : NUMBER | FLOAT | STRING | IDENTIFIER
 *                | "(" expression ")"
 *                | listLiteral
 *                | matrixOp
 *                | call
 *                | "-" base
 *                | ( "sin" | "cos" | "tan" | "sqrt" ) "(" expression ")" ;
 * listLiteral    : "[" ( row ( "," row )* )? "]" ;
 * row            : "[" expression ( "," expression )* "]"
 *                | expression ;
 * matrixOp       : ( "transpose" | "inverse" ) "(" expression ")"
 *                | ( "matmult" | "matadd" | "matsub" ) "(" expression "," expression ")" ;
 * call           : IDENTIFIER "(" arguments? ")"
 *                | builtinKeyword "(" arguments ")" ;   (fixed arity per keyword)
 * arguments      : expression ( "," expression )* ;
 */

public class Parser {
    public static class ParseError extends RuntimeException {
        public final int line;
        public final int column;
        public final Set<TokenType> expected;
        public final TokenType found;

        ParseError(Token token, String message, Set<TokenType> expected) {
            super("[line " + token.position() + "] Error " +
                  (token.type == EOF ? "at end" : "at '" + token.lexeme + "'") +
                  ": " + message);
            this.line = token.line;
            this.column = token.column;
            this.expected = Collections.unmodifiableSet(expected);
            this.found = token.type;
        }
    }

    private static final EnumSet<TokenType> REL_OPS =
        EnumSet.of(EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL);
    private static final EnumSet<TokenType> MATRIX_OPS =
        EnumSet.of(TRANSPOSE, INVERSE, MATMULT, MATADD, MATSUB);
    private static final EnumSet<TokenType> TRIG_FUNCS =
        EnumSet.of(SIN, COS, TAN, SQRT);
    // FIRST sets
    private static final EnumSet<TokenType> EXPR_START;
    private static final EnumSet<TokenType> STMT_START;

    static {
        EXPR_START = EnumSet.of(NUMBER, FLOAT, STRING, IDENTIFIER, LEFT_PAREN, LEFT_BRACKET, MINUS);
        EXPR_START.addAll(MATRIX_OPS);
        EXPR_START.addAll(TRIG_FUNCS);
        for (CallCategory category : CallCategory.values()) {
            EXPR_START.addAll(category.keywords().keySet());
        }
        STMT_START = EnumSet.copyOf(EXPR_START);
        STMT_START.addAll(EnumSet.of(IF, FOR, WHILE, DEF));
    }

    private final List<Token> tokens;
    private int current = 0;
    // names introduced by "def" so far, seen by every later call site
    private final Set<String> userFunctions = new HashSet<>();

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Parser newFromSource(String source) {
        Scanner scanner = new Scanner(source);
        List<Token> tokens = scanner.scanTokens();
        return new Parser(tokens);
    }

    public Program parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Program(statements);
    }

    // the REPL parses each entry separately but keeps functions from earlier ones
    public void setUserFunctions(Set<String> names) {
        for (String name : names) {
            if (!Scanner.isKeyword(name)) {
                userFunctions.add(name);
            }
        }
    }

    public Set<String> getUserFunctions() {
        return Collections.unmodifiableSet(userFunctions);
    }

    private Stmt statement() {
        if (matchAny(IF)) return ifStatement();
        if (matchAny(FOR)) return forStatement();
        if (matchAny(WHILE)) return whileStatement();
        if (matchAny(DEF)) return funDeclaration();
        if (checkTok(RETURN)) {
            throw new ParseError(peekTok(),
                "'return' is only allowed as the last statement of a function body.", STMT_START);
        }
        return assignmentOrExpression();
    }

    private Stmt assignmentOrExpression() {
        Expr expr = expression();
        if (matchAny(EQUAL)) {
            Token equals = prevTok();
            if (!(expr instanceof Expr.Variable)) {
                throw error(equals, "Invalid assignment target, must be a variable name.", SEMICOLON);
            }
            Expr value = expression();
            consumeTok(SEMICOLON, "Expected ';' after assignment.");
            return new Stmt.Assign(((Expr.Variable)expr).name, value);
        }
        consumeTok(SEMICOLON, "Expected ';' after expression.");
        return new Stmt.Expression(expr);
    }

    private Stmt.Assign assignment() {
        Token name = consumeTok(IDENTIFIER, "Expected variable name.");
        consumeTok(EQUAL, "Expected '=' after variable name.");
        Expr value = expression();
        return new Stmt.Assign(name, value);
    }

    private Stmt ifStatement() {
        Token keyword = prevTok();
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'if'.");
        Condition cond = condition();
        consumeTok(RIGHT_PAREN, "Expected ')' after condition in 'if' statement.");
        List<Stmt> thenBranch = block("if");
        List<Stmt> elseBranch = null;
        if (matchAny(ELSE)) {
            elseBranch = block("else");
        }
        return new Stmt.If(keyword, cond, thenBranch, elseBranch);
    }

    private Stmt forStatement() {
        Token keyword = prevTok();
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'for'.");
        Stmt.Assign initializer = assignment();
        consumeTok(SEMICOLON, "Expected ';' in 'for' statement after initializer.");
        Condition cond = condition();
        consumeTok(SEMICOLON, "Expected ';' in 'for' statement after condition.");
        Stmt.Assign increment = assignment();
        consumeTok(RIGHT_PAREN, "Expected ')' in 'for' statement after increment.");
        List<Stmt> body = block("for");
        return new Stmt.For(keyword, initializer, cond, increment, body);
    }

    private Stmt whileStatement() {
        Token keyword = prevTok();
        consumeTok(LEFT_PAREN, "Expected '(' after keyword 'while'.");
        Condition cond = condition();
        consumeTok(RIGHT_PAREN, "Expected ')' after 'while' condition.");
        List<Stmt> body = block("while");
        return new Stmt.While(keyword, cond, body);
    }

    private Stmt funDeclaration() {
        Token name = consumeTok(IDENTIFIER, "Expected function name after 'def' keyword.");
        consumeTok(LEFT_PAREN, "Expected '(' after function name.");
        List<Token> params = new ArrayList<>();
        if (!checkTok(RIGHT_PAREN)) {
            do {
                params.add(consumeTok(IDENTIFIER, "Expected parameter name in function parameter list."));
            } while (matchAny(COMMA));
        }
        consumeTok(RIGHT_PAREN, "Expected ')' to end function parameter list.");
        // registered before the body so the function can call itself
        userFunctions.add(name.lexeme);

        consumeTok(LEFT_BRACE, "Expected '{' after function parameter list.");
        List<Stmt> body = new ArrayList<>();
        while (!checkTok(RETURN)) {
            if (isAtEnd() || checkTok(RIGHT_BRACE)) {
                throw error(peekTok(), "Function '" + name.lexeme + "' must end with a return statement.", RETURN);
            }
            body.add(statement());
        }
        consumeTok(RETURN, "Expected 'return' at end of function body.");
        Expr returnExpr = expression();
        consumeTok(SEMICOLON, "Expected ';' after return expression.");
        consumeTok(RIGHT_BRACE, "Expected '}' after return statement, 'return' must be last in a function body.");
        return new Stmt.Function(name, params, body, returnExpr);
    }

    private List<Stmt> block(String owner) {
        consumeTok(LEFT_BRACE, "Expected '{' to start '" + owner + "' block.");
        List<Stmt> statements = new ArrayList<>();
        while (!checkTok(RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consumeTok(RIGHT_BRACE, "Expected '}' after '" + owner + "' block.");
        return statements;
    }

    private Condition condition() {
        Expr left = expression();
        if (matchAny(EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL)) {
            Token operator = prevTok();
            Expr right = expression();
            return new Condition(left, operator, right);
        }
        return new Condition(left, null, null);
    }

    private Expr expression() {
        Expr expr = term();

        while (matchAny(PLUS, MINUS)) {
            Token operator = prevTok();
            Expr right = term();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr term() {
        Expr expr = factor();

        while (matchAny(STAR, SLASH, PERCENT)) {
            Token operator = prevTok();
            Expr right = factor();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    // "^" folds to the left like the other levels: 2^3^2 is (2^3)^2
    private Expr factor() {
        Expr expr = base();

        while (matchAny(CARET)) {
            Token operator = prevTok();
            Expr right = base();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr base() {
        if (matchAny(NUMBER, FLOAT, STRING)) {
            return new Expr.Literal(prevTok(), prevTok().literal);
        }

        if (matchAny(IDENTIFIER)) {
            Token name = prevTok();
            if (matchAny(LEFT_PAREN)) {
                return call(name);
            }
            return new Expr.Variable(name);
        }

        if (matchAny(LEFT_PAREN)) {
            Token lparen = prevTok();
            Expr expr = expression();
            consumeTok(RIGHT_PAREN, "Expected ')' after group expression.");
            return new Expr.Grouping(lparen, expr);
        }

        if (matchAny(LEFT_BRACKET)) {
            return listLiteral();
        }

        if (checkAny(MATRIX_OPS)) {
            return matrixOp(advance());
        }

        if (CallCategory.isBuiltinKeyword(peekTok().type)) {
            Token callee = advance();
            consumeTok(LEFT_PAREN, "Expected '(' after '" + callee.lexeme + "'.");
            return call(callee);
        }

        if (matchAny(MINUS)) {
            Token operator = prevTok();
            Expr right = base();
            return new Expr.Unary(operator, right);
        }

        if (checkAny(TRIG_FUNCS)) {
            Token function = advance();
            consumeTok(LEFT_PAREN, "Expected '(' after '" + function.lexeme + "'.");
            Expr argument = expression();
            consumeTok(RIGHT_PAREN, "Expected ')' after argument to '" + function.lexeme + "'.");
            return new Expr.Trig(function, argument);
        }

        throw new ParseError(peekTok(), "Expected expression.", EXPR_START);
    }

    // the opening '(' has been consumed
    private Expr call(Token callee) {
        CallCategory category = CallCategory.resolve(callee, userFunctions);
        List<Expr> args = new ArrayList<>();
        if (category == CallCategory.USER) {
            if (!checkTok(RIGHT_PAREN)) {
                do {
                    args.add(expression());
                } while (matchAny(COMMA));
            }
            consumeTok(RIGHT_PAREN, "Expected ')' at end of argument list.", RIGHT_PAREN, COMMA);
        } else {
            args = fixedArguments(callee, category.arity(callee.type));
        }
        return new Expr.Call(category, callee, args);
    }

    private Expr matrixOp(Token keyword) {
        consumeTok(LEFT_PAREN, "Expected '(' after '" + keyword.lexeme + "'.");
        int arity = (keyword.type == TRANSPOSE || keyword.type == INVERSE) ? 1 : 2;
        return new Expr.MatrixOp(keyword, fixedArguments(keyword, arity));
    }

    private List<Expr> fixedArguments(Token callee, int arity) {
        List<Expr> args = new ArrayList<>();
        String plural = arity == 1 ? " argument." : " arguments.";
        for (int i = 0; i < arity; i++) {
            if (i > 0) {
                consumeTok(COMMA, "'" + callee.lexeme + "' takes " + arity + plural);
            }
            args.add(expression());
        }
        consumeTok(RIGHT_PAREN, "'" + callee.lexeme + "' takes " + arity + plural);
        return args;
    }

    // the opening '[' has been consumed
    private Expr listLiteral() {
        Token lbracket = prevTok();
        List<Expr.Row> rows = new ArrayList<>();
        if (!checkTok(RIGHT_BRACKET)) {
            do {
                rows.add(row());
            } while (matchAny(COMMA));
        }
        consumeTok(RIGHT_BRACKET, "Expected ']' to end list literal.", RIGHT_BRACKET, COMMA);
        return new Expr.ListLiteral(lbracket, rows);
    }

    // "[]" in row position is an empty list element, not an empty row
    private Expr.Row row() {
        if (checkTok(LEFT_BRACKET) && peekTokN(1).type != RIGHT_BRACKET) {
            Token lbracket = advance();
            List<Expr> elements = new ArrayList<>();
            do {
                elements.add(expression());
            } while (matchAny(COMMA));
            consumeTok(RIGHT_BRACKET, "Expected ']' to end matrix row.", RIGHT_BRACKET, COMMA);
            return new Expr.Row(lbracket, elements);
        }
        List<Expr> single = new ArrayList<>();
        single.add(expression());
        return new Expr.Row(null, single);
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean checkAny(Set<TokenType> ttypes) {
        return ttypes.contains(peekTok().type);
    }

    private Token consumeTok(TokenType ttype, String msg) {
        return consumeTok(ttype, msg, ttype);
    }

    private Token consumeTok(TokenType ttype, String msg, TokenType... expected) {
        if (checkTok(ttype)) {
            return advance();
        }
        throw error(peekTok(), msg, expected);
    }

    private boolean checkTok(TokenType ttype) {
        if (isAtEnd()) return false;
        return peekTok().type == ttype;
    }

    private Token peekTok() {
        return tokens.get(current);
    }

    private Token peekTokN(int n) {
        int idx = Math.min(current + n, tokens.size() - 1);
        return tokens.get(idx);
    }

    private Token prevTok() {
        if (current == 0) return peekTok();
        return tokens.get(current-1);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return prevTok();
    }

    private boolean isAtEnd() {
        return peekTok().type == EOF;
    }

    private ParseError error(Token token, String msg, TokenType... expected) {
        EnumSet<TokenType> kinds = EnumSet.noneOf(TokenType.class);
        Collections.addAll(kinds, expected);
        return new ParseError(token, msg, kinds);
    }
}
