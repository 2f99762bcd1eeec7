package com.deeplearningdsl.dsl;

import java.util.List;

public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
    private int indent = 0;

    public static final String PARSE_ERROR = "!error!";

    /**
     * Parses {@code src} and renders it one statement per line, or returns
     * {@link #PARSE_ERROR} when it does not lex or parse.
     */
    public static String print(String src) {
        Program program;
        try {
            program = Program.parse(src);
        } catch (Scanner.LexError | Parser.ParseError err) {
            return PARSE_ERROR;
        }
        return new AstPrinter().stmtsToString(program.statements);
    }

    public String stmtsToString(List<Stmt> stmts) {
        StringBuilder builder = new StringBuilder();
        for (Stmt stmt : stmts) {
            builder.append(stmt.accept(this));
            builder.append("\n");
        }
        return builder.toString();
    }

    public String exprToString(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitAssignStmt(Stmt.Assign stmt) {
        return indent() + "(assign " + stmt.name.lexeme + " " + exprToString(stmt.value) + ")";
    }

    @Override
    public String visitExpressionStmt(Stmt.Expression stmt) {
        return indent() + exprToString(stmt.expression);
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(if " + conditionToString(stmt.condition) + "\n");
        builder.append(block("then", stmt.thenBranch));
        if (stmt.elseBranch != null) {
            builder.append("\n").append(block("else", stmt.elseBranch));
        }
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitWhileStmt(Stmt.While stmt) {
        return indent() + "(while " + conditionToString(stmt.condition) + "\n" +
            block("body", stmt.body) + ")";
    }

    @Override
    public String visitForStmt(Stmt.For stmt) {
        String header = "(for " +
            inline(stmt.initializer) + " " +
            conditionToString(stmt.condition) + " " +
            inline(stmt.increment);
        return indent() + header + "\n" + block("body", stmt.body) + ")";
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        StringBuilder builder = new StringBuilder();
        builder.append(indent() + "(def " + stmt.name.lexeme + " (");
        for (int i = 0; i < stmt.params.size(); i++) {
            if (i > 0) builder.append(" ");
            builder.append(stmt.params.get(i).lexeme);
        }
        builder.append(")\n");
        builder.append(block("body", stmt.body)).append("\n");
        indent++;
        builder.append(indent() + "(return " + exprToString(stmt.returnExpr) + "))");
        indent--;
        return builder.toString();
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return parenthesize("-", expr.right);
    }

    @Override
    public String visitTrigExpr(Expr.Trig expr) {
        return parenthesize(expr.function.lexeme, expr.argument);
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        if (expr.value instanceof Double) {
            return DslNumber.format((Double)expr.value);
        }
        return "\"" + expr.value + "\"";
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return parenthesize("group", expr.expression);
    }

    @Override
    public String visitListLiteralExpr(Expr.ListLiteral expr) {
        StringBuilder builder = new StringBuilder("(list");
        for (Expr.Row row : expr.rows) {
            builder.append(" ");
            if (row.bracketed()) {
                builder.append(parenthesize("row", row.elements.toArray(new Expr[0])));
            } else {
                builder.append(exprToString(row.elements.get(0)));
            }
        }
        return builder.append(")").toString();
    }

    @Override
    public String visitMatrixOpExpr(Expr.MatrixOp expr) {
        return parenthesize(expr.keyword.lexeme, expr.operands.toArray(new Expr[0]));
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        return parenthesize("call " + expr.category.label() + " " + expr.callee.lexeme,
            expr.args.toArray(new Expr[0]));
    }

    private String conditionToString(Condition cond) {
        if (cond.isTruthinessTest()) {
            return exprToString(cond.left);
        }
        return parenthesize(cond.operator.lexeme, cond.left, cond.right);
    }

    // a statement printed inside a header line, without leading indentation
    private String inline(Stmt stmt) {
        int oldIndent = indent;
        indent = 0;
        try {
            return stmt.accept(this);
        } finally {
            indent = oldIndent;
        }
    }

    private String block(String label, List<Stmt> stmts) {
        indent++;
        StringBuilder builder = new StringBuilder(indent() + "(" + label);
        indent++;
        for (Stmt stmt : stmts) {
            builder.append("\n").append(stmt.accept(this));
        }
        indent -= 2;
        return builder.append(")").toString();
    }

    private String parenthesize(String name, Expr... exprs) {
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (Expr expr : exprs) {
            builder.append(" ");
            builder.append(expr.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }

    private String indent() {
        StringBuilder builder = new StringBuilder();
        int i = indent;
        while (i > 0) {
            builder.append("  ");
            i--;
        }
        return builder.toString();
    }
}
