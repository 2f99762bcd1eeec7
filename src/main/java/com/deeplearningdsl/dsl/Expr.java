package com.deeplearningdsl.dsl;

import java.util.List;

public abstract class Expr {
    public interface Visitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitTrigExpr(Trig expr);
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitMatrixOpExpr(MatrixOp expr);
        R visitCallExpr(Call expr);
        R visitGroupingExpr(Grouping expr);
    }

    // operator is one of + - * / % ^
    public static class Binary extends Expr {
        Binary(Expr left, Token operator, Expr right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        public final Expr left;
        public final Token operator;
        public final Expr right;
    }

    // unary minus, the only prefix operator
    public static class Unary extends Expr {
        Unary(Token operator, Expr right) {
            this.operator = operator;
            this.right = right;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        public final Token operator;
        public final Expr right;
    }

    // sin, cos, tan, sqrt
    public static class Trig extends Expr {
        Trig(Token function, Expr argument) {
            this.function = function;
            this.argument = argument;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitTrigExpr(this);
        }

        public final Token function;
        public final Expr argument;
    }

    // value is a Double (NUMBER and FLOAT) or a String
    public static class Literal extends Expr {
        Literal(Token token, Object value) {
            this.token = token;
            this.value = value;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        public final Token token;
        public final Object value;
    }

    public static class Variable extends Expr {
        Variable(Token name) {
            this.name = name;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        public final Token name;
    }

    /**
     * A bracketed literal. Rows are kept exactly as written; whether the
     * literal is a list or a matrix is decided when it is evaluated.
     */
    public static class ListLiteral extends Expr {
        ListLiteral(Token lbracket, List<Row> rows) {
            this.lbracket = lbracket;
            this.rows = rows;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }

        public boolean allBracketed() {
            for (Row row : rows) {
                if (!row.bracketed()) return false;
            }
            return true;
        }

        public boolean noneBracketed() {
            for (Row row : rows) {
                if (row.bracketed()) return false;
            }
            return true;
        }

        public final Token lbracket;
        public final List<Row> rows;
    }

    /**
     * One row of a {@link ListLiteral}: either "[e1, e2, ...]" (lbracket is the
     * opening bracket) or a single bare expression (lbracket is null).
     */
    public static class Row {
        Row(Token lbracket, List<Expr> elements) {
            this.lbracket = lbracket;
            this.elements = elements;
        }

        public boolean bracketed() {
            return lbracket != null;
        }

        public final Token lbracket;
        public final List<Expr> elements;
    }

    // transpose, inverse, matmult, matadd, matsub
    public static class MatrixOp extends Expr {
        MatrixOp(Token keyword, List<Expr> operands) {
            this.keyword = keyword;
            this.operands = operands;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatrixOpExpr(this);
        }

        public final Token keyword;
        public final List<Expr> operands;
    }

    public static class Call extends Expr {
        Call(CallCategory category, Token callee, List<Expr> args) {
            this.category = category;
            this.callee = callee;
            this.args = args;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        public final CallCategory category;
        public final Token callee;
        public final List<Expr> args;
    }

    public static class Grouping extends Expr {
        Grouping(Token lparen, Expr expression) {
            this.lparen = lparen;
            this.expression = expression;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }

        public final Token lparen;
        public final Expr expression;
    }

    abstract <R> R accept(Visitor<R> visitor);
}
