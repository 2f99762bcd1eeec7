package com.deeplearningdsl.dsl;

import java.util.List;

public abstract class Stmt {
    public interface Visitor<R> {
        R visitAssignStmt(Assign stmt);
        R visitIfStmt(If stmt);
        R visitForStmt(For stmt);
        R visitWhileStmt(While stmt);
        R visitFunctionStmt(Function stmt);
        R visitExpressionStmt(Expression stmt);
    }

    public static class Assign extends Stmt {
        Assign(Token name, Expr value) {
            this.name = name;
            this.value = value;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignStmt(this);
        }

        public final Token name;
        public final Expr value;
    }

    // elseBranch is null when there is no "else"
    public static class If extends Stmt {
        If(Token keyword, Condition condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStmt(this);
        }

        public final Token keyword;
        public final Condition condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;
    }

    public static class For extends Stmt {
        For(Token keyword, Assign initializer, Condition condition, Assign increment, List<Stmt> body) {
            this.keyword = keyword;
            this.initializer = initializer;
            this.condition = condition;
            this.increment = increment;
            this.body = body;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitForStmt(this);
        }

        public final Token keyword;
        public final Assign initializer;
        public final Condition condition;
        public final Assign increment;
        public final List<Stmt> body;
    }

    public static class While extends Stmt {
        While(Token keyword, Condition condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileStmt(this);
        }

        public final Token keyword;
        public final Condition condition;
        public final List<Stmt> body;
    }

    /**
     * "def name(params) { body return returnExpr; }". The trailing return is
     * part of the declaration, never a statement of its own.
     */
    public static class Function extends Stmt {
        Function(Token name, List<Token> params, List<Stmt> body, Expr returnExpr) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.returnExpr = returnExpr;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionStmt(this);
        }

        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        public final Expr returnExpr;
    }

    public static class Expression extends Stmt {
        Expression(Expr expression) {
            this.expression = expression;
        }

        <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStmt(this);
        }

        public final Expr expression;
    }

    abstract <R> R accept(Visitor<R> visitor);
}
