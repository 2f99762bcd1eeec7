package com.deeplearningdsl.dsl;

/**
 * The test of an if/while/for. With no operator it is a truthiness test of
 * {@code left} alone, otherwise {@code left op right} where op is one of
 * == != &lt; &lt;= &gt; &gt;=.
 */
public final class Condition {
    public final Expr left;
    public final Token operator;
    public final Expr right;

    Condition(Expr left, Token operator, Expr right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public boolean isTruthinessTest() {
        return operator == null;
    }
}
