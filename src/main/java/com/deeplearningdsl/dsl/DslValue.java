package com.deeplearningdsl.dsl;

/**
 * Runtime value. Every value is immutable; operations build new values.
 */
public abstract class DslValue {
    public enum Kind {
        NUMBER, STRING, LIST, MATRIX, FUNCTION, NONE
    }

    public abstract Kind kind();

    public abstract boolean isTruthy();

    // name used in error messages, ex: "number"
    public String typeName() {
        return kind().name().toLowerCase();
    }
}
