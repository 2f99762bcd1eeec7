package com.deeplearningdsl.dsl;

public final class DslNone extends DslValue {
    public static final DslNone NONE = new DslNone();

    private DslNone() {
    }

    @Override
    public Kind kind() {
        return Kind.NONE;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String toString() {
        return "none";
    }
}
