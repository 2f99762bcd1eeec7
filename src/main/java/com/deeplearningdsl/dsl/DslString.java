package com.deeplearningdsl.dsl;

public final class DslString extends DslValue {
    public final String value;

    public DslString(String value) {
        this.value = value;
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DslString)) return false;
        return value.equals(((DslString)other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
