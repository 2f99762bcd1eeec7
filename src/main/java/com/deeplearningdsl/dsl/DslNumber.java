package com.deeplearningdsl.dsl;

public final class DslNumber extends DslValue {
    public final double value;

    private DslNumber(double value) {
        this.value = value;
    }

    // -0.0 is stored as 0.0, so zeros compare and print alike
    public static DslNumber of(double value) {
        return new DslNumber(value == 0.0 ? 0.0 : value);
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DslNumber)) return false;
        return Double.compare(value, ((DslNumber)other).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return format(value);
    }

    // Work around Java adding ".0" to integer-valued doubles.
    static String format(double value) {
        String text = Double.toString(value);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text;
    }
}
