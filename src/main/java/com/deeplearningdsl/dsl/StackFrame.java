package com.deeplearningdsl.dsl;

class StackFrame {
    final DslFunction function;
    final Token token;

    StackFrame(DslFunction function, Token tok) {
        this.function = function;
        this.token = tok;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("<" + function.getName() + ">");
        if (token != null) {
            builder.append(" at line " + token.line + ".");
        }
        return builder.toString();
    }
}
