package com.deeplearningdsl.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RuntimeError extends RuntimeException {
    public enum Kind {
        UNDEFINED_VARIABLE,
        UNDEFINED_FUNCTION,
        ARITY_ERROR,
        DIVISION_BY_ZERO,
        DOMAIN_ERROR,
        SHAPE_ERROR,
        TYPE_MISMATCH,
        DISPATCH_FAILURE
    }

    public final Kind kind;
    public final Token token; // token of the failing node
    private List<String> callStack = Collections.emptyList();

    public RuntimeError(Kind kind, Token token, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public RuntimeError(Kind kind, Token token, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.token = token;
    }

    // stacktrace lines, most recent call first
    public List<String> getCallStack() {
        return callStack;
    }

    void attachCallStack(List<String> lines) {
        this.callStack = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public String where() {
        if (token == null) return "";
        return "[line " + token.position() + "]";
    }
}
