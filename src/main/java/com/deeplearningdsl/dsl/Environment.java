package com.deeplearningdsl.dsl;

import java.util.HashMap;
import java.util.Map;

/**
 * One frame of variables. Blocks run in the frame that encloses them; only a
 * function call opens a new frame, whose enclosing frame is the one the
 * function was defined in.
 */
public class Environment {
    private final Map<String, DslValue> values = new HashMap<>();
    final Environment enclosing;

    public Environment() {
        enclosing = null;
    }

    Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    // assignment always binds in this frame, shadowing any outer binding
    public void define(String name, DslValue value) {
        values.put(name, value);
    }

    public DslValue get(Token name) {
        DslValue value = lookup(name.lexeme);
        if (value == null) {
            throw new RuntimeError(RuntimeError.Kind.UNDEFINED_VARIABLE, name,
                    "Undefined variable '" + name.lexeme + "'.");
        }
        return value;
    }

    // null when the name is bound in no frame of the chain
    public DslValue lookup(String name) {
        if (values.containsKey(name)) {
            return values.get(name);
        }

        if (enclosing != null) {
            return enclosing.lookup(name);
        }

        return null;
    }

    public boolean isDefined(String name) {
        return lookup(name) != null;
    }
}
