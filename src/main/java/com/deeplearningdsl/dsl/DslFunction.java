package com.deeplearningdsl.dsl;

import java.util.List;

/**
 * A user function: its declaration plus the frame it was defined in.
 */
public final class DslFunction extends DslValue {
    final Stmt.Function declaration;
    final Environment closure;

    DslFunction(Stmt.Function declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    public String getName() {
        return declaration.name.lexeme;
    }

    public int arity() {
        return declaration.params.size();
    }

    DslValue call(Interpreter interpreter, List<DslValue> args, Token callToken) {
        if (args.size() != arity()) {
            throw new RuntimeError(RuntimeError.Kind.ARITY_ERROR, callToken,
                    "Function '" + getName() + "' expects " + arity() +
                    " argument(s), got " + args.size() + ".");
        }
        Environment environment = new Environment(closure);
        for (int i = 0; i < arity(); i++) {
            environment.define(declaration.params.get(i).lexeme, args.get(i));
        }

        interpreter.stack.add(new StackFrame(this, callToken));
        Environment oldEnv = interpreter.environment;
        DslValue result;
        try {
            interpreter.environment = environment;
            interpreter.executeStmts(declaration.body);
            result = interpreter.evaluate(declaration.returnExpr);
        } finally {
            interpreter.environment = oldEnv;
        }
        // not in the finally clause, so a failing call stays on the stack for the stacktrace
        interpreter.stack.pop();
        return result;
    }

    @Override
    public Kind kind() {
        return Kind.FUNCTION;
    }

    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }
}
