package com.deeplearningdsl.dsl;

import java.util.List;

/**
 * The interpreter's only way to reach the ML, IO and plot collaborators.
 * Arguments arrive evaluated and in call order; their count always matches
 * the keyword's fixed arity in {@link CallCategory}.
 */
public interface BuiltinDispatcher {
    DslValue dispatch(CallCategory category, String keyword, List<DslValue> args) throws DispatchError;
}
