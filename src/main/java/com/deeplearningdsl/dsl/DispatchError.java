package com.deeplearningdsl.dsl;

/**
 * Failure reported by a {@link BuiltinDispatcher}. The interpreter passes it
 * on unchanged as the cause of a DISPATCH_FAILURE runtime error.
 */
public class DispatchError extends Exception {
    public final CallCategory category;
    public final String keyword;

    public DispatchError(CallCategory category, String keyword, String message) {
        super(message);
        this.category = category;
        this.keyword = keyword;
    }

    public DispatchError(CallCategory category, String keyword, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.keyword = keyword;
    }
}
