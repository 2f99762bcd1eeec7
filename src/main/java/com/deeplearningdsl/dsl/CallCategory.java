package com.deeplearningdsl.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.deeplearningdsl.dsl.TokenType.*;

/**
 * Who answers a call. USER calls go to functions defined with "def"; the
 * other categories go through the {@link BuiltinDispatcher}, each with a
 * fixed keyword table and a fixed argument count per keyword.
 */
public enum CallCategory {
    USER,
    ML,
    IO,
    PLOT;

    private static final Map<TokenType, Integer> ML_ARITY = new LinkedHashMap<>();
    private static final Map<TokenType, Integer> IO_ARITY = new LinkedHashMap<>();
    private static final Map<TokenType, Integer> PLOT_ARITY = new LinkedHashMap<>();

    static {
        ML_ARITY.put(LINEAR_REGRESSION, 2);    // (features, targets)
        ML_ARITY.put(MLP_CLASSIFIER, 3);       // (features, targets, config)
        ML_ARITY.put(NEURAL_NETWORK, 3);       // (features, targets, config)
        ML_ARITY.put(PREDICT, 2);              // (model, input)
        ML_ARITY.put(TRAIN, 2);                // (model, data)
        ML_ARITY.put(KMEANS, 2);               // (data, k)
        ML_ARITY.put(FIT_PREDICT, 2);          // (model, data)
        ML_ARITY.put(GET_CENTROIDS, 1);        // (model)
        ML_ARITY.put(AUTOENCODER, 2);          // (data, config)
        ML_ARITY.put(ENCODE, 2);               // (model, input)
        ML_ARITY.put(DECODE, 2);               // (model, input)
        ML_ARITY.put(RECONSTRUCT, 2);          // (model, input)
        ML_ARITY.put(RECONSTRUCTION_ERROR, 2); // (model, input)

        IO_ARITY.put(READ_FILE, 1);  // (path)
        IO_ARITY.put(WRITE_FILE, 2); // (path, data)
        IO_ARITY.put(PRINT, 1);      // (value)

        PLOT_ARITY.put(TokenType.PLOT, 1); // (data)
        PLOT_ARITY.put(SCATTER, 2);        // (x, y)
        PLOT_ARITY.put(HISTOGRAM, 1);      // (data)
    }

    public Map<TokenType, Integer> keywords() {
        switch (this) {
            case ML: return Collections.unmodifiableMap(ML_ARITY);
            case IO: return Collections.unmodifiableMap(IO_ARITY);
            case PLOT: return Collections.unmodifiableMap(PLOT_ARITY);
            default: return Collections.emptyMap();
        }
    }

    public boolean hasKeyword(TokenType ttype) {
        return keywords().containsKey(ttype);
    }

    // -1 for USER calls, whose arity comes from the definition
    public int arity(TokenType ttype) {
        Integer arity = keywords().get(ttype);
        return arity == null ? -1 : arity;
    }

    public String label() {
        return name().toLowerCase();
    }

    /**
     * Resolves the category of a call whose callee token is {@code callee}.
     * A name already registered by "def" is a user call, as is any other
     * identifier (it may be defined later in the program). Keywords are
     * looked up in the ML, IO and plot tables in that order. Keywords never
     * lex as identifiers, so a user definition cannot shadow a built-in.
     * Returns null when the token cannot start a call.
     */
    public static CallCategory resolve(Token callee, Set<String> userFunctions) {
        if (userFunctions.contains(callee.lexeme)) return USER;
        if (callee.type == IDENTIFIER) return USER;
        if (ML.hasKeyword(callee.type)) return ML;
        if (IO.hasKeyword(callee.type)) return IO;
        if (PLOT.hasKeyword(callee.type)) return PLOT;
        return null;
    }

    public static boolean isBuiltinKeyword(TokenType ttype) {
        return ML.hasKeyword(ttype) || IO.hasKeyword(ttype) || PLOT.hasKeyword(ttype);
    }
}
