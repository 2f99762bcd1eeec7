package com.deeplearningdsl.dsl;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BuiltinDispatcher} backed by a table of handlers, one per
 * category and keyword. Keywords without a handler fail with a
 * {@link DispatchError}; the engines behind them live outside this package.
 */
public class NativeDispatcher implements BuiltinDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(NativeDispatcher.class);

    @FunctionalInterface
    public interface Handler {
        DslValue apply(List<DslValue> args) throws DispatchError;
    }

    private final Map<String, Handler> handlers = new HashMap<>();

    /**
     * A dispatcher that answers io.print by writing the value to {@code out},
     * one value per line.
     */
    public static NativeDispatcher withPrint(PrintStream out) {
        NativeDispatcher dispatcher = new NativeDispatcher();
        dispatcher.register(CallCategory.IO, "print", args -> {
            out.println(args.get(0).toString());
            return DslNone.NONE;
        });
        return dispatcher;
    }

    public NativeDispatcher register(CallCategory category, String keyword, Handler handler) {
        if (!isKnownKeyword(category, keyword)) {
            throw new IllegalArgumentException("'" + keyword + "' is not a " + category.label() + " keyword");
        }
        Handler old = handlers.put(key(category, keyword), handler);
        if (old != null) {
            LOGGER.debug("Replaced handler for {}.{}", category.label(), keyword);
        }
        return this;
    }

    public boolean hasHandler(CallCategory category, String keyword) {
        return handlers.containsKey(key(category, keyword));
    }

    @Override
    public DslValue dispatch(CallCategory category, String keyword, List<DslValue> args) throws DispatchError {
        Handler handler = handlers.get(key(category, keyword));
        if (handler == null) {
            LOGGER.warn("No handler registered for {}.{}", category.label(), keyword);
            throw new DispatchError(category, keyword,
                    "no handler registered for " + category.label() + " function '" + keyword + "'");
        }
        LOGGER.debug("Dispatching {}.{} with {} argument(s)", category.label(), keyword, args.size());
        DslValue result;
        try {
            result = handler.apply(args);
        } catch (DispatchError err) {
            throw err;
        } catch (RuntimeException err) {
            throw new DispatchError(category, keyword, keyword + " failed: " + err.getMessage(), err);
        }
        return result == null ? DslNone.NONE : result;
    }

    private static boolean isKnownKeyword(CallCategory category, String keyword) {
        for (TokenType ttype : category.keywords().keySet()) {
            if (ttype.name().toLowerCase().equals(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String key(CallCategory category, String keyword) {
        return category.label() + "." + keyword;
    }
}
