package com.deeplearningdsl.test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.deeplearningdsl.dsl.BuiltinDispatcher;
import com.deeplearningdsl.dsl.CallCategory;
import com.deeplearningdsl.dsl.DispatchError;
import com.deeplearningdsl.dsl.DslValue;

// Records every dispatched call and answers with canned results.
class RecordingDispatcher implements BuiltinDispatcher {
    static class Call {
        final CallCategory category;
        final String keyword;
        final List<DslValue> args;

        Call(CallCategory category, String keyword, List<DslValue> args) {
            this.category = category;
            this.keyword = keyword;
            this.args = new ArrayList<>(args);
        }
    }

    final List<Call> calls = new ArrayList<>();
    private final Map<String, DslValue> results = new HashMap<>();
    private final Map<String, DispatchError> failures = new HashMap<>();

    RecordingDispatcher returning(String keyword, DslValue result) {
        results.put(keyword, result);
        return this;
    }

    RecordingDispatcher failing(String keyword, DispatchError error) {
        failures.put(keyword, error);
        return this;
    }

    List<Call> callsTo(String keyword) {
        List<Call> ret = new ArrayList<>();
        for (Call call : calls) {
            if (call.keyword.equals(keyword)) {
                ret.add(call);
            }
        }
        return ret;
    }

    @Override
    public DslValue dispatch(CallCategory category, String keyword, List<DslValue> args) throws DispatchError {
        calls.add(new Call(category, keyword, args));
        DispatchError failure = failures.get(keyword);
        if (failure != null) {
            throw failure;
        }
        return results.get(keyword);
    }
}
