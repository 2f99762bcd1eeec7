package com.deeplearningdsl.test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Before;
import org.junit.Test;
import com.deeplearningdsl.dsl.CallCategory;
import com.deeplearningdsl.dsl.DispatchError;
import com.deeplearningdsl.dsl.DslList;
import com.deeplearningdsl.dsl.DslMatrix;
import com.deeplearningdsl.dsl.DslNone;
import com.deeplearningdsl.dsl.DslNumber;
import com.deeplearningdsl.dsl.DslString;
import com.deeplearningdsl.dsl.DslValue;
import com.deeplearningdsl.dsl.Environment;
import com.deeplearningdsl.dsl.Interpreter;
import com.deeplearningdsl.dsl.NativeDispatcher;
import com.deeplearningdsl.dsl.Program;
import com.deeplearningdsl.dsl.RuntimeError;

public class DispatchTest {
    private RecordingDispatcher dispatcher;
    private Environment globals;

    @Before
    public void setUp() {
        dispatcher = new RecordingDispatcher();
        globals = new Environment();
    }

    @Test
    public void testPrintInForLoop() {
        run("for (i = 0; i < 3; i = i + 1) { print(i); }");
        List<RecordingDispatcher.Call> prints = dispatcher.callsTo("print");
        assertEquals(3, prints.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(CallCategory.IO, prints.get(i).category);
            assertEquals(Arrays.<DslValue>asList(DslNumber.of(i)), prints.get(i).args);
        }
    }

    @Test
    public void testKmeansArguments() {
        DslValue model = new DslString("model#1");
        dispatcher.returning("kmeans", model);
        run("data = [[1, 2], [3, 4]];\n" +
            "model = kmeans(data, 3);");

        RecordingDispatcher.Call call = dispatcher.calls.get(0);
        assertEquals(CallCategory.ML, call.category);
        assertEquals("kmeans", call.keyword);
        assertEquals(2, call.args.size());
        assertEquals(new DslMatrix(new double[][] {{1, 2}, {3, 4}}), call.args.get(0));
        assertEquals(DslNumber.of(3), call.args.get(1));
        assertSame(model, globals.lookup("model"));
    }

    @Test
    public void testResultFeedsLaterCalls() {
        DslValue model = new DslString("autoencoder#1");
        dispatcher.returning("autoencoder", model);
        run("ae = autoencoder([1, 2], [4, 2]);\n" +
            "z = encode(ae, [1, 2]);");
        RecordingDispatcher.Call encode = dispatcher.callsTo("encode").get(0);
        assertSame(model, encode.args.get(0));
        assertTrue(encode.args.get(1) instanceof DslList);
    }

    @Test
    public void testMissingResultIsNone() {
        run("p = plot([1, 2, 3]);");
        assertEquals(CallCategory.PLOT, dispatcher.calls.get(0).category);
        assertSame(DslNone.NONE, globals.lookup("p"));
    }

    @Test
    public void testArgumentsEvaluatedOnceInOrder() {
        run("def tag(x) { print(x); return x; }\n" +
            "scatter(tag(1), tag(2));");
        assertEquals(3, dispatcher.calls.size());
        assertEquals(DslNumber.of(1), dispatcher.calls.get(0).args.get(0));
        assertEquals(DslNumber.of(2), dispatcher.calls.get(1).args.get(0));
        assertEquals("scatter", dispatcher.calls.get(2).keyword);
    }

    @Test
    public void testNoDispatchForUserFunctions() {
        run("def twice(x) { return x * 2; }\n" +
            "y = twice(4);");
        assertTrue(dispatcher.calls.isEmpty());
        assertEquals(DslNumber.of(8), globals.lookup("y"));
    }

    @Test
    public void testDispatchFailureKeepsCause() {
        DispatchError cause = new DispatchError(CallCategory.IO, "read_file", "no such file");
        dispatcher.failing("read_file", cause);
        try {
            run("d = read_file(\"missing.csv\");\nprint(d);");
            fail("expected RuntimeError");
        } catch (RuntimeError err) {
            assertEquals(RuntimeError.Kind.DISPATCH_FAILURE, err.kind);
            assertSame(cause, err.getCause());
            assertEquals("read_file", err.token.lexeme);
        }
        // the first error aborts the run
        assertEquals(1, dispatcher.calls.size());
        assertFalse(globals.isDefined("d"));
    }

    @Test
    public void testNativeDispatcherHandlers() throws DispatchError {
        NativeDispatcher natives = new NativeDispatcher()
            .register(CallCategory.ML, "predict", args -> args.get(1));
        assertTrue(natives.hasHandler(CallCategory.ML, "predict"));
        assertFalse(natives.hasHandler(CallCategory.ML, "train"));

        DslValue input = DslNumber.of(7);
        DslValue ret = natives.dispatch(CallCategory.ML, "predict",
                                        Arrays.asList(new DslString("m"), input));
        assertSame(input, ret);
    }

    @Test
    public void testNativeDispatcherNullResultIsNone() throws DispatchError {
        NativeDispatcher natives = new NativeDispatcher()
            .register(CallCategory.PLOT, "histogram", args -> null);
        DslValue ret = natives.dispatch(CallCategory.PLOT, "histogram",
                                        Arrays.<DslValue>asList(DslNumber.of(1)));
        assertSame(DslNone.NONE, ret);
    }

    @Test
    public void testNativeDispatcherMissingHandler() {
        NativeDispatcher natives = new NativeDispatcher();
        try {
            natives.dispatch(CallCategory.ML, "train", Arrays.<DslValue>asList(DslNumber.of(1), DslNumber.of(2)));
            fail("expected DispatchError");
        } catch (DispatchError err) {
            assertEquals(CallCategory.ML, err.category);
            assertEquals("train", err.keyword);
            assertTrue(err.getMessage().contains("no handler registered"));
        }
    }

    @Test
    public void testNativeDispatcherWrapsHandlerFailure() {
        NativeDispatcher natives = new NativeDispatcher()
            .register(CallCategory.IO, "write_file", args -> {
                throw new IllegalStateException("disk full");
            });
        try {
            natives.dispatch(CallCategory.IO, "write_file",
                             Arrays.<DslValue>asList(new DslString("out.csv"), DslNumber.of(1)));
            fail("expected DispatchError");
        } catch (DispatchError err) {
            assertTrue(err.getCause() instanceof IllegalStateException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegisterRejectsForeignKeyword() {
        new NativeDispatcher().register(CallCategory.PLOT, "kmeans", args -> null);
    }

    @Test
    public void testStaticEvaluateSharesGlobals() {
        Interpreter.evaluate(Program.parse("a = 2;"), globals, dispatcher);
        Interpreter.evaluate(Program.parse("b = a + 1;"), globals, dispatcher);
        assertEquals(DslNumber.of(3), globals.lookup("b"));
    }

    private void run(String code) {
        new Interpreter(globals, dispatcher).interpret(Program.parse(code));
    }
}
