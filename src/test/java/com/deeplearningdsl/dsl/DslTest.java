package com.deeplearningdsl.dsl;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DslTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;
    private Dsl dsl;

    @Before
    public void setUp() throws UnsupportedEncodingException {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream(outBytes, true, "UTF-8");
        err = new PrintStream(errBytes, true, "UTF-8");
        dsl = new Dsl(NativeDispatcher.withPrint(out), err);
    }

    @Test
    public void testRunSrc() {
        dsl.runSrc("print(1 + 2);");
        assertEquals("3\n", output());
        assertFalse(dsl.hadError);
        assertFalse(dsl.hadRuntimeError);
        assertEquals("", errors());
    }

    @Test
    public void testParseErrorReport() {
        dsl.runSrc("x = 1;\ny = ;");
        assertTrue(dsl.hadError);
        assertFalse(dsl.hadRuntimeError);
        assertEquals("[line 2:5] Error at ';': Expected expression.\n", errors());
    }

    @Test
    public void testLexErrorReport() {
        assertNull(dsl.parse("x = 3.;"));
        assertTrue(dsl.hadError);
        assertEquals("[line 1:6] Unexpected character '.'.\n", errors());
    }

    @Test
    public void testRuntimeErrorReport() {
        dsl.runSrc("def f(a) {\n" +
                   "  return a / 0;\n" +
                   "}\n" +
                   "f(1);");
        assertFalse(dsl.hadError);
        assertTrue(dsl.hadRuntimeError);
        String expected = "==============\n" +
                          "RuntimeError (DIVISION_BY_ZERO): division by 0\n" +
                          "[line 2:12]\n" +
                          "Stacktrace:\n" +
                          "<f> at line 4.\n" +
                          "<main>\n" +
                          "==============\n";
        assertEquals(expected, errors());
    }

    @Test
    public void testStackOverflowIsReported() {
        dsl.runSrc("def down(n) { return down(n + 1); }\n" +
                   "down(0);");
        assertTrue(dsl.hadRuntimeError);
        assertTrue(errors().contains("StackOverflowError"));

        // the session stays usable
        dsl.runSrc("print(2);");
        assertEquals("2\n", output());
    }

    @Test
    public void testExecuteSource() throws IOException {
        int status = Dsl.execute(new String[] {"-s", "x = 2;\nprint(x * x);"}, out, err);
        assertEquals(0, status);
        assertEquals("4\n", output());
    }

    @Test
    public void testExecuteFile() throws IOException {
        File script = tmp.newFile("script.dsl");
        Files.write(script.toPath(), "for (i = 0; i < 2; i = i + 1) { print(i); }".getBytes(StandardCharsets.UTF_8));
        int status = Dsl.execute(new String[] {"-f", script.getPath()}, out, err);
        assertEquals(0, status);
        assertEquals("0\n1\n", output());
    }

    @Test
    public void testExecutePrintAst() throws IOException {
        int status = Dsl.execute(new String[] {"-p", "-s", "x = 1 + 2;"}, out, err);
        assertEquals(0, status);
        assertEquals("(assign x (+ 1 2))\n", output());
    }

    @Test
    public void testExitCodes() throws IOException {
        assertEquals(Dsl.EXIT_PARSE_ERROR, Dsl.execute(new String[] {"-s", "x = ;"}, out, err));
        assertEquals(Dsl.EXIT_PARSE_ERROR, Dsl.execute(new String[] {"-p", "-s", "x = "}, out, err));
        assertEquals(Dsl.EXIT_RUNTIME_ERROR, Dsl.execute(new String[] {"-s", "print(1 / 0);"}, out, err));
        assertEquals("", output());
    }

    @Test
    public void testUsageErrors() throws IOException {
        assertEquals(Dsl.EXIT_USAGE, Dsl.execute(new String[] {"-x"}, out, err));
        assertEquals(Dsl.EXIT_USAGE, Dsl.execute(new String[] {"-p"}, out, err));
        assertEquals(Dsl.EXIT_USAGE, Dsl.execute(new String[] {"-s"}, out, err));
        assertTrue(errors().startsWith("Usage: dsl"));
    }

    private String output() {
        try {
            return outBytes.toString("UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new AssertionError(e);
        }
    }

    private String errors() {
        try {
            return errBytes.toString("UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new AssertionError(e);
        }
    }
}
