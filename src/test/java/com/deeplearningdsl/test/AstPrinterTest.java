package com.deeplearningdsl.test;

import static org.junit.Assert.assertEquals;
import org.junit.Test;
import com.deeplearningdsl.dsl.AstPrinter;

public class AstPrinterTest {

    @Test
    public void testEmpty() {
        String ast = AstPrinter.print("");
        assertEquals("", ast);
    }

    @Test
    public void testPrecedence() {
        String ast = AstPrinter.print("2 + 3 * 4;");
        assertEquals("(+ 2 (* 3 4))\n", ast);
    }

    @Test
    public void testPowerFoldsLeft() {
        String ast = AstPrinter.print("x = 2 ^ 3 ^ 2;");
        assertEquals("(assign x (^ (^ 2 3) 2))\n", ast);
    }

    @Test
    public void testUnaryMinusBindsToBase() {
        String ast = AstPrinter.print("-2 ^ 2;");
        assertEquals("(^ (- 2) 2)\n", ast);
    }

    @Test
    public void testGroupingAndTrig() {
        String ast = AstPrinter.print("y = sin(x) + (1 - 2.5);");
        assertEquals("(assign y (+ (sin x) (group (- 1 2.5))))\n", ast);
    }

    @Test
    public void testMatrixRows() {
        String ast = AstPrinter.print("m = [[1, 2], [3, 4]];");
        assertEquals("(assign m (list (row 1 2) (row 3 4)))\n", ast);
    }

    @Test
    public void testBareList() {
        String ast = AstPrinter.print("l = [1, \"a\", []];");
        assertEquals("(assign l (list 1 \"a\" (list)))\n", ast);
    }

    @Test
    public void testMatrixOps() {
        String ast = AstPrinter.print("t = transpose(matmult(a, b));");
        assertEquals("(assign t (transpose (matmult a b)))\n", ast);
    }

    @Test
    public void testCallCategories() {
        String code = "model = kmeans(data, 3);\n" +
                      "histogram(read_file(\"x.csv\"));\n" +
                      "z = f(1, 2);";
        String ast = AstPrinter.print(code);
        assertEquals("(assign model (call ml kmeans data 3))\n" +
                     "(call plot histogram (call io read_file \"x.csv\"))\n" +
                     "(assign z (call user f 1 2))\n",
                     ast);
    }

    @Test
    public void testIfElse() {
        String code = "if (x > 1) { y = 1; } else { y = 2; }";
        String ast = AstPrinter.print(code);
        assertEquals("(if (> x 1)\n" +
                     "  (then\n" +
                     "    (assign y 1))\n" +
                     "  (else\n" +
                     "    (assign y 2)))\n",
                     ast);
    }

    @Test
    public void testEmptyWhile() {
        String ast = AstPrinter.print("while (x) {}");
        assertEquals("(while x\n" +
                     "  (body))\n",
                     ast);
    }

    @Test
    public void testFor() {
        String code = "for (i = 0; i < 3; i = i + 1) { print(i); }";
        String ast = AstPrinter.print(code);
        assertEquals("(for (assign i 0) (< i 3) (assign i (+ i 1))\n" +
                     "  (body\n" +
                     "    (call io print i)))\n",
                     ast);
    }

    @Test
    public void testFunction() {
        String code = "def f(a, b) { c = a * b; return c + 1; }";
        String ast = AstPrinter.print(code);
        assertEquals("(def f (a b)\n" +
                     "  (body\n" +
                     "    (assign c (* a b)))\n" +
                     "  (return (+ c 1)))\n",
                     ast);
    }

    @Test
    public void testNestedBlocks() {
        String code = "while (i < 2) { if (i == 0) { print(i); } i = i + 1; }";
        String ast = AstPrinter.print(code);
        assertEquals("(while (< i 2)\n" +
                     "  (body\n" +
                     "    (if (== i 0)\n" +
                     "      (then\n" +
                     "        (call io print i)))\n" +
                     "    (assign i (+ i 1))))\n",
                     ast);
    }

    @Test
    public void testErrorNoSemiColon() {
        String ast = AstPrinter.print("1+1");
        assertEquals("!error!", ast);
    }

    @Test
    public void testLexErrorPrintsError() {
        String ast = AstPrinter.print("x = 3.;");
        assertEquals("!error!", ast);
    }
}
