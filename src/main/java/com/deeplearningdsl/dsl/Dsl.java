package com.deeplearningdsl.dsl;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import jline.console.ConsoleReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Dsl {
    private static final Logger LOGGER = LoggerFactory.getLogger(Dsl.class);

    static final int EXIT_USAGE = 64;
    static final int EXIT_PARSE_ERROR = 65;
    static final int EXIT_RUNTIME_ERROR = 70;

    private static final String USAGE = "Usage: dsl [-p] [-f FILENAME | -s SOURCE]";

    private final Interpreter interpreter;
    private final PrintStream err;
    boolean hadError = false;
    boolean hadRuntimeError = false;

    Dsl(BuiltinDispatcher dispatcher, PrintStream err) {
        this.interpreter = new Interpreter(dispatcher);
        this.err = err;
    }

    public static void main(String[] args) throws IOException {
        int status = execute(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    // returns the process exit status
    static int execute(String[] args, PrintStream out, PrintStream err) throws IOException {
        String fname = null;
        String src = null;
        boolean printAst = false;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i += 2;
            } else if (args[i].equals("-s") && i + 1 < args.length) {
                src = args[i+1];
                i += 2;
            } else if (args[i].equals("-p")) {
                printAst = true;
                i += 1;
            } else {
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        if (fname != null) {
            LOGGER.info("Loading script {}", fname);
            byte[] bytes = Files.readAllBytes(Paths.get(fname));
            src = new String(bytes, StandardCharsets.UTF_8);
        }

        Dsl dsl = new Dsl(NativeDispatcher.withPrint(out), err);
        if (src == null) {
            if (printAst) {
                err.println(USAGE);
                return EXIT_USAGE;
            }
            dsl.runPrompt();
            return 0;
        }
        if (printAst) {
            String ast = AstPrinter.print(src);
            if (AstPrinter.PARSE_ERROR.equals(ast)) {
                dsl.parse(src); // reports the error
                return EXIT_PARSE_ERROR;
            }
            out.print(ast);
            return 0;
        }
        dsl.runSrc(src);
        if (dsl.hadError) return EXIT_PARSE_ERROR;
        if (dsl.hadRuntimeError) return EXIT_RUNTIME_ERROR;
        return 0;
    }

    void runSrc(String src) {
        Program program = parse(src);
        if (program == null) {
            return;
        }
        run(program);
    }

    // null after reporting a lex or parse error
    Program parse(String src) {
        try {
            return Parser.newFromSource(src).parse();
        } catch (Scanner.LexError | Parser.ParseError error) {
            reportError(error.getMessage());
            return null;
        }
    }

    private void run(Program program) {
        long start = System.nanoTime();
        try {
            interpreter.interpret(program);
        } catch (RuntimeError error) {
            runtimeError(error);
        } catch (StackOverflowError error) {
            // no depth limit in the interpreter, the JVM stack is the limit
            LOGGER.debug("Stack overflow while running program", error);
            err.println("==============");
            err.println("StackOverflowError: call depth exceeded the JVM stack");
            err.println("==============");
            hadRuntimeError = true;
        }
        LOGGER.debug("Ran {} statement(s) in {} us", program.statements.size(),
                (System.nanoTime() - start) / 1000);
    }

    private void runPrompt() throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt("> ");

        Scanner scanner = new Scanner("");
        Set<String> userFunctions = new HashSet<>();
        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.equals("exit") || line.equals("quit")) {
                break;
            }
            if (line.equals("cls")) {
                reader.clearScreen();
                out.println(""); // avoid double-prompt at next input
                out.flush();
                continue;
            }
            scanner.appendSrc(line);
            List<Token> tokens;
            try {
                tokens = scanner.scanUntilEnd();
            } catch (Scanner.LexError error) {
                reportError(error.getMessage());
                scanner = new Scanner("");
                reader.setPrompt("> ");
                continue;
            }
            if (scanner.inBlock > 0) {
                String prompt = "> ";
                for (int i = 0; i < scanner.inBlock; i++) {
                    prompt = prompt + "  ";
                }
                reader.setPrompt(prompt);
                continue;
            }
            scanner.addEOF();
            Parser parser = new Parser(tokens);
            parser.setUserFunctions(userFunctions);
            try {
                Program program = parser.parse();
                userFunctions.addAll(parser.getUserFunctions());
                run(program);
            } catch (Parser.ParseError error) {
                reportError(error.getMessage());
            }
            scanner = new Scanner("");
            reader.setPrompt("> ");
            hadError = false;
            hadRuntimeError = false;
        }
    }

    private void reportError(String message) {
        err.println(message);
        hadError = true;
    }

    private void runtimeError(RuntimeError error) {
        err.println("==============");
        err.println("RuntimeError (" + error.kind + "): " + error.getMessage());
        if (error.token != null) {
            err.println(error.where());
        }
        err.println("Stacktrace:");
        for (String line : error.getCallStack()) {
            err.println(line);
        }
        err.println("==============");
        hadRuntimeError = true;
    }
}
