package com.deeplearningdsl.dsl;

import java.util.Collections;
import java.util.List;

public final class Program {
    public final List<Stmt> statements;

    Program(List<Stmt> statements) {
        this.statements = Collections.unmodifiableList(statements);
    }

    public static Program parse(String source) {
        return Parser.newFromSource(source).parse();
    }
}
