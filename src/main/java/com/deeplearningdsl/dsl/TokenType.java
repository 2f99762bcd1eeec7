package com.deeplearningdsl.dsl;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET, COMMA, SEMICOLON,
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,

    // One or two character tokens.
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals.
    IDENTIFIER, STRING, NUMBER, FLOAT,

    // Statement keywords.
    IF, ELSE, FOR, WHILE, DEF, RETURN,

    // ML keywords.
    LINEAR_REGRESSION, MLP_CLASSIFIER, NEURAL_NETWORK, PREDICT, TRAIN,
    KMEANS, FIT_PREDICT, GET_CENTROIDS, AUTOENCODER, ENCODE, DECODE,
    RECONSTRUCT, RECONSTRUCTION_ERROR,

    // Matrix keywords.
    TRANSPOSE, INVERSE, MATMULT, MATADD, MATSUB,

    // IO keywords.
    READ_FILE, WRITE_FILE, PRINT,

    // Plot keywords.
    PLOT, SCATTER, HISTOGRAM,

    // Trig keywords.
    SIN, COS, TAN, SQRT,

    EOF
}
