package com.deeplearningdsl.dsl;

import java.util.Arrays;

/**
 * Rectangular grid of numbers with at least one row and one column.
 */
public final class DslMatrix extends DslValue {
    private final double[][] cells;

    public DslMatrix(double[][] cells) {
        if (cells.length == 0 || cells[0].length == 0) {
            throw new IllegalArgumentException("matrix must have at least one row and one column");
        }
        int cols = cells[0].length;
        this.cells = new double[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            if (cells[i].length != cols) {
                throw new IllegalArgumentException("matrix rows must all have " + cols + " columns");
            }
            this.cells[i] = new double[cols];
            for (int j = 0; j < cols; j++) {
                // -0.0 as 0.0, as in DslNumber
                this.cells[i][j] = cells[i][j] == 0.0 ? 0.0 : cells[i][j];
            }
        }
    }

    public int rows() {
        return cells.length;
    }

    public int cols() {
        return cells[0].length;
    }

    public double get(int row, int col) {
        return cells[row][col];
    }

    public boolean isSquare() {
        return rows() == cols();
    }

    // "2x3"
    public String shape() {
        return rows() + "x" + cols();
    }

    public double[][] toArray() {
        double[][] copy = new double[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }

    @Override
    public Kind kind() {
        return Kind.MATRIX;
    }

    @Override
    public boolean isTruthy() {
        return true;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DslMatrix)) return false;
        return Arrays.deepEquals(cells, ((DslMatrix)other).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) builder.append(", ");
            builder.append("[");
            for (int j = 0; j < cells[i].length; j++) {
                if (j > 0) builder.append(", ");
                builder.append(DslNumber.format(cells[i][j]));
            }
            builder.append("]");
        }
        return builder.append("]").toString();
    }
}
