package com.deeplearningdsl.dsl;

import static com.deeplearningdsl.dsl.RuntimeError.Kind.SHAPE_ERROR;

/**
 * transpose, inverse, matmult, matadd and matsub. Shapes are checked before
 * anything is computed; every failure is a SHAPE_ERROR on {@code tok}.
 */
final class MatrixOps {
    // a pivot within SINGULAR_EPSILON * n * (largest |entry|) of zero counts as zero
    static final double SINGULAR_EPSILON = 1e-12;

    private MatrixOps() {}

    static DslMatrix transpose(DslMatrix m) {
        double[][] out = new double[m.cols()][m.rows()];
        for (int i = 0; i < m.rows(); i++) {
            for (int j = 0; j < m.cols(); j++) {
                out[j][i] = m.get(i, j);
            }
        }
        return new DslMatrix(out);
    }

    static DslMatrix add(Token tok, DslMatrix a, DslMatrix b) {
        checkSameShape(tok, a, b);
        double[][] out = new double[a.rows()][a.cols()];
        for (int i = 0; i < a.rows(); i++) {
            for (int j = 0; j < a.cols(); j++) {
                out[i][j] = a.get(i, j) + b.get(i, j);
            }
        }
        return new DslMatrix(out);
    }

    static DslMatrix subtract(Token tok, DslMatrix a, DslMatrix b) {
        checkSameShape(tok, a, b);
        double[][] out = new double[a.rows()][a.cols()];
        for (int i = 0; i < a.rows(); i++) {
            for (int j = 0; j < a.cols(); j++) {
                out[i][j] = a.get(i, j) - b.get(i, j);
            }
        }
        return new DslMatrix(out);
    }

    static DslMatrix multiply(Token tok, DslMatrix a, DslMatrix b) {
        if (a.cols() != b.rows()) {
            throw new RuntimeError(SHAPE_ERROR, tok,
                    "matmult: cannot multiply " + a.shape() + " by " + b.shape() + ".");
        }
        double[][] out = new double[a.rows()][b.cols()];
        for (int i = 0; i < a.rows(); i++) {
            for (int j = 0; j < b.cols(); j++) {
                double sum = 0.0;
                for (int k = 0; k < a.cols(); k++) {
                    sum += a.get(i, k) * b.get(k, j);
                }
                out[i][j] = sum;
            }
        }
        return new DslMatrix(out);
    }

    // Gauss-Jordan elimination with partial pivoting
    static DslMatrix inverse(Token tok, DslMatrix m) {
        if (!m.isSquare()) {
            throw new RuntimeError(SHAPE_ERROR, tok,
                    "inverse: matrix must be square, is " + m.shape() + ".");
        }
        int n = m.rows();
        double[][] a = m.toArray();
        double[][] inv = new double[n][n];
        double maxAbs = 0.0;
        for (int i = 0; i < n; i++) {
            inv[i][i] = 1.0;
            for (int j = 0; j < n; j++) {
                maxAbs = Math.max(maxAbs, Math.abs(a[i][j]));
            }
        }
        double tolerance = SINGULAR_EPSILON * n * maxAbs;

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) <= tolerance) {
                throw new RuntimeError(SHAPE_ERROR, tok, "inverse: matrix is singular.");
            }
            swapRows(a, col, pivot);
            swapRows(inv, col, pivot);

            double p = a[col][col];
            for (int j = 0; j < n; j++) {
                a[col][j] /= p;
                inv[col][j] /= p;
            }
            for (int row = 0; row < n; row++) {
                if (row == col) continue;
                double factor = a[row][col];
                if (factor == 0.0) continue;
                for (int j = 0; j < n; j++) {
                    a[row][j] -= factor * a[col][j];
                    inv[row][j] -= factor * inv[col][j];
                }
            }
        }
        return new DslMatrix(inv);
    }

    private static void checkSameShape(Token tok, DslMatrix a, DslMatrix b) {
        if (a.rows() != b.rows() || a.cols() != b.cols()) {
            throw new RuntimeError(SHAPE_ERROR, tok,
                    tok.lexeme + ": shapes differ, " + a.shape() + " vs " + b.shape() + ".");
        }
    }

    private static void swapRows(double[][] grid, int i, int j) {
        if (i == j) return;
        double[] tmp = grid[i];
        grid[i] = grid[j];
        grid[j] = tmp;
    }
}
