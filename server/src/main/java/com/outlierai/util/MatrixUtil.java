package com.outlierai.util;

import com.outlierai.server.ai.InvalidInputException;

public class MatrixUtil {

    /**
     * Checks that x is a non-empty, rectangular matrix of finite values.
     *
     * @return the number of columns
     */
    public static int requireMatrix(double[][] x, String name) {
        if (x == null || x.length == 0) {
            throw new InvalidInputException(name + " must contain at least one row");
        }
        if (x[0] == null || x[0].length == 0) {
            throw new InvalidInputException(name + " must contain at least one column");
        }
        int cols = x[0].length;
        for (int i = 0; i < x.length; i++) {
            if (x[i] == null || x[i].length != cols) {
                throw new InvalidInputException(
                        name + " is not rectangular: row " + i + " does not have " + cols + " columns");
            }
            for (int j = 0; j < cols; j++) {
                if (!Double.isFinite(x[i][j])) {
                    throw new InvalidInputException(name + " has a non-finite entry at (" + i + ", " + j + ")");
                }
            }
        }
        return cols;
    }

    public static void requireVector(double[] v, String name) {
        if (v == null || v.length == 0) {
            throw new InvalidInputException(name + " must not be empty");
        }
        for (int i = 0; i < v.length; i++) {
            if (!Double.isFinite(v[i])) {
                throw new InvalidInputException(name + " has a non-finite entry at " + i);
            }
        }
    }

    public static double[] column(double[][] x, int j) {
        double[] col = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            col[i] = x[i][j];
        }
        return col;
    }

    /**
     * Stacks score vectors as the columns of an N x M matrix.
     */
    public static double[][] columnStack(double[][] columns) {
        int m = columns.length;
        int n = columns[0].length;
        double[][] out = new double[n][m];
        for (int j = 0; j < m; j++) {
            if (columns[j].length != n) {
                throw new InvalidInputException("Score column " + j + " has " + columns[j].length
                        + " rows, expected " + n);
            }
            for (int i = 0; i < n; i++) {
                out[i][j] = columns[j][i];
            }
        }
        return out;
    }

    public static double[][] copy(double[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i].clone();
        }
        return out;
    }
}
