package com.outlierai.server.ai.combination;

import com.outlierai.server.ai.InvalidInputException;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;

/**
 * Seeded partition of score-matrix columns into disjoint groups, computed once and applied to
 * every row.
 */
public final class ColumnGrouping {

    private final int[][] groups;

    private ColumnGrouping(int[][] groups) {
        this.groups = groups;
    }

    /**
     * Shuffles the column indices with a generator seeded by {@code seed} and cuts the shuffled
     * order into {@code nGroups} equal groups.
     *
     * @param remainderToLast when {@code nGroups} does not divide {@code nColumns}, give the
     *                        extra columns to the last group instead of failing
     */
    public static ColumnGrouping partition(int nColumns, int nGroups, long seed, boolean remainderToLast) {
        if (nGroups < 1 || nGroups > nColumns) {
            throw new InvalidInputException("Group count must be in [1, " + nColumns + "], got " + nGroups);
        }
        if (nColumns % nGroups != 0 && !remainderToLast) {
            throw new InvalidInputException(
                    nGroups + " groups do not evenly divide " + nColumns + " score columns");
        }
        int[] order = new int[nColumns];
        for (int j = 0; j < nColumns; j++) {
            order[j] = j;
        }
        MathArrays.shuffle(order, new Well19937c(seed));

        int size = nColumns / nGroups;
        int[][] groups = new int[nGroups][];
        for (int g = 0; g < nGroups; g++) {
            int from = g * size;
            int to = (g == nGroups - 1) ? nColumns : from + size;
            groups[g] = Arrays.copyOfRange(order, from, to);
        }
        return new ColumnGrouping(groups);
    }

    public int size() {
        return groups.length;
    }

    public int[] group(int g) {
        return groups[g].clone();
    }

    int[][] groups() {
        return groups;
    }

    @Override
    public String toString() {
        return "ColumnGrouping" + Arrays.deepToString(groups);
    }
}
