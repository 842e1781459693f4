package com.ili.analysis.matching;

import java.util.Arrays;

/**
 * Optimal one-to-one assignment on a rectangular cost matrix (Hungarian method with potentials).
 * Runs in O(n^2 m) for an n x m matrix with n &lt;= m; taller matrices are solved transposed.
 */
public final class HungarianAssignment {

    private HungarianAssignment() {
        // Utility class
    }

    /**
     * Solves the minimum-cost assignment.
     *
     * @param cost rectangular matrix, {@code cost[row][col]}
     * @return for each row the assigned column, or -1 when the row is left unassigned
     *         (only possible when there are more rows than columns)
     */
    public static int[] solve(double[][] cost) {
        int rows = cost.length;
        if (rows == 0) {
            return new int[0];
        }
        int cols = cost[0].length;
        if (cols == 0) {
            int[] none = new int[rows];
            Arrays.fill(none, -1);
            return none;
        }
        for (double[] row : cost) {
            if (row.length != cols) {
                throw new IllegalArgumentException("Cost matrix must be rectangular");
            }
        }

        if (rows <= cols) {
            return solveWide(cost, rows, cols);
        }

        double[][] transposed = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                transposed[j][i] = cost[i][j];
            }
        }
        int[] colToRow = solveWide(transposed, cols, rows);
        int[] rowToCol = new int[rows];
        Arrays.fill(rowToCol, -1);
        for (int j = 0; j < cols; j++) {
            if (colToRow[j] >= 0) {
                rowToCol[colToRow[j]] = j;
            }
        }
        return rowToCol;
    }

    /**
     * Total cost of an assignment returned by {@link #solve(double[][])}.
     */
    public static double totalCost(double[][] cost, int[] assignment) {
        double total = 0.0;
        for (int i = 0; i < assignment.length; i++) {
            if (assignment[i] >= 0) {
                total += cost[i][assignment[i]];
            }
        }
        return total;
    }

    // rows <= cols; 1-based potentials, column 0 is the virtual start
    private static int[] solveWide(double[][] a, int n, int m) {
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[m + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[m + 1];
            do {
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (!used[j]) {
                        double cur = a[i0 - 1][j - 1] - u[i0] - v[j];
                        if (cur < minv[j]) {
                            minv[j] = cur;
                            way[j] = j0;
                        }
                        if (minv[j] < delta) {
                            delta = minv[j];
                            j1 = j;
                        }
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);
            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] rowToCol = new int[n];
        Arrays.fill(rowToCol, -1);
        for (int j = 1; j <= m; j++) {
            if (p[j] != 0) {
                rowToCol[p[j] - 1] = j - 1;
            }
        }
        return rowToCol;
    }
}
