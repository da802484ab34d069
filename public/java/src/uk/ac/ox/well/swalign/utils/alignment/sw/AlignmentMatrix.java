package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Dynamic-programming state of an affine-gap Smith-Waterman alignment.
 *
 * Seven matrices of shape (len(seq2) + 1) x (len(seq1) + 1) are kept: four score matrices and three traceback
 * matrices.  Rows index seq2, columns index seq1, and row 0 and column 0 stay at zero.
 *
 * <ul>
 *     <li>M  - best score of an alignment ending in a symbol-symbol pair at (i, j)</li>
 *     <li>Ix - best score of an alignment ending in a gap that consumes a symbol of seq2 (vertical move)</li>
 *     <li>Iy - best score of an alignment ending in a gap that consumes a symbol of seq1 (horizontal move)</li>
 *     <li>F  - max(M, Ix, Iy) at (i, j)</li>
 * </ul>
 *
 * TM, TIx and TIy record, for the corresponding score matrix, which predecessor produced the value
 * (see {@link TracebackState}).  HALT means the zero floor won.
 */
public class AlignmentMatrix {
    // Stands in for an excluded recurrence term.  Never added to, so it cannot overflow.
    private static final int EXCLUDED = Integer.MIN_VALUE;

    private final ScoringMatrix scoring;
    private final String seq1;
    private final String seq2;
    private final int o;
    private final int e;
    private final DoubleGapPolicy policy;

    private final int rows;
    private final int cols;

    private final int[][] m;
    private final int[][] ix;
    private final int[][] iy;
    private final int[][] f;

    private final byte[][] tm;
    private final byte[][] tix;
    private final byte[][] tiy;

    private boolean filled = false;

    public AlignmentMatrix(ScoringMatrix scoring, String seq1, String seq2, int openPenalty, int extendPenalty, DoubleGapPolicy policy) {
        this.scoring = scoring;
        this.seq1 = seq1;
        this.seq2 = seq2;
        this.o = openPenalty;
        this.e = extendPenalty;
        this.policy = policy;

        this.rows = seq2.length() + 1;
        this.cols = seq1.length() + 1;

        this.m = new int[rows][cols];
        this.ix = new int[rows][cols];
        this.iy = new int[rows][cols];
        this.f = new int[rows][cols];

        this.tm = new byte[rows][cols];
        this.tix = new byte[rows][cols];
        this.tiy = new byte[rows][cols];
    }

    /**
     * Fill all seven matrices.  Cells are visited row by row, left to right, since every recurrence reads the
     * cells above, to the left and diagonally up-left.
     */
    public void fillMatrix() {
        boolean allowOrthogonal = policy == DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION;

        for (int i = 1; i < rows; i++) {
            for (int j = 1; j < cols; j++) {
                int s = scoring.getScore(seq1.charAt(j - 1), seq2.charAt(i - 1));

                // match or mismatch
                int a = m[i-1][j-1] + s;
                int b = ix[i-1][j-1] + s;
                int c = iy[i-1][j-1] + s;
                m[i][j] = best(a, b, c);
                tm[i][j] = origin(m[i][j], a, b, c);

                // gap consuming seq2[i]
                a = m[i-1][j] + o;
                b = ix[i-1][j] + e;
                c = allowOrthogonal ? iy[i-1][j] + o : EXCLUDED;
                ix[i][j] = best(a, b, c);
                tix[i][j] = origin(ix[i][j], a, b, c);

                // gap consuming seq1[j]
                a = m[i][j-1] + o;
                b = allowOrthogonal ? ix[i][j-1] + o : EXCLUDED;
                c = iy[i][j-1] + e;
                iy[i][j] = best(a, b, c);
                tiy[i][j] = origin(iy[i][j], a, b, c);

                f[i][j] = Math.max(m[i][j], Math.max(ix[i][j], iy[i][j]));
            }
        }

        filled = true;
    }

    private static int best(int a, int b, int c) {
        return Math.max(Math.max(a, b), Math.max(c, 0));
    }

    // First term in (a, b, c, 0) order that reaches the maximum wins.
    private static byte origin(int max, int a, int b, int c) {
        if (a == max) { return TracebackState.MATCH.code(); }
        if (b == max) { return TracebackState.GAP_X.code(); }
        if (c == max) { return TracebackState.GAP_Y.code(); }
        return TracebackState.HALT.code();
    }

    /**
     * @return the best local alignment score, i.e. the maximum over F
     */
    public int getMax() {
        int max = 0;
        for (int[] row : f) {
            for (int v : row) {
                if (v > max) {
                    max = v;
                }
            }
        }
        return max;
    }

    /**
     * Returns the position of the best score.  The row is the first row whose maximum equals the largest row
     * maximum; the column is the leftmost position in that row reaching the row maximum.
     *
     * @return the coordinate of the best score
     */
    public MatrixCoordinate getMaxCoord() {
        int bestRow = 0;
        int bestRowMax = rowMax(0);
        for (int i = 1; i < rows; i++) {
            int rm = rowMax(i);
            if (rm > bestRowMax) {
                bestRowMax = rm;
                bestRow = i;
            }
        }

        int bestCol = 0;
        for (int j = 1; j < cols; j++) {
            if (f[bestRow][j] > f[bestRow][bestCol]) {
                bestCol = j;
            }
        }

        return new MatrixCoordinate(bestRow, bestCol);
    }

    private int rowMax(int i) {
        int max = f[i][0];
        for (int j = 1; j < cols; j++) {
            max = Math.max(max, f[i][j]);
        }
        return max;
    }

    /**
     * @return the score held by the matrix belonging to the given state, or 0 for HALT
     */
    public int getScore(TracebackState state, int i, int j) {
        switch (state) {
            case MATCH: return m[i][j];
            case GAP_X: return ix[i][j];
            case GAP_Y: return iy[i][j];
            default:    return 0;
        }
    }

    /**
     * @return the origin recorded for the cell of the matrix belonging to the given state
     */
    public TracebackState getOrigin(TracebackState state, int i, int j) {
        switch (state) {
            case MATCH: return TracebackState.fromCode(tm[i][j]);
            case GAP_X: return TracebackState.fromCode(tix[i][j]);
            case GAP_Y: return TracebackState.fromCode(tiy[i][j]);
            default:    return TracebackState.HALT;
        }
    }

    public int getM(int i, int j) { return m[i][j]; }

    public int getIx(int i, int j) { return ix[i][j]; }

    public int getIy(int i, int j) { return iy[i][j]; }

    public int getF(int i, int j) { return f[i][j]; }

    /**
     * @return a copy of the final score matrix F
     */
    public int[][] getScoreTable() {
        int[][] copy = new int[rows][];
        for (int i = 0; i < rows; i++) {
            copy[i] = f[i].clone();
        }
        return copy;
    }

    public boolean isFilled() { return filled; }

    public int getNumRows() { return rows; }

    public int getNumColumns() { return cols; }

    public String getSeq1() { return seq1; }

    public String getSeq2() { return seq2; }

    /**
     * @return the seq1 symbol at a 1-based column
     */
    public char getSeq1Symbol(int j) { return seq1.charAt(j - 1); }

    /**
     * @return the seq2 symbol at a 1-based row
     */
    public char getSeq2Symbol(int i) { return seq2.charAt(i - 1); }
}
