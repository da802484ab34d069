package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Walks the traceback matrices of a filled {@link AlignmentMatrix} from the best-scoring cell back to the zero
 * floor and lays out the aligned symbols with their unaligned flanks.
 */
public class TracebackReconstructor {
    public static final char GAP = '-';
    public static final char IDENTITY = '|';
    public static final char BLANK = ' ';
    public static final char CORE_OPEN = '(';
    public static final char CORE_CLOSE = ')';

    private final AlignmentMatrix matrix;

    public TracebackReconstructor(AlignmentMatrix matrix) {
        if (!matrix.isFilled()) {
            throw new IllegalStateException("Alignment matrix must be filled before traceback");
        }

        this.matrix = matrix;
    }

    /**
     * Reconstruct the best local alignment.
     *
     * @param start  the state the traceback is entered in
     * @param stop   which matrix decides that the walk has reached the zero floor
     * @return  the score, coordinates and display lines of the alignment
     */
    public AlignmentResult reconstruct(TracebackStart start, TracebackStop stop) {
        MatrixCoordinate best = matrix.getMaxCoord();
        AlignmentBuilder builder = new AlignmentBuilder();

        MatrixCoordinate halt = traceback(builder, best, initialState(start, best), stop);
        builder.endCore();

        completeFront(builder, halt.getRow(), halt.getColumn());
        builder.reverse();

        int coreStart = builder.getCoreStart();
        int coreEnd = builder.getCoreEnd();

        completeBack(builder, best.getRow() + 1, best.getColumn() + 1);

        return new AlignmentResult(matrix.getMax(), best, halt,
                                   builder.getTop(), builder.getMatch(), builder.getBottom(),
                                   coreStart, coreEnd,
                                   matrix.getSeq2().length(), matrix.getScoreTable());
    }

    TracebackState initialState(TracebackStart start, MatrixCoordinate best) {
        if (start == TracebackStart.BEST_STATE) {
            int i = best.getRow();
            int j = best.getColumn();
            int f = matrix.getF(i, j);

            if (matrix.getM(i, j) == f)  { return TracebackState.MATCH; }
            if (matrix.getIx(i, j) == f) { return TracebackState.GAP_X; }
            return TracebackState.GAP_Y;
        }

        return TracebackState.MATCH;
    }

    /**
     * Follow the traceback matrices from a cell until the score drops to zero or a HALT origin is reached.  The
     * core is appended backwards.  After each step the score is read at the new cell from the matrix chosen by
     * {@code stop}.
     *
     * @return the cell the walk stopped at, i.e. the last position before the first aligned symbol
     */
    MatrixCoordinate traceback(AlignmentBuilder builder, MatrixCoordinate from, TracebackState initial, TracebackStop stop) {
        int i = from.getRow();
        int j = from.getColumn();
        TracebackState state = initial;
        int currVal = matrix.getScore(state, i, j);

        while (currVal != 0 && state != TracebackState.HALT) {
            TracebackState next = matrix.getOrigin(state, i, j);

            switch (state) {
                case MATCH: {
                    char a = matrix.getSeq1Symbol(j);
                    char b = matrix.getSeq2Symbol(i);
                    builder.append(a, a == b ? IDENTITY : BLANK, b);
                    i--;
                    j--;
                    break;
                }
                case GAP_X:
                    builder.append(GAP, BLANK, matrix.getSeq2Symbol(i));
                    i--;
                    break;
                case GAP_Y:
                    builder.append(matrix.getSeq1Symbol(j), BLANK, GAP);
                    j--;
                    break;
                default:
                    break;
            }

            TracebackState previous = state;
            state = next;
            currVal = matrix.getScore(stop == TracebackStop.PREVIOUS_STATE ? previous : state, i, j);
        }

        return new MatrixCoordinate(i, j);
    }

    /**
     * Append the symbols preceding the aligned core, walking back from (i, j) to the sequence origins.  The
     * shorter prefix is padded with blanks.
     */
    void completeFront(AlignmentBuilder builder, int i, int j) {
        builder.append(CORE_OPEN, BLANK, CORE_OPEN);

        while (i > 0 || j > 0) {
            char a = j > 0 ? matrix.getSeq1Symbol(j) : BLANK;
            char b = i > 0 ? matrix.getSeq2Symbol(i) : BLANK;
            builder.append(a, BLANK, b);

            i--;
            j--;
        }
    }

    /**
     * Append the symbols following the aligned core, from (i, j) to the sequence ends.  The shorter suffix is
     * padded with blanks.
     */
    void completeBack(AlignmentBuilder builder, int i, int j) {
        builder.append(CORE_CLOSE, BLANK, CORE_CLOSE);

        int rows = matrix.getNumRows();
        int cols = matrix.getNumColumns();

        while (i < rows || j < cols) {
            char a = j < cols ? matrix.getSeq1Symbol(j) : BLANK;
            char b = i < rows ? matrix.getSeq2Symbol(i) : BLANK;
            builder.append(a, BLANK, b);

            i++;
            j++;
        }
    }
}
