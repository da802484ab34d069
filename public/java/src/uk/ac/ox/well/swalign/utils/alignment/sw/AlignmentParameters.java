package uk.ac.ox.well.swalign.utils.alignment.sw;

import uk.ac.ox.well.swalign.utils.exceptions.InvalidPenaltyException;

/**
 * Holds the affine gap penalties and the traceback behaviour of a local alignment.
 */
public final class AlignmentParameters {
    public static final int DEFAULT_OPEN_PENALTY = -2;
    public static final int DEFAULT_EXTEND_PENALTY = -1;

    private final int openPenalty;
    private final int extendPenalty;
    private final DoubleGapPolicy doubleGapPolicy;
    private final TracebackStart tracebackStart;
    private final TracebackStop tracebackStop;

    public AlignmentParameters() {
        this(DEFAULT_OPEN_PENALTY, DEFAULT_EXTEND_PENALTY, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStart.MATCH_STATE, TracebackStop.PREVIOUS_STATE);
    }

    public AlignmentParameters(int openPenalty, int extendPenalty, DoubleGapPolicy doubleGapPolicy) {
        this(openPenalty, extendPenalty, doubleGapPolicy, TracebackStart.MATCH_STATE, TracebackStop.PREVIOUS_STATE);
    }

    public AlignmentParameters(int openPenalty, int extendPenalty, DoubleGapPolicy doubleGapPolicy, TracebackStart tracebackStart) {
        this(openPenalty, extendPenalty, doubleGapPolicy, tracebackStart, TracebackStop.PREVIOUS_STATE);
    }

    /**
     * Create a new set of alignment parameters
     *
     * @param openPenalty      the cost of opening a gap, must be <= 0
     * @param extendPenalty    the cost of each further position of an open gap, must be <= 0
     * @param doubleGapPolicy  whether a gap may directly follow a gap in the other sequence
     * @param tracebackStart   the state the traceback is entered in
     * @param tracebackStop    which matrix decides that the traceback has reached the zero floor
     */
    public AlignmentParameters(int openPenalty, int extendPenalty, DoubleGapPolicy doubleGapPolicy, TracebackStart tracebackStart, TracebackStop tracebackStop) {
        if (openPenalty > 0) throw new InvalidPenaltyException("Gap open penalty must be <= 0 but got " + openPenalty);
        if (extendPenalty > 0) throw new InvalidPenaltyException("Gap extend penalty must be <= 0 but got " + extendPenalty);
        if (doubleGapPolicy == null) throw new IllegalArgumentException("doubleGapPolicy cannot be null");
        if (tracebackStart == null) throw new IllegalArgumentException("tracebackStart cannot be null");
        if (tracebackStop == null) throw new IllegalArgumentException("tracebackStop cannot be null");

        this.openPenalty = openPenalty;
        this.extendPenalty = extendPenalty;
        this.doubleGapPolicy = doubleGapPolicy;
        this.tracebackStart = tracebackStart;
        this.tracebackStop = tracebackStop;
    }

    public int getOpenPenalty() { return openPenalty; }

    public int getExtendPenalty() { return extendPenalty; }

    public DoubleGapPolicy getDoubleGapPolicy() { return doubleGapPolicy; }

    public TracebackStart getTracebackStart() { return tracebackStart; }

    public TracebackStop getTracebackStop() { return tracebackStop; }

    @Override
    public String toString() {
        return "open=" + openPenalty + " extend=" + extendPenalty + " policy=" + doubleGapPolicy + " start=" + tracebackStart + " stop=" + tracebackStop;
    }
}
