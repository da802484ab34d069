package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * State in which the traceback is entered at the best-scoring cell.
 */
public enum TracebackStart {
    /**
     * Always start in MATCH and read M at the best cell, even when Ix or Iy holds the best score.
     */
    MATCH_STATE,

    /**
     * Start in whichever of M, Ix, Iy attains the best score at the best cell (M first, then Ix, then Iy on ties).
     */
    BEST_STATE
}
