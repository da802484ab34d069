package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Which matrix is read, after each traceback step, to decide whether the walk has reached the zero floor.
 */
public enum TracebackStop {
    /**
     * Read the matrix of the state the step was taken from, at the new cell.  A walk leaving MATCH stops as soon as
     * M is zero at the new cell, even when the next state is a gap.
     */
    PREVIOUS_STATE,

    /**
     * Read the matrix of the state the step leads to, at the new cell.  The reported core is then the full path
     * back to the zero floor and its steps sum to the best score.
     */
    NEXT_STATE
}
