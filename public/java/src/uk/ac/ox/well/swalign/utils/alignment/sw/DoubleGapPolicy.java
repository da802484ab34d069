package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Whether a gap in one sequence may directly follow a gap in the other one.
 */
public enum DoubleGapPolicy {
    /**
     * The opposite gap is entered as a freshly opened gap.
     */
    ALLOW_ORTHOGONAL_EXTENSION,

    /**
     * A match or mismatch has to separate gaps of opposite direction.
     */
    DISALLOW_ORTHOGONAL_EXTENSION
}
