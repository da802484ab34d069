package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Origin of a score-matrix cell.  Each state doubles as the matrix that has to be read next during traceback.
 */
public enum TracebackState {
    MATCH,
    GAP_X,
    GAP_Y,
    HALT;

    private static final TracebackState[] BY_CODE = values();

    public byte code() {
        return (byte) ordinal();
    }

    public static TracebackState fromCode(int code) {
        return BY_CODE[code];
    }
}
