package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Accumulates the three display lines of an alignment.  The aligned core and the front context are appended
 * backwards and put in order with {@link #reverse()}; the back context is appended afterwards.
 */
class AlignmentBuilder {
    private final StringBuilder top = new StringBuilder();
    private final StringBuilder match = new StringBuilder();
    private final StringBuilder bottom = new StringBuilder();

    private int coreLength = 0;
    private int coreStart = -1;

    void append(char topSymbol, char matchSymbol, char bottomSymbol) {
        top.append(topSymbol);
        match.append(matchSymbol);
        bottom.append(bottomSymbol);
    }

    /**
     * Mark everything appended so far as the aligned core.
     */
    void endCore() {
        coreLength = length();
    }

    void reverse() {
        top.reverse();
        match.reverse();
        bottom.reverse();

        coreStart = length() - coreLength;
    }

    int length() {
        return top.length();
    }

    int getCoreStart() { return coreStart; }

    int getCoreEnd() { return coreStart + coreLength; }

    String getTop() { return top.toString(); }

    String getMatch() { return match.toString(); }

    String getBottom() { return bottom.toString(); }
}
