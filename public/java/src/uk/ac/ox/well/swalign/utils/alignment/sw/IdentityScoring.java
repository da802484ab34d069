package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Scores identical symbols with a fixed reward and everything else with a fixed penalty.
 */
public class IdentityScoring implements ScoringMatrix {
    private final int match;
    private final int mismatch;

    public IdentityScoring(int match, int mismatch) {
        this.match = match;
        this.mismatch = mismatch;
    }

    @Override
    public boolean hasScore(char a, char b) {
        return true;
    }

    @Override
    public int getScore(char a, char b) {
        return a == b ? match : mismatch;
    }

    public int getMatch() { return match; }

    public int getMismatch() { return mismatch; }
}
