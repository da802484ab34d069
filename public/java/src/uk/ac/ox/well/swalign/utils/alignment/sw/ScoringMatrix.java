package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Affinity between two symbols.  The first symbol always comes from the column sequence (seq1), the second from
 * the row sequence (seq2).
 */
public interface ScoringMatrix {
    /**
     * @return true if a score is defined for the pair
     */
    boolean hasScore(char a, char b);

    /**
     * @return the signed affinity of the pair
     * @throws uk.ac.ox.well.swalign.utils.exceptions.ScoringConfigurationException if the pair has no score
     */
    int getScore(char a, char b);
}
