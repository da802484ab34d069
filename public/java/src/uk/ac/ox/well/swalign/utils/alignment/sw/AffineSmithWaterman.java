package uk.ac.ox.well.swalign.utils.alignment.sw;

import org.slf4j.Logger;
import uk.ac.ox.well.swalign.utils.exceptions.ScoringConfigurationException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Smith-Waterman local alignment with affine gap penalties.
 *
 * Smith, Temple F., and Michael S. Waterman.
 * "Identification of common molecular subsequences."
 * Journal of molecular biology 147.1 (1981): 195-197.
 *
 * usage ===
 *     AlignmentParameters params = new AlignmentParameters(-2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION,
 *                                                          TracebackStart.MATCH_STATE, TracebackStop.NEXT_STATE);
 *     AffineSmithWaterman sw = new AffineSmithWaterman(new IdentityScoring(3, -1), params);
 *     AlignmentResult res = sw.align("ACGT", "AGT");
 *     System.out.println(res.getTopLine());
 *     System.out.println(res.getMatchLine());
 *     System.out.println(res.getBottomLine());
 *
 * output ===
 * (ACGT)
 *  | ||
 * (A-GT)
 */
public class AffineSmithWaterman {
    private final ScoringMatrix scoring;
    private final AlignmentParameters parameters;

    private Logger log;

    public AffineSmithWaterman(ScoringMatrix scoring) {
        this(scoring, new AlignmentParameters());
    }

    public AffineSmithWaterman(ScoringMatrix scoring, AlignmentParameters parameters) {
        if (scoring == null) throw new IllegalArgumentException("scoring cannot be null");
        if (parameters == null) throw new IllegalArgumentException("parameters cannot be null");

        this.scoring = scoring;
        this.parameters = parameters;
    }

    public AffineSmithWaterman(ScoringMatrix scoring, AlignmentParameters parameters, Logger log) {
        this(scoring, parameters);
        this.log = log;
    }

    /**
     * Align two sequences in a single call.
     *
     * @param scoring        the similarity lookup
     * @param seq1           the column sequence
     * @param seq2           the row sequence
     * @param openPenalty    the gap open penalty (<= 0)
     * @param extendPenalty  the gap extension penalty (<= 0)
     * @param policy         whether gaps of opposite direction may be adjacent
     * @return  the best local alignment
     */
    public static AlignmentResult align(ScoringMatrix scoring, String seq1, String seq2, int openPenalty, int extendPenalty, DoubleGapPolicy policy) {
        return new AffineSmithWaterman(scoring, new AlignmentParameters(openPenalty, extendPenalty, policy)).align(seq1, seq2);
    }

    /**
     * Fill the alignment matrices for two sequences without reconstructing the alignment.
     *
     * @param seq1  the column sequence
     * @param seq2  the row sequence
     * @return  the filled matrices
     */
    public AlignmentMatrix fill(String seq1, String seq2) {
        if (seq1 == null || seq2 == null) throw new IllegalArgumentException("sequences cannot be null");

        checkScoresDefined(seq1, seq2);

        AlignmentMatrix matrix = new AlignmentMatrix(scoring, seq1, seq2, parameters.getOpenPenalty(), parameters.getExtendPenalty(), parameters.getDoubleGapPolicy());
        matrix.fillMatrix();

        if (log != null) { log.debug("Filled {}x{} alignment matrices ({})", matrix.getNumRows(), matrix.getNumColumns(), parameters); }

        return matrix;
    }

    /**
     * Find the best local alignment of two sequences.
     *
     * @param seq1  the column sequence
     * @param seq2  the row sequence
     * @return  the best local alignment
     */
    public AlignmentResult align(String seq1, String seq2) {
        AlignmentMatrix matrix = fill(seq1, seq2);

        AlignmentResult result = new TracebackReconstructor(matrix).reconstruct(parameters.getTracebackStart(), parameters.getTracebackStop());

        if (log != null) { log.debug("Best score {} at {}, traceback halted at {}", result.getBestScore(), result.getBestCoordinate(), result.getAlignmentStart()); }

        return result;
    }

    private void checkScoresDefined(String seq1, String seq2) {
        Set<Character> symbols1 = distinctSymbols(seq1);
        Set<Character> symbols2 = distinctSymbols(seq2);

        for (Character a : symbols1) {
            for (Character b : symbols2) {
                if (!scoring.hasScore(a, b)) {
                    throw new ScoringConfigurationException("No similarity score defined for the symbol pair '" + a + "', '" + b + "'");
                }
            }
        }
    }

    private static Set<Character> distinctSymbols(String seq) {
        Set<Character> symbols = new LinkedHashSet<>();
        for (int i = 0; i < seq.length(); i++) {
            symbols.add(seq.charAt(i));
        }
        return symbols;
    }

    public ScoringMatrix getScoring() { return scoring; }

    public AlignmentParameters getParameters() { return parameters; }
}
