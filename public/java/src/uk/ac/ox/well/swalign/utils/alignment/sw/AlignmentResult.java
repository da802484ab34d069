package uk.ac.ox.well.swalign.utils.alignment.sw;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the result of a local alignment: the best score and where it was found, the three display lines, and the
 * final score matrix.
 *
 * The display lines have the layout {@code front context ( core ) back context}; the core spans
 * [getCoreStart(), getCoreEnd()) in each line.
 */
public class AlignmentResult {
    private final int bestScore;
    private final MatrixCoordinate bestCoordinate;
    private final MatrixCoordinate alignmentStart;
    private final String topLine;
    private final String matchLine;
    private final String bottomLine;
    private final int coreStart;
    private final int coreEnd;
    private final int seq2Length;
    private final int[][] scoreTable;

    AlignmentResult(int bestScore, MatrixCoordinate bestCoordinate, MatrixCoordinate alignmentStart,
                    String topLine, String matchLine, String bottomLine,
                    int coreStart, int coreEnd, int seq2Length, int[][] scoreTable) {
        this.bestScore = bestScore;
        this.bestCoordinate = bestCoordinate;
        this.alignmentStart = alignmentStart;
        this.topLine = topLine;
        this.matchLine = matchLine;
        this.bottomLine = bottomLine;
        this.coreStart = coreStart;
        this.coreEnd = coreEnd;
        this.seq2Length = seq2Length;
        this.scoreTable = scoreTable;
    }

    public int getBestScore() { return bestScore; }

    public MatrixCoordinate getBestCoordinate() { return bestCoordinate; }

    /**
     * @return the cell the traceback halted at; its row and column count the seq2 and seq1 symbols that precede
     * the aligned core
     */
    public MatrixCoordinate getAlignmentStart() { return alignmentStart; }

    public String getTopLine() { return topLine; }

    public String getMatchLine() { return matchLine; }

    public String getBottomLine() { return bottomLine; }

    public int getCoreStart() { return coreStart; }

    public int getCoreEnd() { return coreEnd; }

    public String getAlignedTop() { return topLine.substring(coreStart, coreEnd); }

    public String getAlignedMatch() { return matchLine.substring(coreStart, coreEnd); }

    public String getAlignedBottom() { return bottomLine.substring(coreStart, coreEnd); }

    public boolean isEmpty() { return coreStart == coreEnd; }

    /**
     * @return a copy of the final score matrix F
     */
    public int[][] getScoreTable() {
        int[][] copy = new int[scoreTable.length][];
        for (int i = 0; i < scoreTable.length; i++) {
            copy[i] = scoreTable[i].clone();
        }
        return copy;
    }

    /**
     * Describe the aligned core as a CIGAR of seq2 against seq1.  Unaligned seq2 symbols before and after the
     * core are soft-clipped.
     *
     * @return the CIGAR, empty when nothing aligned
     */
    public Cigar getCigar() {
        List<CigarElement> cigarElements = new ArrayList<>();

        if (isEmpty()) {
            return new Cigar(cigarElements);
        }

        String top = getAlignedTop();
        String bottom = getAlignedBottom();

        int initialSoftClipLength = alignmentStart.getRow();
        if (initialSoftClipLength > 0) {
            cigarElements.add(new CigarElement(initialSoftClipLength, CigarOperator.SOFT_CLIP));
        }

        int currentElementLength = 0;
        CigarOperator currentElementOperator = null;

        for (int i = 0; i < top.length(); i++) {
            CigarOperator nextElementOperator;

            if (top.charAt(i) == TracebackReconstructor.GAP) {
                nextElementOperator = CigarOperator.INSERTION;
            } else if (bottom.charAt(i) == TracebackReconstructor.GAP) {
                nextElementOperator = CigarOperator.DELETION;
            } else {
                nextElementOperator = CigarOperator.MATCH_OR_MISMATCH;
            }

            if (currentElementOperator == null) {
                currentElementOperator = nextElementOperator;
                currentElementLength = 0;
            } else if (currentElementOperator != nextElementOperator) {
                cigarElements.add(new CigarElement(currentElementLength, currentElementOperator));

                currentElementOperator = nextElementOperator;
                currentElementLength = 0;
            }

            currentElementLength++;
        }

        cigarElements.add(new CigarElement(currentElementLength, currentElementOperator));

        int remainingSoftClipLength = seq2Length - bestCoordinate.getRow();
        if (remainingSoftClipLength > 0) {
            cigarElements.add(new CigarElement(remainingSoftClipLength, CigarOperator.SOFT_CLIP));
        }

        return new Cigar(cigarElements);
    }

    @Override
    public String toString() {
        return "score=" + bestScore + " at " + bestCoordinate + "\n" + topLine + "\n" + matchLine + "\n" + bottomLine;
    }
}
