package uk.ac.ox.well.swalign.commands.align;

import uk.ac.ox.well.swalign.commands.Module;
import uk.ac.ox.well.swalign.utils.alignment.sw.*;
import uk.ac.ox.well.swalign.utils.arguments.Argument;
import uk.ac.ox.well.swalign.utils.arguments.Description;
import uk.ac.ox.well.swalign.utils.arguments.Output;
import uk.ac.ox.well.swalign.utils.io.sequence.SequencePairReader;

import java.io.File;
import java.io.PrintStream;

@Description(text="Find the best local alignment of two sequences with affine gap penalties")
public class Align extends Module {
    @Argument(fullName="input", shortName="i", doc="Sequence file (two sequences, one per line, or FASTA)")
    public File INPUT;

    @Argument(fullName="score", shortName="s", doc="Similarity table file, or a built-in table (BLOSUM62, EDNAFULL)")
    public SimilarityTable SCORE;

    @Argument(fullName="opengap", shortName="o", doc="Gap open penalty")
    public Integer OPEN_GAP = AlignmentParameters.DEFAULT_OPEN_PENALTY;

    @Argument(fullName="extgap", shortName="e", doc="Gap extension penalty")
    public Integer EXT_GAP = AlignmentParameters.DEFAULT_EXTEND_PENALTY;

    @Argument(fullName="policy", shortName="p", doc="Whether a gap may directly follow a gap in the other sequence")
    public DoubleGapPolicy POLICY = DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION;

    @Argument(fullName="tracebackStart", shortName="t", doc="State the traceback starts in at the best-scoring cell")
    public TracebackStart TRACEBACK_START = TracebackStart.MATCH_STATE;

    @Argument(fullName="tracebackStop", shortName="x", doc="Matrix read after each traceback step to decide whether the walk has ended")
    public TracebackStop TRACEBACK_STOP = TracebackStop.PREVIOUS_STATE;

    @Argument(fullName="cigar", shortName="c", doc="Also print the CIGAR of the aligned region", required=false)
    public Boolean CIGAR = false;

    @Output
    public PrintStream out;

    @Override
    public void execute() {
        SequencePairReader spr = new SequencePairReader(INPUT);
        String seq1 = spr.getSeq1();
        String seq2 = spr.getSeq2();

        log.info("Aligning {} ({} symbols) and {} ({} symbols) with {}", spr.getName1(), seq1.length(), spr.getName2(), seq2.length(), SCORE);

        AlignmentParameters parameters = new AlignmentParameters(OPEN_GAP, EXT_GAP, POLICY, TRACEBACK_START, TRACEBACK_STOP);
        AffineSmithWaterman sw = new AffineSmithWaterman(SCORE, parameters, log);
        AlignmentResult result = sw.align(seq1, seq2);

        log.info("  best score {} at {}", result.getBestScore(), result.getBestCoordinate());

        writeReport(out, seq1, seq2, result, CIGAR);
        out.flush();
    }

    static void writeReport(PrintStream out, String seq1, String seq2, AlignmentResult result, boolean withCigar) {
        out.println("-----------\n|Sequences|\n-----------");
        out.println("sequence1");
        out.println(seq1);
        out.println("sequence2");
        out.println(seq2);

        out.println("--------------\n|Score Matrix|\n--------------");
        writeScoreTable(out, seq1, seq2, result.getScoreTable());

        out.println("----------------------\n|Best Local Alignment|\n----------------------");
        out.print("Alignment Score:");
        out.println(result.getBestScore());
        out.println("Alignment Results:");
        out.println(result.getTopLine());
        out.println(result.getMatchLine());
        out.println(result.getBottomLine());

        if (withCigar) {
            out.println("CIGAR:" + result.getCigar());
        }
    }

    // seq1 labels the columns and seq2 the rows; the sentinel row and column carry blank labels.
    static void writeScoreTable(PrintStream out, String seq1, String seq2, int[][] f) {
        StringBuilder sb = new StringBuilder("\t\t");
        for (int j = 0; j < seq1.length(); j++) {
            sb.append(seq1.charAt(j)).append('\t');
        }
        out.println(sb);

        for (int i = 0; i < f.length; i++) {
            StringBuilder row = new StringBuilder();
            row.append(i > 0 ? seq2.charAt(i - 1) + "\t" : "\t");

            for (int v : f[i]) {
                row.append(v).append('\t');
            }

            out.println(row);
        }
    }
}
