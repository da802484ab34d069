package uk.ac.ox.well.swalign.utils.io.sequence;

import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;
import uk.ac.ox.well.swalign.utils.io.utils.LineReader;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the two sequences to align from a file.  Plain text files hold one sequence per line (blank lines are
 * skipped); files whose first non-blank line starts with '>' are read as FASTA.
 */
public class SequencePairReader {
    private final String seq1;
    private final String seq2;
    private final String name1;
    private final String name2;

    public SequencePairReader(File sequenceFile) {
        if (!sequenceFile.exists()) {
            throw new SWAlignException("Could not find sequence file '" + sequenceFile.getAbsolutePath() + "'");
        }

        List<String> names = new ArrayList<>();
        List<String> seqs = new ArrayList<>();

        if (isFasta(sequenceFile)) {
            loadFasta(sequenceFile, names, seqs);
        } else {
            loadPlain(sequenceFile, names, seqs);
        }

        if (seqs.size() < 2) {
            throw new SWAlignException("Expected two sequences in '" + sequenceFile.getAbsolutePath() + "' but found " + seqs.size());
        }

        this.name1 = names.get(0);
        this.name2 = names.get(1);
        this.seq1 = seqs.get(0);
        this.seq2 = seqs.get(1);
    }

    private static boolean isFasta(File sequenceFile) {
        LineReader lr = new LineReader(sequenceFile);

        try {
            while (lr.hasNext()) {
                String line = lr.getNextRecord().trim();
                if (!line.isEmpty()) {
                    return line.startsWith(">");
                }
            }

            return false;
        } finally {
            try {
                lr.close();
            } catch (IOException e) {
                throw new SWAlignException("Unable to close '" + sequenceFile.getAbsolutePath() + "'", e);
            }
        }
    }

    private static void loadFasta(File sequenceFile, List<String> names, List<String> seqs) {
        LineReader lr = new LineReader(sequenceFile);

        StringBuilder current = null;
        while (lr.hasNext()) {
            String line = lr.getNextRecord().trim();

            if (line.startsWith(">")) {
                if (current != null) {
                    seqs.add(current.toString());
                }

                String[] header = line.substring(1).trim().split("\\s+");
                names.add(header[0]);
                current = new StringBuilder();
            } else if (current != null) {
                current.append(line);
            }
        }

        if (current != null) {
            seqs.add(current.toString());
        }
    }

    private static void loadPlain(File sequenceFile, List<String> names, List<String> seqs) {
        LineReader lr = new LineReader(sequenceFile);

        while (lr.hasNext()) {
            String line = lr.getNextRecord().trim();

            if (!line.isEmpty() && seqs.size() < 2) {
                names.add("sequence" + (seqs.size() + 1));
                seqs.add(line);
            }
        }
    }

    public String getSeq1() { return seq1; }

    public String getSeq2() { return seq2; }

    public String getName1() { return name1; }

    public String getName2() { return name2; }
}
