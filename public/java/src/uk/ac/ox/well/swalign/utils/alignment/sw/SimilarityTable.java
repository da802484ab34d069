package uk.ac.ox.well.swalign.utils.alignment.sw;

import uk.ac.ox.well.swalign.utils.exceptions.ScoringConfigurationException;
import uk.ac.ox.well.swalign.utils.io.utils.LineReader;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.*;

/**
 * A square similarity table keyed by symbol on both axes.  The text form is whitespace-delimited: a header line of
 * column symbols, then one line per row symbol with the row label followed by one integer per column.  Lines
 * starting with '#' are comments.
 *
 * A score is looked up as row = seq1 symbol, column = seq2 symbol.
 */
public class SimilarityTable implements ScoringMatrix {
    private final String name;
    private final Map<Character, Integer> rowIndex = new LinkedHashMap<>();
    private final Map<Character, Integer> columnIndex = new LinkedHashMap<>();
    private final int[][] scores;

    private SimilarityTable(String name, List<String> lines) {
        this.name = name;

        List<List<String>> rows = new ArrayList<>();
        List<String> header = null;

        for (String line : lines) {
            if (line.trim().isEmpty() || line.trim().startsWith("#")) {
                continue;
            }

            if (header == null) {
                header = splitWithSpace(line);
            } else {
                rows.add(splitWithSpace(line));
            }
        }

        if (header == null || header.isEmpty()) {
            throw new ScoringConfigurationException("Similarity table '" + name + "' has no header line");
        }

        for (int j = 0; j < header.size(); j++) {
            char c = toSymbol(header.get(j), "column label");
            if (columnIndex.containsKey(c)) {
                throw new ScoringConfigurationException("Similarity table '" + name + "' has duplicate column '" + c + "'");
            }
            columnIndex.put(c, j);
        }

        scores = new int[rows.size()][header.size()];

        for (int i = 0; i < rows.size(); i++) {
            List<String> pt = rows.get(i);

            if (pt.size() != header.size() + 1) {
                throw new ScoringConfigurationException("Similarity table '" + name + "' row " + (i + 1) + " has " + (pt.size() - 1) + " values, expected " + header.size());
            }

            char c = toSymbol(pt.get(0), "row label");
            if (rowIndex.containsKey(c)) {
                throw new ScoringConfigurationException("Similarity table '" + name + "' has duplicate row '" + c + "'");
            }
            rowIndex.put(c, i);

            for (int j = 1; j < pt.size(); j++) {
                try {
                    scores[i][j - 1] = Integer.parseInt(pt.get(j));
                } catch (NumberFormatException e) {
                    throw new ScoringConfigurationException("Similarity table '" + name + "' has non-integer score '" + pt.get(j) + "' at row '" + c + "'", e);
                }
            }
        }

        if (rows.size() != header.size()) {
            throw new ScoringConfigurationException("Similarity table '" + name + "' is not square: " + rows.size() + " rows but " + header.size() + " columns");
        }

        if (!rowIndex.keySet().equals(columnIndex.keySet())) {
            throw new ScoringConfigurationException("Similarity table '" + name + "' labels its rows " + rowIndex.keySet() + " but its columns " + columnIndex.keySet());
        }
    }

    /**
     * Load a similarity table from a whitespace-delimited text file.
     *
     * @param tableFile  the table to read
     * @return  the parsed table
     */
    public static SimilarityTable fromFile(File tableFile) {
        LineReader lr = new LineReader(tableFile);

        List<String> lines = new ArrayList<>();
        while (lr.hasNext()) {
            lines.add(lr.getNextRecord());
        }

        return new SimilarityTable(tableFile.getName(), lines);
    }

    /**
     * Parse a similarity table held in memory.
     */
    public static SimilarityTable fromString(String name, String table) {
        List<String> lines = new ArrayList<>();

        try (LineReader lr = new LineReader(new StringReader(table), name)) {
            while (lr.hasNext()) {
                lines.add(lr.getNextRecord());
            }
        } catch (IOException e) {
            throw new ScoringConfigurationException("Unable to read similarity table '" + name + "'", e);
        }

        return new SimilarityTable(name, lines);
    }

    static SimilarityTable fromLines(String name, String[] lines) {
        return new SimilarityTable(name, Arrays.asList(lines));
    }

    /**
     * Resolve a built-in table by name (BLOSUM62, EDNAFULL), or else load the named file.
     *
     * @param nameOrPath  a built-in table name or a path to a table file
     * @return  the table
     */
    public static SimilarityTable fromName(String nameOrPath) {
        if (nameOrPath.equalsIgnoreCase(BLOSUM62.NAME)) {
            return BLOSUM62.getTable();
        } else if (nameOrPath.equalsIgnoreCase(EDNAFULL.NAME)) {
            return EDNAFULL.getTable();
        }

        File f = new File(nameOrPath);
        if (!f.exists()) {
            throw new ScoringConfigurationException("'" + nameOrPath + "' is neither a built-in similarity table nor an existing file");
        }

        return fromFile(f);
    }

    private char toSymbol(String token, String what) {
        if (token.length() != 1) {
            throw new ScoringConfigurationException("Similarity table '" + name + "' has " + what + " '" + token + "' that is not a single symbol");
        }

        return token.charAt(0);
    }

    private static List<String> splitWithSpace(String str) {
        List<String> ret = new ArrayList<>();
        for (String s : str.trim().split("\\s+")) {
            if (s.length() > 0) {
                ret.add(s);
            }
        }
        return ret;
    }

    @Override
    public boolean hasScore(char a, char b) {
        return rowIndex.containsKey(a) && columnIndex.containsKey(b);
    }

    @Override
    public int getScore(char a, char b) {
        Integer i = rowIndex.get(a);
        Integer j = columnIndex.get(b);

        if (i == null || j == null) {
            throw new ScoringConfigurationException("Similarity table '" + name + "' has no score for the pair '" + a + "', '" + b + "'");
        }

        return scores[i][j];
    }

    public String getName() { return name; }

    public Set<Character> getRowSymbols() { return Collections.unmodifiableSet(rowIndex.keySet()); }

    public Set<Character> getColumnSymbols() { return Collections.unmodifiableSet(columnIndex.keySet()); }

    @Override
    public String toString() {
        return name;
    }
}
