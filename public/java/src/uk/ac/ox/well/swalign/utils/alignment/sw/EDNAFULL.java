package uk.ac.ox.well.swalign.utils.alignment.sw;

/**
 * Built-in nucleotide similarity table (ftp://ftp.ncbi.nih.gov/blast/matrices/NUC.4.4).
 */
final class EDNAFULL {
    static final String NAME = "EDNAFULL";

    private static final String[] LINES = {
            "    A   T   G   C   S   W   R   Y   K   M   B   V   H   D   N   *",
            "A   5  -4  -4  -4  -4   1   1  -4  -4   1  -4  -1  -1  -1  -2  -4",
            "T  -4   5  -4  -4  -4   1  -4   1   1  -4  -1  -4  -1  -1  -2  -4",
            "G  -4  -4   5  -4   1  -4   1  -4   1  -4  -1  -1  -4  -1  -2  -4",
            "C  -4  -4  -4   5   1  -4  -4   1  -4   1  -1  -1  -1  -4  -2  -4",
            "S  -4  -4   1   1  -1  -4  -2  -2  -2  -2  -1  -1  -3  -3  -1  -4",
            "W   1   1  -4  -4  -4  -1  -2  -2  -2  -2  -3  -3  -1  -1  -1  -4",
            "R   1  -4   1  -4  -2  -2  -1  -4  -2  -2  -3  -1  -3  -1  -1  -4",
            "Y  -4   1  -4   1  -2  -2  -4  -1  -2  -2  -1  -3  -1  -3  -1  -4",
            "K  -4   1   1  -4  -2  -2  -2  -2  -1  -4  -1  -3  -3  -1  -1  -4",
            "M   1  -4  -4   1  -2  -2  -2  -2  -4  -1  -3  -1  -1  -3  -1  -4",
            "B  -4  -1  -1  -1  -1  -3  -3  -1  -1  -3  -1  -2  -2  -2  -1  -4",
            "V  -1  -4  -1  -1  -1  -3  -1  -3  -3  -1  -2  -1  -2  -2  -1  -4",
            "H  -1  -1  -4  -1  -3  -1  -3  -1  -3  -1  -2  -2  -1  -2  -1  -4",
            "D  -1  -1  -1  -4  -3  -1  -1  -3  -1  -3  -2  -2  -2  -1  -1  -4",
            "N  -2  -2  -2  -2  -1  -1  -1  -1  -1  -1  -1  -1  -1  -1  -1  -4",
            "*  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4  -4   1",
    };

    private static SimilarityTable table;

    private EDNAFULL() {}

    static synchronized SimilarityTable getTable() {
        if (table == null) {
            table = SimilarityTable.fromLines(NAME, LINES);
        }

        return table;
    }
}
