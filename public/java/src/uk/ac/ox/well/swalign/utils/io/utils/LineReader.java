package uk.ac.ox.well.swalign.utils.io.utils;

import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;

import java.io.*;
import java.nio.charset.StandardCharsets;

/**
 * Reads a text file one line at a time, looking one record ahead so callers can ask whether more lines remain.
 */
public class LineReader implements Closeable {
    protected BufferedReader br = null;

    protected String nextRecord = null;

    private final String source;

    public LineReader(File fileToRead) {
        this(openFile(fileToRead), fileToRead.getAbsolutePath());
    }

    public LineReader(Reader reader, String source) {
        this.source = source;

        try {
            br = new BufferedReader(reader);

            nextRecord = br.readLine();
            if (nextRecord == null) {
                close();
            }
        } catch (IOException e) {
            throw new SWAlignException("Error while reading '" + source + "'", e);
        }
    }

    private static Reader openFile(File fileToRead) {
        try {
            return new InputStreamReader(new FileInputStream(fileToRead), StandardCharsets.UTF_8);
        } catch (FileNotFoundException e) {
            throw new SWAlignException("Could not find file '" + fileToRead.getAbsolutePath() + "'", e);
        }
    }

    @Override
    public void close() throws IOException {
        br.close();
    }

    public boolean hasNext() {
        return nextRecord != null;
    }

    public String getNextRecord() {
        try {
            String currentRecord = nextRecord;

            nextRecord = br.readLine();
            if (nextRecord == null) {
                close();
            }

            return currentRecord;
        } catch (IOException e) {
            throw new SWAlignException("Error while reading '" + source + "'", e);
        }
    }
}
