package uk.ac.ox.well.swalign.utils.io.utils;

import org.testng.Assert;
import org.testng.annotations.Test;
import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;

import java.io.File;
import java.io.StringReader;

public class LineReaderTest {
    @Test
    public void testReadsEveryLine() {
        LineReader lr = new LineReader(new StringReader("first\n\nthird"), "inline");

        Assert.assertTrue(lr.hasNext());
        Assert.assertEquals(lr.getNextRecord(), "first");
        Assert.assertEquals(lr.getNextRecord(), "");
        Assert.assertEquals(lr.getNextRecord(), "third");
        Assert.assertFalse(lr.hasNext());
    }

    @Test
    public void testEmptyInput() {
        LineReader lr = new LineReader(new StringReader(""), "empty");

        Assert.assertFalse(lr.hasNext());
    }

    @Test(expectedExceptions = SWAlignException.class)
    public void testMissingFile() {
        new LineReader(new File("/no/such/file.txt"));
    }
}
