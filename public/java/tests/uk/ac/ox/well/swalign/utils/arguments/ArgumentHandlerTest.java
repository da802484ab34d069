package uk.ac.ox.well.swalign.utils.arguments;

import org.testng.Assert;
import org.testng.annotations.Test;
import uk.ac.ox.well.swalign.commands.align.Align;
import uk.ac.ox.well.swalign.utils.alignment.sw.AlignmentParameters;
import uk.ac.ox.well.swalign.utils.alignment.sw.DoubleGapPolicy;
import uk.ac.ox.well.swalign.utils.alignment.sw.TracebackStart;
import uk.ac.ox.well.swalign.utils.alignment.sw.TracebackStop;
import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;

import java.io.File;
import java.io.IOException;

public class ArgumentHandlerTest {
    private static String tempOutput() throws IOException {
        File out = File.createTempFile("swalign-args", ".txt");
        out.deleteOnExit();

        return out.getAbsolutePath();
    }

    @Test
    public void testAllArguments() throws IOException {
        Align align = new Align();
        ArgumentHandler.parse(align, new String[] {
                "-i", "pair.txt",
                "-s", "EDNAFULL",
                "-o", "-5",
                "--extgap", "-2",
                "-p", "disallow_orthogonal_extension",
                "-t", "BEST_STATE",
                "-x", "next_state",
                "-c",
                "--out", tempOutput()
        });

        Assert.assertEquals(align.INPUT, new File("pair.txt"));
        Assert.assertEquals(align.SCORE.getName(), "EDNAFULL");
        Assert.assertEquals(align.OPEN_GAP.intValue(), -5);
        Assert.assertEquals(align.EXT_GAP.intValue(), -2);
        Assert.assertEquals(align.POLICY, DoubleGapPolicy.DISALLOW_ORTHOGONAL_EXTENSION);
        Assert.assertEquals(align.TRACEBACK_START, TracebackStart.BEST_STATE);
        Assert.assertEquals(align.TRACEBACK_STOP, TracebackStop.NEXT_STATE);
        Assert.assertTrue(align.CIGAR);
        Assert.assertNotNull(align.out);

        align.out.close();
    }

    @Test
    public void testDefaults() throws IOException {
        Align align = new Align();
        ArgumentHandler.parse(align, new String[] { "--input", "pair.txt", "--score", "blosum62", "--out", tempOutput() });

        Assert.assertEquals(align.OPEN_GAP.intValue(), AlignmentParameters.DEFAULT_OPEN_PENALTY);
        Assert.assertEquals(align.EXT_GAP.intValue(), AlignmentParameters.DEFAULT_EXTEND_PENALTY);
        Assert.assertEquals(align.POLICY, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);
        Assert.assertEquals(align.TRACEBACK_START, TracebackStart.MATCH_STATE);
        Assert.assertEquals(align.TRACEBACK_STOP, TracebackStop.PREVIOUS_STATE);
        Assert.assertFalse(align.CIGAR);

        align.out.close();
    }

    @Test(expectedExceptions = SWAlignException.class)
    public void testMissingRequiredArgument() throws IOException {
        ArgumentHandler.parse(new Align(), new String[] { "-i", "pair.txt", "--out", tempOutput() });
    }

    @Test(expectedExceptions = SWAlignException.class)
    public void testUnknownOption() throws IOException {
        ArgumentHandler.parse(new Align(), new String[] { "-i", "pair.txt", "-s", "EDNAFULL", "--gapfree", "--out", tempOutput() });
    }

    @Test(expectedExceptions = SWAlignException.class)
    public void testBadEnumValue() throws IOException {
        ArgumentHandler.parse(new Align(), new String[] { "-i", "pair.txt", "-s", "EDNAFULL", "-p", "sometimes", "--out", tempOutput() });
    }

    @Test(expectedExceptions = SWAlignException.class)
    public void testBadIntegerValue() throws IOException {
        ArgumentHandler.parse(new Align(), new String[] { "-i", "pair.txt", "-s", "EDNAFULL", "-o", "two", "--out", tempOutput() });
    }

    @Test
    public void testHandleArgumentTypes() {
        Assert.assertEquals(ArgumentHandler.handleArgumentTypes(Integer.class, "-3"), -3);
        Assert.assertEquals(ArgumentHandler.handleArgumentTypes(Double.class, "0.5"), 0.5);
        Assert.assertEquals(ArgumentHandler.handleArgumentTypes(TracebackStart.class, "match_state"), TracebackStart.MATCH_STATE);
    }
}
