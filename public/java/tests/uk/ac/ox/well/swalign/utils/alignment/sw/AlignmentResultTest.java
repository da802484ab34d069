package uk.ac.ox.well.swalign.utils.alignment.sw;

import htsjdk.samtools.Cigar;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class AlignmentResultTest {
    @DataProvider(name = "cigars")
    public Object[][] cigars() {
        return new Object[][] {
                { new IdentityScoring(3, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "1S2M" },
                { new IdentityScoring(3, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.NEXT_STATE, "1M1D2M" },
                { new IdentityScoring(3, -1), "AGT", "ACGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "2S2M" },
                { new IdentityScoring(3, -1), "AGT", "ACGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.NEXT_STATE, "1M1I2M" },
                { new IdentityScoring(2, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "1S2M" },
                { new IdentityScoring(2, -1), "ACGT", "CCACGTCC", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "2S4M2S" },
                { new IdentityScoring(2, -10), "AAAAACAAAAA", "AAAAAGAAAAA", -1, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "6S5M" },
                { new IdentityScoring(2, -10), "AAAAACAAAAA", "AAAAAGAAAAA", -1, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStop.NEXT_STATE, "5M1D1I5M" },
                { new IdentityScoring(1, 0), "TTGCCGCCTGA", "CAAGTCA", 0, -1, DoubleGapPolicy.DISALLOW_ORTHOGONAL_EXTENSION, TracebackStop.PREVIOUS_STATE, "2S2M1I1M1S" },
                { new IdentityScoring(1, 0), "TTGCCGCCTGA", "CAAGTCA", 0, -1, DoubleGapPolicy.DISALLOW_ORTHOGONAL_EXTENSION, TracebackStop.NEXT_STATE, "1M1I2M1I1M1S" },
        };
    }

    @Test(dataProvider = "cigars")
    public void testCigar(ScoringMatrix scoring, String seq1, String seq2, int open, int extend, DoubleGapPolicy policy, TracebackStop stop, String expectedCigar) {
        AlignmentParameters parameters = new AlignmentParameters(open, extend, policy, TracebackStart.MATCH_STATE, stop);
        AlignmentResult res = new AffineSmithWaterman(scoring, parameters).align(seq1, seq2);

        Assert.assertEquals(res.getCigar().toString(), expectedCigar);
    }

    @Test
    public void testCigarCoversBottomSequence() {
        AlignmentResult res = AffineSmithWaterman.align(new IdentityScoring(2, -1), "TTACGTAAGT", "GGACGTCAGTCC", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);

        Cigar cigar = res.getCigar();

        Assert.assertFalse(cigar.isEmpty());
        Assert.assertEquals(cigar.getReadLength(), "GGACGTCAGTCC".length());
    }

    @Test
    public void testEmptyAlignmentHasEmptyCigar() {
        AlignmentResult res = AffineSmithWaterman.align(new IdentityScoring(2, -1), "AAA", "CCC", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);

        Assert.assertTrue(res.isEmpty());
        Assert.assertTrue(res.getCigar().isEmpty());
    }

    @Test
    public void testToStringShowsScoreAndLines() {
        AlignmentResult res = AffineSmithWaterman.align(new IdentityScoring(3, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);

        Assert.assertEquals(res.toString(), "score=7 at (3, 4)\nAC(GT)\n   || \n A(GT)");
    }
}
