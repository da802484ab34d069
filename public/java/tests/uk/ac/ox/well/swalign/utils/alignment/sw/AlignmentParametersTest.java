package uk.ac.ox.well.swalign.utils.alignment.sw;

import org.testng.Assert;
import org.testng.annotations.Test;
import uk.ac.ox.well.swalign.utils.exceptions.InvalidPenaltyException;

public class AlignmentParametersTest {
    @Test
    public void testDefaults() {
        AlignmentParameters p = new AlignmentParameters();

        Assert.assertEquals(p.getOpenPenalty(), -2);
        Assert.assertEquals(p.getExtendPenalty(), -1);
        Assert.assertEquals(p.getDoubleGapPolicy(), DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);
        Assert.assertEquals(p.getTracebackStart(), TracebackStart.MATCH_STATE);
        Assert.assertEquals(p.getTracebackStop(), TracebackStop.PREVIOUS_STATE);
        Assert.assertEquals(new AlignmentParameters(-3, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStart.BEST_STATE).getTracebackStop(), TracebackStop.PREVIOUS_STATE);
    }

    @Test
    public void testZeroPenaltiesAreAllowed() {
        AlignmentParameters p = new AlignmentParameters(0, 0, DoubleGapPolicy.DISALLOW_ORTHOGONAL_EXTENSION);

        Assert.assertEquals(p.getOpenPenalty(), 0);
        Assert.assertEquals(p.getExtendPenalty(), 0);
    }

    @Test(expectedExceptions = InvalidPenaltyException.class)
    public void testPositiveOpenPenalty() {
        new AlignmentParameters(1, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullPolicy() {
        new AlignmentParameters(-2, -1, null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullTracebackStop() {
        new AlignmentParameters(-2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION, TracebackStart.MATCH_STATE, null);
    }

    @Test
    public void testTracebackStateCodes() {
        for (TracebackState state : TracebackState.values()) {
            Assert.assertEquals(TracebackState.fromCode(state.code()), state);
        }
    }
}
