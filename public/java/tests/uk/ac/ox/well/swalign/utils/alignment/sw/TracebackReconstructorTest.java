package uk.ac.ox.well.swalign.utils.alignment.sw;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class TracebackReconstructorTest {
    private AlignmentMatrix am;
    private TracebackReconstructor tr;

    @BeforeMethod
    public void setup() {
        am = new AlignmentMatrix(new IdentityScoring(3, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION);
        am.fillMatrix();

        tr = new TracebackReconstructor(am);
    }

    @Test
    public void testBestStateFollowsTheMatrixHoldingTheCellMaximum() {
        // (1, 2): M = 0, Iy = 1.  (2, 1): M = 0, Ix = 1.  (3, 4): M = 7.
        Assert.assertEquals(tr.initialState(TracebackStart.BEST_STATE, new MatrixCoordinate(1, 2)), TracebackState.GAP_Y);
        Assert.assertEquals(tr.initialState(TracebackStart.BEST_STATE, new MatrixCoordinate(2, 1)), TracebackState.GAP_X);
        Assert.assertEquals(tr.initialState(TracebackStart.BEST_STATE, new MatrixCoordinate(3, 4)), TracebackState.MATCH);
    }

    @Test
    public void testMatchStateAlwaysStartsInMatch() {
        Assert.assertEquals(tr.initialState(TracebackStart.MATCH_STATE, new MatrixCoordinate(1, 2)), TracebackState.MATCH);
        Assert.assertEquals(tr.initialState(TracebackStart.MATCH_STATE, new MatrixCoordinate(2, 1)), TracebackState.MATCH);
    }

    @Test
    public void testTracebackFromGapState() {
        MatrixCoordinate from = new MatrixCoordinate(1, 2);
        TracebackState initial = tr.initialState(TracebackStart.BEST_STATE, from);

        AlignmentBuilder toFloor = new AlignmentBuilder();
        Assert.assertEquals(tr.traceback(toFloor, from, initial, TracebackStop.NEXT_STATE), new MatrixCoordinate(0, 0));
        toFloor.endCore();
        toFloor.reverse();

        Assert.assertEquals(toFloor.getTop(), "AC");
        Assert.assertEquals(toFloor.getBottom(), "A-");

        // Iy is 0 at (1, 1), so only the gap column is taken
        AlignmentBuilder oneStep = new AlignmentBuilder();
        Assert.assertEquals(tr.traceback(oneStep, from, initial, TracebackStop.PREVIOUS_STATE), new MatrixCoordinate(1, 1));
        oneStep.endCore();
        oneStep.reverse();

        Assert.assertEquals(oneStep.getTop(), "C");
        Assert.assertEquals(oneStep.getBottom(), "-");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testUnfilledMatrixIsRejected() {
        new TracebackReconstructor(new AlignmentMatrix(new IdentityScoring(3, -1), "ACGT", "AGT", -2, -1, DoubleGapPolicy.ALLOW_ORTHOGONAL_EXTENSION));
    }
}
