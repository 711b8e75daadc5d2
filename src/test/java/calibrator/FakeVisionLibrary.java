package calibrator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.opencv.core.Point;
import org.opencv.core.Size;

/**
 * Vision library that reports whatever the test tells it to. No OpenCV natives needed.
 */
class FakeVisionLibrary implements VisionLibrary
{
    final AtomicBoolean supported = new AtomicBoolean(true);
    final AtomicBoolean found = new AtomicBoolean(true);
    final AtomicBoolean solveFails = new AtomicBoolean(false);
    final AtomicBoolean solveThrows = new AtomicBoolean(false);
    final AtomicInteger detectCalls = new AtomicInteger();
    final AtomicInteger solveCalls = new AtomicInteger();
    final List<CapturedSet> solvedSets = new CopyOnWriteArrayList<>();

    // when set, detection and solving wait for the latch
    volatile CountDownLatch detectGate;
    volatile CountDownLatch solveGate;
    final CountDownLatch solveEntered = new CountDownLatch(1);

    @Override
    public boolean supports(PatternType type)
    {
        return supported.get();
    }

    @Override
    public FeatureDetection detectFeatures(FrameBuffer frame, PatternSpec pattern)
    {
        int call = detectCalls.incrementAndGet();
        awaitGate(detectGate);
        if ( ! found.get())
        {
            return new FeatureDetection(false, List.of(new Point(1, 1)));
        }
        // x follows the frame contents, y numbers the detection
        double first = frame.pixels()[0] & 0xFF;
        List<Point> positions = new ArrayList<>();
        for (int i = 0; i < pattern.featureCount(); i++)
        {
            positions.add(new Point(first + i, call));
        }
        return new FeatureDetection(true, positions);
    }

    @Override
    public List<Point> refineFeatures(FrameBuffer frame, List<Point> positions)
    {
        List<Point> refined = new ArrayList<>();
        for (Point point : positions)
        {
            refined.add(new Point(point.x + 0.25, point.y + 0.25));
        }
        return refined;
    }

    @Override
    public CalibrationOutcome solve(List<CapturedSet> sets, PatternSpec pattern, Size imageSize)
    {
        solveCalls.incrementAndGet();
        solvedSets.addAll(sets);
        solveEntered.countDown();
        awaitGate(solveGate);
        if (solveThrows.get())
        {
            throw new IllegalStateException("solver blew up");
        }
        if (solveFails.get())
        {
            return CalibrationOutcome.failed("did not converge");
        }
        var parameters = new CameraParameters((int) imageSize.width, (int) imageSize.height,
            new double[] {500., 0., imageSize.width/2., 0., 500., imageSize.height/2., 0., 0., 1.},
            new double[] {0.1, -0.05, 0., 0., 0.});
        return CalibrationOutcome.solved(parameters, 0.1, 0.2, 0.3, sets.size());
    }

    private static void awaitGate(CountDownLatch gate)
    {
        if (gate == null)
        {
            return;
        }
        try {
            gate.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
