package calibrator;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.opencv.core.Point;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CornerFinderWorker class                                    */
/*                                     CornerFinderWorker class                                    */
/*                                     CornerFinderWorker class                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Runs the pattern detector on its own thread against the session's frame buffer.
 *
 * The frame buffer belongs to the worker from submit() until awaitCompletion()
 * returns; the session only writes it while the worker is idle. The result slot is
 * written by the worker thread and may be read only after completion was observed.
 */
class CornerFinderWorker implements AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    // job
    private final FrameBuffer frame;
    private final PatternSpec pattern;
    private final VisionLibrary vision;

    // result slot, overwritten each cycle
    private boolean foundAll = false;
    private List<Point> positions = List.of();

    private final BackgroundWorker worker;
    private long jobCount = 0; // worker thread only

    CornerFinderWorker(FrameBuffer frame, PatternSpec pattern, VisionLibrary vision)
    {
        this.frame = frame;
        this.pattern = pattern;
        this.vision = vision;
        this.worker = new BackgroundWorker("cornerFinder", this::findCorners);
    }

    /**
     * Start a detection on the current frame buffer contents
     * @return false if a job is already in flight
     */
    boolean submit()
    {
        return worker.submit();
    }

    boolean isComplete()
    {
        return worker.pollComplete();
    }

    boolean isBusy()
    {
        return worker.isBusy();
    }

    /**
     * Collect the finished job and return to idle
     * @return true if a result is available in the slot
     */
    boolean awaitCompletion()
    {
        return worker.await();
    }

    // result slot getters, valid after a completion was observed
    boolean foundAll()
    {
        return foundAll;
    }
    List<Point> positions()
    {
        return positions;
    }
    FrameBuffer frame()
    {
        return frame;
    }

    @Override
    public void close()
    {
        worker.close();
    }

    private void findCorners()
    {
        jobCount++;
        FeatureDetection detection;
        try {
            detection = vision.detectFeatures(frame, pattern);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "corner finding failed on job " + jobCount, e);
            detection = FeatureDetection.NOT_FOUND;
        }
        foundAll = detection.foundAll();
        positions = detection.positions();
        LOGGER.finest("job " + jobCount + " found all " + foundAll + ", " + positions.size() + " corners");
    }
}
