package calibrator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.opencv.core.Point;
import org.opencv.core.Size;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationSession class                                    */
/*                                     CalibrationSession class                                    */
/*                                     CalibrationSession class                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * One calibration of one camera at one frame size.
 *
 * The frame pump calls submitFrame() for every frame while capturing. Corner finding
 * takes longer than a frame interval so it runs on the corner finder thread and frames
 * that arrive while it is busy are skipped. Each completed detection is published to
 * the ResultBuffer for display and for capture().
 *
 * The flow controller calls capture(), uncapture(), uncaptureAll() and
 * computeCalibration(). Those are the only calls that change the captured sets.
 */
public class CalibrationSession implements AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private final PatternSpec pattern;
    private final int maxCount;
    private final int videoWidth;
    private final int videoHeight;
    private final VisionLibrary vision;

    private final FrameBuffer frame; // corner finder input
    private final CornerFinderWorker cornerFinder;
    private final ResultBuffer resultBuffer;

    private final Object setsLock = new Object();
    private final List<CapturedSet> sets; // guarded by setsLock

    // frame pump only
    private long lastFrameTimestamp = 0L;
    private boolean frameSizeWarned = false;
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationSession constructor                              */
/*                                     CalibrationSession constructor                              */
/*                                     CalibrationSession constructor                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Create a new calibration session and start its corner finder thread.
     *
     * @param pattern the calibration pattern that will be used
     * @param maxCount number of views of the pattern to capture
     * @param videoWidth width of the frames that will be passed to submitFrame()
     * @param videoHeight height of the frames that will be passed to submitFrame()
     * @param vision detection and solving
     * @throws CalibrationConfigurationException pattern not supported by the vision library, or bad sizes
     */
    public CalibrationSession(PatternSpec pattern, int maxCount, int videoWidth, int videoHeight, VisionLibrary vision)
            throws CalibrationConfigurationException
    {
        if ( ! vision.supports(pattern.type()))
        {
            throw new CalibrationConfigurationException("pattern type " + pattern.type() + " is not supported");
        }
        if (pattern.columns() < 2 || pattern.rows() < 2)
        {
            throw new CalibrationConfigurationException("pattern must be at least 2x2, is " + pattern.columns() + "x" + pattern.rows());
        }
        if ( ! (pattern.spacing() > 0.))
        {
            throw new CalibrationConfigurationException("pattern spacing must be positive, is " + pattern.spacing());
        }
        if (maxCount < 1)
        {
            throw new CalibrationConfigurationException("capture count maximum must be at least 1, is " + maxCount);
        }
        if (videoWidth <= 0 || videoHeight <= 0)
        {
            throw new CalibrationConfigurationException("video size must be positive, is " + videoWidth + "x" + videoHeight);
        }

        this.pattern = pattern;
        this.maxCount = maxCount;
        this.videoWidth = videoWidth;
        this.videoHeight = videoHeight;
        this.vision = vision;
        this.sets = new ArrayList<>(maxCount);

        this.frame = new FrameBuffer(videoWidth, videoHeight);
        this.resultBuffer = new ResultBuffer(videoWidth, videoHeight);
        this.cornerFinder = new CornerFinderWorker(frame, pattern, vision);

        LOGGER.config("calibration session " + pattern + ", " + maxCount + " captures, video " + videoWidth + "x" + videoHeight);
    }

    // getters
    public PatternSpec pattern()
    {
        return pattern;
    }
    public Size imageSize()
    {
        return new Size(videoWidth, videoHeight);
    }
    public ResultBuffer resultBuffer()
    {
        return resultBuffer;
    }
    public int maxCount()
    {
        return maxCount;
    }
    public int capturedCount()
    {
        synchronized (setsLock)
        {
            return sets.size();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     submitFrame                                                 */
/*                                     submitFrame                                                 */
/*                                     submitFrame                                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * One cycle of the corner finding pipeline: publish a finished detection, then
     * hand the newest frame to the idle corner finder. Call from the frame pump only.
     *
     * @param source video source
     * @return false if the source frame does not match the session's frame size
     */
    public boolean submitFrame(FrameSource source)
    {
        // First, see if a frame has been completely processed.
        if (cornerFinder.isComplete())
        {
            cornerFinder.awaitCompletion(); // already finished so this only resets it to idle
            resultBuffer.publish(cornerFinder.foundAll(), cornerFinder.positions(), cornerFinder.frame());
        }

        // If the corner finder is idle submit the next frame; when busy the frame is skipped
        if (cornerFinder.isBusy())
        {
            return true;
        }

        VideoFrame videoFrame = source.checkoutFrameIfNewerThan(lastFrameTimestamp);
        if (videoFrame == null)
        {
            return true; // nothing new yet
        }

        try {
            if ( ! frame.sameSize(videoFrame.width(), videoFrame.height()))
            {
                if ( ! frameSizeWarned)
                {
                    LOGGER.warning("frame size " + videoFrame.width() + "x" + videoFrame.height()
                        + " does not match session size " + videoWidth + "x" + videoHeight + "; frames ignored");
                    frameSizeWarned = true;
                }
                return false;
            }
            // the detector needs exclusive use of the pixels for longer than the source lends them
            frame.copyFrom(videoFrame);
            lastFrameTimestamp = videoFrame.timestamp();
        } finally {
            source.checkinFrame();
        }

        cornerFinder.submit(); // results are collected on a later cycle
        return true;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     capture                                                     */
/*                                     capture                                                     */
/*                                     capture                                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Keep the most recent corner finder result as a calibration view.
     *
     * @return false if enough views are already captured or the latest result does not
     *     have all the pattern features
     */
    public boolean capture()
    {
        if (capturedCount() >= maxCount)
        {
            return false;
        }

        List<Point> refined = null;
        DetectionResult result = resultBuffer.lockAndFetch(); // the pixels must not change while refining
        try {
            if (result.foundAll() && result.frame() != null)
            {
                refined = vision.refineFeatures(result.frame(), result.positions());
                if (refined.size() != result.positions().size())
                {
                    LOGGER.warning("refinement returned " + refined.size() + " corners for " + result.positions().size());
                    refined = null;
                }
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "corner refinement failed", e);
            refined = null;
        } finally {
            resultBuffer.unlock();
        }

        if (refined == null)
        {
            return false;
        }

        int count;
        synchronized (setsLock)
        {
            if (sets.size() >= maxCount)
            {
                return false;
            }
            sets.add(new CapturedSet(refined));
            count = sets.size();
        }

        if (LOGGER.isLoggable(Level.FINE))
        {
            StringBuilder corners = new StringBuilder();
            for (Point point : refined)
            {
                corners.append(String.format("%n  %f, %f", point.x, point.y));
            }
            LOGGER.fine(String.format("---------- %2d/%2d -----------", count, maxCount) + corners);
        }
        LOGGER.info("captured image " + count + "/" + maxCount);
        return true;
    }

    /**
     * Undo the most recent capture
     * @return false if nothing was captured
     */
    public boolean uncapture()
    {
        synchronized (setsLock)
        {
            if (sets.isEmpty())
            {
                return false;
            }
            sets.remove(sets.size() - 1);
            LOGGER.info("removed capture, " + sets.size() + "/" + maxCount + " remain");
            return true;
        }
    }

    /**
     * Discard all captures
     * @return false if nothing was captured
     */
    public boolean uncaptureAll()
    {
        synchronized (setsLock)
        {
            if (sets.isEmpty())
            {
                return false;
            }
            sets.clear();
            LOGGER.info("removed all captures");
            return true;
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     computeCalibration                                          */
/*                                     computeCalibration                                          */
/*                                     computeCalibration                                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Solve for the camera parameters from the captured views. Blocks for as long as
     * the solver takes.
     * @return the outcome; a failed outcome if nothing was captured or the solver failed
     */
    public CalibrationOutcome computeCalibration()
    {
        List<CapturedSet> views;
        synchronized (setsLock)
        {
            views = new ArrayList<>(sets);
        }

        if (views.isEmpty())
        {
            LOGGER.warning("no captured images to calibrate with");
            return CalibrationOutcome.failed("no captured images");
        }

        LOGGER.info("calculating camera parameters from " + views.size() + " images");
        CalibrationOutcome outcome;
        try {
            outcome = vision.solve(views, pattern, imageSize());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "calibration solver failed", e);
            outcome = CalibrationOutcome.failed(e.toString());
        }
        if (outcome == null)
        {
            outcome = CalibrationOutcome.failed("solver returned no result");
        }

        LOGGER.info(outcome.toString());
        return outcome;
    }

    /**
     * Stop the corner finder thread
     */
    @Override
    public void close()
    {
        cornerFinder.close();
        LOGGER.fine("calibration session closed");
    }
}
