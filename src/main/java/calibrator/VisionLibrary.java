package calibrator;

import java.util.List;

import org.opencv.core.Point;
import org.opencv.core.Size;

/**
 * The image processing the calibrator delegates: finding the pattern, refining
 * the found positions, and solving for the camera parameters.
 *
 * All calls are synchronous and may be slow. Implementations must not keep
 * references to the frames they are given.
 */
public interface VisionLibrary
{
    /**
     * @param type pattern type
     * @return true if this library can detect and solve with the pattern type
     */
    boolean supports(PatternType type);

    /**
     * Find the pattern features in an image
     * @param frame single channel image
     * @param pattern what to look for
     * @return found flag and positions in pattern order
     */
    FeatureDetection detectFeatures(FrameBuffer frame, PatternSpec pattern);

    /**
     * Refine feature positions to sub-pixel precision
     * @param frame image the positions were found in
     * @param positions found positions
     * @return refined positions, same order and count
     */
    List<Point> refineFeatures(FrameBuffer frame, List<Point> positions);

    /**
     * Solve for the camera parameters
     * @param sets captured views
     * @param pattern pattern geometry for all views
     * @param imageSize image width and height
     * @return the outcome; failures are reported in the outcome, not thrown
     */
    CalibrationOutcome solve(List<CapturedSet> sets, PatternSpec pattern, Size imageSize);
}
