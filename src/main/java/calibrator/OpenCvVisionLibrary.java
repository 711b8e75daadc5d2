package calibrator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.MatOfPoint3f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.core.TermCriteria;
import org.opencv.imgproc.Imgproc;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     OpenCvVisionLibrary class                                   */
/*                                     OpenCvVisionLibrary class                                   */
/*                                     OpenCvVisionLibrary class                                   */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Chessboard detection, sub-pixel refinement and camera calibration with OpenCV.
 * The OpenCV native library must be loaded before use.
 */
public class OpenCvVisionLibrary implements VisionLibrary
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private static final int findChessboardFlags =
        Calib3d.CALIB_CB_FAST_CHECK | Calib3d.CALIB_CB_ADAPTIVE_THRESH | Calib3d.CALIB_CB_FILTER_QUADS;

    private final TermCriteria cornerSubPixCriteria =
        new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS, Cfg.cornerSubPixMaxIterations, Cfg.cornerSubPixEpsilon);
    private final Size cornerSubPixWindow = new Size(Cfg.cornerSubPixWindow, Cfg.cornerSubPixWindow);
    private final Size cornerSubPixZeroZone = new Size(-1, -1); // no zero zone

    @Override
    public boolean supports(PatternType type)
    {
        return type == PatternType.CHESSBOARD;
    }

    @Override
    public FeatureDetection detectFeatures(FrameBuffer frame, PatternSpec pattern)
    {
        Mat gray = toMat(frame);
        MatOfPoint2f corners = new MatOfPoint2f();
        try {
            boolean found = Calib3d.findChessboardCorners(gray, pattern.size(), corners, findChessboardFlags);
            List<Point> positions = corners.empty() ? List.of() : corners.toList();
            return new FeatureDetection(found && positions.size() == pattern.featureCount(), positions);
        } finally {
            corners.release();
            gray.release();
        }
    }

    @Override
    public List<Point> refineFeatures(FrameBuffer frame, List<Point> positions)
    {
        if (positions.isEmpty())
        {
            return List.of();
        }
        Mat gray = toMat(frame);
        MatOfPoint2f corners = new MatOfPoint2f();
        corners.fromList(positions);
        try {
            Imgproc.cornerSubPix(gray, corners, cornerSubPixWindow, cornerSubPixZeroZone, cornerSubPixCriteria);
            return corners.toList();
        } finally {
            corners.release();
            gray.release();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     solve                                                       */
/*                                     solve                                                       */
/*                                     solve                                                       */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Calibrate over all views. Every view uses the same object points; the per view
     * RMS reprojection errors give the min, average and max errors.
     */
    @Override
    public CalibrationOutcome solve(List<CapturedSet> sets, PatternSpec pattern, Size imageSize)
    {
        if (sets.isEmpty())
        {
            return CalibrationOutcome.failed("no views");
        }

        // split into the two separate lists OpenCV calibrateCamera takes
        List<Mat> pts2dFrames = new ArrayList<>(sets.size()); // image points
        List<Mat> pts3dFrames = new ArrayList<>(sets.size()); // object points
        for (CapturedSet set : sets)
        {
            if (set.size() != pattern.featureCount())
            {
                release(pts2dFrames);
                release(pts3dFrames);
                return CalibrationOutcome.failed("view has " + set.size() + " points, pattern has " + pattern.featureCount());
            }
            MatOfPoint2f p2d = new MatOfPoint2f();
            p2d.fromList(set.positions());
            pts2dFrames.add(p2d);
            MatOfPoint3f p3d = new MatOfPoint3f();
            p3d.fromList(pattern.objectPoints());
            pts3dFrames.add(p3d);
        }

        Mat K = new Mat();
        Mat cdist = new Mat();
        List<Mat> rvecs = new ArrayList<>();
        List<Mat> tvecs = new ArrayList<>();
        Mat stdDeviationsIntrinsics = new Mat();
        Mat stdDeviationsExtrinsics = new Mat();
        Mat perViewErrors = new Mat();
        try
        {
            double reperr = Calib3d.calibrateCameraExtended(
                pts3dFrames, pts2dFrames,
                imageSize, K, cdist,
                rvecs, tvecs,
                stdDeviationsIntrinsics, stdDeviationsExtrinsics, perViewErrors,
                0);
            LOGGER.fine("calibrateCameraExtended overall RMS error " + reperr);

            double[] errors = new double[(int) perViewErrors.total()];
            Mat errors64 = new Mat();
            perViewErrors.convertTo(errors64, CvType.CV_64F);
            errors64.get(0, 0, errors);
            errors64.release();

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0.;
            for (double error : errors)
            {
                min = Math.min(min, error);
                max = Math.max(max, error);
                sum += error;
            }
            if (errors.length == 0)
            {
                min = max = reperr;
                sum = reperr;
            }
            double avg = sum / Math.max(1, errors.length);

            double[] cameraMatrix = new double[9];
            Mat K64 = new Mat();
            K.convertTo(K64, CvType.CV_64F);
            K64.get(0, 0, cameraMatrix);
            K64.release();

            double[] distortion = new double[(int) cdist.total()];
            Mat cdist64 = new Mat();
            cdist.convertTo(cdist64, CvType.CV_64F);
            cdist64.get(0, 0, distortion);
            cdist64.release();

            CameraParameters parameters =
                new CameraParameters((int) imageSize.width, (int) imageSize.height, cameraMatrix, distortion);
            return CalibrationOutcome.solved(parameters, min, avg, max, sets.size());
        }
        catch(CvException error)
        {
            LOGGER.severe("Calib3d.calibrateCameraExtended error " + error);
            return CalibrationOutcome.failed(error.getMessage());
        }
        finally
        {
            release(pts2dFrames);
            release(pts3dFrames);
            release(rvecs);
            release(tvecs);
            K.release();
            cdist.release();
            stdDeviationsIntrinsics.release();
            stdDeviationsExtrinsics.release();
            perViewErrors.release();
        }
    }

    private static Mat toMat(FrameBuffer frame)
    {
        Mat gray = new Mat(frame.height(), frame.width(), CvType.CV_8UC1);
        gray.put(0, 0, frame.pixels());
        return gray;
    }

    private static void release(List<Mat> mats)
    {
        for (Mat mat : mats)
        {
            mat.release();
        }
    }
}
