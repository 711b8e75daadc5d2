package calibrator;

import java.util.List;
import java.util.logging.Logger;

import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.highgui.HighGui;
import org.opencv.imgproc.Imgproc;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     PreviewDisplay class                                        */
/*                                     PreviewDisplay class                                        */
/*                                     PreviewDisplay class                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Window showing the latest corner finder frame with the found corners drawn on it,
 * the flow state and the status messages. Must be used from one thread.
 */
class PreviewDisplay implements AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private final String windowName;
    private final Mat gray;
    private final Mat out = new Mat(); // user display Mat
    private long lastPublishedCount = -1;

    PreviewDisplay(String windowName, int width, int height)
    {
        this.windowName = windowName;
        this.gray = Mat.zeros(height, width, CvType.CV_8UC1);
        LOGGER.config("preview window " + windowName);
    }

    /**
     * Draw the latest result and give the window a chance to process input
     * @param results the session's result buffer
     * @param pattern pattern to draw
     * @param state flow state
     * @param flowStatus flow status message
     * @param uploadStatus upload status message
     * @return key pressed in the window, or -1
     */
    int show(ResultBuffer results, PatternSpec pattern, FlowState state, String flowStatus, String uploadStatus)
    {
        boolean foundAll;
        List<Point> positions;
        DetectionResult result = results.lockAndFetch();
        try {
            foundAll = result.foundAll();
            positions = result.positions();
            long publishedCount = results.publishedCount(); // lock is reentrant
            if (result.frame() != null && publishedCount != lastPublishedCount)
            {
                gray.put(0, 0, result.frame().pixels());
                lastPublishedCount = publishedCount;
            }
        } finally {
            results.unlock();
        }

        Imgproc.cvtColor(gray, out, Imgproc.COLOR_GRAY2BGR);
        if (state == FlowState.CAPTURING && ! positions.isEmpty())
        {
            MatOfPoint2f corners = new MatOfPoint2f();
            corners.fromList(positions);
            Calib3d.drawChessboardCorners(out, pattern.size(), corners, foundAll);
            corners.release();
        }

        putText(state.toString(), 20);
        putText(flowStatus, 40);
        putText(uploadStatus, out.rows() - 10);

        HighGui.imshow(windowName, out);
        return HighGui.waitKey(1);
    }

    // white text outlined in black shows on any background
    private void putText(String text, int y)
    {
        if (text == null || text.isEmpty())
        {
            return;
        }
        Imgproc.putText(out, text, new Point(0, y), Imgproc.FONT_HERSHEY_SIMPLEX, .6, new Scalar(0, 0, 0), 2);
        Imgproc.putText(out, text, new Point(0, y), Imgproc.FONT_HERSHEY_SIMPLEX, .6, new Scalar(255, 255, 255), 1);
    }

    @Override
    public void close()
    {
        HighGui.destroyWindow(windowName);
        gray.release();
        out.release();
    }
}
