package calibrator;

import java.util.logging.Logger;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     VideoCaptureFrameSource class                               */
/*                                     VideoCaptureFrameSource class                               */
/*                                     VideoCaptureFrameSource class                               */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Frames from a USB camera or a network stream through OpenCV VideoCapture,
 * converted to grayscale.
 *
 * Each checkout reads the next frame from the device so it is always newer than the
 * last. The returned frame's pixels are reused by the next checkout.
 */
public class VideoCaptureFrameSource implements FrameSource, AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private final VideoCapture capture;
    private final String cameraId;
    private final int width;
    private final int height;
    private final Mat img = new Mat();
    private final Mat gray = new Mat();
    private final byte[] luma;
    private boolean checkedOut = false;
    private long lastTimestamp = 0L;

    /**
     * Open a camera
     * @param cameraId integer index of a USB camera, or a stream URL http://...
     * @param requestedWidth image width to ask the camera for
     * @param requestedHeight image height to ask the camera for
     * @throws IllegalStateException the camera could not be opened
     */
    public VideoCaptureFrameSource(String cameraId, int requestedWidth, int requestedHeight)
    {
        this.cameraId = cameraId;
        var remoteCamera = cameraId.toLowerCase().contains("://"); // assume it's a URL remote feed or not
        if (remoteCamera)
        {
            capture = new VideoCapture(cameraId);
        }
        else // assume it's an integer camera id
        {
            int index;
            try {
                index = Integer.parseInt(cameraId.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("camera id " + cameraId + " is neither an integer nor a stream URL", e);
            }
            capture = new VideoCapture(index);
            LOGGER.config("Setting camera mode " + requestedWidth + "x" + requestedHeight);
            capture.set(Videoio.CAP_PROP_FRAME_WIDTH, requestedWidth);
            capture.set(Videoio.CAP_PROP_FRAME_HEIGHT, requestedHeight);
        }

        if ( ! capture.isOpened())
        {
            throw new IllegalStateException("unable to open video source " + cameraId);
        }

        // the camera may not support the requested size; it reports what it chose
        width = (int) capture.get(Videoio.CAP_PROP_FRAME_WIDTH);
        height = (int) capture.get(Videoio.CAP_PROP_FRAME_HEIGHT);
        if (width != requestedWidth || height != requestedHeight)
        {
            LOGGER.warning("camera " + cameraId + " image size is " + width + "x" + height
                + ", not the requested " + requestedWidth + "x" + requestedHeight);
        }
        luma = new byte[width*height];
        LOGGER.config("camera " + cameraId + " opened " + width + "x" + height);
    }

    public int width()
    {
        return width;
    }
    public int height()
    {
        return height;
    }
    public String cameraId()
    {
        return cameraId;
    }

    @Override
    public VideoFrame checkoutFrameIfNewerThan(long timestamp)
    {
        if (checkedOut)
        {
            throw new IllegalStateException("frame already checked out");
        }
        if ( ! capture.read(img) || img.empty())
        {
            LOGGER.finest("no frame from camera " + cameraId);
            return null;
        }
        if (img.width() != width || img.height() != height)
        {
            LOGGER.warning("camera " + cameraId + " frame " + img.width() + "x" + img.height() + " expected " + width + "x" + height);
            return null;
        }

        if (img.channels() == 1)
        {
            img.copyTo(gray);
        }
        else
        {
            Imgproc.cvtColor(img, gray, Imgproc.COLOR_BGR2GRAY);
        }
        gray.get(0, 0, luma);

        long now = Math.max(System.nanoTime(), lastTimestamp + 1);
        if (now <= timestamp)
        {
            return null;
        }
        lastTimestamp = now;
        checkedOut = true;
        return new VideoFrame(now, width, height, luma);
    }

    @Override
    public void checkinFrame()
    {
        checkedOut = false;
    }

    @Override
    public void close()
    {
        capture.release();
        img.release();
        gray.release();
        LOGGER.fine("camera " + cameraId + " released");
    }
}
