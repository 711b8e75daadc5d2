package calibrator;

/**
 * Video source as seen by a calibration session.
 *
 * A checked out frame stays valid until checkinFrame() is called; the session only
 * holds it long enough to copy the pixels.
 */
public interface FrameSource
{
    /**
     * Get the latest frame if it is newer than a given time
     * @param timestamp time of the last frame the caller consumed; 0 for any frame
     * @return the frame, or null if there is no newer frame
     */
    VideoFrame checkoutFrameIfNewerThan(long timestamp);

    /**
     * Return the frame obtained by the last successful checkout
     */
    void checkinFrame();
}
