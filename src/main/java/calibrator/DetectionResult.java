package calibrator;

import java.util.List;

import org.opencv.core.Point;

/**
 * Output of one completed corner finding job as handed to a reader of the
 * ResultBuffer.
 *
 * The found flag and the positions are fixed when the result is fetched. The frame is
 * the buffer's own copy of the pixels the detection ran on and is only stable while
 * the reader holds the ResultBuffer lock.
 */
public final class DetectionResult
{
    private final boolean foundAll;
    private final List<Point> positions;
    private final FrameBuffer frame;

    DetectionResult(boolean foundAll, List<Point> positions, FrameBuffer frame)
    {
        this.foundAll = foundAll;
        this.positions = positions;
        this.frame = frame;
    }

    public boolean foundAll()
    {
        return foundAll;
    }
    /**
     * @return unmodifiable positions, empty or partial if not all found
     */
    public List<Point> positions()
    {
        return positions;
    }
    /**
     * @return pixels the detection ran on; null before the first result is published
     */
    public FrameBuffer frame()
    {
        return frame;
    }
}
