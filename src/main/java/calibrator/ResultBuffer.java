package calibrator;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.opencv.core.Point;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     ResultBuffer class                                          */
/*                                     ResultBuffer class                                          */
/*                                     ResultBuffer class                                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * The most recent completed corner finding result, shared between the session
 * (writer) and any number of readers such as a display.
 *
 * Readers use lockAndFetch() / unlock() on the same thread. While a reader holds the
 * lock the fetched result, including the frame pixels, cannot change; publish() waits
 * for the unlock.
 */
public class ResultBuffer
{
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final FrameBuffer frame; // own copy of the detection frame, allocated once
    private boolean published = false;
    private boolean foundAll = false;
    private List<Point> positions = List.of();
    private long publishedCount = 0;

    ResultBuffer(int width, int height)
    {
        this.frame = new FrameBuffer(width, height);
    }

    /**
     * Replace the buffered result with a new one. Blocks while a reader holds the lock.
     * @param foundAll all features found
     * @param positions found positions
     * @param source frame the detection ran on; its pixels are copied
     */
    void publish(boolean foundAll, List<Point> positions, FrameBuffer source)
    {
        List<Point> copy = FeatureDetection.copyOf(positions); // outside the lock
        lock.lock();
        try {
            frame.copyFrom(source);
            this.foundAll = foundAll;
            this.positions = copy;
            this.published = true;
            publishedCount++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lock the buffer and get the current result. The caller must call unlock() from
     * the same thread when done with the result, before any further publish can proceed.
     * @return the result; not found with no positions and no frame before the first publish
     */
    public DetectionResult lockAndFetch()
    {
        lock.lock();
        return new DetectionResult(foundAll, positions, published ? frame : null);
    }

    /**
     * Release the lock taken by lockAndFetch()
     */
    public void unlock()
    {
        lock.unlock();
    }

    /**
     * @return number of results published so far
     */
    public long publishedCount()
    {
        lock.lock();
        try {
            return publishedCount;
        } finally {
            lock.unlock();
        }
    }
}
