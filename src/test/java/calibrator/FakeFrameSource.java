package calibrator;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Frame source with a new frame on every checkout. Each frame's pixels are filled
 * with its sequence number.
 */
class FakeFrameSource implements FrameSource
{
    private final int width;
    private final int height;
    private long timestamp = 0L;
    private boolean checkedOut = false;
    volatile boolean empty = false;

    final AtomicInteger checkouts = new AtomicInteger();
    final AtomicInteger checkins = new AtomicInteger();

    FakeFrameSource(int width, int height)
    {
        this.width = width;
        this.height = height;
    }

    @Override
    public synchronized VideoFrame checkoutFrameIfNewerThan(long lastTimestamp)
    {
        if (checkedOut)
        {
            throw new IllegalStateException("frame already checked out");
        }
        if (empty)
        {
            return null;
        }
        timestamp = Math.max(timestamp, lastTimestamp) + 1;
        checkedOut = true;
        checkouts.incrementAndGet();
        byte[] luma = new byte[width*height];
        Arrays.fill(luma, (byte) timestamp);
        return new VideoFrame(timestamp, width, height, luma);
    }

    @Override
    public synchronized void checkinFrame()
    {
        checkedOut = false;
        checkins.incrementAndGet();
    }

    synchronized boolean isCheckedOut()
    {
        return checkedOut;
    }
}
