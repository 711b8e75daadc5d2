package calibrator;

/**
 * A frame as handed out by a FrameSource. The source owns the pixels and may reuse
 * them after the frame is checked back in.
 */
public final class VideoFrame
{
    private final long timestamp; // nanoseconds, source defined epoch, increases with each new frame
    private final int width;
    private final int height;
    private final byte[] luma;

    public VideoFrame(long timestamp, int width, int height, byte[] luma)
    {
        if (luma.length < width*height)
        {
            throw new IllegalArgumentException("luma buffer " + luma.length + " too small for " + width + "x" + height);
        }
        this.timestamp = timestamp;
        this.width = width;
        this.height = height;
        this.luma = luma;
    }

    public long timestamp()
    {
        return timestamp;
    }
    public int width()
    {
        return width;
    }
    public int height()
    {
        return height;
    }
    public byte[] luma()
    {
        return luma;
    }
}
