package calibrator;

/**
 * Fixed size single channel (luma) pixel buffer.
 *
 * Allocated once for a session and overwritten in place on every capture cycle.
 * Rows are packed, no padding: pixel (x, y) is at y*width + x.
 */
public final class FrameBuffer
{
    private final int width;
    private final int height;
    private final byte[] pixels;

    public FrameBuffer(int width, int height)
    {
        if (width <= 0 || height <= 0)
        {
            throw new IllegalArgumentException("frame size must be positive " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = new byte[width*height];
    }

    // getters
    public int width()
    {
        return width;
    }
    public int height()
    {
        return height;
    }
    /**
     * The backing pixels, not a copy
     * @return pixel array of length width*height
     */
    public byte[] pixels()
    {
        return pixels;
    }

    boolean sameSize(int width, int height)
    {
        return this.width == width && this.height == height;
    }

    /**
     * Copy a video source frame into this buffer
     * @param frame source frame of the same size
     */
    void copyFrom(VideoFrame frame)
    {
        if ( ! sameSize(frame.width(), frame.height()))
        {
            throw new IllegalArgumentException("frame " + frame.width() + "x" + frame.height()
                + " does not fit buffer " + width + "x" + height);
        }
        System.arraycopy(frame.luma(), 0, pixels, 0, pixels.length);
    }

    /**
     * Copy another buffer of the same size into this buffer
     * @param other source buffer
     */
    void copyFrom(FrameBuffer other)
    {
        if ( ! sameSize(other.width, other.height))
        {
            throw new IllegalArgumentException("frame " + other.width + "x" + other.height
                + " does not fit buffer " + width + "x" + height);
        }
        System.arraycopy(other.pixels, 0, pixels, 0, pixels.length);
    }
}
