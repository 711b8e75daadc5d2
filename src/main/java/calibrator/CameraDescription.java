package calibrator;

/**
 * What the saved calibration says about the camera it was made with
 */
public final class CameraDescription
{
    private final String deviceId;
    private final String name;
    private final int index;
    private final String facing;
    private final double focalLength; // 0 if unknown
    private final int width;
    private final int height;

    public CameraDescription(String deviceId, String name, int index, String facing, double focalLength, int width, int height)
    {
        this.deviceId = deviceId;
        this.name = name;
        this.index = index;
        this.facing = facing;
        this.focalLength = focalLength;
        this.width = width;
        this.height = height;
    }

    // getters
    public String deviceId()
    {
        return deviceId;
    }
    public String name()
    {
        return name;
    }
    public int index()
    {
        return index;
    }
    public String facing()
    {
        return facing;
    }
    public double focalLength()
    {
        return focalLength;
    }
    public int width()
    {
        return width;
    }
    public int height()
    {
        return height;
    }

    @Override
    public String toString()
    {
        return "camera " + deviceId + " (" + name + ") index " + index + " " + facing + " " + width + "x" + height
            + (focalLength > 0. ? " focal length " + focalLength : "");
    }
}
