package calibrator;

/**
 * Result of solving for the camera parameters over the captured sets: the
 * parameters and the minimum, average and maximum per-view reprojection error
 * (pixels), or the reason the solve failed.
 */
public final class CalibrationOutcome
{
    private final boolean success;
    private final CameraParameters parameters;
    private final double errorMin;
    private final double errorAvg;
    private final double errorMax;
    private final int viewCount;
    private final String failureReason;

    private CalibrationOutcome(boolean success, CameraParameters parameters,
            double errorMin, double errorAvg, double errorMax, int viewCount, String failureReason)
    {
        this.success = success;
        this.parameters = parameters;
        this.errorMin = errorMin;
        this.errorAvg = errorAvg;
        this.errorMax = errorMax;
        this.viewCount = viewCount;
        this.failureReason = failureReason;
    }

    public static CalibrationOutcome solved(CameraParameters parameters,
            double errorMin, double errorAvg, double errorMax, int viewCount)
    {
        return new CalibrationOutcome(true, parameters, errorMin, errorAvg, errorMax, viewCount, null);
    }

    public static CalibrationOutcome failed(String reason)
    {
        return new CalibrationOutcome(false, null, Double.NaN, Double.NaN, Double.NaN, 0, reason);
    }

    // getters
    public boolean success()
    {
        return success;
    }
    /**
     * @return the parameters; null if the solve failed
     */
    public CameraParameters parameters()
    {
        return parameters;
    }
    public double errorMin()
    {
        return errorMin;
    }
    public double errorAvg()
    {
        return errorAvg;
    }
    public double errorMax()
    {
        return errorMax;
    }
    public int viewCount()
    {
        return viewCount;
    }
    public String failureReason()
    {
        return failureReason;
    }

    /**
     * Operator facing one line summary
     */
    public String summary()
    {
        if (success)
        {
            return String.format("Camera parameters calculated (error min=%.3f, avg=%.3f, max=%.3f)", errorMin, errorAvg, errorMax);
        }
        return "Camera parameters could not be calculated: " + failureReason;
    }

    @Override
    public String toString()
    {
        return summary() + (success ? " " + parameters : "");
    }
}
