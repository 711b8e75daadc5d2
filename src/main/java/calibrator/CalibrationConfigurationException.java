package calibrator;

/**
 * The requested calibration cannot be set up: unsupported pattern type, or
 * nonsensical sizes or counts. Thrown when a session is constructed so the caller
 * can report it and decide whether to quit.
 */
public class CalibrationConfigurationException extends Exception
{
    private static final long serialVersionUID = 1L;

    public CalibrationConfigurationException(String message)
    {
        super(message);
    }
}
