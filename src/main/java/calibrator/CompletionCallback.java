package calibrator;

/**
 * Receives the outcome of each calibration run that was not cancelled. A solver
 * failure arrives as a failed outcome.
 *
 * Called on the flow thread, which is blocked until the call returns, so an
 * implementation should only persist the outcome and hand any slow work (upload) to
 * another thread.
 */
@FunctionalInterface
public interface CompletionCallback
{
    void calibrationCompleted(CalibrationOutcome outcome);
}
