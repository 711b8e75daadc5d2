package calibrator;

import static org.junit.jupiter.api.Assertions.fail;

import java.util.function.BooleanSupplier;

/**
 * Polling for conditions reached on other threads
 */
final class Await
{
    private Await() {}

    static void until(BooleanSupplier condition, String what)
    {
        long deadline = System.nanoTime() + 10_000_000_000L;
        while ( ! condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
            {
                fail("timed out waiting for " + what);
            }
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted waiting for " + what);
            }
        }
    }

    /**
     * Run the frame pump until the result buffer has had at least count publishes
     */
    static void published(CalibrationSession session, FrameSource source, long count)
    {
        until(() -> {
            session.submitFrame(source);
            return session.resultBuffer().publishedCount() >= count;
        }, count + " published results");
    }
}
