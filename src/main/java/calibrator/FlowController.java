package calibrator;

import java.util.EnumSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FlowController class                                        */
/*                                     FlowController class                                        */
/*                                     FlowController class                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Drives the operator through welcome, capturing, calibrating and done on the "flow"
 * thread. The operator's input arrives through handleEvent() from any thread.
 *
 * <pre>
 * WELCOME      TOUCH start capturing, MODAL open a dialog (next MODAL closes it)
 * CAPTURING    TOUCH capture a view, BACK_BUTTON undo the last capture or, with
 *              nothing captured since the last BACK_BUTTON, cancel to DONE
 * CALIBRATING  no input accepted until the solver returns
 * DONE         result or cancel message shown, TOUCH back to WELCOME
 * </pre>
 */
public class FlowController
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private static final EnumSet<FlowEvent> WELCOME_EVENTS = EnumSet.of(FlowEvent.TOUCH, FlowEvent.MODAL);
    private static final EnumSet<FlowEvent> MODAL_EVENTS = EnumSet.of(FlowEvent.MODAL);
    private static final EnumSet<FlowEvent> CAPTURING_EVENTS = EnumSet.of(FlowEvent.TOUCH, FlowEvent.BACK_BUTTON);
    private static final EnumSet<FlowEvent> DONE_EVENTS = EnumSet.of(FlowEvent.TOUCH);

    private final CalibrationSession session;
    private final CompletionCallback callback;
    private final EventMailbox mailbox = new EventMailbox();

    private final Object stateLock = new Object();
    private FlowState state = FlowState.NOT_INITED; // guarded by stateLock
    private String statusMessage = ""; // guarded by stateLock

    private final Object lifecycleLock = new Object();
    private Thread thread; // guarded by lifecycleLock
    private volatile boolean stopRequested = false;

    /**
     * @param session calibration to drive
     * @param callback receives the outcome of each calibration run, failed or not
     */
    public FlowController(CalibrationSession session, CompletionCallback callback)
    {
        this.session = session;
        this.callback = callback;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     start                                                       */
/*                                     start                                                       */
/*                                     start                                                       */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Start the flow thread in WELCOME
     * @return false if already running
     */
    public boolean start()
    {
        synchronized (lifecycleLock)
        {
            if (thread != null)
            {
                LOGGER.warning("flow already running");
                return false;
            }
            stopRequested = false;
            mailbox.reset();
            setStatusMessage("");
            setState(FlowState.WELCOME);
            thread = new Thread(this::run, "flow");
            thread.setDaemon(true);
            thread.start();
            return true;
        }
    }

    /**
     * Stop the flow thread and wait for it. If the solver is running this waits for it
     * to return.
     * @return false if not running
     */
    public boolean stop()
    {
        synchronized (lifecycleLock)
        {
            if (thread == null)
            {
                return false;
            }
            stopRequested = true;
            mailbox.stop();
            try {
                thread.join();
            } catch (InterruptedException e) {
                LOGGER.warning("interrupted waiting for flow thread to end");
                Thread.currentThread().interrupt();
            }
            thread = null;
            setState(FlowState.NOT_INITED);
            return true;
        }
    }

    /**
     * Deliver operator input. Any thread.
     * @param event event
     * @return false if the current step does not accept the event; it is discarded
     */
    public boolean handleEvent(FlowEvent event)
    {
        boolean accepted = mailbox.post(event);
        LOGGER.finer(event + (accepted ? " accepted" : " ignored"));
        return accepted;
    }

    public FlowState state()
    {
        synchronized (stateLock)
        {
            return state;
        }
    }

    /**
     * @return text for a status bar; empty if nothing to show
     */
    public String statusMessage()
    {
        synchronized (stateLock)
        {
            return statusMessage;
        }
    }

    /**
     * @return true while the flow thread is blocked waiting for input
     */
    boolean isWaitingForEvent()
    {
        return mailbox.isWaiting();
    }

    private void setState(FlowState newState)
    {
        synchronized (stateLock)
        {
            if (state != newState)
            {
                LOGGER.fine("flow state " + state + " -> " + newState);
            }
            state = newState;
        }
    }

    private void setStatusMessage(String message)
    {
        synchronized (stateLock)
        {
            statusMessage = message;
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     run                                                         */
/*                                     run                                                         */
/*                                     run                                                         */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    private void run()
    {
        LOGGER.fine("Start flow thread");

        while ( ! stopRequested)
        {
            setState(FlowState.WELCOME);
            if ( ! welcome())
            {
                continue; // re-evaluate the welcome step, or stop
            }

            if (capturing())
            {
                calibrating();
            }
            else if (stopRequested)
            {
                break;
            }
            else
            {
                setStatusMessage("Calibration canceled");
                LOGGER.info("Calibration canceled");
                mailbox.setMask(DONE_EVENTS);
                setState(FlowState.DONE);
            }

            // done; wait for acknowledgement
            if (awaitEvent(DONE_EVENTS) == FlowEvent.NONE)
            {
                break;
            }
            setStatusMessage("");
        }

        LOGGER.fine("End flow thread");
    }

    /**
     * @return true to start capturing, false to repeat the welcome step or stop
     */
    private boolean welcome()
    {
        FlowEvent event = awaitEvent(WELCOME_EVENTS);
        if (event == FlowEvent.MODAL)
        {
            LOGGER.fine("dialog open");
            awaitEvent(MODAL_EVENTS);
            LOGGER.fine("dialog closed");
            return false;
        }
        return event == FlowEvent.TOUCH;
    }

    /**
     * @return true when the capture target was reached, false if cancelled or stopping
     */
    private boolean capturing()
    {
        setState(FlowState.CAPTURING);
        boolean capturedSinceLastBack = false;

        while (session.capturedCount() < session.maxCount())
        {
            String progress = String.format("Capturing image %d/%d", session.capturedCount() + 1, session.maxCount());
            setStatusMessage(progress);
            LOGGER.info(progress);

            FlowEvent event = awaitEvent(CAPTURING_EVENTS);
            if (event == FlowEvent.TOUCH)
            {
                if (session.capture())
                {
                    capturedSinceLastBack = true;
                }
                else
                {
                    LOGGER.fine("capture refused, pattern not found");
                }
            }
            else if (event == FlowEvent.BACK_BUTTON)
            {
                if (capturedSinceLastBack)
                {
                    session.uncapture();
                    capturedSinceLastBack = false;
                }
                else
                {
                    session.uncaptureAll();
                    return false;
                }
            }
            else
            {
                return false; // stopping
            }
        }
        return true;
    }

    private void calibrating()
    {
        mailbox.setMask(EnumSet.noneOf(FlowEvent.class)); // not cancelable
        setState(FlowState.CALIBRATING);
        setStatusMessage("Calculating camera parameters...");

        CalibrationOutcome outcome = session.computeCalibration();
        try {
            callback.calibrationCompleted(outcome);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "calibration completion handler failed", e);
        }
        session.uncaptureAll();

        setStatusMessage(outcome.summary());
        LOGGER.info(outcome.summary());
        mailbox.setMask(DONE_EVENTS);
        setState(FlowState.DONE);
    }

    private FlowEvent awaitEvent(EnumSet<FlowEvent> accepted)
    {
        mailbox.setMask(accepted);
        FlowEvent event = mailbox.await();
        LOGGER.finer("flow got " + event);
        return event;
    }
}
