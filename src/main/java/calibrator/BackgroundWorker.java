package calibrator;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     BackgroundWorker class                                      */
/*                                     BackgroundWorker class                                      */
/*                                     BackgroundWorker class                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * A dedicated thread that runs the same job each time it is signalled to start.
 *
 * Life of a cycle: idle -> submit() -> busy -> job ends -> complete (pollComplete() true)
 * -> await() -> idle. submit() is refused while a cycle is anywhere between submit and
 * await so there is never more than one job in flight, and whoever submitted must
 * collect the completion with await() before the next submit.
 */
public class BackgroundWorker implements AutoCloseable
{
    private static Logger LOGGER;
    static {
      LOGGER = Logger.getLogger("");
      LOGGER.finer("Loading");
    }

    private final String name;
    private final Runnable job;
    private final Thread thread;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition startCondition = lock.newCondition();
    private final Condition endCondition = lock.newCondition();
    // all guarded by lock
    private boolean startRequested = false;
    private boolean busy = false;
    private boolean complete = false;
    private boolean stopRequested = false;

    /**
     * Start the worker thread; it waits for the first submit()
     * @param name thread name
     * @param job work to do each cycle
     */
    public BackgroundWorker(String name, Runnable job)
    {
        this.name = name;
        this.job = job;
        this.thread = new Thread(this::run, name);
        this.thread.setDaemon(true);
        this.thread.start();
    }

    /**
     * Start a cycle if the worker is idle. Never blocks.
     * @return true if the job was started, false if busy or stopped
     */
    public boolean submit()
    {
        lock.lock();
        try {
            if (busy || stopRequested)
            {
                return false;
            }
            busy = true;
            startRequested = true;
            startCondition.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the last submitted job has finished and await() has not yet been called
     */
    public boolean pollComplete()
    {
        lock.lock();
        try {
            return complete;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true from submit() until await() returns
     */
    public boolean isBusy()
    {
        lock.lock();
        try {
            return busy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the submitted job to finish and reset the worker to idle.
     * Returns at once if nothing is in flight or the worker was stopped.
     * @return true if a completed job was collected
     */
    public boolean await()
    {
        lock.lock();
        try {
            if ( ! busy)
            {
                return false;
            }
            while ( ! complete && ! stopRequested)
            {
                endCondition.awaitUninterruptibly();
            }
            boolean collected = complete;
            complete = false;
            busy = false;
            return collected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask the thread to end. A job already running finishes first.
     */
    public void requestStop()
    {
        lock.lock();
        try {
            stopRequested = true;
            startCondition.signalAll();
            endCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop and wait for the thread to end
     */
    @Override
    public void close()
    {
        requestStop();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(10));
            if (thread.isAlive())
            {
                LOGGER.warning(name + " thread did not end");
            }
        } catch (InterruptedException e) {
            LOGGER.warning("interrupted waiting for " + name + " thread to end");
            Thread.currentThread().interrupt();
        }
    }

    private boolean waitForStart()
    {
        lock.lock();
        try {
            while ( ! startRequested && ! stopRequested)
            {
                startCondition.awaitUninterruptibly();
            }
            startRequested = false;
            return ! stopRequested;
        } finally {
            lock.unlock();
        }
    }

    private void signalEnd()
    {
        lock.lock();
        try {
            complete = true;
            endCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void run()
    {
        LOGGER.fine("Start " + name + " thread");

        while (waitForStart())
        {
            try {
                job.run();
            } catch (RuntimeException e) {
                // the cycle still completes so the submitter is never left waiting
                LOGGER.log(Level.SEVERE, name + " job failed", e);
            }
            signalEnd();
        }

        LOGGER.fine("End " + name + " thread");
    }
}
