package calibrator;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     EventMailbox class                                          */
/*                                     EventMailbox class                                          */
/*                                     EventMailbox class                                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * One-slot event handoff from any poster to the flow thread.
 *
 * Only events in the current mask are accepted. A newer accepted event overwrites one
 * that has not been taken yet, so the flow sees the latest input only.
 */
class EventMailbox
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition eventCondition = lock.newCondition();

    // guarded by lock
    private final EnumSet<FlowEvent> mask = EnumSet.noneOf(FlowEvent.class);
    private FlowEvent pending = FlowEvent.NONE;
    private boolean stopped = false;
    private boolean waiting = false;

    /**
     * Replace the accepted event set. A pending event the new mask does not accept is dropped.
     * @param events accepted events
     */
    void setMask(Set<FlowEvent> events)
    {
        lock.lock();
        try {
            mask.clear();
            mask.addAll(events);
            mask.remove(FlowEvent.NONE);
            if ( ! mask.contains(pending))
            {
                pending = FlowEvent.NONE;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offer an event
     * @param event event
     * @return true if stored, false if not in the mask or stopped
     */
    boolean post(FlowEvent event)
    {
        lock.lock();
        try {
            if (stopped || ! mask.contains(event))
            {
                return false;
            }
            pending = event;
            eventCondition.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for an event and take it
     * @return the event, or NONE once stopped
     */
    FlowEvent await()
    {
        lock.lock();
        try {
            waiting = true;
            while (pending == FlowEvent.NONE && ! stopped)
            {
                eventCondition.awaitUninterruptibly();
            }
            waiting = false;
            if (stopped)
            {
                return FlowEvent.NONE;
            }
            FlowEvent event = pending;
            pending = FlowEvent.NONE;
            return event;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake the waiter whatever the mask; every later await() returns NONE
     */
    void stop()
    {
        lock.lock();
        try {
            stopped = true;
            pending = FlowEvent.NONE;
            eventCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear the stop and the mask so the mailbox can be used again
     */
    void reset()
    {
        lock.lock();
        try {
            stopped = false;
            pending = FlowEvent.NONE;
            mask.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true while a consumer is blocked with no event pending
     */
    boolean isWaiting()
    {
        lock.lock();
        try {
            return waiting && pending == FlowEvent.NONE;
        } finally {
            lock.unlock();
        }
    }

    boolean hasPending()
    {
        lock.lock();
        try {
            return pending != FlowEvent.NONE;
        } finally {
            lock.unlock();
        }
    }
}
