package com.phillippitts.radflow.service.queue;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion between the action worker and the study poller over the external
 * applications' screen and keyboard focus.
 *
 * <p>The worker {@link #enter() blocks} for the gate around every action. The poller only
 * {@link #tryEnter() tries} it and skips its cycle when an action holds it, so a scrape
 * never observes a screen mid-keystroke and a due cycle is dropped, not queued.
 */
@Component
public class ExternalAccessGate {

    private final ReentrantLock lock = new ReentrantLock();

    public void enter() {
        lock.lock();
    }

    public boolean tryEnter() {
        return lock.tryLock();
    }

    public void exit() {
        lock.unlock();
    }

    public boolean isHeld() {
        return lock.isLocked();
    }
}
