package com.phillippitts.radflow.service.dictation;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guarded belief about whether the reporting app is recording dictation.
 *
 * <p>Mutated only by the background sync and by manual toggles. Reads and writes of
 * {@code believed}, {@code consecutiveFalseReads} and {@code lastManualToggle} happen under one lock.
 *
 * <p>Probe policy (asymmetric debounce):
 * <ul>
 *   <li>A {@code true} reading resets the false-read counter and turns the belief on at once.</li>
 *   <li>A {@code false} reading increments the counter; the belief turns off only once the
 *       counter reaches the sticky-off threshold.</li>
 *   <li>Within the lockout window after a manual toggle the belief is not overwritten, though
 *       the counter and the debounced indicator reading still advance.</li>
 * </ul>
 */
final class DictationState {

    /**
     * Result of applying one probe reading.
     *
     * @param believed         belief after the reading
     * @param beliefChanged    whether this reading changed the belief
     * @param indicator        debounced reading for the recording indicator
     * @param indicatorChanged whether the debounced reading changed
     */
    record SyncOutcome(boolean believed, boolean beliefChanged, boolean indicator, boolean indicatorChanged) { }

    private final ReentrantLock lock = new ReentrantLock();

    private boolean believed;
    private int consecutiveFalseReads;
    private Instant lastManualToggle;
    private boolean indicator;

    SyncOutcome applyProbe(boolean active, Instant now, int stickyOffThreshold, Duration lockout) {
        lock.lock();
        try {
            if (active) {
                consecutiveFalseReads = 0;
            } else {
                consecutiveFalseReads++;
            }
            boolean confirmedOff = !active && consecutiveFalseReads >= stickyOffThreshold;

            boolean previousIndicator = indicator;
            if (active) {
                indicator = true;
            } else if (confirmedOff) {
                indicator = false;
            }

            boolean changed = false;
            if (!isLockedOut(now, lockout) && active != believed && (active || confirmedOff)) {
                believed = active;
                changed = true;
            }
            return new SyncOutcome(believed, changed, indicator, indicator != previousIndicator);
        } finally {
            lock.unlock();
        }
    }

    private boolean isLockedOut(Instant now, Duration lockout) {
        return lastManualToggle != null && Duration.between(lastManualToggle, now).compareTo(lockout) < 0;
    }

    void recordManualToggle(Instant now) {
        lock.lock();
        try {
            lastManualToggle = now;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the belief optimistically after a manual action.
     */
    void setBelieved(boolean value) {
        lock.lock();
        try {
            believed = value;
            indicator = value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flips the belief and records the toggle time.
     *
     * @return the new belief
     */
    boolean toggle(Instant now) {
        lock.lock();
        try {
            believed = !believed;
            indicator = believed;
            lastManualToggle = now;
            return believed;
        } finally {
            lock.unlock();
        }
    }

    boolean believed() {
        lock.lock();
        try {
            return believed;
        } finally {
            lock.unlock();
        }
    }

    int consecutiveFalseReads() {
        lock.lock();
        try {
            return consecutiveFalseReads;
        } finally {
            lock.unlock();
        }
    }

    Instant lastManualToggle() {
        lock.lock();
        try {
            return lastManualToggle;
        } finally {
            lock.unlock();
        }
    }
}
