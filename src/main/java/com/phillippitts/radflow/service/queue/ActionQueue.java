package com.phillippitts.radflow.service.queue;

import com.phillippitts.radflow.config.properties.ActionQueueProperties;
import com.phillippitts.radflow.domain.ActionKind;
import com.phillippitts.radflow.domain.ActionRequest;
import com.phillippitts.radflow.domain.ActionSources;
import com.phillippitts.radflow.service.external.ExternalCommander;
import com.phillippitts.radflow.service.external.PresentationSurface;
import com.phillippitts.radflow.service.metrics.OrchestrationMetrics;
import com.phillippitts.radflow.service.queue.event.ActionFailedEvent;
import com.phillippitts.radflow.service.queue.event.ActionRequestedEvent;
import com.phillippitts.radflow.util.Pause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of requested actions drained by a single dedicated worker thread.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>{@link #enqueue(ActionRequest)} never blocks on execution and is safe from any thread.</li>
 *   <li>Exactly one action executes at a time; actions run in enqueue order.</li>
 *   <li>An action that throws, including an {@link Error} other than a
 *       {@link VirtualMachineError}, is logged, surfaced as a toast and published as
 *       {@link ActionFailedEvent}; the loop keeps running.</li>
 *   <li>After every action, whatever its outcome, focus is restored (if configured) and
 *       overlays are re-asserted on top.</li>
 * </ul>
 *
 * <p>The worker holds the {@link ExternalAccessGate} for the whole of each action, which is what
 * makes the study poller skip its cycle while an action runs.
 *
 * <p>Thread-safety: the pending deque is guarded by {@code lock}; the worker waits on
 * {@code signal} with a bounded timeout so it wakes periodically even when idle.
 */
@Service
public class ActionQueue implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ActionQueue.class);
    static final String WORKER_THREAD_NAME = "action-worker";

    private final ActionDispatcher dispatcher;
    private final ExternalAccessGate gate;
    private final ExternalCommander commander;
    private final PresentationSurface presentation;
    private final ActionQueueProperties props;
    private final OrchestrationMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Pause pause;

    private final Deque<ActionRequest> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private final AtomicBoolean busy = new AtomicBoolean();
    private final AtomicLong executed = new AtomicLong();

    private volatile boolean running;
    private volatile Thread worker;

    public ActionQueue(ActionDispatcher dispatcher,
                       ExternalAccessGate gate,
                       ExternalCommander commander,
                       PresentationSurface presentation,
                       ActionQueueProperties props,
                       OrchestrationMetrics metrics,
                       ApplicationEventPublisher publisher,
                       Pause pause) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.commander = Objects.requireNonNull(commander, "commander must not be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.pause = Objects.requireNonNull(pause, "pause must not be null");
    }

    /**
     * Appends a request and wakes the worker. Requests enqueued before {@link #start()} run
     * once the worker starts.
     */
    public void enqueue(ActionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        lock.lock();
        try {
            pending.addLast(request);
            signal.signal();
        } finally {
            lock.unlock();
        }
        LOG.debug("Enqueued {} from {}", request.kind(), request.source());
    }

    @EventListener
    public void onActionRequested(ActionRequestedEvent event) {
        enqueue(event.request());
    }

    /** @return true while an action is executing */
    public boolean isBusy() {
        return busy.get();
    }

    public int depth() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public long executedCount() {
        return executed.get();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this::workerLoop, WORKER_THREAD_NAME);
        t.setDaemon(true);
        worker = t;
        t.start();
        LOG.info("Action worker started");
    }

    /**
     * Stops taking new work and joins the worker for at most {@code actions.shutdown-join-ms}.
     * An action in flight is allowed to finish; requests still pending are dropped.
     */
    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        lock.lock();
        try {
            signal.signalAll();
        } finally {
            lock.unlock();
        }
        Thread t = worker;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(props.getShutdownJoinMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                LOG.warn("Action worker still finishing an action after {}ms", props.getShutdownJoinMs());
            }
        }
        LOG.info("Action worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void workerLoop() {
        while (running) {
            ActionRequest next = awaitNext();
            if (next == null) {
                continue;
            }
            try {
                execute(next);
            } catch (VirtualMachineError e) {
                running = false;
                LOG.fatal("Action worker stopping after {} from {}", next.kind(), next.source(), e);
                throw e;
            } catch (RuntimeException | Error e) {
                LOG.error("Action worker recovered after {} from {}", next.kind(), next.source(), e);
            }
        }
        int dropped = depth();
        if (dropped > 0) {
            LOG.info("Action worker exiting with {} pending request(s) dropped", dropped);
        }
    }

    private ActionRequest awaitNext() {
        lock.lock();
        try {
            if (pending.isEmpty() && running) {
                signal.await(props.getIdleWakeMs(), TimeUnit.MILLISECONDS);
            }
            return running ? pending.pollFirst() : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return null;
        } finally {
            lock.unlock();
        }
    }

    // Package-private for tests that drive execution without the worker thread
    void execute(ActionRequest request) {
        ActionKind kind = request.kind();
        ThreadContext.put("action", kind.name());
        ThreadContext.put("source", request.source());
        long start = System.nanoTime();
        gate.enter();
        busy.set(true);
        try {
            LOG.debug("Executing {} from {}", kind, request.source());
            if (request.isFrom(ActionSources.HOTKEY)) {
                commander.releaseModifiers();
                pause.pause(props.getModifierReleasePauseMs());
            }
            dispatcher.dispatch(request);
            metrics.incrementActionSuccess(kind);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            reportFailure(request, e);
        } finally {
            cleanup();
            busy.set(false);
            gate.exit();
            executed.incrementAndGet();
            metrics.recordActionLatency(kind, System.nanoTime() - start);
            ThreadContext.remove("action");
            ThreadContext.remove("source");
        }
    }

    private void reportFailure(ActionRequest request, Throwable failure) {
        ActionKind kind = request.kind();
        String reason = failure.getClass().getSimpleName();
        LOG.error("Action {} from {} failed", kind, request.source(), failure);
        try {
            metrics.incrementActionFailure(kind, reason);
            publisher.publishEvent(new ActionFailedEvent(kind, request.source(), reason, Instant.now()));
            presentation.showToast("Error: " + (failure.getMessage() == null ? kind.displayName()
                    : failure.getMessage()), props.getErrorToastMs());
        } catch (RuntimeException e) {
            LOG.warn("Could not report failure of {}: {}", kind, e.toString());
        }
    }

    private void cleanup() {
        try {
            if (props.isRestoreFocusAfterAction()) {
                commander.restorePreviousFocus();
            }
            presentation.ensureOverlaysOnTop();
        } catch (RuntimeException e) {
            LOG.warn("Post-action cleanup failed: {}", e.toString());
        }
    }
}
