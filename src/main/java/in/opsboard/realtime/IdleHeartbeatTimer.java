package in.opsboard.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * One-shot idle timer for a single session.
 *
 * Every {@link #arm()} replaces the pending timeout and bumps a generation counter; the timeout
 * callback receives the generation it was armed with so a late-firing task can recognise that a
 * client frame re-armed the timer in the meantime.
 *
 * Usage:
 * <pre>
 * IdleHeartbeatTimer timer = new IdleHeartbeatTimer(
 *     "conn-42",
 *     scheduler,
 *     Duration.ofSeconds(30),
 *     generation -> session.onIdleTimeout(generation)
 * );
 * timer.arm();      // after connect, after every client frame, after every heartbeat
 * timer.disarm();   // on close
 * </pre>
 */
public final class IdleHeartbeatTimer {
    private static final Logger log = LoggerFactory.getLogger(IdleHeartbeatTimer.class);

    private final String connectionId;
    private final ScheduledExecutorService scheduler;
    private final Duration idleTimeout;
    private final LongConsumer onTimeout;

    private ScheduledFuture<?> pending;
    private long generation;

    public IdleHeartbeatTimer(String connectionId, ScheduledExecutorService scheduler,
                              Duration idleTimeout, LongConsumer onTimeout) {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
        }
        this.connectionId = connectionId;
        this.scheduler = scheduler;
        this.idleTimeout = idleTimeout;
        this.onTimeout = onTimeout;
    }

    /**
     * (Re)start the idle countdown.
     */
    public synchronized void arm() {
        cancelPending();
        long armedGeneration = ++generation;
        try {
            pending = scheduler.schedule(() -> fire(armedGeneration), idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // Scheduler already shut down: the server is stopping.
            log.debug("[{}] idle timer not armed: scheduler is shut down", connectionId);
            pending = null;
        }
    }

    /**
     * Cancel the countdown. A task already running sees a stale generation and does nothing.
     */
    public synchronized void disarm() {
        cancelPending();
        generation++;
    }

    public synchronized boolean isCurrent(long armedGeneration) {
        return pending != null && generation == armedGeneration;
    }

    private void fire(long armedGeneration) {
        try {
            onTimeout.accept(armedGeneration);
        } catch (Exception e) {
            log.error("[{}] idle timeout handler failed", connectionId, e);
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }
}
