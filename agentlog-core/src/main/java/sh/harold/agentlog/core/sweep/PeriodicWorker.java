package sh.harold.agentlog.core.sweep;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a unit of work repeatedly, waiting {@code interval} after each run completes.
 *
 * <p>Runs never overlap: a scheduled tick and a manual {@link #runNow()} share one lock, so the
 * second caller waits for the first to finish. {@link #close()} stops future ticks and raises a
 * cancellation flag that in-flight work can poll through {@link #isCancelled()}. The scheduler is
 * owned by the caller.
 */
public abstract class PeriodicWorker<R> implements AutoCloseable {
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final System.Logger logger;
    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Object armLock = new Object();
    private ScheduledFuture<?> pending;

    protected PeriodicWorker(Duration interval, ScheduledExecutorService scheduler, System.Logger logger) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.logger = Objects.requireNonNull(logger, "logger");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0.");
        }
    }

    protected abstract R doWork();

    public void start() {
        if (cancelled.get()) {
            throw new IllegalStateException("Worker has been closed.");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        arm();
    }

    /**
     * Runs the work on the calling thread, waiting for any in-flight run to finish first.
     *
     * @return the result, or empty when the worker was closed or the caller was interrupted
     */
    public Optional<R> runNow() {
        try {
            runLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        try {
            if (cancelled.get()) {
                return Optional.empty();
            }
            return Optional.ofNullable(doWork());
        } finally {
            runLock.unlock();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    public Duration interval() {
        return interval;
    }

    private void arm() {
        synchronized (armLock) {
            if (cancelled.get()) {
                return;
            }
            try {
                pending = scheduler.schedule(this::tick, delayMillis(interval), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.log(System.Logger.Level.WARNING, "Scheduler rejected next run; stopping.", e);
            }
        }
    }

    static long delayMillis(Duration interval) {
        try {
            return interval.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void tick() {
        try {
            runNow();
        } catch (RuntimeException e) {
            logger.log(System.Logger.Level.WARNING, "Periodic work failed.", e);
        } finally {
            arm();
        }
    }

    @Override
    public void close() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        synchronized (armLock) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }
}
