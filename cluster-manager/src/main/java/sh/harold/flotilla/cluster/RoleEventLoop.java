package sh.harold.flotilla.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single thread owning the state of a manager or worker: the periodic tick, lobby callbacks and
 * chat commands all run on it, one at a time.
 */
public final class RoleEventLoop {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoleEventLoop.class);

    private final ScheduledExecutorService scheduler;
    private volatile Thread loopThread;
    private ScheduledFuture<?> tickTask;

    public RoleEventLoop(String name) {
        Objects.requireNonNull(name, "name");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    /**
     * Starts the periodic tick. Exceptions thrown by the tick are logged and do not cancel it.
     */
    public synchronized void startTick(Runnable tick, Duration interval) {
        if (tickTask != null) {
            return;
        }
        tickTask = scheduler.scheduleWithFixedDelay(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                LOGGER.error("Unexpected error during periodic check", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Queues a task, fire-and-forget. Tasks queued after {@link #stop()} are dropped.
     */
    public void execute(Runnable task) {
        if (isLoopThread()) {
            task.run();
            return;
        }
        if (scheduler.isShutdown()) {
            LOGGER.debug("Event loop stopped, dropping event");
            return;
        }
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOGGER.error("Unexpected error while processing event", e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Event loop stopped, dropping event");
        }
    }

    /**
     * Runs a task on the loop and waits for its result.
     *
     * @throws IllegalStateException if the task failed, the loop is stopped or the caller was interrupted
     */
    public <T> T call(Callable<T> task) {
        if (isLoopThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        Future<T> future;
        try {
            future = scheduler.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Event loop is stopped", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IllegalStateException("Interrupted while waiting for event loop", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Stops the tick and the loop thread, letting an already running task finish.
     */
    public synchronized void stop() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        scheduler.shutdown();
        if (isLoopThread()) {
            return;
        }
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Event loop did not terminate in time, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    private boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }
}
