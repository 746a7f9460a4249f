package eventbus.util;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Set of detached tasks that are still running, so that shutdown can join them.
 *
 * <p>Tasks remove themselves when they complete. This class is thread-safe.
 */
public final class TaskTracker {
    private static final Logger logger = Logger.getLogger(TaskTracker.class.getName());

    private final Set<CompletableFuture<?>> tasks = ConcurrentHashMap.newKeySet();

    /**
     * Tracks a task until it completes.
     *
     * @param task the task
     * @param <T>  result type
     * @return the same task
     */
    public <T> CompletableFuture<T> track(CompletableFuture<T> task) {
        tasks.add(task);
        task.whenComplete((result, error) -> tasks.remove(task));
        return task;
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Waits for every currently tracked task to complete.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if all tasks completed in time
     */
    public boolean awaitAll(Duration timeout) {
        CompletableFuture<?>[] snapshot = tasks.toArray(new CompletableFuture<?>[0]);
        if (snapshot.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(snapshot).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            logger.log(Level.FINE, "A tracked task completed exceptionally", e.getCause());
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Cancels every tracked task that has not completed.
     *
     * @return number of tasks cancelled
     */
    public int cancelAll() {
        int cancelled = 0;
        for (CompletableFuture<?> task : tasks) {
            if (task.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }
}
