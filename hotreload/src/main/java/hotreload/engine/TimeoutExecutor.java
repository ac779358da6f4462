package hotreload.engine;

import hotreload.exceptions.ReloadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs reload phases with a time limit.
 *
 * <p>A phase that exceeds its limit is interrupted and a
 * {@link ReloadTimeoutException} is thrown. The phase may not react to the
 * interrupt; its result is then discarded when it finishes.
 *
 * @see hotreload.config.HotReloadConfig
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    /** Duration meaning "no limit". */
    public static final Duration NO_TIMEOUT = Duration.ZERO;

    // daemon threads so a stuck phase never keeps the host process alive
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "hotreload-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
        // Utility class
    }

    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Executes a callable with a timeout.
     *
     * <p>Without a timeout ({@link #NO_TIMEOUT} or null) the callable runs on
     * the calling thread.
     *
     * @param operation the name of the operation (for error messages)
     * @param timeout the timeout duration, or null/zero to disable
     * @param callable the operation to execute
     * @param <T> the return type
     * @return the result of the callable
     * @throws ReloadTimeoutException if the operation times out
     * @throws Exception if the callable throws a checked exception
     */
    public static <T> T executeWithTimeout(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return callable.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, EXECUTOR);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new ReloadTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReloadTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new RuntimeException("Operation '" + operation + "' failed", cause);
            }
        }
    }
}
