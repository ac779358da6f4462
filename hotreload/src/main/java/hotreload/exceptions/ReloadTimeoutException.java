package hotreload.exceptions;

import java.time.Duration;

/**
 * Exception thrown when a reload phase exceeds its configured timeout.
 *
 * <p>This is an unchecked exception so timeout protection can wrap existing
 * code without changing method signatures.
 *
 * @see hotreload.engine.TimeoutExecutor
 */
public class ReloadTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     */
    public ReloadTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public ReloadTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the name of the operation that timed out.
     *
     * @return the operation name (e.g., "compile", "synthesize")
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the configured timeout that was exceeded.
     *
     * @return the timeout duration
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
