package eu.okaeri.cellstore.util;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Retries establishing a connection (e.g. the pool of a cell store) with exponential backoff.
 * <p>
 * Defaults come from system properties:
 * <ul>
 *   <li>{@code okaeri.cellstore.connectRetry.initialBackoffMs} (default: 1000)</li>
 *   <li>{@code okaeri.cellstore.connectRetry.maxBackoffMs} (default: 30000)</li>
 *   <li>{@code okaeri.cellstore.connectRetry.multiplier} (default: 2.0)</li>
 *   <li>{@code okaeri.cellstore.connectRetry.timeoutMs}, 0 for no timeout (default: 300000)</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public final class ConnectionRetry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRetry.class.getSimpleName());
    private static final String PROPERTY_PREFIX = "okaeri.cellstore.connectRetry.";

    @Builder.Default
    private final Duration initialBackoff = Duration.ofMillis(longProperty("initialBackoffMs", 1000));
    @Builder.Default
    private final Duration maxBackoff = Duration.ofMillis(longProperty("maxBackoffMs", 30_000));
    @Builder.Default
    private final double multiplier = Double.parseDouble(System.getProperty(PROPERTY_PREFIX + "multiplier", "2.0"));
    @Builder.Default
    private final Duration timeout = Duration.ofMillis(longProperty("timeoutMs", 300_000));

    public static ConnectionRetry defaults() {
        return builder().build();
    }

    /**
     * @param context name used in log messages, e.g. the jdbc url
     * @throws ConnectionException when the timeout elapses or the thread is interrupted
     */
    public <T> T connect(@NonNull String context, @NonNull Callable<T> connector) {

        if (this.multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }

        Instant deadline = this.timeout.isZero() ? null : Instant.now().plus(this.timeout);
        Duration backoff = this.initialBackoff;

        for (int attempt = 1; ; attempt++) {
            try {
                return connector.call();
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("interrupted while connecting to " + context, exception);
            } catch (Exception exception) {

                if ((deadline != null) && Instant.now().plus(backoff).isAfter(deadline)) {
                    throw new ConnectionException("cannot connect to " + context + " (" + attempt + " attempts)", exception);
                }

                String cause = (exception.getCause() == null) ? "" : (" caused by " + exception.getCause().getMessage());
                LOGGER.severe("[" + context + "] Cannot connect (attempt " + attempt + ", waiting "
                    + backoff.toMillis() + "ms): " + exception.getMessage() + cause);

                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ConnectionException("interrupted while connecting to " + context, interrupted);
                }

                long next = (long) (backoff.toMillis() * this.multiplier);
                backoff = Duration.ofMillis(Math.min(next, this.maxBackoff.toMillis()));
            }
        }
    }

    private static long longProperty(String name, long defaultValue) {
        return Long.parseLong(System.getProperty(PROPERTY_PREFIX + name, String.valueOf(defaultValue)));
    }

    public static class ConnectionException extends RuntimeException {
        public ConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
