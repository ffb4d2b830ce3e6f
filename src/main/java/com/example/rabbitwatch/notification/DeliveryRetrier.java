package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one delivery with retries. Transient failures are retried up to
 * {@code maxRetries} more times, sleeping {@code baseDelay * 2^attempt}
 * before each retry; a terminal failure stops immediately. Never throws:
 * every outcome is folded into a {@link DeliveryResult}.
 */
@Slf4j
@Component
public class DeliveryRetrier {

    @FunctionalInterface
    public interface Attempt {
        /** Perform one transport call and return its status code, or null when there is none. */
        Integer run() throws TransientDeliveryException, TerminalDeliveryException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long baseDelayMillis;
    private final Sleeper sleeper;

    @Autowired
    public DeliveryRetrier(RabbitWatchProperties properties) {
        this(properties.getNotifications().getRetry().getMaxRetries(),
                properties.getNotifications().getRetry().getBaseDelayMillis(),
                Thread::sleep);
    }

    public DeliveryRetrier(int maxRetries, long baseDelayMillis, Sleeper sleeper) {
        this.maxRetries = maxRetries;
        this.baseDelayMillis = baseDelayMillis;
        this.sleeper = sleeper;
    }

    public DeliveryResult execute(String label, Attempt attempt) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                Integer status = attempt.run();
                if (attempts > 1) {
                    log.info("Delivery to {} succeeded on attempt {}", label, attempts);
                }
                return DeliveryResult.success(status, attempts);
            } catch (TerminalDeliveryException e) {
                log.error("Delivery to {} failed permanently: {}", label, e.getMessage());
                return DeliveryResult.failure(e.getStatusCode(), attempts, e.getMessage());
            } catch (TransientDeliveryException e) {
                int retry = attempts - 1;
                if (retry >= maxRetries) {
                    log.error("Delivery to {} failed after {} attempts: {}", label, attempts, e.getMessage());
                    return DeliveryResult.failure(e.getStatusCode(), attempts, e.getMessage());
                }
                long delay = delayFor(retry);
                log.warn("Delivery to {} failed (attempt {}), retrying in {}ms: {}",
                        label, attempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return DeliveryResult.failure(e.getStatusCode(), attempts, "Interrupted while waiting to retry");
                }
            } catch (RuntimeException e) {
                log.error("Delivery to {} failed unexpectedly", label, e);
                return DeliveryResult.failure(null, attempts, "Unexpected error: " + e.getClass().getSimpleName());
            }
        }
    }

    /** Delay before retry number {@code retry + 1}. */
    long delayFor(int retry) {
        return baseDelayMillis * (1L << retry);
    }
}
