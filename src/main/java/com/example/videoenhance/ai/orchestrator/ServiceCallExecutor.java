package com.example.videoenhance.ai.orchestrator;

import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.config.EnhancementProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Gate for every outbound AI call. A process-wide semaphore bounds how many
 * calls are in flight across all group workers, and retryable failures get a
 * single retry after a backoff.
 */
@Component
public class ServiceCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ServiceCallExecutor.class);

    static final int MAX_ATTEMPTS = 2;

    private final Semaphore permits;
    private final long retryBackoffMs;

    @Autowired
    public ServiceCallExecutor(EnhancementProperties properties) {
        this(properties.getAi().getMaxConcurrentCalls(), properties.getAi().getRetryBackoffMs());
    }

    ServiceCallExecutor(int maxConcurrentCalls, long retryBackoffMs) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("max-concurrent-calls must be at least 1: " + maxConcurrentCalls);
        }
        this.permits = new Semaphore(maxConcurrentCalls, true);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
    }

    /**
     * Runs the call, retrying once if it fails with a retryable {@link ServiceCallException}.
     *
     * @param operation short label for logs, e.g. "enhance group 3"
     * @throws ServiceCallException the last failure when no attempt succeeded
     */
    public <T> T execute(String operation, Supplier<T> call) {
        long delay = retryBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return callWithPermit(operation, call);
            } catch (ServiceCallException e) {
                if (!e.isRetryable() || attempt >= MAX_ATTEMPTS) {
                    log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.info("{} failed (attempt {}/{}), retrying in {}ms: {}",
                         operation, attempt, MAX_ATTEMPTS, delay, e.getMessage());
                sleep(operation, delay, e);
                delay *= 2;
            }
        }
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    private <T> T callWithPermit(String operation, Supplier<T> call) {
        try {
            permits.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ServiceCallException(operation, "interrupted while waiting for a call slot", ie);
        }
        try {
            return call.get();
        } finally {
            permits.release();
        }
    }

    private void sleep(String operation, long delay, ServiceCallException cause) {
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ServiceCallException interrupted =
                new ServiceCallException(cause.getProvider(), operation + " interrupted during retry backoff", ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
