package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs storage operations with exponential-backoff retry for transient failures.
 * Anything the classifier rejects is rethrown on the first attempt.
 */
@Component
public class StorageRetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(StorageRetryExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final Predicate<Throwable> defaultClassifier;
    private final Sleeper sleeper;

    @Autowired
    public StorageRetryExecutor(ReviewflowProperties reviewflowProperties,
                                TransientErrorClassifier transientErrorClassifier) {
        this(RetryPolicy.from(reviewflowProperties.getRetry()), transientErrorClassifier, Sleeper.THREAD);
    }

    public StorageRetryExecutor(RetryPolicy defaultPolicy, Predicate<Throwable> defaultClassifier, Sleeper sleeper) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy is required");
        this.defaultClassifier = Objects.requireNonNull(defaultClassifier, "defaultClassifier is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    public <T> T execute(String label, Supplier<T> operation) {
        return withRetry(label, operation, defaultClassifier, defaultPolicy);
    }

    public void run(String label, Runnable operation) {
        withRetry(label, () -> {
            operation.run();
            return null;
        }, defaultClassifier, defaultPolicy);
    }

    public <T> T withRetry(String label,
                           Supplier<T> operation,
                           Predicate<Throwable> isRetryable,
                           RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(isRetryable, "isRetryable is required");
        Objects.requireNonNull(policy, "policy is required");

        int retriesUsed = 0;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException ex) {
                if (retriesUsed >= policy.maxRetries() || !isRetryable.test(ex)) {
                    if (retriesUsed > 0) {
                        log.warn("Giving up on {} after {} attempt(s)", label, retriesUsed + 1);
                    }
                    throw ex;
                }

                Duration backoff = policy.delayBeforeRetry(retriesUsed);
                retriesUsed++;
                log.warn(
                        "Transient error on {} (attempt {}/{}), retrying in {} ms: {}",
                        label,
                        retriesUsed,
                        policy.maxRetries() + 1,
                        backoff.toMillis(),
                        ex.getMessage()
                );
                pause(label, backoff, ex);
            }
        }
    }

    private void pause(String label, Duration backoff, RuntimeException lastError) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            IllegalStateException aborted = new IllegalStateException("Interrupted while retrying " + label, interrupted);
            aborted.addSuppressed(lastError);
            throw aborted;
        }
    }
}
