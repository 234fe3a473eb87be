package com.actiongate.failover;

import com.actiongate.error.ActionGateException;
import com.actiongate.error.UpstreamOutcomeUnknownException;
import com.actiongate.error.UpstreamPermanentException;
import com.actiongate.error.UpstreamTransientException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;

/**
 * Wraps driver and upstream calls with a bounded timeout, transient-error retry with exponential
 * backoff, and endpoint rotation on every transient failure.
 *
 * {@link #call} is for idempotent calls and retries; {@link #callOnce} is for broadcast and never
 * retries. A timed-out {@link #callOnce} raises {@link UpstreamOutcomeUnknownException}, since the
 * request may have been delivered.
 */
public class UpstreamCaller {

    private static final Logger log = LoggerFactory.getLogger(UpstreamCaller.class);

    private final FailoverStateStore failoverState;
    private final UpstreamErrorClassifier classifier;
    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;
    private final RetryConfig retryConfig;

    public UpstreamCaller(FailoverStateStore failoverState,
                          UpstreamErrorClassifier classifier,
                          ExecutorService executor,
                          Duration timeout,
                          int maxAttempts,
                          Duration initialBackoff,
                          double backoffMultiplier) {
        this.failoverState = failoverState;
        this.classifier = classifier;
        this.executor = executor;
        this.timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(Math.max(1, maxAttempts))
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier))
            .retryOnException(classifier::isTransient)
            .build();
    }

    public <T> T call(String pool, String operation, Callable<T> callable) {
        Retry retry = Retry.of(pool + ":" + operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} on pool={} attempt={} after {}: {}",
            operation, pool, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
            event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));
        try {
            return retry.executeCallable(() -> attempt(pool, operation, callable));
        } catch (Exception ex) {
            throw translate(operation, ex);
        }
    }

    public <T> T callOnce(String pool, String operation, Callable<T> callable) {
        try {
            return attempt(pool, operation, callable);
        } catch (Exception ex) {
            if (classifier.isTimeout(ex)) {
                throw new UpstreamOutcomeUnknownException(operation + " timed out with unknown outcome: "
                    + describe(ex), ex);
            }
            throw translate(operation, ex);
        }
    }

    private <T> T attempt(String pool, String operation, Callable<T> callable) throws Exception {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(callable));
        } catch (Exception ex) {
            if (classifier.isTransient(ex)) {
                failoverState.rotate(pool, operation + ": " + describe(ex));
            }
            throw ex;
        }
    }

    private RuntimeException translate(String operation, Exception ex) {
        if (ex instanceof InterruptedException || ex instanceof CancellationException) {
            Thread.currentThread().interrupt();
            return new CancellationException(operation + " cancelled");
        }
        if (ex instanceof UpstreamTransientException || ex instanceof UpstreamPermanentException) {
            return (RuntimeException) ex;
        }
        if (classifier.isTransient(ex)) {
            return new UpstreamTransientException(operation + " failed after retries: " + describe(ex), ex);
        }
        String code = ex instanceof ActionGateException coded ? coded.getErrorCode() : "UPSTREAM_PERMANENT";
        return new UpstreamPermanentException(code, operation + " failed: " + describe(ex), ex);
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
