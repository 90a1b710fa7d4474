package uk.gegc.adaptivequiz.features.oracle.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.oracle.config.OracleProperties;
import uk.gegc.adaptivequiz.shared.exception.OracleUnavailableException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs oracle calls on the oracle executor with a per-attempt timeout and a
 * bounded number of attempts. Exhausting the attempts raises
 * {@link OracleUnavailableException}.
 * <p>
 * Calls are submitted as {@link FutureTask}s so a timed-out attempt interrupts
 * its worker thread. A saturated executor rejects the call instead of running
 * it on the caller's thread.
 */
@Component
@Slf4j
public class OracleCallGuard {

    private final Executor oracleTaskExecutor;
    private final OracleProperties properties;

    public OracleCallGuard(@Qualifier("oracleTaskExecutor") Executor oracleTaskExecutor,
                           OracleProperties properties) {
        this.oracleTaskExecutor = oracleTaskExecutor;
        this.properties = properties;
    }

    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        long timeoutMs = properties.getCallTimeout().toMillis();
        Throwable lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            FutureTask<T> future = new FutureTask<>(action::get);
            try {
                oracleTaskExecutor.execute(future);
            } catch (RejectedExecutionException e) {
                log.warn("Oracle executor saturated, rejecting call '{}'", operation);
                throw new OracleUnavailableException("Content oracle is overloaded, cannot " + operation, e);
            }
            try {
                T result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                if (result == null) {
                    throw new ExecutionException(new IllegalStateException("Oracle returned no result"));
                }
                return result;
            } catch (TimeoutException e) {
                future.cancel(true);
                lastFailure = e;
                log.warn("Oracle call '{}' timed out after {} ms (attempt {}/{})",
                        operation, timeoutMs, attempt, maxAttempts);
            } catch (ExecutionException e) {
                lastFailure = e.getCause() != null ? e.getCause() : e;
                log.warn("Oracle call '{}' failed (attempt {}/{}): {}",
                        operation, attempt, maxAttempts, lastFailure.getMessage());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new OracleUnavailableException("Interrupted while waiting for oracle call: " + operation, e);
            }
        }

        log.error("Oracle call '{}' gave up after {} attempts", operation, maxAttempts, lastFailure);
        throw new OracleUnavailableException(
                "Content oracle failed to " + operation + " after " + maxAttempts + " attempts", lastFailure);
    }
}
