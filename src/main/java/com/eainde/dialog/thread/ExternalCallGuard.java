package com.eainde.dialog.thread;

import com.eainde.dialog.exception.ExternalCallTimeoutException;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Puts a deadline on a blocking external call (model inference, tool execution).
 * A {@code null} or non-positive timeout runs the call on the calling thread without a deadline.
 */
@Log4j2
public class ExternalCallGuard {

    private final Executor executor;

    public ExternalCallGuard(Executor executor) {
        this.executor = executor;
    }

    public static ExternalCallGuard direct() {
        return new ExternalCallGuard(Runnable::run);
    }

    public <T> T call(String operation, Duration timeout, Callable<T> task) throws Exception {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return task.call();
        }

        FutureTask<T> future = new FutureTask<>(task);
        executor.execute(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}ms", operation, timeout.toMillis());
            throw new ExternalCallTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
