package com.market.chat.infrastructure;

import com.market.chat.exception.ChatErrorCode;
import com.market.chat.exception.ChatException;
import com.market.chat.exception.ChatTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs store and codec calls with an upper bound on how long the caller waits.
 *
 * <p>A timeout only releases the caller: the call itself keeps running, so a
 * write that was already issued may still commit.
 */
@Component
@Slf4j
public class BoundedCallExecutor {

    private final ExecutorService executor;
    private final long storeTimeoutMs;
    private final long codecTimeoutMs;

    public BoundedCallExecutor(
            @Qualifier("chatPipelineExecutor") ExecutorService executor,
            @Value("${chat.pipeline.store-timeout-ms:10000}") long storeTimeoutMs,
            @Value("${chat.pipeline.codec-timeout-ms:5000}") long codecTimeoutMs) {
        this.executor = executor;
        this.storeTimeoutMs = storeTimeoutMs;
        this.codecTimeoutMs = codecTimeoutMs;
    }

    public <T> T store(String operation, Supplier<T> call) {
        return call(operation, call, storeTimeoutMs);
    }

    public void storeRun(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        }, storeTimeoutMs);
    }

    public <T> T codec(String operation, Supplier<T> call) {
        return call(operation, call, codecTimeoutMs);
    }

    /**
     * Fire and forget on the same pool; failures are logged.
     */
    public void runAsync(String operation, Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.warn("Background task failed: operation={}, error={}", operation, e.getMessage());
            }
        });
    }

    <T> T call(String operation, Supplier<T> call, long timeoutMs) {
        Future<T> future = executor.submit((Callable<T>) call::get);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("⏱️ {} exceeded {}ms, caller released", operation, timeoutMs);
            throw new ChatTimeoutException();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatTimeoutException("Request interrupted. Please try again.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ChatException(operation + " failed", cause, ChatErrorCode.INTERNAL_ERROR);
        }
    }
}
