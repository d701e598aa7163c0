package com.github.salilvnair.convintel.profile.store;

import com.github.salilvnair.convintel.config.ConvIntelProperties;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs profile store calls on a bounded worker pool with a short deadline.
 * <p>
 * Reads degrade to the given fallback on any failure. Writes are retried on
 * {@code PROFILE_STORE_FAILED} up to {@code writeRetries} times; a timed out write is not retried
 * because it may still complete. Domain errors raised by the store (duplicate identity, update
 * conflict) are rethrown for the caller to resolve.
 * A {@code callTimeoutMs} of zero or less runs calls inline without a deadline.
 */
@Slf4j
@Component
public class ProfileCallGuard {

    private final ConvIntelProperties properties;
    private final ThreadPoolExecutor executor;
    private final AtomicLong timeouts = new AtomicLong();

    public ProfileCallGuard(ConvIntelProperties properties) {
        this.properties = properties;
        ConvIntelProperties.Profile config = properties.getProfile();
        if (config.getCallTimeoutMs() <= 0) {
            this.executor = null;
            return;
        }
        int workers = Math.max(1, config.getWorkerThreads());
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, config.getQueueCapacity())),
                new ProfileStoreThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.executor.prestartAllCoreThreads();
    }

    public <T> T read(String operation, Supplier<T> call, T fallback) {
        try {
            T result = execute(operation, call, true);
            return result == null ? fallback : result;
        }
        catch (ConvIntelException e) {
            log.warn("Profile store read degraded operation={} errorCode={} msg={}", operation, e.getErrorCode(), e.getMessage());
            return fallback;
        }
    }

    public <T> T write(String operation, Supplier<T> call, T fallback) {
        int retries = Math.max(0, properties.getProfile().getWriteRetries());
        for (int attempt = 0; ; attempt++) {
            try {
                T result = execute(operation, call, false);
                return result == null ? fallback : result;
            }
            catch (ConvIntelException e) {
                if (e.is(ConvIntelErrorCode.PROFILE_STORE_TIMEOUT)) {
                    log.warn("Profile store write timed out operation={}, not retried", operation);
                    return fallback;
                }
                if (!e.is(ConvIntelErrorCode.PROFILE_STORE_FAILED)) {
                    throw e;
                }
                if (attempt >= retries) {
                    log.warn("Profile store write failed operation={} attempts={} msg={}", operation, attempt + 1, e.getMessage());
                    return fallback;
                }
                log.debug("Retrying profile store write operation={} attempt={}", operation, attempt + 1);
            }
        }
    }

    public long timeoutCount() {
        return timeouts.get();
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private <T> T execute(String operation, Supplier<T> call, boolean cancelOnTimeout) {
        if (executor == null) {
            return invoke(call);
        }
        Future<T> future;
        try {
            future = executor.submit(() -> invoke(call));
        }
        catch (RejectedExecutionException e) {
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_STORE_FAILED, "Profile store queue full for " + operation, e);
        }
        try {
            return future.get(properties.getProfile().getCallTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            timeouts.incrementAndGet();
            if (cancelOnTimeout) {
                future.cancel(true);
            }
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_STORE_TIMEOUT, "Profile store call timed out: " + operation, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_STORE_FAILED, "Interrupted during " + operation, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConvIntelException convIntelException) {
                throw convIntelException;
            }
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_STORE_FAILED, "Profile store call failed: " + operation, cause);
        }
    }

    private static <T> T invoke(Supplier<T> call) {
        try {
            return call.get();
        }
        catch (ConvIntelException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_STORE_FAILED, e.getMessage(), e);
        }
    }

    private static final class ProfileStoreThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "convintel-profile-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
