package com.postpilot.trigger.application.common;

import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 限时调用：外部存储与发布渠道的调用都经由这里，超时抛出 TIMEOUT 并取消后台任务。
 */
@Slf4j
@Component
public class BoundedCallInvoker {

    private final ExecutorService executor;

    @Autowired
    public BoundedCallInvoker(@Qualifier("boundedCallExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @param timeout 为空或非正数时在当前线程直接调用
     */
    public <T> T call(String operation, Duration timeout, Callable<T> callable) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return callDirectly(operation, callable);
        }

        Future<T> future;
        try {
            future = executor.submit(callable);
        } catch (RejectedExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR, operation + " rejected by executor", ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Bounded call timed out. operation={}, timeoutMs={}", operation, timeout.toMillis());
            throw new AppException(ResponseCode.TIMEOUT, operation + " exceeded " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.UN_ERROR, operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            throw unwrap(operation, ex.getCause());
        }
    }

    public void run(String operation, Duration timeout, Runnable runnable) {
        call(operation, timeout, () -> {
            runnable.run();
            return null;
        });
    }

    private <T> T callDirectly(String operation, Callable<T> callable) {
        try {
            return callable.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw unwrap(operation, ex);
        }
    }

    private RuntimeException unwrap(String operation, Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new AppException(ResponseCode.UN_ERROR, operation + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    }
}
