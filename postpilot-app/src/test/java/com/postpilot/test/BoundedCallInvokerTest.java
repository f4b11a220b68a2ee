package com.postpilot.test;

import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.trigger.application.common.PostLockRegistry;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class BoundedCallInvokerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final BoundedCallInvoker invoker = new BoundedCallInvoker(executor);

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldReturnResultWithinTimeout() {
        Assertions.assertEquals("ok", invoker.call("store.get", Duration.ofSeconds(1), () -> "ok"));
    }

    @Test
    public void shouldFailWithTimeoutAndInterruptSlowCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        AppException ex = Assertions.assertThrows(AppException.class, () -> invoker.call("publisher.publish", Duration.ofMillis(100), () -> {
            try {
                Thread.sleep(10_000L);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "late";
        }));

        Assertions.assertTrue(ex.is(ResponseCode.TIMEOUT));
        Assertions.assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void shouldRethrowRuntimeExceptionsUnchanged() {
        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class,
                () -> invoker.call("store.update", Duration.ofSeconds(1), () -> {
                    throw new IllegalStateException("boom");
                }));

        Assertions.assertEquals("boom", ex.getMessage());
    }

    @Test
    public void shouldWrapCheckedExceptions() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> invoker.call("store.update", null, () -> {
                    throw new IOException("disk");
                }));

        Assertions.assertTrue(ex.is(ResponseCode.UN_ERROR));
        Assertions.assertTrue(ex.getCause() instanceof IOException);
    }

    @Test
    public void shouldRejectSecondHolderOfPostLock() throws Exception {
        PostLockRegistry registry = new PostLockRegistry();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> registry.tryExecute(7L, Duration.ZERO, () -> {
            held.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        Assertions.assertTrue(held.await(2, TimeUnit.SECONDS));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> registry.tryExecute(7L, Duration.ofMillis(50), () -> "second"));
        Assertions.assertTrue(ex.is(ResponseCode.ALREADY_IN_PROGRESS));
        Assertions.assertEquals("other", registry.tryExecute(8L, Duration.ZERO, () -> "other"));

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
        Assertions.assertEquals("third", registry.tryExecute(7L, Duration.ZERO, () -> "third"));
    }
}
