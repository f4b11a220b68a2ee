package com.postpilot.trigger.application.common;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按帖子 ID 的互斥锁注册表，另含按商家的排期时段锁。
 * <p>
 * 锁实例缓存在弱引用值的 Guava Cache 中，无人持有时可被回收；同一时刻每个 ID 只对应一把锁。
 * 加锁顺序固定为先帖子锁、后时段锁，时段锁内不再获取帖子锁。
 * </p>
 */
@Slf4j
@Component
public class PostLockRegistry {

    private final Cache<Long, ReentrantLock> locks;
    private final Cache<String, ReentrantLock> slotLocks;

    @Autowired
    public PostLockRegistry(@Qualifier("postLockCache") Cache<Long, ReentrantLock> locks,
                            @Qualifier("slotLockCache") Cache<String, ReentrantLock> slotLocks) {
        this.locks = locks;
        this.slotLocks = slotLocks;
    }

    public PostLockRegistry() {
        this(CacheBuilder.newBuilder().weakValues().build(), CacheBuilder.newBuilder().weakValues().build());
    }

    /**
     * 在锁内执行，等待 wait 仍未获取到锁时抛出 ALREADY_IN_PROGRESS。
     */
    public <T> T tryExecute(Long postId, Duration wait, Supplier<T> action) {
        ReentrantLock lock = lockOf(postId);
        boolean acquired;
        try {
            long waitNanos = wait == null || wait.isNegative() ? 0L : wait.toNanos();
            acquired = waitNanos == 0L ? lock.tryLock() : lock.tryLock(waitNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.ALREADY_IN_PROGRESS, "Interrupted while waiting for post " + postId, ex);
        }
        if (!acquired) {
            log.debug("Post lock busy. postId={}", postId);
            throw new AppException(ResponseCode.ALREADY_IN_PROGRESS, "Post " + postId + " has an operation in progress");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在锁内执行，阻塞等待直至获取到锁。仅用于临界区很短的收尾写入。
     */
    public <T> T execute(Long postId, Supplier<T> action) {
        ReentrantLock lock = lockOf(postId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在商家时段锁内执行，阻塞等待。用于“检查时段空闲 + 写入”必须原子完成的场景。
     */
    public <T> T executeOnSlots(String businessId, Supplier<T> action) {
        if (businessId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Business id cannot be null");
        }
        ReentrantLock lock;
        try {
            lock = slotLocks.get(businessId, ReentrantLock::new);
        } catch (ExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to obtain slot lock for business " + businessId, ex);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(Long postId) {
        ReentrantLock lock = locks.getIfPresent(postId);
        return lock != null && lock.isLocked();
    }

    private ReentrantLock lockOf(Long postId) {
        if (postId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Post id cannot be null");
        }
        try {
            return locks.get(postId, ReentrantLock::new);
        } catch (ExecutionException ex) {
            throw new AppException(ResponseCode.UN_ERROR, "Failed to obtain lock for post " + postId, ex);
        }
    }
}
