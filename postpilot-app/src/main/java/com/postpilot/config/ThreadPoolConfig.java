package com.postpilot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * boundedCallExecutor 承载存储与发布渠道的限时调用，调用线程只负责等待结果与超时判定。
 * </p>
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * 限时调用线程池：
     * 1) 超时后任务被 cancel(true) 中断，调用方不被外部阻塞；
     * 2) 默认 queue-capacity=0，线程耗尽时按拒绝策略处理而不是排队等待。
     */
    @Bean(name = "boundedCallExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "boundedCallExecutor")
    public ThreadPoolExecutor boundedCallExecutor(
            @Value("${executor.bounded-call.core-size:4}") int coreSize,
            @Value("${executor.bounded-call.max-size:32}") int maxSize,
            @Value("${executor.bounded-call.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.bounded-call.queue-capacity:0}") int queueCapacity,
            @Value("${executor.bounded-call.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.bounded-call.thread-name-prefix:bounded-call-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unsupported rejection policy '{}' for bounded calls, fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
