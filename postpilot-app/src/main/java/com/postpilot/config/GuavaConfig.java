package com.postpilot.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Guava 缓存配置类。
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Configuration
public class GuavaConfig {

    /**
     * 帖子锁缓存：弱引用值，锁无人持有且无人等待时可被回收。
     *
     * @return 帖子 ID → 互斥锁
     */
    @Bean(name = "postLockCache")
    public Cache<Long, ReentrantLock> postLockCache() {
        return CacheBuilder.newBuilder()
                .weakValues()
                .build();
    }

    /**
     * 商家时段锁缓存：串行化同一商家的改期写入。
     *
     * @return 商家 ID → 互斥锁
     */
    @Bean(name = "slotLockCache")
    public Cache<String, ReentrantLock> slotLockCache() {
        return CacheBuilder.newBuilder()
                .weakValues()
                .build();
    }

}
