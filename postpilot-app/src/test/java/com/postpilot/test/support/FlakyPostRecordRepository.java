package com.postpilot.test.support;

import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.infrastructure.repository.post.InMemoryPostRecordRepository;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 可注入故障的内存仓储：第 N 次保存失败、删除失败。
 */
public class FlakyPostRecordRepository extends InMemoryPostRecordRepository {

    private final AtomicInteger saveCount = new AtomicInteger(0);
    private volatile int failOnSave = -1;
    private volatile boolean failDelete;

    public FlakyPostRecordRepository failOnSave(int nth) {
        this.failOnSave = nth;
        return this;
    }

    public FlakyPostRecordRepository failDelete() {
        this.failDelete = true;
        return this;
    }

    @Override
    public PostRecordEntity save(PostRecordEntity entity) {
        if (saveCount.incrementAndGet() == failOnSave) {
            throw new IllegalStateException("store unavailable on save #" + failOnSave);
        }
        return super.save(entity);
    }

    @Override
    public boolean deleteById(Long id) {
        if (failDelete) {
            throw new IllegalStateException("store unavailable on delete " + id);
        }
        return super.deleteById(id);
    }
}
