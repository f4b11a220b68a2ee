package com.postpilot.infrastructure.repository.post;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 帖子记录仓储的内存实现。
 * <p>
 * 负责：
 * <ul>
 *   <li>自增 ID 分配</li>
 *   <li>基于 version 的乐观锁更新</li>
 *   <li>读写均做深拷贝，调用方持有的实例与存储内容互不影响</li>
 * </ul>
 * </p>
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Slf4j
@Repository
public class InMemoryPostRecordRepository implements IPostRecordRepository {

    private static final Comparator<PostRecordEntity> SLOT_ORDER = Comparator
            .comparing(PostRecordEntity::getScheduledDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PostRecordEntity::getScheduledTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PostRecordEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<Long, PostRecordEntity> records = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0L);
    private final Clock clock;

    @Autowired
    public InMemoryPostRecordRepository(Clock clock) {
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public InMemoryPostRecordRepository() {
        this(Clock.systemDefaultZone());
    }

    /**
     * 保存实体；创建与更新时间为空时按存储时钟补齐。
     */
    @Override
    public PostRecordEntity save(PostRecordEntity entity) {
        entity.validate();
        PostRecordEntity stored = entity.copy();
        stored.setId(idSequence.incrementAndGet());
        stored.setVersion(0);
        LocalDateTime now = LocalDateTime.now(clock);
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(now);
        }
        if (stored.getUpdatedAt() == null) {
            stored.setUpdatedAt(now);
        }
        records.put(stored.getId(), stored);
        log.debug("Post record saved. postId={}, businessId={}, status={}",
                stored.getId(), stored.getBusinessId(), stored.getStatus());
        return stored.copy();
    }

    @Override
    public PostRecordEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        PostRecordEntity stored = records.get(id);
        return stored == null ? null : stored.copy();
    }

    /**
     * 更新实体 (乐观锁)，更新时间取存储时钟。
     */
    @Override
    public PostRecordEntity update(PostRecordEntity entity) {
        entity.validate();
        Integer oldVersion = entity.getVersion();
        if (oldVersion == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Version cannot be null for PostRecord update: " + entity.getId());
        }
        PostRecordEntity result = records.compute(entity.getId(), (id, current) -> {
            if (current == null) {
                throw new AppException(ResponseCode.NOT_FOUND, "Post record not found: " + id);
            }
            if (!Objects.equals(current.getVersion(), oldVersion)) {
                throw new AppException(ResponseCode.CONFLICT,
                        "Optimistic lock failed for PostRecord: " + id
                                + ", expectedVersion=" + oldVersion + ", actualVersion=" + current.getVersion());
            }
            PostRecordEntity next = entity.copy();
            next.setVersion(oldVersion + 1);
            next.setCreatedAt(current.getCreatedAt());
            next.setUpdatedAt(LocalDateTime.now(clock));
            return next;
        });
        entity.setVersion(result.getVersion());
        return result.copy();
    }

    @Override
    public boolean deleteById(Long id) {
        if (id == null) {
            return false;
        }
        return records.remove(id) != null;
    }

    @Override
    public List<PostRecordEntity> findByBusinessAndDateRange(String businessId, DateWindow window) {
        if (StringUtils.isBlank(businessId) || window == null) {
            return List.of();
        }
        return records.values().stream()
                .filter(post -> businessId.equals(post.getBusinessId()))
                .filter(post -> window.contains(post.getScheduledDate()))
                .sorted(SLOT_ORDER)
                .map(PostRecordEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<PostRecordEntity> findByBusinessId(String businessId) {
        if (StringUtils.isBlank(businessId)) {
            return List.of();
        }
        return records.values().stream()
                .filter(post -> businessId.equals(post.getBusinessId()))
                .sorted(SLOT_ORDER)
                .map(PostRecordEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<PostRecordEntity> findByStatus(PostStatusEnum status) {
        if (status == null) {
            return List.of();
        }
        return records.values().stream()
                .filter(post -> post.getStatus() == status)
                .sorted(SLOT_ORDER)
                .map(PostRecordEntity::copy)
                .collect(Collectors.toList());
    }
}
