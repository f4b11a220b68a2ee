package com.postpilot.domain.post.adapter.repository;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.types.enums.PostStatusEnum;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 帖子存储端口，具体持久化方式由外部实现。
 *
 * @author postpilot
 * @since 2026-09-14
 */
public interface IPostRecordRepository {

    /**
     * 保存新记录并分配 ID
     */
    PostRecordEntity save(PostRecordEntity entity);

    /**
     * 根据 ID 查询，不存在返回 null
     */
    PostRecordEntity findById(Long id);

    /**
     * 更新记录 (带乐观锁)。
     * 不存在时抛出 NOT_FOUND，版本不一致时抛出 CONFLICT。
     */
    PostRecordEntity update(PostRecordEntity entity);

    /**
     * 根据 ID 删除，不存在返回 false
     */
    boolean deleteById(Long id);

    /**
     * 查询业务在日期窗口内的记录
     */
    List<PostRecordEntity> findByBusinessAndDateRange(String businessId, DateWindow window);

    /**
     * 查询业务全部记录
     */
    List<PostRecordEntity> findByBusinessId(String businessId);

    /**
     * 根据状态查询
     */
    List<PostRecordEntity> findByStatus(PostStatusEnum status);

    /**
     * 根据业务和状态查询。
     * 默认基于 findByBusinessId 过滤，便于测试替身只实现基础方法。
     */
    default List<PostRecordEntity> findByBusinessIdAndStatus(String businessId, PostStatusEnum status) {
        List<PostRecordEntity> posts = findByBusinessId(businessId);
        if (posts == null) {
            return List.of();
        }
        return posts.stream()
                .filter(post -> post != null && post.getStatus() == status)
                .collect(Collectors.toList());
    }
}
