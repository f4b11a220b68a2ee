package com.postpilot.domain.post.model.valobj;

import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.PostTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 业务下帖子状态与类型的聚合统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostStatusStat {

    private String businessId;

    private long total;

    private Map<PostStatusEnum, Long> countByStatus;

    private Map<PostTypeEnum, Long> countByPostType;

    private LocalDateTime generatedAt;

    public long countOf(PostStatusEnum status) {
        if (countByStatus == null || status == null) {
            return 0L;
        }
        return countByStatus.getOrDefault(status, 0L);
    }
}
