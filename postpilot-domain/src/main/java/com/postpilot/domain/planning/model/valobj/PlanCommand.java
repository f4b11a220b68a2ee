package com.postpilot.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * 一次规划请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanCommand {

    private String businessId;

    private List<PostCandidate> candidates;

    private BusinessPreferences preferences;

    private DateWindow window;

    /**
     * 调用方期望的最大帖子数；为 0 时直接返回空排期
     */
    private Integer requestedPostCount;

    /**
     * 覆盖全局 draftOnly 配置
     */
    private Boolean draftOnly;

    /**
     * 覆盖全局存储超时
     */
    private Duration storeTimeout;

    public boolean isZeroPostRequest() {
        return requestedPostCount != null && requestedPostCount == 0;
    }
}
