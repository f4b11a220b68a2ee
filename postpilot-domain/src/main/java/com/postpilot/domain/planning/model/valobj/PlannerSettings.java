package com.postpilot.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 规划与生命周期管理的全局配置，由启动模块显式注入。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannerSettings {

    /**
     * 偏好未指定频率时的默认每周发帖数
     */
    @Builder.Default
    private int defaultFrequency = 3;

    /**
     * 每周发帖数上限
     */
    @Builder.Default
    private int maxFrequency = 7;

    /**
     * 单次规划窗口的最大天数
     */
    @Builder.Default
    private int maxWindowDays = 92;

    /**
     * 仅生成草稿，等待人工确认
     */
    @Builder.Default
    private boolean draftOnly = false;

    /**
     * 存储调用默认超时
     */
    @Builder.Default
    private Duration storeTimeout = Duration.ofSeconds(3);

    /**
     * 发布调用默认超时
     */
    @Builder.Default
    private Duration publishTimeout = Duration.ofSeconds(10);

    /**
     * 获取帖子互斥锁的最长等待时间，0 表示不等待
     */
    @Builder.Default
    private Duration lockWait = Duration.ZERO;

    public static PlannerSettings defaults() {
        return PlannerSettings.builder().build();
    }
}
