package com.postpilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 规划与生命周期配置属性，配置前缀为 planner。
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Data
@ConfigurationProperties(prefix = "planner", ignoreInvalidFields = true)
public class PlannerConfigProperties {

    /** 偏好未指定频率时的默认每周发帖数，默认3 */
    private Integer defaultFrequency = 3;

    /** 每周发帖数上限，默认7 */
    private Integer maxFrequency = 7;

    /** 单次规划窗口最大天数，默认92 */
    private Integer maxWindowDays = 92;

    /** 仅生成草稿，默认false */
    private Boolean draftOnly = false;

    /** 存储调用超时（毫秒），默认3000 */
    private Long storeTimeoutMs = 3000L;

    /** 发布调用超时（毫秒），默认10000 */
    private Long publishTimeoutMs = 10000L;

    /** 帖子锁等待时间（毫秒），默认0即不等待 */
    private Long lockWaitMs = 0L;

}
