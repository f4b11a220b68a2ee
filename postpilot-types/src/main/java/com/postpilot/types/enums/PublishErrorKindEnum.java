package com.postpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外部发布错误类型
 *
 * @author postpilot
 * @since 2026-09-14
 */
public enum PublishErrorKindEnum {

    /**
     * 网络或渠道暂时不可用
     */
    NETWORK("network"),

    /**
     * 渠道拒绝（内容违规、参数错误等）
     */
    REJECTED("rejected"),

    /**
     * 凭证无效或已过期
     */
    INVALID_CREDENTIALS("invalid_credentials"),

    /**
     * 触发渠道限流
     */
    RATE_LIMITED("rate_limited"),

    /**
     * 无法归类的错误
     */
    UNKNOWN("unknown");

    private final String code;

    PublishErrorKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
