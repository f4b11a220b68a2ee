package com.postpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 帖子状态枚举
 *
 * @author postpilot
 * @since 2026-09-14
 */
public enum PostStatusEnum {

    /**
     * 草稿 - 已分配时段，等待人工确认
     */
    DRAFT("draft"),

    /**
     * 已排期 - 已确认，等待发布
     */
    SCHEDULED("scheduled"),

    /**
     * 发布中 - 已受理发布请求，等待外部渠道结果
     */
    PUBLISHING("publishing"),

    /**
     * 已发布 - 外部渠道已返回帖子 ID
     */
    PUBLISHED("published"),

    /**
     * 发布失败 - 外部渠道返回错误，可人工重试
     */
    FAILED("failed"),

    /**
     * 已取消
     */
    CANCELLED("cancelled");

    private final String code;

    PostStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 内容是否已锁定（发布中或已发布的内容必须与外部渠道保持一致）。
     */
    public boolean isContentLocked() {
        return this == PUBLISHING || this == PUBLISHED;
    }

    /**
     * 状态迁移表：返回事件作用后的目标状态，不允许的迁移返回 null。
     */
    public PostStatusEnum next(PostEventEnum event) {
        if (event == null) {
            return null;
        }
        return switch (this) {
            case DRAFT -> switch (event) {
                case CONFIRM -> SCHEDULED;
                case CANCEL -> CANCELLED;
                default -> null;
            };
            case SCHEDULED -> switch (event) {
                case EDIT -> SCHEDULED;
                case CANCEL -> CANCELLED;
                case REQUEST_PUBLISH -> PUBLISHING;
                default -> null;
            };
            case PUBLISHING -> switch (event) {
                case PUBLISH_SUCCEEDED -> PUBLISHED;
                case PUBLISH_FAILED -> FAILED;
                default -> null;
            };
            case FAILED -> event == PostEventEnum.RETRY_PUBLISH ? PUBLISHING : null;
            case PUBLISHED, CANCELLED -> null;
        };
    }

    public static PostStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PostStatusEnum status : PostStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown post status code: " + code);
    }
}
