package com.postpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 帖子生命周期事件枚举
 *
 * @author postpilot
 * @since 2026-09-14
 */
public enum PostEventEnum {

    CONFIRM("confirm"),

    CANCEL("cancel"),

    EDIT("edit"),

    REQUEST_PUBLISH("request_publish"),

    PUBLISH_SUCCEEDED("publish_succeeded"),

    PUBLISH_FAILED("publish_failed"),

    RETRY_PUBLISH("retry_publish");

    private final String code;

    PostEventEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PostEventEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PostEventEnum event : PostEventEnum.values()) {
            if (event.code.equals(code)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown post event code: " + code);
    }
}
