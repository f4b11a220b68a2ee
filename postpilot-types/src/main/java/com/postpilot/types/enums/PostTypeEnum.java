package com.postpilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalTime;

/**
 * 帖子类型枚举。
 * <p>
 * 声明顺序即默认发帖时间的优先顺序：当候选内容未给出建议时间时，按类型取默认时段。
 * </p>
 *
 * @author postpilot
 * @since 2026-09-14
 */
public enum PostTypeEnum {

    /**
     * 促销 - 傍晚
     */
    PROMO("promo", LocalTime.of(18, 0)),

    /**
     * 小贴士 - 早晨
     */
    TIP("tip", LocalTime.of(9, 0)),

    /**
     * 动态 - 上午
     */
    UPDATE("update", LocalTime.of(10, 0)),

    /**
     * 行业洞察 - 下午
     */
    INSIGHT("insight", LocalTime.of(15, 0)),

    /**
     * 未识别类型 - 中午
     */
    GENERAL("general", LocalTime.of(12, 0));

    private final String code;
    private final LocalTime defaultTime;

    PostTypeEnum(String code, LocalTime defaultTime) {
        this.code = code;
        this.defaultTime = defaultTime;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public LocalTime getDefaultTime() {
        return defaultTime;
    }

    /**
     * 宽松解析：未知或空值归为 GENERAL。
     */
    public static PostTypeEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return GENERAL;
        }
        String normalized = code.trim().toLowerCase();
        for (PostTypeEnum type : PostTypeEnum.values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        if ("promotional".equals(normalized) || "promotion".equals(normalized)) {
            return PROMO;
        }
        if ("tips".equals(normalized)) {
            return TIP;
        }
        return GENERAL;
    }
}
