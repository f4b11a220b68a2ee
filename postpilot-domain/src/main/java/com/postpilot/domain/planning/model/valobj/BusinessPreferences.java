package com.postpilot.domain.planning.model.valobj;

import com.postpilot.types.enums.PostTypeEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 业务发帖偏好。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessPreferences {

    /**
     * 业务 ID
     */
    private String businessId;

    /**
     * 每周发帖次数 (1..7)，为空时使用全局默认值
     */
    private Integer frequency;

    /**
     * 偏好发帖日，为空表示不限
     */
    private Set<DayOfWeek> preferredDays;

    /**
     * 默认语气标签（透传，不解释）
     */
    private String defaultTone;

    /**
     * 默认帖子类型（透传，不解释）
     */
    private PostTypeEnum defaultPostType;

    public boolean hasPreferredDays() {
        return preferredDays != null && !preferredDays.isEmpty();
    }

    /**
     * 偏好发帖日的有序副本（周一在前）。
     */
    public Set<DayOfWeek> preferredDaysOrEmpty() {
        if (!hasPreferredDays()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(preferredDays));
    }

    /**
     * 解析 "monday" / "Mon" / "WED" 形式的星期名称。
     */
    public static Set<DayOfWeek> parseWeekdays(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EnumSet.noneOf(DayOfWeek.class);
        }
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String name : names) {
            days.add(parseWeekday(name));
        }
        return days;
    }

    private static DayOfWeek parseWeekday(String name) {
        if (name == null || name.isBlank()) {
            throw new AppException(ResponseCode.INVALID_PREFERENCES, "星期名称不能为空");
        }
        String normalized = name.trim().toUpperCase();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(normalized) || day.name().startsWith(normalized) && normalized.length() >= 3) {
                return day;
            }
        }
        throw new AppException(ResponseCode.INVALID_PREFERENCES, "无法识别的星期名称: " + name);
    }
}
