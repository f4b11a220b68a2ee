package com.postpilot.domain.planning.model.valobj;

import com.postpilot.types.enums.PostTypeEnum;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * 候选帖子内容：由外部内容生成产出，交给规划器后不可变。
 */
@Value
@Builder
public class PostCandidate {

    private static final DateTimeFormatter TWELVE_HOUR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm a")
            .toFormatter(Locale.US);

    private static final DateTimeFormatter TWENTY_FOUR_HOUR = DateTimeFormatter.ofPattern("H:mm");

    /**
     * 正文
     */
    String text;

    /**
     * 话题标签
     */
    @Singular
    List<String> hashtags;

    /**
     * 帖子类型
     */
    PostTypeEnum postType;

    /**
     * 语气标签
     */
    String tone;

    /**
     * 行动号召
     */
    String callToAction;

    /**
     * 建议发帖时间，可为空
     */
    LocalTime suggestedTime;

    public PostTypeEnum resolvedPostType() {
        return postType == null ? PostTypeEnum.GENERAL : postType;
    }

    /**
     * 解析 "6:00 PM" 或 "18:00" 形式的建议时间，无法解析时返回 null。
     */
    public static LocalTime parseSuggestedTime(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        String normalized = raw.trim();
        String upper = normalized.toUpperCase(Locale.US);
        DateTimeFormatter formatter = upper.endsWith("AM") || upper.endsWith("PM") ? TWELVE_HOUR : TWENTY_FOUR_HOUR;
        try {
            return LocalTime.parse(normalized, formatter);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
