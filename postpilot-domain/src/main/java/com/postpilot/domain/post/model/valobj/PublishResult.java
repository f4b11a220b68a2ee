package com.postpilot.domain.post.model.valobj;

import com.postpilot.types.enums.PublishErrorKindEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 一次发布尝试的结果：成功时记录外部帖子 ID，失败时记录错误类型与信息。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {

    private String externalId;

    private String postUrl;

    private PublishErrorKindEnum errorKind;

    private String errorMessage;

    private LocalDateTime completedAt;

    /**
     * 补齐完成时间，已有值时保持不变
     */
    public PublishResult completedAtIfAbsent(LocalDateTime now) {
        return completedAt != null ? this : toBuilder().completedAt(now).build();
    }

    public boolean isSuccess() {
        return externalId != null && errorKind == null;
    }

    public static PublishResult success(String externalId, String postUrl) {
        return PublishResult.builder()
                .externalId(externalId)
                .postUrl(postUrl)
                .build();
    }

    public static PublishResult failure(PublishErrorKindEnum errorKind, String errorMessage) {
        return PublishResult.builder()
                .errorKind(errorKind == null ? PublishErrorKindEnum.UNKNOWN : errorKind)
                .errorMessage(errorMessage)
                .build();
    }
}
