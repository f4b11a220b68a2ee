package com.postpilot.domain.post.model.valobj;

import com.postpilot.types.enums.PublishErrorKindEnum;

/**
 * 发布渠道响应：成功时携带外部帖子 ID，失败时携带错误类型与信息。
 */
public record PublisherResponse(boolean success,
                                String externalId,
                                String postUrl,
                                PublishErrorKindEnum errorKind,
                                String errorMessage) {

    public static PublisherResponse success(String externalId, String postUrl) {
        return new PublisherResponse(true, externalId, postUrl, null, null);
    }

    public static PublisherResponse failure(PublishErrorKindEnum errorKind, String errorMessage) {
        return new PublisherResponse(false, null, null, errorKind, errorMessage);
    }

    public PublishResult toPublishResult() {
        if (success) {
            return PublishResult.success(externalId, postUrl);
        }
        return PublishResult.failure(errorKind, errorMessage);
    }
}
