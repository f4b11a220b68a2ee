package com.postpilot.infrastructure.gateway;

import com.postpilot.domain.post.adapter.gateway.IChannelPublisher;
import com.postpilot.domain.post.model.valobj.ChannelCredentials;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.domain.post.model.valobj.PublisherResponse;
import com.postpilot.types.enums.PublishErrorKindEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模拟发布渠道：不访问外部网络，生成 "{pageId}_{10 位十六进制}" 格式的外部帖子 ID。
 * <p>
 * publisher.mock-mode=false 时不注册，由接入方提供真实的 {@link IChannelPublisher} 实现。
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "publisher", name = "mock-mode", havingValue = "true", matchIfMissing = true)
public class MockChannelPublisher implements IChannelPublisher {

    private static final int EXTERNAL_ID_SUFFIX_LENGTH = 10;

    private final String pageUrlBase;
    private final Map<String, String> publishedMessages = new ConcurrentHashMap<>();

    public MockChannelPublisher(@Value("${publisher.mock-page-url:https://facebook.com/mock-page}") String pageUrlBase) {
        this.pageUrlBase = StringUtils.removeEnd(StringUtils.defaultIfBlank(pageUrlBase, "https://facebook.com/mock-page"), "/");
    }

    @Override
    public PublisherResponse publish(PostContent content, ChannelCredentials credentials) {
        if (credentials == null || StringUtils.isBlank(credentials.getPageId())) {
            return PublisherResponse.failure(PublishErrorKindEnum.INVALID_CREDENTIALS, "Page id is required");
        }
        if (StringUtils.isBlank(credentials.getAccessToken())) {
            return PublisherResponse.failure(PublishErrorKindEnum.INVALID_CREDENTIALS, "Access token is required");
        }
        String message = content == null ? "" : content.toMessage();
        if (StringUtils.isBlank(message)) {
            return PublisherResponse.failure(PublishErrorKindEnum.REJECTED, "Message cannot be empty");
        }

        String externalId = credentials.getPageId() + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, EXTERNAL_ID_SUFFIX_LENGTH);
        publishedMessages.put(externalId, message);
        log.info("Mock publish succeeded. pageId={}, externalId={}, messageLength={}",
                credentials.getPageId(), externalId, message.length());
        return PublisherResponse.success(externalId, pageUrlBase + "/" + externalId);
    }

    /**
     * 已模拟发布的消息，按外部帖子 ID 索引。
     */
    public Map<String, String> getPublishedMessages() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(publishedMessages));
    }
}
