package com.postpilot.domain.post.adapter.gateway;

import com.postpilot.domain.post.model.valobj.ChannelCredentials;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.domain.post.model.valobj.PublisherResponse;

/**
 * 外部发布渠道端口（如 Facebook 主页）。
 */
public interface IChannelPublisher {

    /**
     * 发布内容。
     * 渠道明确拒绝时返回失败响应；网络异常可直接抛出，由调用方归类为 NETWORK 错误。
     *
     * @param content 帖子内容
     * @param credentials 渠道凭证
     * @return 发布响应
     */
    PublisherResponse publish(PostContent content, ChannelCredentials credentials);
}
