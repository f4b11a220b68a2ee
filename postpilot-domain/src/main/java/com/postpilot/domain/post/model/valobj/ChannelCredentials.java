package com.postpilot.domain.post.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 发布渠道凭证（如主页 ID + 主页访问令牌）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelCredentials {

    private String pageId;

    @ToString.Exclude
    private String accessToken;
}
