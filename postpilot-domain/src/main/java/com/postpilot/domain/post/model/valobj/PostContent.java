package com.postpilot.domain.post.model.valobj;

import com.postpilot.domain.planning.model.valobj.PostCandidate;
import com.postpilot.types.enums.PostTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 帖子内容：候选内容的可变副本。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostContent {

    private String text;

    private List<String> hashtags;

    private PostTypeEnum postType;

    private String tone;

    private String callToAction;

    public static PostContent from(PostCandidate candidate) {
        return PostContent.builder()
                .text(candidate.getText())
                .hashtags(candidate.getHashtags() == null ? new ArrayList<>() : new ArrayList<>(candidate.getHashtags()))
                .postType(candidate.resolvedPostType())
                .tone(candidate.getTone())
                .callToAction(candidate.getCallToAction())
                .build();
    }

    public PostContent copy() {
        return PostContent.builder()
                .text(text)
                .hashtags(hashtags == null ? new ArrayList<>() : new ArrayList<>(hashtags))
                .postType(postType)
                .tone(tone)
                .callToAction(callToAction)
                .build();
    }

    /**
     * 渠道消息正文：正文 + 空行 + 话题标签。
     */
    public String toMessage() {
        String body = StringUtils.defaultString(text);
        if (hashtags == null || hashtags.isEmpty()) {
            return body;
        }
        return body + "\n\n" + String.join(" ", hashtags);
    }
}
