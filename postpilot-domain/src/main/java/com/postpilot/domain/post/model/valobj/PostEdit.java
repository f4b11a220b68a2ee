package com.postpilot.domain.post.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 帖子编辑请求，空字段表示保持不变。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostEdit {

    private String text;

    private List<String> hashtags;

    private String tone;

    private String callToAction;

    private LocalDate scheduledDate;

    private LocalTime scheduledTime;

    public boolean hasSlotChange() {
        return scheduledDate != null || scheduledTime != null;
    }

    public boolean isEmpty() {
        return text == null && hashtags == null && tone == null && callToAction == null && !hasSlotChange();
    }
}
