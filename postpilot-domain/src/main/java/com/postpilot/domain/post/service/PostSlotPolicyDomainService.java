package com.postpilot.domain.post.service;

import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.PostEdit;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * 时段占用策略：同一业务的两条有效记录不能占用相同 (日期, 时间)。
 */
@Service
public class PostSlotPolicyDomainService {

    /**
     * 编辑改动时段时校验目标时段未被同业务其它记录占用，已取消的记录不占用时段。
     */
    public void ensureSlotAvailable(PostRecordEntity post, PostEdit edit, List<PostRecordEntity> sameDayPosts) {
        if (post == null || edit == null || !edit.hasSlotChange()) {
            return;
        }
        LocalDate targetDate = edit.getScheduledDate() != null ? edit.getScheduledDate() : post.getScheduledDate();
        LocalTime targetTime = edit.getScheduledTime() != null ? edit.getScheduledTime() : post.getScheduledTime();
        if (sameDayPosts == null || sameDayPosts.isEmpty()) {
            return;
        }
        for (PostRecordEntity other : sameDayPosts) {
            if (other == null || Objects.equals(other.getId(), post.getId())) {
                continue;
            }
            if (other.getStatus() == PostStatusEnum.CANCELLED) {
                continue;
            }
            if (Objects.equals(other.getBusinessId(), post.getBusinessId()) && other.occupies(targetDate, targetTime)) {
                throw new AppException(ResponseCode.CONFLICT,
                        "时段 " + targetDate + " " + targetTime + " 已被帖子 " + other.getId() + " 占用");
            }
        }
    }
}
