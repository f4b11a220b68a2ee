package com.postpilot.domain.post.model.entity;

import com.postpilot.domain.planning.model.valobj.SlotAssignment;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.domain.post.model.valobj.PostEdit;
import com.postpilot.domain.post.model.valobj.PublishResult;
import com.postpilot.types.enums.PostEventEnum;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;

/**
 * 帖子记录领域实体
 *
 * @author postpilot
 * @since 2026-09-14
 */
@Data
public class PostRecordEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 业务 ID
     */
    private String businessId;

    /**
     * 帖子内容 (候选内容的可变副本)
     */
    private PostContent content;

    /**
     * 状态
     */
    private PostStatusEnum status;

    /**
     * 排期日期
     */
    private LocalDate scheduledDate;

    /**
     * 排期时间
     */
    private LocalTime scheduledTime;

    /**
     * 最近一次发布结果，发布尝试完成前为空
     */
    private PublishResult publishResult;

    /**
     * 发布尝试次数
     */
    private Integer publishAttempts;

    /**
     * 最近一次进入 publishing 的时间
     */
    private LocalDateTime publishRequestedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 由分配结果创建草稿
     */
    public static PostRecordEntity draftOf(String businessId, SlotAssignment assignment) {
        PostRecordEntity entity = new PostRecordEntity();
        entity.setBusinessId(businessId);
        entity.setContent(PostContent.from(assignment.candidate()));
        entity.setStatus(PostStatusEnum.DRAFT);
        entity.setScheduledDate(assignment.date());
        entity.setScheduledTime(assignment.time());
        entity.setPublishAttempts(0);
        entity.setVersion(0);
        return entity;
    }

    /**
     * 验证记录是否有效
     */
    public void validate() {
        if (StringUtils.isBlank(businessId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Business ID cannot be empty");
        }
        if (status == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Status cannot be null");
        }
        if (content == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Content cannot be null");
        }
        if (scheduledDate == null || scheduledTime == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Scheduled slot cannot be empty");
        }
    }

    /**
     * 确认草稿
     */
    public void confirm() {
        transit(PostEventEnum.CONFIRM);
    }

    /**
     * 取消
     */
    public void cancel() {
        transit(PostEventEnum.CANCEL);
    }

    /**
     * 编辑内容或时段，状态保持 scheduled
     */
    public void applyEdit(PostEdit edit) {
        ensureEditable();
        PostStatusEnum target = requireTarget(PostEventEnum.EDIT);
        if (edit != null) {
            PostContent next = this.content == null ? new PostContent() : this.content.copy();
            if (edit.getText() != null) {
                next.setText(edit.getText());
            }
            if (edit.getHashtags() != null) {
                next.setHashtags(new ArrayList<>(edit.getHashtags()));
            }
            if (edit.getTone() != null) {
                next.setTone(edit.getTone());
            }
            if (edit.getCallToAction() != null) {
                next.setCallToAction(edit.getCallToAction());
            }
            this.content = next;
            if (edit.getScheduledDate() != null) {
                this.scheduledDate = edit.getScheduledDate();
            }
            if (edit.getScheduledTime() != null) {
                this.scheduledTime = edit.getScheduledTime();
            }
        }
        this.status = target;
    }

    /**
     * 编辑前检查：publishing/published 内容不可变，其余非 scheduled 状态为非法迁移
     */
    public void ensureEditable() {
        if (this.status != null && this.status.isContentLocked()) {
            throw new AppException(ResponseCode.IMMUTABLE_POST,
                    "Post " + id + " is " + status.getCode() + ", content is immutable");
        }
        requireTarget(PostEventEnum.EDIT);
    }

    /**
     * 受理发布请求
     */
    public void requestPublish(LocalDateTime requestedAt) {
        transit(PostEventEnum.REQUEST_PUBLISH);
        this.publishAttempts = normalizedPublishAttempts() + 1;
        this.publishRequestedAt = requestedAt;
    }

    /**
     * 失败后人工重试
     */
    public void retryPublish(LocalDateTime requestedAt) {
        transit(PostEventEnum.RETRY_PUBLISH);
        this.publishAttempts = normalizedPublishAttempts() + 1;
        this.publishRequestedAt = requestedAt;
    }

    /**
     * 记录发布成功
     */
    public void markPublished(PublishResult result) {
        if (result == null || StringUtils.isBlank(result.getExternalId())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Publish result must carry an external id");
        }
        transit(PostEventEnum.PUBLISH_SUCCEEDED);
        this.publishResult = result;
    }

    /**
     * 记录发布失败
     */
    public void markFailed(PublishResult result) {
        if (result == null || result.getErrorKind() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Publish result must carry an error kind");
        }
        transit(PostEventEnum.PUBLISH_FAILED);
        this.publishResult = result;
    }

    /**
     * 删除前检查：发布中的帖子结果未定，不允许删除
     */
    public void ensureDeletable() {
        if (this.status == PostStatusEnum.PUBLISHING) {
            throw new AppException(ResponseCode.ILLEGAL_TRANSITION,
                    "Post " + id + " is publishing and cannot be deleted");
        }
    }

    /**
     * 增加版本号 (用于乐观锁)
     */
    public void incrementVersion() {
        this.version = this.version == null ? 1 : this.version + 1;
    }

    public boolean isPublishing() {
        return this.status == PostStatusEnum.PUBLISHING;
    }

    public boolean occupies(LocalDate date, LocalTime time) {
        return date != null && time != null && date.equals(scheduledDate) && time.equals(scheduledTime);
    }

    public int normalizedPublishAttempts() {
        return this.publishAttempts == null ? 0 : Math.max(this.publishAttempts, 0);
    }

    /**
     * 深拷贝，存储实现用来隔离调用方持有的实例
     */
    public PostRecordEntity copy() {
        PostRecordEntity copy = new PostRecordEntity();
        copy.setId(id);
        copy.setBusinessId(businessId);
        copy.setContent(content == null ? null : content.copy());
        copy.setStatus(status);
        copy.setScheduledDate(scheduledDate);
        copy.setScheduledTime(scheduledTime);
        copy.setPublishResult(publishResult == null ? null : publishResult.toBuilder().build());
        copy.setPublishAttempts(publishAttempts);
        copy.setPublishRequestedAt(publishRequestedAt);
        copy.setVersion(version);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }

    private void transit(PostEventEnum event) {
        this.status = requireTarget(event);
    }

    private PostStatusEnum requireTarget(PostEventEnum event) {
        PostStatusEnum target = this.status == null ? null : this.status.next(event);
        if (target == null) {
            throw new AppException(ResponseCode.ILLEGAL_TRANSITION,
                    "Post " + id + " cannot apply " + event.getCode() + " from status "
                            + (status == null ? "null" : status.getCode()));
        }
        return target;
    }
}
