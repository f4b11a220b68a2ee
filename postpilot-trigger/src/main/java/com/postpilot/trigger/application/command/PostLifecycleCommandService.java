package com.postpilot.trigger.application.command;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.ChannelCredentials;
import com.postpilot.domain.post.model.valobj.PostEdit;
import com.postpilot.domain.post.model.valobj.PublishResult;
import com.postpilot.domain.post.service.PostSlotPolicyDomainService;
import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.trigger.application.common.PostLockRegistry;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.function.Consumer;

/**
 * 帖子生命周期写用例：确认、编辑、取消、发布请求、重试、对账与删除。
 * <p>
 * 同一帖子的所有迁移在帖子锁内串行执行；锁被占用时立即返回 ALREADY_IN_PROGRESS。
 * 发布请求只在锁内完成 → publishing 的迁移，外部调用交给 {@link PublishDispatchApplicationService}。
 * </p>
 */
@Slf4j
@Service
public class PostLifecycleCommandService {

    private final IPostRecordRepository postRecordRepository;
    private final PostSlotPolicyDomainService postSlotPolicyDomainService;
    private final PublishDispatchApplicationService publishDispatchApplicationService;
    private final PostLockRegistry postLockRegistry;
    private final BoundedCallInvoker boundedCallInvoker;
    private final PlannerSettings plannerSettings;
    private final Clock clock;

    public PostLifecycleCommandService(IPostRecordRepository postRecordRepository,
                                       PostSlotPolicyDomainService postSlotPolicyDomainService,
                                       PublishDispatchApplicationService publishDispatchApplicationService,
                                       PostLockRegistry postLockRegistry,
                                       BoundedCallInvoker boundedCallInvoker,
                                       PlannerSettings plannerSettings,
                                       Clock clock) {
        this.postRecordRepository = postRecordRepository;
        this.postSlotPolicyDomainService = postSlotPolicyDomainService;
        this.publishDispatchApplicationService = publishDispatchApplicationService;
        this.postLockRegistry = postLockRegistry;
        this.boundedCallInvoker = boundedCallInvoker;
        this.plannerSettings = plannerSettings == null ? PlannerSettings.defaults() : plannerSettings;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public PostRecordEntity confirmDraft(Long postId) {
        return confirmDraft(postId, plannerSettings.getStoreTimeout());
    }

    public PostRecordEntity confirmDraft(Long postId, Duration storeTimeout) {
        return transit(postId, storeTimeout, "confirm", PostRecordEntity::confirm);
    }

    public PostRecordEntity editPost(Long postId, PostEdit edit) {
        Duration storeTimeout = plannerSettings.getStoreTimeout();
        return postLockRegistry.tryExecute(postId, plannerSettings.getLockWait(), () -> {
            PostRecordEntity post = requirePost(postId, storeTimeout);
            post.ensureEditable();
            PostRecordEntity updated;
            if (edit != null && edit.hasSlotChange()) {
                // 时段检查与写入在同一把商家时段锁内完成
                updated = postLockRegistry.executeOnSlots(post.getBusinessId(), () -> {
                    LocalDate targetDate = edit.getScheduledDate() != null ? edit.getScheduledDate() : post.getScheduledDate();
                    postSlotPolicyDomainService.ensureSlotAvailable(post, edit,
                            boundedCallInvoker.call("store.listByBusiness", storeTimeout,
                                    () -> postRecordRepository.findByBusinessAndDateRange(post.getBusinessId(),
                                            DateWindow.of(targetDate, targetDate))));
                    post.applyEdit(edit);
                    return store(post, storeTimeout);
                });
            } else {
                post.applyEdit(edit);
                updated = store(post, storeTimeout);
            }
            log.debug("Post edited. postId={}, date={}, time={}",
                    postId, updated.getScheduledDate(), updated.getScheduledTime());
            return updated;
        });
    }

    public PostRecordEntity cancelPost(Long postId) {
        return transit(postId, plannerSettings.getStoreTimeout(), "cancel", PostRecordEntity::cancel);
    }

    /**
     * 请求发布：scheduled → publishing，随后同步分发到外部渠道。
     */
    public PublishResult requestPublish(Long postId, ChannelCredentials credentials) {
        return requestPublish(postId, credentials, plannerSettings.getPublishTimeout());
    }

    public PublishResult requestPublish(Long postId, ChannelCredentials credentials, Duration publishTimeout) {
        transit(postId, plannerSettings.getStoreTimeout(), "request_publish", post -> {
            rejectIfPublishing(post);
            post.requestPublish(LocalDateTime.now(clock));
        });
        return publishDispatchApplicationService.publish(postId, credentials, publishTimeout);
    }

    /**
     * 失败后人工重试：failed → publishing，随后同步分发。
     */
    public PublishResult retryPublish(Long postId, ChannelCredentials credentials) {
        return retryPublish(postId, credentials, plannerSettings.getPublishTimeout());
    }

    public PublishResult retryPublish(Long postId, ChannelCredentials credentials, Duration publishTimeout) {
        transit(postId, plannerSettings.getStoreTimeout(), "retry_publish", post -> {
            rejectIfPublishing(post);
            post.retryPublish(LocalDateTime.now(clock));
        });
        return publishDispatchApplicationService.publish(postId, credentials, publishTimeout);
    }

    /**
     * 对账：对超时后停留在 publishing 的帖子写入外部渠道查询到的真实结果。
     */
    public PostRecordEntity resolvePublishing(Long postId, PublishResult outcome) {
        if (outcome == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Publish outcome cannot be null");
        }
        PublishResult stamped = outcome.completedAtIfAbsent(LocalDateTime.now(clock));
        PostRecordEntity resolved = transit(postId, plannerSettings.getStoreTimeout(), "resolve_publishing", post -> {
            if (stamped.isSuccess()) {
                post.markPublished(stamped);
            } else {
                post.markFailed(stamped);
            }
        });
        log.info("Publishing post reconciled. postId={}, status={}, externalId={}",
                postId, resolved.getStatus(), outcome.getExternalId());
        return resolved;
    }

    public void deletePost(Long postId) {
        Duration storeTimeout = plannerSettings.getStoreTimeout();
        postLockRegistry.tryExecute(postId, plannerSettings.getLockWait(), () -> {
            PostRecordEntity post = requirePost(postId, storeTimeout);
            post.ensureDeletable();
            Boolean deleted = boundedCallInvoker.call("store.delete", storeTimeout,
                    () -> postRecordRepository.deleteById(postId));
            if (!Boolean.TRUE.equals(deleted)) {
                throw new AppException(ResponseCode.NOT_FOUND, "Post not found: " + postId);
            }
            log.info("Post deleted. postId={}, businessId={}, status={}", postId, post.getBusinessId(), post.getStatus());
            return null;
        });
    }

    private PostRecordEntity transit(Long postId, Duration storeTimeout, String event, Consumer<PostRecordEntity> transition) {
        return postLockRegistry.tryExecute(postId, plannerSettings.getLockWait(), () -> {
            PostRecordEntity post = requirePost(postId, storeTimeout);
            PostStatusEnum from = post.getStatus();
            transition.accept(post);
            PostRecordEntity updated = store(post, storeTimeout);
            log.debug("Post transition applied. postId={}, event={}, from={}, to={}",
                    postId, event, from, updated.getStatus());
            return updated;
        });
    }

    private void rejectIfPublishing(PostRecordEntity post) {
        if (post.isPublishing()) {
            throw new AppException(ResponseCode.ALREADY_IN_PROGRESS, "Post " + post.getId() + " is already publishing");
        }
    }

    private PostRecordEntity requirePost(Long postId, Duration storeTimeout) {
        PostRecordEntity post = boundedCallInvoker.call("store.get", storeTimeout,
                () -> postRecordRepository.findById(postId));
        if (post == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Post not found: " + postId);
        }
        return post;
    }

    private PostRecordEntity store(PostRecordEntity post, Duration storeTimeout) {
        return boundedCallInvoker.call("store.update", storeTimeout, () -> postRecordRepository.update(post));
    }
}
