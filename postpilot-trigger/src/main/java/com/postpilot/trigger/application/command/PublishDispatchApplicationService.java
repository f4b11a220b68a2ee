package com.postpilot.trigger.application.command;

import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.post.adapter.gateway.IChannelPublisher;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.ChannelCredentials;
import com.postpilot.domain.post.model.valobj.PublishResult;
import com.postpilot.domain.post.model.valobj.PublisherResponse;
import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.trigger.application.common.PostLockRegistry;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.PublishErrorKindEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 发布分发用例：对已处于 publishing 的帖子调用外部渠道，并把结果落到记录上。
 * <p>
 * 外部调用不持有帖子锁；超时抛出 TIMEOUT，帖子保持 publishing 等待对账。
 * 失败不自动重试。
 * </p>
 */
@Slf4j
@Service
public class PublishDispatchApplicationService {

    private final IPostRecordRepository postRecordRepository;
    private final IChannelPublisher channelPublisher;
    private final PostLockRegistry postLockRegistry;
    private final BoundedCallInvoker boundedCallInvoker;
    private final PlannerSettings plannerSettings;
    private final Clock clock;

    private final Counter publishSucceededCounter;
    private final Counter publishFailedCounter;
    private final Counter publishTimeoutCounter;

    public PublishDispatchApplicationService(IPostRecordRepository postRecordRepository,
                                             IChannelPublisher channelPublisher,
                                             PostLockRegistry postLockRegistry,
                                             BoundedCallInvoker boundedCallInvoker,
                                             PlannerSettings plannerSettings,
                                             Clock clock) {
        this.postRecordRepository = postRecordRepository;
        this.channelPublisher = channelPublisher;
        this.postLockRegistry = postLockRegistry;
        this.boundedCallInvoker = boundedCallInvoker;
        this.plannerSettings = plannerSettings == null ? PlannerSettings.defaults() : plannerSettings;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.publishSucceededCounter = Counter.builder("postpilot.publish.succeeded.total").register(Metrics.globalRegistry);
        this.publishFailedCounter = Counter.builder("postpilot.publish.failed.total").register(Metrics.globalRegistry);
        this.publishTimeoutCounter = Counter.builder("postpilot.publish.timeout.total").register(Metrics.globalRegistry);
    }

    public PublishResult publish(Long postId, ChannelCredentials credentials) {
        return publish(postId, credentials, plannerSettings.getPublishTimeout());
    }

    public PublishResult publish(Long postId, ChannelCredentials credentials, Duration timeout) {
        Duration storeTimeout = plannerSettings.getStoreTimeout();
        PostRecordEntity post = boundedCallInvoker.call("store.get", storeTimeout,
                () -> postRecordRepository.findById(postId));
        if (post == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "Post not found: " + postId);
        }
        if (post.getStatus() != PostStatusEnum.PUBLISHING) {
            throw new AppException(ResponseCode.ILLEGAL_TRANSITION,
                    "Post " + postId + " is " + post.getStatus().getCode() + ", only publishing posts can be dispatched");
        }

        PublishResult result = invokePublisher(post, credentials, timeout).completedAtIfAbsent(LocalDateTime.now(clock));

        return postLockRegistry.execute(postId, () -> {
            PostRecordEntity current = boundedCallInvoker.call("store.get", storeTimeout,
                    () -> postRecordRepository.findById(postId));
            if (current == null) {
                throw new AppException(ResponseCode.NOT_FOUND, "Post disappeared while publishing: " + postId);
            }
            if (current.getStatus() != PostStatusEnum.PUBLISHING) {
                log.warn("Post resolved while publish was in flight. postId={}, status={}, externalId={}",
                        postId, current.getStatus(), result.getExternalId());
                throw new AppException(ResponseCode.CONFLICT,
                        "Post " + postId + " was resolved to " + current.getStatus().getCode() + " during publish");
            }
            if (result.isSuccess()) {
                current.markPublished(result);
            } else {
                current.markFailed(result);
            }
            boundedCallInvoker.call("store.update", storeTimeout, () -> postRecordRepository.update(current));
            if (result.isSuccess()) {
                publishSucceededCounter.increment();
                log.info("Post published. postId={}, businessId={}, externalId={}",
                        postId, current.getBusinessId(), result.getExternalId());
            } else {
                publishFailedCounter.increment();
                log.info("Post publish failed. postId={}, businessId={}, errorKind={}, error={}",
                        postId, current.getBusinessId(), result.getErrorKind(), result.getErrorMessage());
            }
            return result;
        });
    }

    private PublishResult invokePublisher(PostRecordEntity post, ChannelCredentials credentials, Duration timeout) {
        PublisherResponse response;
        try {
            response = boundedCallInvoker.call("publisher.publish", timeout,
                    () -> channelPublisher.publish(post.getContent().copy(), credentials));
        } catch (AppException ex) {
            if (ex.is(ResponseCode.TIMEOUT)) {
                publishTimeoutCounter.increment();
                log.warn("Publish timed out, post stays publishing for reconciliation. postId={}, businessId={}",
                        post.getId(), post.getBusinessId());
            }
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Publisher call failed. postId={}, error={}", post.getId(), ex.getMessage());
            return PublishResult.failure(PublishErrorKindEnum.NETWORK,
                    StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()));
        }
        if (response == null) {
            return PublishResult.failure(PublishErrorKindEnum.UNKNOWN, "Publisher returned no response");
        }
        if (response.success() && StringUtils.isBlank(response.externalId())) {
            return PublishResult.failure(PublishErrorKindEnum.UNKNOWN, "Publisher reported success without an external id");
        }
        return response.toPublishResult();
    }
}
