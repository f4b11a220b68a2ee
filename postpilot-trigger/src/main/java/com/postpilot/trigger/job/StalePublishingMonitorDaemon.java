package com.postpilot.trigger.job;

import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.types.enums.PostStatusEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * publishing 滞留监控：发布超时后长时间未对账的帖子只告警，不自动推进状态。
 */
@Slf4j
@Component
public class StalePublishingMonitorDaemon {

    private final IPostRecordRepository postRecordRepository;
    private final Clock clock;
    private final int staleMinutes;
    private final Counter staleCounter;

    public StalePublishingMonitorDaemon(IPostRecordRepository postRecordRepository,
                                        Clock clock,
                                        @Value("${reconciliation.stale-publishing-minutes:15}") int staleMinutes) {
        this.postRecordRepository = postRecordRepository;
        this.clock = clock;
        this.staleMinutes = staleMinutes > 0 ? staleMinutes : 15;
        this.staleCounter = Counter.builder("postpilot.publishing.stale.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${reconciliation.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void reportStalePublishing() {
        List<PostRecordEntity> stale = findStalePublishing();
        for (PostRecordEntity post : stale) {
            staleCounter.increment();
            log.warn("Post stuck in publishing, reconciliation required. postId={}, businessId={}, publishRequestedAt={}, attempts={}",
                    post.getId(), post.getBusinessId(), post.getPublishRequestedAt(), post.normalizedPublishAttempts());
        }
    }

    public List<PostRecordEntity> findStalePublishing() {
        List<PostRecordEntity> publishing = postRecordRepository.findByStatus(PostStatusEnum.PUBLISHING);
        if (publishing == null || publishing.isEmpty()) {
            return Collections.emptyList();
        }
        LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(staleMinutes);
        List<PostRecordEntity> stale = new ArrayList<>();
        for (PostRecordEntity post : publishing) {
            if (post == null) {
                continue;
            }
            LocalDateTime since = post.getPublishRequestedAt() != null ? post.getPublishRequestedAt() : post.getUpdatedAt();
            if (since != null && since.isBefore(threshold)) {
                stale.add(post);
            }
        }
        return stale;
    }
}
