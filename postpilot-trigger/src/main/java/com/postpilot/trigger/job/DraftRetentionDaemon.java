package com.postpilot.trigger.job;

import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.trigger.application.command.PostLifecycleCommandService;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 草稿清理守护进程：删除创建时间超过保留天数、仍未确认的草稿。
 */
@Slf4j
@Component
public class DraftRetentionDaemon {

    private final IPostRecordRepository postRecordRepository;
    private final PostLifecycleCommandService postLifecycleCommandService;
    private final Clock clock;
    private final int retentionDays;
    private final Counter deletedCounter;

    public DraftRetentionDaemon(IPostRecordRepository postRecordRepository,
                                PostLifecycleCommandService postLifecycleCommandService,
                                Clock clock,
                                @Value("${retention.draft-days:30}") int retentionDays) {
        this.postRecordRepository = postRecordRepository;
        this.postLifecycleCommandService = postLifecycleCommandService;
        this.clock = clock;
        this.retentionDays = retentionDays;
        this.deletedCounter = Counter.builder("postpilot.retention.draft.deleted.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${retention.poll-interval-ms:3600000}", scheduler = "daemonScheduler")
    public void purgeExpiredDrafts() {
        if (retentionDays <= 0) {
            return;
        }
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(retentionDays);
        List<PostRecordEntity> drafts = postRecordRepository.findByStatus(PostStatusEnum.DRAFT);
        if (drafts == null || drafts.isEmpty()) {
            return;
        }
        int deleted = 0;
        for (PostRecordEntity draft : drafts) {
            if (draft == null || draft.getCreatedAt() == null || !draft.getCreatedAt().isBefore(threshold)) {
                continue;
            }
            try {
                postLifecycleCommandService.deletePost(draft.getId());
                deleted++;
                deletedCounter.increment();
            } catch (AppException ex) {
                log.warn("Skip expired draft. postId={}, code={}, reason={}", draft.getId(), ex.getCode(), ex.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Expired drafts purged. deleted={}, retentionDays={}", deleted, retentionDays);
        }
    }
}
