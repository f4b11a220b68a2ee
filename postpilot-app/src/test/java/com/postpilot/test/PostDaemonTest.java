package com.postpilot.test;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlanCommand;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.planning.model.valobj.PostCandidate;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.ChannelCredentials;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.infrastructure.repository.post.InMemoryPostRecordRepository;
import com.postpilot.test.support.ControllablePublisher;
import com.postpilot.test.support.PostPilotTestFixture;
import com.postpilot.trigger.job.DraftRetentionDaemon;
import com.postpilot.trigger.job.StalePublishingMonitorDaemon;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class PostDaemonTest {

    private static final ZoneId ZONE = ZoneId.of("UTC");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 19, 12, 0);
    private static final Clock CLOCK = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);

    @Test
    public void shouldPurgeOnlyExpiredDrafts() {
        InMemoryPostRecordRepository repository = new InMemoryPostRecordRepository();
        try (PostPilotTestFixture fixture = new PostPilotTestFixture(repository,
                ControllablePublisher.succeeding("page-1_a"), PlannerSettings.defaults())) {
            PostRecordEntity expired = repository.save(newPost(PostStatusEnum.DRAFT, NOW.minusDays(40), null));
            PostRecordEntity fresh = repository.save(newPost(PostStatusEnum.DRAFT, NOW.minusDays(2), null));
            PostRecordEntity oldScheduled = repository.save(newPost(PostStatusEnum.SCHEDULED, NOW.minusDays(40), null));
            DraftRetentionDaemon daemon = new DraftRetentionDaemon(repository, fixture.lifecycle, CLOCK, 30);

            daemon.purgeExpiredDrafts();

            Assertions.assertNull(repository.findById(expired.getId()));
            Assertions.assertNotNull(repository.findById(fresh.getId()));
            Assertions.assertNotNull(repository.findById(oldScheduled.getId()));
        }
    }

    @Test
    public void shouldKeepDraftsWhenRetentionDisabled() {
        InMemoryPostRecordRepository repository = new InMemoryPostRecordRepository();
        try (PostPilotTestFixture fixture = new PostPilotTestFixture(repository,
                ControllablePublisher.succeeding("page-1_a"), PlannerSettings.defaults())) {
            PostRecordEntity expired = repository.save(newPost(PostStatusEnum.DRAFT, NOW.minusDays(400), null));

            new DraftRetentionDaemon(repository, fixture.lifecycle, CLOCK, 0).purgeExpiredDrafts();

            Assertions.assertNotNull(repository.findById(expired.getId()));
        }
    }

    @Test
    public void shouldReportPostsStuckInPublishing() {
        InMemoryPostRecordRepository repository = new InMemoryPostRecordRepository();
        PostRecordEntity stuck = repository.save(newPost(PostStatusEnum.PUBLISHING, NOW.minusDays(1), NOW.minusMinutes(30)));
        repository.save(newPost(PostStatusEnum.PUBLISHING, NOW.minusDays(1), NOW.minusMinutes(1)));
        repository.save(newPost(PostStatusEnum.SCHEDULED, NOW.minusDays(1), null));
        StalePublishingMonitorDaemon daemon = new StalePublishingMonitorDaemon(repository, CLOCK, 15);

        List<Long> staleIds = daemon.findStalePublishing().stream()
                .map(PostRecordEntity::getId)
                .collect(Collectors.toList());
        daemon.reportStalePublishing();

        Assertions.assertEquals(List.of(stuck.getId()), staleIds);
        Assertions.assertEquals(PostStatusEnum.PUBLISHING, repository.findById(stuck.getId()).getStatus());
    }

    @Test
    public void shouldMeasureThresholdsAgainstTimestampsFromInjectedClock() {
        Clock weeksAgo = Clock.fixed(NOW.minusDays(40).atZone(ZONE).toInstant(), ZONE);
        Clock halfHourAgo = Clock.fixed(NOW.minusMinutes(30).atZone(ZONE).toInstant(), ZONE);
        InMemoryPostRecordRepository repository = new InMemoryPostRecordRepository(weeksAgo);
        ControllablePublisher publisher = ControllablePublisher.blocking("page-1_late");
        PlannerSettings settings = PlannerSettings.builder().publishTimeout(Duration.ofMillis(100)).build();
        try (PostPilotTestFixture planned = new PostPilotTestFixture(repository, publisher, settings, weeksAgo);
             PostPilotTestFixture requested = new PostPilotTestFixture(repository, publisher, settings, halfHourAgo)) {
            Long draftId = plan(planned, true);
            Long publishingId = plan(planned, false);
            Assertions.assertThrows(AppException.class, () -> requested.lifecycle.requestPublish(publishingId,
                    ChannelCredentials.builder().pageId("page-1").accessToken("token").build()));

            PostRecordEntity stuck = repository.findById(publishingId);
            Assertions.assertEquals(NOW.minusMinutes(30), stuck.getPublishRequestedAt());
            Assertions.assertEquals(NOW.minusDays(40), repository.findById(draftId).getCreatedAt());

            List<Long> staleIds = new StalePublishingMonitorDaemon(repository, CLOCK, 15).findStalePublishing().stream()
                    .map(PostRecordEntity::getId)
                    .collect(Collectors.toList());
            new DraftRetentionDaemon(repository, planned.lifecycle, CLOCK, 30).purgeExpiredDrafts();

            Assertions.assertEquals(List.of(publishingId), staleIds);
            Assertions.assertNull(repository.findById(draftId));
            publisher.release();
        }
    }

    private Long plan(PostPilotTestFixture fixture, boolean draftOnly) {
        return fixture.planner.plan(PlanCommand.builder()
                .businessId(draftOnly ? "biz-drafts" : "biz-publish")
                .candidates(List.of(PostCandidate.builder().text("hello").build()))
                .preferences(BusinessPreferences.builder()
                        .businessId(draftOnly ? "biz-drafts" : "biz-publish")
                        .frequency(1)
                        .build())
                .window(DateWindow.weekFrom(LocalDate.of(2026, 9, 7)))
                .draftOnly(draftOnly)
                .build()).postIds().get(0);
    }

    private PostRecordEntity newPost(PostStatusEnum status, LocalDateTime createdAt, LocalDateTime publishRequestedAt) {
        PostRecordEntity post = new PostRecordEntity();
        post.setBusinessId("biz-1");
        post.setStatus(status);
        post.setContent(PostContent.builder().text("hello").hashtags(new ArrayList<>()).build());
        post.setScheduledDate(LocalDate.of(2026, 10, 20));
        post.setScheduledTime(LocalTime.of(9, 0));
        post.setPublishAttempts(publishRequestedAt == null ? 0 : 1);
        post.setPublishRequestedAt(publishRequestedAt);
        post.setCreatedAt(createdAt);
        post.setUpdatedAt(createdAt);
        return post;
    }
}
