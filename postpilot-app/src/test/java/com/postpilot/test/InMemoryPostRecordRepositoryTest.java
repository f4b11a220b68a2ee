package com.postpilot.test;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.infrastructure.repository.post.InMemoryPostRecordRepository;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class InMemoryPostRecordRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 19);

    private final InMemoryPostRecordRepository repository = new InMemoryPostRecordRepository();

    @Test
    public void shouldAssignIdsAndVersionOnSave() {
        PostRecordEntity first = repository.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));
        PostRecordEntity second = repository.save(newPost("biz-1", DAY, LocalTime.of(10, 0)));

        Assertions.assertNotNull(first.getId());
        Assertions.assertNotEquals(first.getId(), second.getId());
        Assertions.assertEquals(0, first.getVersion());
    }

    @Test
    public void shouldRejectStaleUpdate() {
        PostRecordEntity saved = repository.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));
        PostRecordEntity staleCopy = repository.findById(saved.getId());

        saved.confirm();
        PostRecordEntity updated = repository.update(saved);
        Assertions.assertEquals(1, updated.getVersion());

        staleCopy.cancel();
        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.update(staleCopy));

        Assertions.assertTrue(ex.is(ResponseCode.CONFLICT));
        Assertions.assertEquals(PostStatusEnum.SCHEDULED, repository.findById(saved.getId()).getStatus());
    }

    @Test
    public void shouldReportMissingRecordOnUpdate() {
        PostRecordEntity ghost = newPost("biz-1", DAY, LocalTime.of(9, 0));
        ghost.setId(99L);
        ghost.setVersion(0);

        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.update(ghost));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldIsolateStoredRecordsFromCallerMutation() {
        PostRecordEntity saved = repository.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));

        PostRecordEntity loaded = repository.findById(saved.getId());
        loaded.getContent().setText("mutated");
        loaded.setStatus(PostStatusEnum.CANCELLED);

        PostRecordEntity reloaded = repository.findById(saved.getId());
        Assertions.assertEquals("hello", reloaded.getContent().getText());
        Assertions.assertEquals(PostStatusEnum.DRAFT, reloaded.getStatus());
    }

    @Test
    public void shouldListByBusinessWindowInSlotOrder() {
        PostRecordEntity late = repository.save(newPost("biz-1", DAY.plusDays(2), LocalTime.of(9, 0)));
        PostRecordEntity early = repository.save(newPost("biz-1", DAY, LocalTime.of(18, 0)));
        PostRecordEntity earliest = repository.save(newPost("biz-1", DAY, LocalTime.of(8, 0)));
        repository.save(newPost("biz-1", DAY.plusDays(10), LocalTime.of(8, 0)));
        repository.save(newPost("biz-2", DAY, LocalTime.of(8, 0)));

        List<Long> ids = repository.findByBusinessAndDateRange("biz-1", DateWindow.weekFrom(DAY)).stream()
                .map(PostRecordEntity::getId)
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of(earliest.getId(), early.getId(), late.getId()), ids);
        Assertions.assertEquals(4, repository.findByBusinessId("biz-1").size());
        Assertions.assertEquals(5, repository.findByStatus(PostStatusEnum.DRAFT).size());
    }

    @Test
    public void shouldDeleteOnlyExistingRecords() {
        PostRecordEntity saved = repository.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));

        Assertions.assertTrue(repository.deleteById(saved.getId()));
        Assertions.assertFalse(repository.deleteById(saved.getId()));
        Assertions.assertNull(repository.findById(saved.getId()));
    }

    @Test
    public void shouldStampTimestampsFromStoreClock() {
        LocalDateTime createdAt = LocalDateTime.of(2026, 10, 1, 8, 0);
        InMemoryPostRecordRepository clocked = new InMemoryPostRecordRepository(
                Clock.fixed(createdAt.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

        PostRecordEntity saved = clocked.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));
        saved.setUpdatedAt(createdAt.minusYears(1));
        saved.confirm();
        PostRecordEntity updated = clocked.update(saved);

        Assertions.assertEquals(createdAt, saved.getCreatedAt());
        Assertions.assertEquals(createdAt, updated.getUpdatedAt());
    }

    @Test
    public void shouldRejectUpdateWithoutVersion() {
        PostRecordEntity saved = repository.save(newPost("biz-1", DAY, LocalTime.of(9, 0)));
        saved.setVersion(null);

        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.update(saved));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    private PostRecordEntity newPost(String businessId, LocalDate date, LocalTime time) {
        PostRecordEntity post = new PostRecordEntity();
        post.setBusinessId(businessId);
        post.setStatus(PostStatusEnum.DRAFT);
        post.setContent(PostContent.builder().text("hello").hashtags(new ArrayList<>()).build());
        post.setScheduledDate(date);
        post.setScheduledTime(time);
        post.setPublishAttempts(0);
        return post;
    }
}
