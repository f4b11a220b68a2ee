package com.postpilot.trigger.application.common;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.Schedule;
import com.postpilot.domain.planning.model.valobj.ScheduleEntry;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.types.enums.PostStatusEnum;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 排期视图组装器：帖子记录 → 按 (日期, 时间, 帖子 ID) 排序的 Schedule，已取消的记录不占用时段。
 */
@Component
public class ScheduleViewAssembler {

    private static final Comparator<ScheduleEntry> ENTRY_ORDER = Comparator
            .comparing(ScheduleEntry::date)
            .thenComparing(ScheduleEntry::time)
            .thenComparing(ScheduleEntry::postId, Comparator.nullsLast(Comparator.naturalOrder()));

    public Schedule toSchedule(String businessId, DateWindow window, Collection<PostRecordEntity> posts) {
        if (posts == null || posts.isEmpty()) {
            return Schedule.empty(businessId, window);
        }
        List<ScheduleEntry> entries = posts.stream()
                .filter(Objects::nonNull)
                .filter(post -> post.getStatus() != PostStatusEnum.CANCELLED)
                .filter(post -> post.getScheduledDate() != null && post.getScheduledTime() != null)
                .filter(post -> window == null || window.contains(post.getScheduledDate()))
                .map(this::toEntry)
                .sorted(ENTRY_ORDER)
                .collect(Collectors.toList());
        return new Schedule(businessId, window, entries);
    }

    public ScheduleEntry toEntry(PostRecordEntity post) {
        return new ScheduleEntry(post.getScheduledDate(),
                post.getScheduledDate().getDayOfWeek(),
                post.getScheduledTime(),
                post.getId(),
                post.getStatus());
    }
}
