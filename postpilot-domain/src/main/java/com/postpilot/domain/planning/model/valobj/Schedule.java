package com.postpilot.domain.planning.model.valobj;

import java.util.Collections;
import java.util.List;

/**
 * 业务在窗口内的排期视图，按 (日期, 时间, 帖子 ID) 升序。
 */
public record Schedule(String businessId,
                       DateWindow window,
                       List<ScheduleEntry> entries) {

    public Schedule {
        entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
    }

    public static Schedule empty(String businessId, DateWindow window) {
        return new Schedule(businessId, window, Collections.emptyList());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Long> postIds() {
        return entries.stream().map(ScheduleEntry::postId).toList();
    }
}
