package com.postpilot.domain.planning.model.valobj;

import com.postpilot.types.common.Constants;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 规划窗口：[startDate, endDate]，首尾均包含。
 */
public record DateWindow(LocalDate startDate, LocalDate endDate) {

    public static DateWindow of(LocalDate startDate, LocalDate endDate) {
        return new DateWindow(startDate, endDate);
    }

    /**
     * 从起始日开始的完整一周。
     */
    public static DateWindow weekFrom(LocalDate startDate) {
        return new DateWindow(startDate, startDate.plusDays(Constants.DAYS_PER_WEEK - 1L));
    }

    public boolean isWellFormed() {
        return startDate != null && endDate != null && !endDate.isBefore(startDate);
    }

    public long days() {
        if (!isWellFormed()) {
            return 0L;
        }
        return ChronoUnit.DAYS.between(startDate, endDate) + 1L;
    }

    /**
     * 窗口覆盖的周数，不足一周按一周计。
     */
    public int weeks() {
        long days = days();
        if (days <= 0L) {
            return 0;
        }
        return (int) ((days + Constants.DAYS_PER_WEEK - 1L) / Constants.DAYS_PER_WEEK);
    }

    public boolean contains(LocalDate date) {
        return isWellFormed() && date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public List<LocalDate> dates() {
        if (!isWellFormed()) {
            return Collections.emptyList();
        }
        List<LocalDate> dates = new ArrayList<>((int) days());
        for (LocalDate cursor = startDate; !cursor.isAfter(endDate); cursor = cursor.plusDays(1)) {
            dates.add(cursor);
        }
        return dates;
    }

    @Override
    public String toString() {
        return startDate + ".." + endDate;
    }
}
