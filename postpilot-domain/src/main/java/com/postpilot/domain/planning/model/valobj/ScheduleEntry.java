package com.postpilot.domain.planning.model.valobj;

import com.postpilot.types.enums.PostStatusEnum;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 排期视图中的一行。
 */
public record ScheduleEntry(LocalDate date,
                            DayOfWeek dayOfWeek,
                            LocalTime time,
                            Long postId,
                            PostStatusEnum status) {
}
