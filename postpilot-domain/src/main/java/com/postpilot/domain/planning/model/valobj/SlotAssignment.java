package com.postpilot.domain.planning.model.valobj;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 分配结果：候选内容（按输入下标）落到的 (日期, 时间)。
 */
public record SlotAssignment(int candidateIndex,
                             PostCandidate candidate,
                             LocalDate date,
                             LocalTime time) {

    public DayOfWeek dayOfWeek() {
        return date.getDayOfWeek();
    }
}
