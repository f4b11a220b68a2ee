package com.postpilot.domain.planning.service;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PostCandidate;
import com.postpilot.domain.planning.model.valobj.SlotAssignment;
import com.postpilot.types.common.Constants;
import com.postpilot.types.enums.PostTypeEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 时段分配领域服务：把候选内容分配到规划窗口内的 (日期, 时间)。
 * <p>
 * 规则：
 * <ul>
 *   <li>可用日 = 窗口内星期属于偏好发帖日的日期；未设置偏好时窗口内每天都可用</li>
 *   <li>分配数量 = min(候选数, 每周频率 × 窗口周数)</li>
 *   <li>按自然周（周一开始）逐周分配，每周最多 frequency 篇；有偏好日时在可用日上均匀铺开，
 *   无偏好日时按默认发帖日表选取（见 {@link #defaultPostingDays(int)}）</li>
 *   <li>时间优先取候选建议时间；为空或当天已占用时取帖子类型默认时间，仍冲突则顺延一小时</li>
 * </ul>
 * 无状态、无随机性，相同输入始终得到相同顺序的结果。
 * </p>
 */
@Service
public class ScheduleSlotAllocator {

    private static final int HOURS_PER_DAY = 24;

    private static final List<DayOfWeek> LIGHT_POSTING_DAYS =
            List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);

    private static final List<DayOfWeek> REGULAR_POSTING_DAYS =
            List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);

    public List<SlotAssignment> allocate(List<PostCandidate> candidates,
                                         BusinessPreferences preferences,
                                         DateWindow window) {
        return allocate(candidates, preferences, window, Integer.MAX_VALUE);
    }

    /**
     * @param maxPosts 调用方允许的最大分配数，0 表示显式请求空排期
     */
    public List<SlotAssignment> allocate(List<PostCandidate> candidates,
                                         BusinessPreferences preferences,
                                         DateWindow window,
                                         int maxPosts) {
        if (preferences == null || preferences.getFrequency() == null
                || preferences.getFrequency() < 1
                || preferences.getFrequency() > Constants.MAX_WEEKLY_FREQUENCY) {
            throw new AppException(ResponseCode.INVALID_PREFERENCES, "每周发帖次数必须在 1..7 之间");
        }
        if (window == null || !window.isWellFormed()) {
            throw new AppException(ResponseCode.INVALID_PREFERENCES, "规划窗口不合法: " + window);
        }

        List<LocalDate> eligibleDates = resolveEligibleDates(preferences, window);
        if (eligibleDates.isEmpty()) {
            throw new AppException(ResponseCode.INSUFFICIENT_SLOTS,
                    "窗口 " + window + " 内没有可用发帖日, preferredDays=" + preferences.preferredDaysOrEmpty());
        }
        if (maxPosts <= 0) {
            return Collections.emptyList();
        }
        if (candidates == null || candidates.isEmpty()) {
            throw new AppException(ResponseCode.EMPTY_CANDIDATES, "候选内容为空");
        }

        int frequency = preferences.getFrequency();
        long capacity = (long) frequency * window.weeks();
        int target = (int) Math.min(Math.min(candidates.size(), capacity), maxPosts);

        List<LocalDate> chosenDates = chooseDates(eligibleDates, frequency, target,
                preferences.preferredDaysOrEmpty().isEmpty());

        Map<LocalDate, Set<LocalTime>> usedTimes = new HashMap<>();
        List<SlotAssignment> assignments = new ArrayList<>(chosenDates.size());
        for (int i = 0; i < chosenDates.size(); i++) {
            LocalDate date = chosenDates.get(i);
            PostCandidate candidate = candidates.get(i);
            Set<LocalTime> used = usedTimes.computeIfAbsent(date, key -> new HashSet<>());
            LocalTime time = resolveTime(candidate, used);
            used.add(time);
            assignments.add(new SlotAssignment(i, candidate, date, time));
        }
        return Collections.unmodifiableList(assignments);
    }

    List<LocalDate> resolveEligibleDates(BusinessPreferences preferences, DateWindow window) {
        Set<DayOfWeek> preferredDays = preferences.preferredDaysOrEmpty();
        List<LocalDate> eligible = new ArrayList<>();
        for (LocalDate date : window.dates()) {
            if (preferredDays.isEmpty() || preferredDays.contains(date.getDayOfWeek())) {
                eligible.add(date);
            }
        }
        return eligible;
    }

    /**
     * 未设置偏好日时的默认发帖日，按优先级排列：
     * 频率 ≤ 3 取周一/周三/周五，≤ 5 取周一/周二/周四/周五/周六，其余为整周；不足部分按星期顺序补齐。
     */
    public static List<DayOfWeek> defaultPostingDays(int frequency) {
        List<DayOfWeek> base = frequency <= 3 ? LIGHT_POSTING_DAYS
                : frequency <= 5 ? REGULAR_POSTING_DAYS
                : List.of(DayOfWeek.values());
        List<DayOfWeek> ordered = new ArrayList<>(base);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (!ordered.contains(day)) {
                ordered.add(day);
            }
        }
        return Collections.unmodifiableList(ordered);
    }

    /**
     * 逐周分配：每周最多 frequency 篇。
     */
    private List<LocalDate> chooseDates(List<LocalDate> eligibleDates, int frequency, int target, boolean useDefaultDays) {
        Map<LocalDate, List<LocalDate>> datesByWeek = new TreeMap<>();
        for (LocalDate date : eligibleDates) {
            LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            datesByWeek.computeIfAbsent(weekStart, key -> new ArrayList<>()).add(date);
        }

        List<LocalDate> chosen = new ArrayList<>(target);
        for (List<LocalDate> weekDates : datesByWeek.values()) {
            int remaining = target - chosen.size();
            if (remaining <= 0) {
                break;
            }
            int quota = Math.min(Math.min(frequency, weekDates.size()), remaining);
            chosen.addAll(useDefaultDays
                    ? pickByPriority(weekDates, quota, defaultPostingDays(frequency))
                    : spread(weekDates, quota));
        }
        return chosen;
    }

    /**
     * 在有序日期中等距选取 count 个。
     */
    private List<LocalDate> spread(List<LocalDate> dates, int count) {
        if (count >= dates.size()) {
            return dates;
        }
        List<LocalDate> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            picked.add(dates.get(i * dates.size() / count));
        }
        return picked;
    }

    private List<LocalDate> pickByPriority(List<LocalDate> dates, int count, List<DayOfWeek> priority) {
        Map<DayOfWeek, LocalDate> byDay = new EnumMap<>(DayOfWeek.class);
        for (LocalDate date : dates) {
            byDay.put(date.getDayOfWeek(), date);
        }
        List<LocalDate> picked = new ArrayList<>(count);
        for (DayOfWeek day : priority) {
            if (picked.size() >= count) {
                break;
            }
            LocalDate date = byDay.get(day);
            if (date != null) {
                picked.add(date);
            }
        }
        Collections.sort(picked);
        return picked;
    }

    private LocalTime resolveTime(PostCandidate candidate, Set<LocalTime> usedTimes) {
        LocalTime suggested = candidate == null ? null : candidate.getSuggestedTime();
        if (suggested != null && !usedTimes.contains(suggested)) {
            return suggested;
        }
        LocalTime cursor = candidate == null
                ? PostTypeEnum.GENERAL.getDefaultTime()
                : candidate.resolvedPostType().getDefaultTime();
        for (int i = 0; i < HOURS_PER_DAY; i++) {
            if (!usedTimes.contains(cursor)) {
                return cursor;
            }
            cursor = cursor.plusHours(1);
        }
        throw new AppException(ResponseCode.INSUFFICIENT_SLOTS, "单日可用发帖时间已耗尽");
    }
}
