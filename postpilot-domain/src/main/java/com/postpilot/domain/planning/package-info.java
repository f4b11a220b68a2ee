/**
 * Planning 领域 - 周计划排期域
 *
 * <p>职责：校验发帖偏好、把候选内容分配到计划窗口内的发帖时段</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>候选内容（Candidate）：外部生成、尚未排期的帖子内容，交给规划器后不可变</li>
 *   <li>时段（Slot）：一个 (日期, 时间) 组合</li>
 *   <li>窗口（Window）：一次规划覆盖的日期范围，首尾均包含</li>
 *   <li>排期视图（Schedule）：按业务与窗口过滤帖子记录得到的派生视图，不单独持久化</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.postpilot.domain.planning.service.ScheduleSlotAllocator} - 纯函数式时段分配</li>
 *   <li>{@link com.postpilot.domain.planning.service.PlanningPolicyDomainService} - 偏好与窗口校验</li>
 * </ul>
 *
 * @author postpilot
 * @since 2026-09-14
 */
package com.postpilot.domain.planning;
