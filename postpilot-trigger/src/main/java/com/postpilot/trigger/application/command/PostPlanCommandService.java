package com.postpilot.trigger.application.command;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlanCommand;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.planning.model.valobj.PostCandidate;
import com.postpilot.domain.planning.model.valobj.Schedule;
import com.postpilot.domain.planning.model.valobj.SlotAssignment;
import com.postpilot.domain.planning.service.PlanningPolicyDomainService;
import com.postpilot.domain.planning.service.ScheduleSlotAllocator;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.trigger.application.common.ScheduleViewAssembler;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 规划用例：校验偏好 → 分配时段 → 批量创建帖子记录。
 * <p>
 * 批量创建是全有或全无的：任一存储调用失败时删除本次已创建的全部记录，
 * 以 PLANNING_ABORTED 抛出，回滚失败作为 suppressed 异常附在其上。
 * 不对窗口内已有的记录去重。
 * </p>
 */
@Slf4j
@Service
public class PostPlanCommandService {

    private final PlanningPolicyDomainService planningPolicyDomainService;
    private final ScheduleSlotAllocator scheduleSlotAllocator;
    private final IPostRecordRepository postRecordRepository;
    private final PostLifecycleCommandService postLifecycleCommandService;
    private final BoundedCallInvoker boundedCallInvoker;
    private final ScheduleViewAssembler scheduleViewAssembler;
    private final PlannerSettings plannerSettings;

    private final Counter planSucceededCounter;
    private final Counter planAbortedCounter;
    private final Counter postsCreatedCounter;
    private final Counter rollbackFailedCounter;

    public PostPlanCommandService(PlanningPolicyDomainService planningPolicyDomainService,
                                  ScheduleSlotAllocator scheduleSlotAllocator,
                                  IPostRecordRepository postRecordRepository,
                                  PostLifecycleCommandService postLifecycleCommandService,
                                  BoundedCallInvoker boundedCallInvoker,
                                  ScheduleViewAssembler scheduleViewAssembler,
                                  PlannerSettings plannerSettings) {
        this.planningPolicyDomainService = planningPolicyDomainService;
        this.scheduleSlotAllocator = scheduleSlotAllocator;
        this.postRecordRepository = postRecordRepository;
        this.postLifecycleCommandService = postLifecycleCommandService;
        this.boundedCallInvoker = boundedCallInvoker;
        this.scheduleViewAssembler = scheduleViewAssembler;
        this.plannerSettings = plannerSettings == null ? PlannerSettings.defaults() : plannerSettings;
        this.planSucceededCounter = Counter.builder("postpilot.plan.succeeded.total").register(Metrics.globalRegistry);
        this.planAbortedCounter = Counter.builder("postpilot.plan.aborted.total").register(Metrics.globalRegistry);
        this.postsCreatedCounter = Counter.builder("postpilot.plan.posts.created.total").register(Metrics.globalRegistry);
        this.rollbackFailedCounter = Counter.builder("postpilot.plan.rollback.failed.total").register(Metrics.globalRegistry);
    }

    public Schedule plan(String businessId,
                         List<PostCandidate> candidates,
                         BusinessPreferences preferences,
                         DateWindow window) {
        return plan(PlanCommand.builder()
                .businessId(businessId)
                .candidates(candidates)
                .preferences(preferences)
                .window(window)
                .build());
    }

    public Schedule plan(PlanCommand command) {
        if (command == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Plan command cannot be null");
        }
        String businessId = command.getBusinessId();
        BusinessPreferences preferences = planningPolicyDomainService.normalizeAndValidate(
                businessId, command.getPreferences(), command.getWindow(), plannerSettings);
        DateWindow window = command.getWindow();
        if (command.isZeroPostRequest()) {
            log.info("Zero posts requested, returning empty schedule. businessId={}, window={}", businessId, window);
            return Schedule.empty(businessId, window);
        }

        int maxPosts = command.getRequestedPostCount() == null || command.getRequestedPostCount() < 0
                ? Integer.MAX_VALUE
                : command.getRequestedPostCount();
        List<SlotAssignment> assignments = scheduleSlotAllocator.allocate(
                command.getCandidates(), preferences, window, maxPosts);

        boolean draftOnly = command.getDraftOnly() != null ? command.getDraftOnly() : plannerSettings.isDraftOnly();
        Duration storeTimeout = command.getStoreTimeout() != null ? command.getStoreTimeout() : plannerSettings.getStoreTimeout();

        List<PostRecordEntity> created = new ArrayList<>(assignments.size());
        try {
            for (SlotAssignment assignment : assignments) {
                PostRecordEntity draft = PostRecordEntity.draftOf(businessId, assignment);
                PostRecordEntity saved = boundedCallInvoker.call("store.create", storeTimeout,
                        () -> postRecordRepository.save(draft));
                created.add(saved);
                if (!draftOnly) {
                    created.set(created.size() - 1, postLifecycleCommandService.confirmDraft(saved.getId(), storeTimeout));
                }
            }
        } catch (RuntimeException ex) {
            throw abort(businessId, window, created, storeTimeout, ex);
        }

        planSucceededCounter.increment();
        postsCreatedCounter.increment(created.size());
        log.info("Plan created. businessId={}, window={}, candidates={}, posts={}, draftOnly={}",
                businessId, window, command.getCandidates().size(), created.size(), draftOnly);
        return scheduleViewAssembler.toSchedule(businessId, window, created);
    }

    private AppException abort(String businessId,
                               DateWindow window,
                               List<PostRecordEntity> created,
                               Duration storeTimeout,
                               RuntimeException cause) {
        planAbortedCounter.increment();
        log.warn("Plan aborted, rolling back. businessId={}, window={}, createdPosts={}, reason={}",
                businessId, window, created.size(), cause.getMessage());
        AppException aborted = new AppException(ResponseCode.PLANNING_ABORTED,
                "规划中止, 回滚本次创建的 " + created.size() + " 条记录: " + cause.getMessage(), cause);
        for (PostRecordEntity post : created) {
            try {
                boundedCallInvoker.call("store.delete", storeTimeout, () -> postRecordRepository.deleteById(post.getId()));
            } catch (RuntimeException rollbackEx) {
                rollbackFailedCounter.increment();
                log.error("Plan rollback failed. businessId={}, postId={}, error={}",
                        businessId, post.getId(), rollbackEx.getMessage(), rollbackEx);
                aborted.addSuppressed(rollbackEx);
            }
        }
        return aborted;
    }
}
