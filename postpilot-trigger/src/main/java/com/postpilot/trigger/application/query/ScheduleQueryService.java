package com.postpilot.trigger.application.query;

import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.planning.model.valobj.Schedule;
import com.postpilot.domain.planning.service.PlanningPolicyDomainService;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.trigger.application.common.ScheduleViewAssembler;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 排期查询用例。
 */
@Service
public class ScheduleQueryService {

    private final IPostRecordRepository postRecordRepository;
    private final PlanningPolicyDomainService planningPolicyDomainService;
    private final BoundedCallInvoker boundedCallInvoker;
    private final ScheduleViewAssembler scheduleViewAssembler;
    private final PlannerSettings plannerSettings;

    public ScheduleQueryService(IPostRecordRepository postRecordRepository,
                                PlanningPolicyDomainService planningPolicyDomainService,
                                BoundedCallInvoker boundedCallInvoker,
                                ScheduleViewAssembler scheduleViewAssembler,
                                PlannerSettings plannerSettings) {
        this.postRecordRepository = postRecordRepository;
        this.planningPolicyDomainService = planningPolicyDomainService;
        this.boundedCallInvoker = boundedCallInvoker;
        this.scheduleViewAssembler = scheduleViewAssembler;
        this.plannerSettings = plannerSettings == null ? PlannerSettings.defaults() : plannerSettings;
    }

    public Schedule getSchedule(String businessId, DateWindow window) {
        if (StringUtils.isBlank(businessId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "业务 ID 不能为空");
        }
        planningPolicyDomainService.validateWindow(window, plannerSettings);
        List<PostRecordEntity> posts = boundedCallInvoker.call("store.listByBusiness", plannerSettings.getStoreTimeout(),
                () -> postRecordRepository.findByBusinessAndDateRange(businessId, window));
        return scheduleViewAssembler.toSchedule(businessId, window, posts);
    }
}
