package com.postpilot.trigger.application.query;

import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.post.adapter.repository.IPostRecordRepository;
import com.postpilot.domain.post.model.entity.PostRecordEntity;
import com.postpilot.domain.post.model.valobj.PostStatusStat;
import com.postpilot.trigger.application.common.BoundedCallInvoker;
import com.postpilot.types.enums.PostStatusEnum;
import com.postpilot.types.enums.PostTypeEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 帖子统计与按状态列表查询。
 */
@Service
public class PostStatsQueryService {

    private final IPostRecordRepository postRecordRepository;
    private final BoundedCallInvoker boundedCallInvoker;
    private final PlannerSettings plannerSettings;
    private final Clock clock;

    public PostStatsQueryService(IPostRecordRepository postRecordRepository,
                                 BoundedCallInvoker boundedCallInvoker,
                                 PlannerSettings plannerSettings,
                                 Clock clock) {
        this.postRecordRepository = postRecordRepository;
        this.boundedCallInvoker = boundedCallInvoker;
        this.plannerSettings = plannerSettings == null ? PlannerSettings.defaults() : plannerSettings;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public PostStatusStat summarize(String businessId) {
        requireBusinessId(businessId);
        List<PostRecordEntity> posts = boundedCallInvoker.call("store.listByBusiness", plannerSettings.getStoreTimeout(),
                () -> postRecordRepository.findByBusinessId(businessId));

        Map<PostStatusEnum, Long> countByStatus = new EnumMap<>(PostStatusEnum.class);
        for (PostStatusEnum status : PostStatusEnum.values()) {
            countByStatus.put(status, 0L);
        }
        Map<PostTypeEnum, Long> countByPostType = new EnumMap<>(PostTypeEnum.class);
        long total = 0L;
        if (posts != null) {
            for (PostRecordEntity post : posts) {
                if (post == null || post.getStatus() == null) {
                    continue;
                }
                total++;
                countByStatus.merge(post.getStatus(), 1L, Long::sum);
                PostTypeEnum postType = post.getContent() == null || post.getContent().getPostType() == null
                        ? PostTypeEnum.GENERAL
                        : post.getContent().getPostType();
                countByPostType.merge(postType, 1L, Long::sum);
            }
        }
        return PostStatusStat.builder()
                .businessId(businessId)
                .total(total)
                .countByStatus(countByStatus)
                .countByPostType(countByPostType)
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    public List<PostRecordEntity> listByStatus(String businessId, PostStatusEnum status) {
        requireBusinessId(businessId);
        if (status == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "状态不能为空");
        }
        return boundedCallInvoker.call("store.listByStatus", plannerSettings.getStoreTimeout(),
                () -> postRecordRepository.findByBusinessIdAndStatus(businessId, status));
    }

    private void requireBusinessId(String businessId) {
        if (StringUtils.isBlank(businessId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "业务 ID 不能为空");
        }
    }
}
