package com.postpilot.domain.planning.service;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.types.common.Constants;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 规划前置校验领域服务：发帖偏好、规划窗口与默认值归一化。
 */
@Service
public class PlanningPolicyDomainService {

    /**
     * 补全默认频率并校验偏好与窗口，返回归一化后的偏好副本。
     */
    public BusinessPreferences normalizeAndValidate(String businessId,
                                                    BusinessPreferences preferences,
                                                    DateWindow window,
                                                    PlannerSettings settings) {
        if (StringUtils.isBlank(businessId)) {
            throw invalid("业务 ID 不能为空");
        }
        if (preferences == null) {
            throw invalid("发帖偏好不能为空");
        }
        if (StringUtils.isNotBlank(preferences.getBusinessId())
                && !businessId.equals(preferences.getBusinessId())) {
            throw invalid("发帖偏好不属于业务 " + businessId);
        }
        PlannerSettings effectiveSettings = settings == null ? PlannerSettings.defaults() : settings;

        int frequency = preferences.getFrequency() == null
                ? effectiveSettings.getDefaultFrequency()
                : preferences.getFrequency();
        int maxFrequency = Math.min(Math.max(effectiveSettings.getMaxFrequency(), 1), Constants.MAX_WEEKLY_FREQUENCY);
        if (frequency < 1 || frequency > maxFrequency) {
            throw invalid("每周发帖次数必须在 1.." + maxFrequency + " 之间, 当前为 " + frequency);
        }
        if (preferences.hasPreferredDays() && frequency > preferences.getPreferredDays().size()) {
            throw invalid("每周发帖次数 " + frequency + " 超过偏好发帖日数量 " + preferences.getPreferredDays().size());
        }
        validateWindow(window, effectiveSettings);

        return BusinessPreferences.builder()
                .businessId(businessId)
                .frequency(frequency)
                .preferredDays(preferences.preferredDaysOrEmpty())
                .defaultTone(preferences.getDefaultTone())
                .defaultPostType(preferences.getDefaultPostType())
                .build();
    }

    public void validateWindow(DateWindow window, PlannerSettings settings) {
        if (window == null || window.startDate() == null || window.endDate() == null) {
            throw invalid("规划窗口起止日期不能为空");
        }
        if (!window.isWellFormed()) {
            throw invalid("规划窗口结束日期早于开始日期: " + window);
        }
        int maxWindowDays = settings == null ? PlannerSettings.defaults().getMaxWindowDays() : settings.getMaxWindowDays();
        if (maxWindowDays > 0 && window.days() > maxWindowDays) {
            throw invalid("规划窗口超过 " + maxWindowDays + " 天: " + window);
        }
    }

    private AppException invalid(String message) {
        return new AppException(ResponseCode.INVALID_PREFERENCES, message);
    }
}
