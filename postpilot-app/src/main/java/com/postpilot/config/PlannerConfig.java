package com.postpilot.config;

import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 把 planner.* 配置转换为显式的 {@link PlannerSettings}，注入规划与生命周期用例。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PlannerConfigProperties.class)
public class PlannerConfig {

    @Bean
    @ConditionalOnMissingBean
    public PlannerSettings plannerSettings(PlannerConfigProperties properties) {
        PlannerSettings defaults = PlannerSettings.defaults();
        PlannerSettings settings = PlannerSettings.builder()
                .defaultFrequency(positiveOr(properties.getDefaultFrequency(), defaults.getDefaultFrequency()))
                .maxFrequency(positiveOr(properties.getMaxFrequency(), defaults.getMaxFrequency()))
                .maxWindowDays(positiveOr(properties.getMaxWindowDays(), defaults.getMaxWindowDays()))
                .draftOnly(Boolean.TRUE.equals(properties.getDraftOnly()))
                .storeTimeout(millis(properties.getStoreTimeoutMs(), defaults.getStoreTimeout()))
                .publishTimeout(millis(properties.getPublishTimeoutMs(), defaults.getPublishTimeout()))
                .lockWait(millis(properties.getLockWaitMs(), defaults.getLockWait()))
                .build();
        log.info("Planner settings loaded. defaultFrequency={}, maxFrequency={}, maxWindowDays={}, draftOnly={}, storeTimeoutMs={}, publishTimeoutMs={}, lockWaitMs={}",
                settings.getDefaultFrequency(), settings.getMaxFrequency(), settings.getMaxWindowDays(), settings.isDraftOnly(),
                settings.getStoreTimeout().toMillis(), settings.getPublishTimeout().toMillis(), settings.getLockWait().toMillis());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private Duration millis(Long value, Duration fallback) {
        return value == null || value < 0 ? fallback : Duration.ofMillis(value);
    }
}
