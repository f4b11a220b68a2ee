package com.postpilot.test.domain;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PlannerSettings;
import com.postpilot.domain.planning.service.PlanningPolicyDomainService;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;

public class PlanningPolicyDomainServiceTest {

    private static final LocalDate START = LocalDate.of(2026, 10, 19);

    private final PlanningPolicyDomainService service = new PlanningPolicyDomainService();

    @Test
    public void shouldApplyDefaultFrequency() {
        BusinessPreferences normalized = service.normalizeAndValidate("biz-1",
                BusinessPreferences.builder().build(),
                DateWindow.weekFrom(START),
                PlannerSettings.builder().defaultFrequency(2).build());

        Assertions.assertEquals(2, normalized.getFrequency());
        Assertions.assertEquals("biz-1", normalized.getBusinessId());
        Assertions.assertTrue(normalized.preferredDaysOrEmpty().isEmpty());
    }

    @Test
    public void shouldRejectFrequencyAbovePreferredDayCount() {
        BusinessPreferences preferences = BusinessPreferences.builder()
                .frequency(4)
                .preferredDays(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.FRIDAY))
                .build();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.normalizeAndValidate("biz-1", preferences, DateWindow.weekFrom(START), PlannerSettings.defaults()));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_PREFERENCES));
    }

    @Test
    public void shouldRejectFrequencyAboveConfiguredMaximum() {
        BusinessPreferences preferences = BusinessPreferences.builder().frequency(5).build();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.normalizeAndValidate("biz-1", preferences, DateWindow.weekFrom(START),
                        PlannerSettings.builder().maxFrequency(4).build()));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_PREFERENCES));
    }

    @Test
    public void shouldRejectZeroFrequency() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.normalizeAndValidate("biz-1", BusinessPreferences.builder().frequency(0).build(),
                        DateWindow.weekFrom(START), PlannerSettings.defaults()));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_PREFERENCES));
    }

    @Test
    public void shouldRejectPreferencesOfAnotherBusiness() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.normalizeAndValidate("biz-1", BusinessPreferences.builder().businessId("biz-2").build(),
                        DateWindow.weekFrom(START), PlannerSettings.defaults()));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_PREFERENCES));
    }

    @Test
    public void shouldRejectInvertedAndOversizedWindows() {
        PlannerSettings settings = PlannerSettings.builder().maxWindowDays(14).build();

        AppException inverted = Assertions.assertThrows(AppException.class,
                () -> service.validateWindow(DateWindow.of(START, START.minusDays(1)), settings));
        AppException oversized = Assertions.assertThrows(AppException.class,
                () -> service.validateWindow(DateWindow.of(START, START.plusDays(14)), settings));

        Assertions.assertTrue(inverted.is(ResponseCode.INVALID_PREFERENCES));
        Assertions.assertTrue(oversized.is(ResponseCode.INVALID_PREFERENCES));
        Assertions.assertDoesNotThrow(() -> service.validateWindow(DateWindow.of(START, START.plusDays(13)), settings));
    }
}
