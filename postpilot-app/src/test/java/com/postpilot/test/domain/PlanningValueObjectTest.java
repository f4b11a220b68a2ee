package com.postpilot.test.domain;

import com.postpilot.domain.planning.model.valobj.BusinessPreferences;
import com.postpilot.domain.planning.model.valobj.DateWindow;
import com.postpilot.domain.planning.model.valobj.PostCandidate;
import com.postpilot.domain.post.model.valobj.PostContent;
import com.postpilot.types.enums.PostTypeEnum;
import com.postpilot.types.enums.ResponseCode;
import com.postpilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;

public class PlanningValueObjectTest {

    @Test
    public void shouldParseTwelveAndTwentyFourHourTimes() {
        Assertions.assertEquals(LocalTime.of(18, 0), PostCandidate.parseSuggestedTime("6:00 PM"));
        Assertions.assertEquals(LocalTime.of(9, 15), PostCandidate.parseSuggestedTime("9:15 am"));
        Assertions.assertEquals(LocalTime.of(18, 0), PostCandidate.parseSuggestedTime("18:00"));
        Assertions.assertNull(PostCandidate.parseSuggestedTime("evening"));
        Assertions.assertNull(PostCandidate.parseSuggestedTime(" "));
    }

    @Test
    public void shouldResolvePostTypesLeniently() {
        Assertions.assertEquals(PostTypeEnum.PROMO, PostTypeEnum.fromCode("promotional"));
        Assertions.assertEquals(PostTypeEnum.TIP, PostTypeEnum.fromCode("Tips"));
        Assertions.assertEquals(PostTypeEnum.INSIGHT, PostTypeEnum.fromCode("insight"));
        Assertions.assertEquals(PostTypeEnum.GENERAL, PostTypeEnum.fromCode("meme"));
        Assertions.assertEquals(PostTypeEnum.GENERAL, PostTypeEnum.fromCode(null));
    }

    @Test
    public void shouldParseWeekdayNames() {
        Assertions.assertEquals(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY),
                BusinessPreferences.parseWeekdays(List.of("monday", "Wed", "FRIDAY")));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> BusinessPreferences.parseWeekdays(List.of("funday")));
        Assertions.assertTrue(ex.is(ResponseCode.INVALID_PREFERENCES));
    }

    @Test
    public void shouldCountPartialWeeksAsWholeWeeks() {
        LocalDate start = LocalDate.of(2026, 10, 19);

        Assertions.assertEquals(1, DateWindow.of(start, start).weeks());
        Assertions.assertEquals(1, DateWindow.weekFrom(start).weeks());
        Assertions.assertEquals(2, DateWindow.of(start, start.plusDays(7)).weeks());
        Assertions.assertFalse(DateWindow.of(start, start.minusDays(1)).isWellFormed());
    }

    @Test
    public void shouldAppendHashtagsToMessage() {
        PostContent content = PostContent.builder()
                .text("Fresh bread daily")
                .hashtags(List.of("#bakery", "#local"))
                .build();

        Assertions.assertEquals("Fresh bread daily\n\n#bakery #local", content.toMessage());
        Assertions.assertEquals("plain", PostContent.builder().text("plain").build().toMessage());
    }
}
