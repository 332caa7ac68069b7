package com.example.oncall.calendar;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarSetTest {

    private static final WeekWindow WEEK = new WeekWindow(LocalDate.of(2024, 5, 6));

    @Test
    void weekFlags_lookAtAllSevenDays() {
        CalendarSet calendar = new CalendarSet(
                Set.of(WEEK.end()),
                Set.of(WEEK.start().plusDays(2)),
                Map.of());

        assertThat(calendar.weekHasHoliday(WEEK)).isTrue();
        assertThat(calendar.weekHasPatching(WEEK)).isTrue();
        assertThat(calendar.weekHasHoliday(WEEK.next())).isFalse();
        assertThat(calendar.weekHasPatching(WEEK.next())).isFalse();
    }

    @Test
    void memberAvailableForWeek_falseWhenAnyDayIsBlocked() {
        CalendarSet calendar = new CalendarSet(Set.of(), Set.of(), Map.of(
                "Ann", Set.of(WEEK.start().plusDays(4)),
                "Ben", Set.of(WEEK.start().minusDays(1))));

        assertThat(calendar.memberAvailableForWeek("Ann", WEEK)).isFalse();
        assertThat(calendar.memberAvailableForWeek("Ben", WEEK)).isTrue();
        assertThat(calendar.memberAvailableForWeek("Cleo", WEEK)).isTrue();
        assertThat(calendar.isUnavailable("Ann", WEEK.start().plusDays(4))).isTrue();
        assertThat(calendar.isUnavailable("Ann", WEEK.start())).isFalse();
    }

    @Test
    void inputsAreCopied() {
        Set<LocalDate> holidays = new HashSet<>();
        CalendarSet calendar = new CalendarSet(holidays, null, null);

        holidays.add(WEEK.start());

        assertThat(calendar.containsHoliday(WEEK.start())).isFalse();
        assertThat(calendar.containsPatching(WEEK.start())).isFalse();
        assertThat(calendar.holidayCount()).isZero();
    }
}
