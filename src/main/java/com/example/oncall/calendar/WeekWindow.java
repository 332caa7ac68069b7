package com.example.oncall.calendar;

import java.time.LocalDate;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Monday-anchored seven day span. Identified by its Monday.
 */
public record WeekWindow(LocalDate start) {

    public static final int DAYS = 7;

    public WeekWindow {
        Objects.requireNonNull(start, "start");
        if (start.getDayOfWeek().getValue() != 1) {
            throw new IllegalArgumentException("Week window must start on a Monday: " + start);
        }
    }

    public static WeekWindow containing(LocalDate date) {
        return new WeekWindow(weekStartMonday(date));
    }

    // ISO weekday: Monday=1 .. Sunday=7
    public static LocalDate weekStartMonday(LocalDate date) {
        int dow = date.getDayOfWeek().getValue();
        return date.minusDays(dow - 1L);
    }

    public LocalDate end() {
        return start.plusDays(DAYS - 1L);
    }

    public Stream<LocalDate> days() {
        return Stream.iterate(start, d -> d.plusDays(1)).limit(DAYS);
    }

    public WeekWindow next() {
        return new WeekWindow(start.plusDays(DAYS));
    }
}
