package com.example.oncall.schedule;

import com.example.oncall.calendar.WeekWindow;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;

/**
 * Outcome of one scheduling week. {@code assignedTo} holds {@link #UNASSIGNED} when no
 * roster member was eligible.
 */
public record WeekAssignment(int weekNumber,
                             LocalDate startDate,
                             LocalDate endDate,
                             String assignedTo,
                             boolean hasHoliday,
                             boolean hasPatching) {

    public static final String UNASSIGNED = "UNASSIGNED";

    public static WeekAssignment assigned(int weekNumber, WeekWindow window, String member,
                                          boolean hasHoliday, boolean hasPatching) {
        return new WeekAssignment(weekNumber, window.start(), window.end(), member, hasHoliday, hasPatching);
    }

    public static WeekAssignment unassigned(int weekNumber, WeekWindow window,
                                            boolean hasHoliday, boolean hasPatching) {
        return new WeekAssignment(weekNumber, window.start(), window.end(), UNASSIGNED, hasHoliday, hasPatching);
    }

    @JsonIgnore
    public boolean isAssigned() {
        return !UNASSIGNED.equals(assignedTo);
    }
}
