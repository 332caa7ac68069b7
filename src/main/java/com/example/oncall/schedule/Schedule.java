package com.example.oncall.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Ordered week assignments for a horizon, one per week.
 */
public record Schedule(List<WeekAssignment> weeks) {

    public Schedule {
        weeks = List.copyOf(weeks);
    }

    public static Schedule empty() {
        return new Schedule(List.of());
    }

    public int size() {
        return weeks.size();
    }

    public boolean isEmpty() {
        return weeks.isEmpty();
    }

    public long unassignedCount() {
        return weeks.stream().filter(w -> !w.isAssigned()).count();
    }

    public LocalDate firstDay() {
        return weeks.isEmpty() ? null : weeks.get(0).startDate();
    }

    public LocalDate lastDay() {
        return weeks.isEmpty() ? null : weeks.get(weeks.size() - 1).endDate();
    }
}
