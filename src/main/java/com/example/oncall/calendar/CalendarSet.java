package com.example.oncall.calendar;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookups over the holiday dates, patching dates and per-member unavailability
 * of a single scheduling run.
 * <p>
 * A member missing from the unavailability index is treated as fully available.
 */
public final class CalendarSet {

    private final Set<LocalDate> holidays;
    private final Set<LocalDate> patchingDates;
    private final Map<String, Set<LocalDate>> unavailability;

    public CalendarSet(Collection<LocalDate> holidays,
                       Collection<LocalDate> patchingDates,
                       Map<String, ? extends Collection<LocalDate>> unavailability) {
        this.holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
        this.patchingDates = patchingDates == null ? Set.of() : Set.copyOf(patchingDates);
        Map<String, Set<LocalDate>> copy = new HashMap<>();
        if (unavailability != null) {
            unavailability.forEach((member, dates) -> copy.put(member, Set.copyOf(dates)));
        }
        this.unavailability = Collections.unmodifiableMap(copy);
    }

    public static CalendarSet empty() {
        return new CalendarSet(Set.of(), Set.of(), Map.of());
    }

    public boolean containsHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public boolean containsPatching(LocalDate date) {
        return patchingDates.contains(date);
    }

    public boolean isUnavailable(String member, LocalDate date) {
        return unavailability.getOrDefault(member, Set.of()).contains(date);
    }

    public boolean weekHasHoliday(WeekWindow window) {
        return window.days().anyMatch(this::containsHoliday);
    }

    public boolean weekHasPatching(WeekWindow window) {
        return window.days().anyMatch(this::containsPatching);
    }

    public boolean memberAvailableForWeek(String member, WeekWindow window) {
        Set<LocalDate> blocked = unavailability.get(member);
        if (blocked == null || blocked.isEmpty()) {
            return true;
        }
        return window.days().noneMatch(blocked::contains);
    }

    public int holidayCount() {
        return holidays.size();
    }

    public int patchingCount() {
        return patchingDates.size();
    }

    public int unavailableMemberCount() {
        return unavailability.size();
    }
}
