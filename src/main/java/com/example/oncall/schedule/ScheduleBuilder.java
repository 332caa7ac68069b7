package com.example.oncall.schedule;

import com.example.oncall.calendar.CalendarSet;
import com.example.oncall.calendar.WeekWindow;
import com.example.oncall.exception.ScheduleGenerationException;
import com.example.oncall.roster.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the weekly assignment across the whole horizon. Every build starts from fresh
 * fairness counters and a cursor at position zero.
 */
@Component
public class ScheduleBuilder {

    /** Ten years of weeks. */
    public static final int MAX_WEEKS = 520;

    private static final Logger logger = LoggerFactory.getLogger(ScheduleBuilder.class);

    public Schedule build(Roster roster, LocalDate startDate, int numWeeks, CalendarSet calendar) {
        validate(roster, startDate, numWeeks);
        return assignWeeks(roster, startDate, numWeeks, calendar,
                new FairnessTracker(roster), new RotationCursor(roster));
    }

    Schedule build(Roster roster, LocalDate startDate, int numWeeks, CalendarSet calendar,
                   FairnessTracker fairness, RotationCursor cursor) {
        validate(roster, startDate, numWeeks);
        return assignWeeks(roster, startDate, numWeeks, calendar, fairness, cursor);
    }

    private Schedule assignWeeks(Roster roster, LocalDate startDate, int numWeeks, CalendarSet calendar,
                                 FairnessTracker fairness, RotationCursor cursor) {
        CalendarSet calendars = calendar == null ? CalendarSet.empty() : calendar;
        WeekAssigner assigner = new WeekAssigner(roster, fairness, cursor, calendars);

        WeekWindow window = WeekWindow.containing(startDate);
        logger.info("Building on-call schedule: {} member(s), {} week(s) from {}",
                roster.size(), numWeeks, window.start());

        List<WeekAssignment> weeks = new ArrayList<>();
        for (int weekNum = 1; weekNum <= numWeeks; weekNum++) {
            boolean hasHoliday = calendars.weekHasHoliday(window);
            boolean hasPatching = calendars.weekHasPatching(window);

            Optional<String> member = assigner.assign(window, hasHoliday, hasPatching);
            if (member.isPresent()) {
                weeks.add(WeekAssignment.assigned(weekNum, window, member.get(), hasHoliday, hasPatching));
            } else {
                logger.info("Week {} ({}): no eligible member, left unassigned", weekNum, window.start());
                weeks.add(WeekAssignment.unassigned(weekNum, window, hasHoliday, hasPatching));
            }
            window = window.next();
        }

        Schedule schedule = new Schedule(weeks);
        logger.info("On-call schedule built: {} week(s), {} unassigned", schedule.size(), schedule.unassignedCount());
        return schedule;
    }

    private void validate(Roster roster, LocalDate startDate, int numWeeks) {
        if (roster == null || roster.size() == 0) {
            throw new ScheduleGenerationException(ScheduleGenerationException.EMPTY_ROSTER,
                    "Roster must contain at least one member");
        }
        Objects.requireNonNull(startDate, "startDate");
        if (numWeeks < 0) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_WEEK_COUNT,
                    "Number of weeks must not be negative: " + numWeeks, numWeeks);
        }
        if (numWeeks > MAX_WEEKS) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_WEEK_COUNT,
                    "Number of weeks must not exceed " + MAX_WEEKS + ": " + numWeeks, numWeeks);
        }
    }
}
