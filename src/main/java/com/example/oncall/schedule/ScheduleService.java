package com.example.oncall.schedule;

import com.example.oncall.calendar.CalendarSet;
import com.example.oncall.calendar.DateListLoader;
import com.example.oncall.calendar.UnavailabilityLoader;
import com.example.oncall.config.OnCallSettings;
import com.example.oncall.roster.Roster;
import com.example.oncall.roster.RosterLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Loads the configured input files and runs one schedule build. Inputs are re-read on every
 * call so each run starts from the current files.
 */
@Service
public class ScheduleService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final OnCallSettings settings;
    private final ResourceLoader resourceLoader;
    private final RosterLoader rosterLoader;
    private final DateListLoader dateListLoader;
    private final UnavailabilityLoader unavailabilityLoader;
    private final ScheduleBuilder scheduleBuilder;

    public ScheduleService(OnCallSettings settings,
                           ResourceLoader resourceLoader,
                           RosterLoader rosterLoader,
                           DateListLoader dateListLoader,
                           UnavailabilityLoader unavailabilityLoader,
                           ScheduleBuilder scheduleBuilder) {
        this.settings = settings;
        this.resourceLoader = resourceLoader;
        this.rosterLoader = rosterLoader;
        this.dateListLoader = dateListLoader;
        this.unavailabilityLoader = unavailabilityLoader;
        this.scheduleBuilder = scheduleBuilder;
    }

    public ScheduleRun generate() {
        return generate(null, null);
    }

    /**
     * @param startDate first date of the horizon, configured default (or today) when null
     * @param weeks     horizon length, configured default when null
     */
    public ScheduleRun generate(LocalDate startDate, Integer weeks) {
        LocalDate start = startDate != null ? startDate : settings.resolveStartDate(LocalDate.now());
        int numWeeks = weeks != null ? weeks : settings.resolveWeeks();

        Roster roster = rosterLoader.load(resourceLoader.getResource(settings.getTeamFile()));
        CalendarSet calendar = loadCalendar();

        Schedule schedule = scheduleBuilder.build(roster, start, numWeeks, calendar);
        logger.info("Generated schedule from {} for {} week(s): {} unassigned",
                start, numWeeks, schedule.unassignedCount());
        return new ScheduleRun(roster, schedule);
    }

    CalendarSet loadCalendar() {
        CalendarSet calendar = new CalendarSet(
                dateListLoader.load(resourceLoader.getResource(settings.getHolidaysFile())),
                dateListLoader.load(resourceLoader.getResource(settings.getPatchingFile())),
                unavailabilityLoader.load(resourceLoader.getResource(settings.getUnavailabilityFile())));
        logger.debug("Calendar loaded: {} holiday(s), {} patching date(s), {} member(s) with unavailability",
                calendar.holidayCount(), calendar.patchingCount(), calendar.unavailableMemberCount());
        return calendar;
    }

    public record ScheduleRun(Roster roster, Schedule schedule) {

        public ScheduleSummary summary() {
            return ScheduleSummary.of(roster.distinctMembers(), schedule);
        }
    }
}
