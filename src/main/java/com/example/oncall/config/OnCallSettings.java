package com.example.oncall.config;

import com.example.oncall.exception.ScheduleGenerationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;

@Component
public class OnCallSettings {

    public static final int DEFAULT_WEEKS = 12;

    private final String teamFile;
    private final String holidaysFile;
    private final String patchingFile;
    private final String unavailabilityFile;
    private final String startDate;
    private final int weeks;
    private final String csvPath;

    public OnCallSettings(
            @Value("${oncall.files.team:file:team.txt}") String teamFile,
            @Value("${oncall.files.holidays:file:holidays.txt}") String holidaysFile,
            @Value("${oncall.files.patching:file:patching.txt}") String patchingFile,
            @Value("${oncall.files.unavailability:file:unavailability.txt}") String unavailabilityFile,
            @Value("${oncall.schedule.start-date:}") String startDate,
            @Value("${oncall.schedule.weeks:" + DEFAULT_WEEKS + "}") int weeks,
            @Value("${oncall.export.csv-path:oncall_schedule.csv}") String csvPath) {
        this.teamFile = teamFile;
        this.holidaysFile = holidaysFile;
        this.patchingFile = patchingFile;
        this.unavailabilityFile = unavailabilityFile;
        this.startDate = startDate;
        this.weeks = weeks;
        this.csvPath = csvPath;
    }

    public String getTeamFile() { return teamFile; }
    public String getHolidaysFile() { return holidaysFile; }
    public String getPatchingFile() { return patchingFile; }
    public String getUnavailabilityFile() { return unavailabilityFile; }
    public String getCsvPath() { return csvPath; }

    public boolean isCsvExportEnabled() {
        return csvPath != null && !csvPath.isBlank();
    }

    /**
     * Configured start date, or {@code today} when none is set.
     */
    public LocalDate resolveStartDate(LocalDate today) {
        if (startDate == null || startDate.isBlank()) {
            return today;
        }
        try {
            return LocalDate.parse(startDate.trim());
        } catch (DateTimeException e) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_START_DATE,
                    "oncall.schedule.start-date is not a valid YYYY-MM-DD date: " + startDate, e, startDate);
        }
    }

    public int resolveWeeks() {
        if (weeks <= 0) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_WEEK_COUNT,
                    "oncall.schedule.weeks must be positive: " + weeks, weeks);
        }
        return weeks;
    }
}
