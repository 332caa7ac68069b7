package com.example.oncall.schedule;

import com.example.oncall.exception.ScheduleGenerationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;

@Component
public class ScheduleCsvExporter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final String[] HEADERS = {
            "Week", "Start Date", "End Date", "Assigned To", "Has Holiday", "Has Patching"
    };

    public CsvFile export(Schedule schedule) {
        byte[] data = render(schedule).getBytes(StandardCharsets.UTF_8);
        String filename = schedule.isEmpty()
                ? "oncall-schedule.csv"
                : String.format("oncall-schedule-%s.csv", DATE_FORMAT.format(schedule.firstDay()));
        return new CsvFile(filename, data);
    }

    public String render(Schedule schedule) {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join(",", HEADERS)).append('\n');
        schedule.weeks().forEach(week -> appendRow(builder, week));
        return builder.toString();
    }

    public Path write(Schedule schedule, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.writeString(target, render(schedule), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScheduleGenerationException(ScheduleGenerationException.CSV_EXPORT_FAILED,
                    "Failed to write schedule CSV to " + target, e, target);
        }
    }

    private void appendRow(StringBuilder builder, WeekAssignment week) {
        StringJoiner joiner = new StringJoiner(",");
        joiner.add(Integer.toString(week.weekNumber()));
        joiner.add(formatDate(week.startDate()));
        joiner.add(formatDate(week.endDate()));
        joiner.add(escapeCsv(week.assignedTo()));
        joiner.add(Boolean.toString(week.hasHoliday()));
        joiner.add(Boolean.toString(week.hasPatching()));
        builder.append(joiner).append('\n');
    }

    private String formatDate(LocalDate date) {
        return date == null ? "" : DATE_FORMAT.format(date);
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
