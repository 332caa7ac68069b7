package com.example.oncall.schedule;

import com.example.oncall.calendar.WeekWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleConsoleRendererTest {

    private final ScheduleConsoleRenderer renderer = new ScheduleConsoleRenderer();

    @Test
    void render_tableAndSummary() {
        Schedule schedule = new Schedule(List.of(
                WeekAssignment.assigned(1, new WeekWindow(LocalDate.of(2024, 1, 1)), "Alice", true, false),
                WeekAssignment.unassigned(2, new WeekWindow(LocalDate.of(2024, 1, 8)), false, true)));
        ScheduleSummary summary = ScheduleSummary.of(List.of("Alice", "Bartholomew"), schedule);

        String text = renderer.render(schedule, summary);

        assertThat(text).contains("On-call schedule 2024-01-01 to 2024-01-14 (2 week(s))");
        assertThat(text).contains("Week", "Start Date", "End Date", "Assigned To", "Holiday", "Patching");
        assertThat(text).containsPattern("1\\s+2024-01-01\\s+2024-01-07\\s+Alice\\s+Yes");
        assertThat(text).containsPattern("2\\s+2024-01-08\\s+2024-01-14\\s+UNASSIGNED\\s+Yes");
        assertThat(text).contains("Alice        weeks=1 holiday=1 patching=0");
        assertThat(text).contains("Bartholomew  weeks=0 holiday=0 patching=0");
        assertThat(text).contains("Unassigned weeks: 1");
    }

    @Test
    void render_emptySchedule() {
        assertThat(renderer.render(Schedule.empty(), null)).contains("no weeks requested");
    }
}
