package com.example.oncall.schedule;

import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Fixed-width text table of a schedule followed by the per-member tallies.
 */
@Component
public class ScheduleConsoleRenderer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final String FLAG = "Yes";

    public String render(Schedule schedule, ScheduleSummary summary) {
        StringBuilder out = new StringBuilder();
        if (schedule.isEmpty()) {
            out.append("On-call schedule: no weeks requested").append(System.lineSeparator());
            return out.toString();
        }
        out.append(String.format("On-call schedule %s to %s (%d week(s))%n",
                DATE_FORMAT.format(schedule.firstDay()), DATE_FORMAT.format(schedule.lastDay()), schedule.size()));

        int nameWidth = Math.max("Assigned To".length(), longestName(schedule, summary));
        String rowFormat = "%-4s  %-10s  %-10s  %-" + nameWidth + "s  %-7s  %-8s%n";
        out.append(String.format(rowFormat, "Week", "Start Date", "End Date", "Assigned To", "Holiday", "Patching"));
        out.append("-".repeat(4 + 2 + 10 + 2 + 10 + 2 + nameWidth + 2 + 7 + 2 + 8)).append(System.lineSeparator());
        for (WeekAssignment week : schedule.weeks()) {
            out.append(String.format(rowFormat,
                    week.weekNumber(),
                    DATE_FORMAT.format(week.startDate()),
                    DATE_FORMAT.format(week.endDate()),
                    week.assignedTo(),
                    week.hasHoliday() ? FLAG : "",
                    week.hasPatching() ? FLAG : ""));
        }

        if (summary != null) {
            out.append(System.lineSeparator()).append("Summary").append(System.lineSeparator());
            List<ScheduleSummary.MemberTally> members = summary.members();
            for (ScheduleSummary.MemberTally tally : members) {
                out.append(String.format("  %-" + nameWidth + "s  weeks=%d holiday=%d patching=%d%n",
                        tally.member(), tally.weeks(), tally.holidayWeeks(), tally.patchingWeeks()));
            }
            out.append(String.format("  Unassigned weeks: %d%n", summary.unassignedWeeks()));
        }
        return out.toString();
    }

    private int longestName(Schedule schedule, ScheduleSummary summary) {
        int longest = schedule.weeks().stream()
                .mapToInt(w -> w.assignedTo().length())
                .max()
                .orElse(0);
        if (summary != null) {
            for (ScheduleSummary.MemberTally tally : summary.members()) {
                longest = Math.max(longest, tally.member().length());
            }
        }
        return longest;
    }
}
