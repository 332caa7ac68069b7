package com.example.oncall.schedule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-member tallies of a finished schedule, in roster order.
 */
public record ScheduleSummary(List<MemberTally> members, long unassignedWeeks) {

    public record MemberTally(String member, int weeks, int holidayWeeks, int patchingWeeks) { }

    public static ScheduleSummary of(Collection<String> rosterMembers, Schedule schedule) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (String member : rosterMembers) {
            counts.putIfAbsent(member, new int[3]);
        }
        for (WeekAssignment week : schedule.weeks()) {
            if (!week.isAssigned()) {
                continue;
            }
            int[] c = counts.computeIfAbsent(week.assignedTo(), k -> new int[3]);
            c[0]++;
            if (week.hasHoliday()) c[1]++;
            if (week.hasPatching()) c[2]++;
        }
        List<MemberTally> tallies = new ArrayList<>(counts.size());
        counts.forEach((member, c) -> tallies.add(new MemberTally(member, c[0], c[1], c[2])));
        return new ScheduleSummary(List.copyOf(tallies), schedule.unassignedCount());
    }
}
