package com.example.oncall.schedule;

import com.example.oncall.roster.Roster;

import java.util.HashMap;
import java.util.Map;

/**
 * Holiday-week and patching-week counters per member for the current run.
 * Counters only grow, and only through {@link #recordAssignment}.
 */
public class FairnessTracker {

    private final Map<String, Integer> holidayCounts = new HashMap<>();
    private final Map<String, Integer> patchingCounts = new HashMap<>();

    public FairnessTracker(Roster roster) {
        for (String member : roster.members()) {
            holidayCounts.putIfAbsent(member, 0);
            patchingCounts.putIfAbsent(member, 0);
        }
    }

    public int holidayCount(String member) {
        return holidayCounts.getOrDefault(member, 0);
    }

    public int patchingCount(String member) {
        return patchingCounts.getOrDefault(member, 0);
    }

    /**
     * Lowest patching count over every roster member, available or not.
     */
    public int minPatchingCount() {
        return patchingCounts.values().stream()
                .mapToInt(Integer::intValue)
                .min()
                .orElse(0);
    }

    public void recordAssignment(String member, boolean hasHoliday, boolean hasPatching) {
        if (hasHoliday) {
            holidayCounts.merge(member, 1, Integer::sum);
        }
        if (hasPatching) {
            patchingCounts.merge(member, 1, Integer::sum);
        }
    }
}
