package com.example.oncall.schedule;

import com.example.oncall.roster.Roster;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FairnessTrackerTest {

    @Test
    void newTracker_startsEveryMemberAtZero() {
        FairnessTracker tracker = new FairnessTracker(Roster.of("A", "B"));

        assertThat(tracker.holidayCount("A")).isZero();
        assertThat(tracker.patchingCount("B")).isZero();
        assertThat(tracker.minPatchingCount()).isZero();
    }

    @Test
    void recordAssignment_incrementsOnlyFlaggedCounters() {
        FairnessTracker tracker = new FairnessTracker(Roster.of("A", "B"));

        tracker.recordAssignment("A", true, false);
        tracker.recordAssignment("B", false, false);
        tracker.recordAssignment("B", true, true);

        assertThat(tracker.holidayCount("A")).isEqualTo(1);
        assertThat(tracker.patchingCount("A")).isZero();
        assertThat(tracker.holidayCount("B")).isEqualTo(1);
        assertThat(tracker.patchingCount("B")).isEqualTo(1);
    }

    @Test
    void minPatchingCount_coversTheWholeRoster() {
        FairnessTracker tracker = new FairnessTracker(Roster.of("A", "B", "C"));

        tracker.recordAssignment("A", false, true);
        tracker.recordAssignment("B", false, true);
        assertThat(tracker.minPatchingCount()).isZero();

        tracker.recordAssignment("C", false, true);
        assertThat(tracker.minPatchingCount()).isEqualTo(1);
    }

    @Test
    void duplicateRosterNames_shareOneCounter() {
        FairnessTracker tracker = new FairnessTracker(Roster.of("A", "A"));

        tracker.recordAssignment("A", false, true);

        assertThat(tracker.patchingCount("A")).isEqualTo(1);
        assertThat(tracker.minPatchingCount()).isEqualTo(1);
    }
}
