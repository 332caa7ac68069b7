package com.example.oncall.schedule;

import com.example.oncall.calendar.CalendarSet;
import com.example.oncall.calendar.WeekWindow;
import com.example.oncall.roster.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Picks the on-call member for a single week.
 * <p>
 * Candidates are taken from the rotation cursor one at a time, for at most one full pass of
 * the roster. Unavailability and the one-holiday-week cap are hard filters. For patching
 * weeks a candidate above the team's minimum patching count is passed over whenever some
 * member at the minimum could take the week instead. The cursor advances once per attempt,
 * accepted or not.
 */
public class WeekAssigner {

    private static final Logger logger = LoggerFactory.getLogger(WeekAssigner.class);

    static final int HOLIDAY_WEEK_CAP = 1;

    private final Roster roster;
    private final FairnessTracker fairness;
    private final RotationCursor cursor;
    private final CalendarSet calendar;

    public WeekAssigner(Roster roster, FairnessTracker fairness, RotationCursor cursor, CalendarSet calendar) {
        this.roster = roster;
        this.fairness = fairness;
        this.cursor = cursor;
        this.calendar = calendar;
    }

    /**
     * @return the assigned member, or empty when nobody in the roster is eligible this week
     */
    public Optional<String> assign(WeekWindow window, boolean hasHoliday, boolean hasPatching) {
        // fairness bar is fixed for the whole week
        int minPatching = fairness.minPatchingCount();

        for (int attempt = 0; attempt < roster.size(); attempt++) {
            String candidate = cursor.peek();
            boolean eligible = calendar.memberAvailableForWeek(candidate, window);

            if (eligible && hasHoliday && fairness.holidayCount(candidate) >= HOLIDAY_WEEK_CAP) {
                logger.debug("Week {}: {} skipped, holiday week already served", window.start(), candidate);
                eligible = false;
            }

            if (eligible && hasPatching && fairness.patchingCount(candidate) > minPatching
                    && fairerPatchingMemberExists(window, hasHoliday, minPatching)) {
                logger.debug("Week {}: {} deferred, patching count {} above minimum {}",
                        window.start(), candidate, fairness.patchingCount(candidate), minPatching);
                eligible = false;
            }

            if (eligible) {
                fairness.recordAssignment(candidate, hasHoliday, hasPatching);
                cursor.advance();
                logger.debug("Week {}: assigned {} after {} attempt(s)", window.start(), candidate, attempt + 1);
                return Optional.of(candidate);
            }
            cursor.advance();
        }
        return Optional.empty();
    }

    /**
     * Read-only circular scan of the whole roster starting at the current cursor position.
     * Works on a copy of the position; the cursor itself is left untouched.
     */
    boolean fairerPatchingMemberExists(WeekWindow window, boolean hasHoliday, int minPatching) {
        long start = cursor.position();
        for (int offset = 0; offset < roster.size(); offset++) {
            String member = roster.memberAt(start + offset);
            if (fairness.patchingCount(member) != minPatching) {
                continue;
            }
            if (!calendar.memberAvailableForWeek(member, window)) {
                continue;
            }
            if (hasHoliday && fairness.holidayCount(member) >= HOLIDAY_WEEK_CAP) {
                continue;
            }
            return true;
        }
        return false;
    }
}
