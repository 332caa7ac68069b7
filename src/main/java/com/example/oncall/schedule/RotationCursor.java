package com.example.oncall.schedule;

import com.example.oncall.roster.Roster;

/**
 * Circular pointer into the roster, shared by every week of a run.
 * <p>
 * The stored index never wraps; the modulo is applied when a member is read. A week that
 * rejects every candidate still leaves the cursor advanced by the roster size, so the next
 * week resumes at the same phase.
 */
public class RotationCursor {

    private final Roster roster;
    private long index;

    public RotationCursor(Roster roster) {
        this(roster, 0L);
    }

    RotationCursor(Roster roster, long index) {
        if (index < 0) {
            throw new IllegalArgumentException("Cursor index must not be negative: " + index);
        }
        this.roster = roster;
        this.index = index;
    }

    public String peek() {
        return roster.memberAt(index);
    }

    public void advance() {
        index++;
    }

    /**
     * Raw, unwrapped position. Read-only lookahead scans copy this value instead of
     * moving the cursor.
     */
    public long position() {
        return index;
    }
}
