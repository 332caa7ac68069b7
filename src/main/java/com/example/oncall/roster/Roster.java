package com.example.oncall.roster;

import com.example.oncall.exception.ScheduleGenerationException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed, ordered list of on-call members for one run.
 * <p>
 * Duplicate names are kept as separate rotation slots; fairness counters are
 * shared between them because they are keyed by name.
 */
public final class Roster {

    private final List<String> members;

    private Roster(List<String> members) {
        this.members = members;
    }

    public static Roster of(List<String> members) {
        if (members == null || members.isEmpty()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.EMPTY_ROSTER,
                    "Roster must contain at least one member");
        }
        for (String member : members) {
            Objects.requireNonNull(member, "member");
            if (member.isBlank()) {
                throw new IllegalArgumentException("Roster member names must not be blank");
            }
        }
        return new Roster(List.copyOf(members));
    }

    public static Roster of(String... members) {
        return of(List.of(members));
    }

    public int size() {
        return members.size();
    }

    /**
     * Member at {@code index mod size}. Accepts any non-negative index so callers can
     * pass an unbounded cursor position.
     */
    public String memberAt(long index) {
        return members.get((int) Math.floorMod(index, (long) members.size()));
    }

    public List<String> members() {
        return members;
    }

    public Set<String> distinctMembers() {
        return new LinkedHashSet<>(members);
    }

    @Override
    public String toString() {
        return "Roster" + members;
    }
}
