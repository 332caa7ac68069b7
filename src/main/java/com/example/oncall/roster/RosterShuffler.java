package com.example.oncall.roster;

import java.util.List;

/**
 * Produces the initial rotation order from the loaded team list.
 */
@FunctionalInterface
public interface RosterShuffler {

    List<String> shuffle(List<String> members);

    static RosterShuffler identity() {
        return List::copyOf;
    }
}
