package com.example.oncall.roster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class RandomRosterShuffler implements RosterShuffler {

    private final Random random;

    public RandomRosterShuffler() {
        this(new Random());
    }

    public RandomRosterShuffler(long seed) {
        this(new Random(seed));
    }

    public RandomRosterShuffler(Random random) {
        this.random = random;
    }

    @Override
    public List<String> shuffle(List<String> members) {
        List<String> copy = new ArrayList<>(members);
        Collections.shuffle(copy, random);
        return List.copyOf(copy);
    }
}
