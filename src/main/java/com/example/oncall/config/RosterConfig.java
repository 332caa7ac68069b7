package com.example.oncall.config;

import com.example.oncall.roster.RandomRosterShuffler;
import com.example.oncall.roster.RosterShuffler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RosterConfig {

    /**
     * Initial rotation order. Disabled shuffling keeps the file order, a seed makes the
     * random order reproducible.
     */
    @Bean
    RosterShuffler rosterShuffler(@Value("${oncall.roster.shuffle:true}") boolean shuffle,
                                  @Value("${oncall.roster.shuffle-seed:#{null}}") Long seed) {
        if (!shuffle) {
            return RosterShuffler.identity();
        }
        return seed == null ? new RandomRosterShuffler() : new RandomRosterShuffler(seed);
    }
}
