package com.example.oncall.roster;

import com.example.oncall.exception.ScheduleGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the team file (one name per line) and applies the initial rotation order.
 */
@Component
public class RosterLoader {

    private static final Logger logger = LoggerFactory.getLogger(RosterLoader.class);

    private final RosterShuffler shuffler;

    public RosterLoader(RosterShuffler shuffler) {
        this.shuffler = shuffler;
    }

    public Roster load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.ROSTER_NOT_FOUND,
                    "Team file not found: " + (resource == null ? "<none>" : resource.getDescription()));
        }
        List<String> names;
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            names = parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource.getDescription(), e);
        }
        if (names.isEmpty()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.EMPTY_ROSTER,
                    "Team file " + resource.getDescription() + " contains no members");
        }
        Roster roster = Roster.of(shuffler.shuffle(names));
        logger.info("Loaded {} team member(s) from {}", roster.size(), resource.getDescription());
        return roster;
    }

    public List<String> parse(Reader source) throws IOException {
        List<String> names = new ArrayList<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            String name = line.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
