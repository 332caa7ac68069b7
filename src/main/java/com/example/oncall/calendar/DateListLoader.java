package com.example.oncall.calendar;

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
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads newline separated {@code YYYY-MM-DD} dates (holidays, patching days).
 * Malformed lines are logged and skipped; a missing file is an empty set.
 */
@Component
public class DateListLoader {

    private static final Logger logger = LoggerFactory.getLogger(DateListLoader.class);

    public Set<LocalDate> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            logger.warn("Date list {} not found, treating as empty", describe(resource));
            return Set.of();
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            Set<LocalDate> dates = parse(reader, resource.getDescription());
            logger.info("Loaded {} date(s) from {}", dates.size(), resource.getDescription());
            return dates;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource.getDescription(), e);
        }
    }

    public Set<LocalDate> parse(Reader source, String sourceName) throws IOException {
        Set<LocalDate> dates = new TreeSet<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String token = line.trim();
            if (token.isEmpty()) {
                continue;
            }
            try {
                dates.add(LocalDate.parse(token));
            } catch (DateTimeException e) {
                logger.warn("Skipping malformed date '{}' in {} line {}", token, sourceName, lineNo);
            }
        }
        return dates;
    }

    static String describe(Resource resource) {
        return resource == null ? "<none>" : resource.getDescription();
    }
}
