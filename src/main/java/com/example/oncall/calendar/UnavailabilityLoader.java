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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads {@code Name,YYYY-MM-DD} lines into a per-member set of blocked days.
 */
@Component
public class UnavailabilityLoader {

    private static final Logger logger = LoggerFactory.getLogger(UnavailabilityLoader.class);

    public Map<String, Set<LocalDate>> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            logger.warn("Unavailability list {} not found, treating everyone as available",
                    DateListLoader.describe(resource));
            return Map.of();
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            Map<String, Set<LocalDate>> index = parse(reader, resource.getDescription());
            logger.info("Loaded unavailability for {} member(s) from {}", index.size(), resource.getDescription());
            return index;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource.getDescription(), e);
        }
    }

    public Map<String, Set<LocalDate>> parse(Reader source, String sourceName) throws IOException {
        Map<String, Set<LocalDate>> index = new LinkedHashMap<>();
        BufferedReader reader = new BufferedReader(source);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split(",", -1);
            if (parts.length != 2) {
                logger.warn("Skipping malformed unavailability line '{}' in {} line {}", line.trim(), sourceName, lineNo);
                continue;
            }
            String name = parts[0].trim();
            if (name.isEmpty()) {
                logger.warn("Skipping unavailability line without a name in {} line {}", sourceName, lineNo);
                continue;
            }
            LocalDate date;
            try {
                date = LocalDate.parse(parts[1].trim());
            } catch (DateTimeException e) {
                logger.warn("Skipping malformed date '{}' in {} line {}", parts[1].trim(), sourceName, lineNo);
                continue;
            }
            index.computeIfAbsent(name, k -> new TreeSet<>()).add(date);
        }
        return index;
    }
}
