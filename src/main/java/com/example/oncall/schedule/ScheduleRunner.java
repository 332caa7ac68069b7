package com.example.oncall.schedule;

import com.example.oncall.config.OnCallSettings;
import com.example.oncall.exception.ScheduleGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Computes the configured schedule on startup, prints it and writes the CSV export.
 */
@Component
@ConditionalOnProperty(name = "oncall.runner.enabled", havingValue = "true", matchIfMissing = true)
public class ScheduleRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleRunner.class);

    private final ScheduleService scheduleService;
    private final ScheduleConsoleRenderer consoleRenderer;
    private final ScheduleCsvExporter csvExporter;
    private final OnCallSettings settings;
    private final PrintStream out;

    @Autowired
    public ScheduleRunner(ScheduleService scheduleService,
                          ScheduleConsoleRenderer consoleRenderer,
                          ScheduleCsvExporter csvExporter,
                          OnCallSettings settings) {
        this(scheduleService, consoleRenderer, csvExporter, settings, System.out);
    }

    ScheduleRunner(ScheduleService scheduleService,
                   ScheduleConsoleRenderer consoleRenderer,
                   ScheduleCsvExporter csvExporter,
                   OnCallSettings settings,
                   PrintStream out) {
        this.scheduleService = scheduleService;
        this.consoleRenderer = consoleRenderer;
        this.csvExporter = csvExporter;
        this.settings = settings;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        ScheduleService.ScheduleRun run;
        try {
            run = scheduleService.generate();
        } catch (ScheduleGenerationException e) {
            logger.error("On-call schedule not generated [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }

        out.print(consoleRenderer.render(run.schedule(), run.summary()));
        out.flush();

        if (settings.isCsvExportEnabled()) {
            Path written = csvExporter.write(run.schedule(), Path.of(settings.getCsvPath()));
            logger.info("Schedule exported to {}", written.toAbsolutePath());
        }
        logger.info("On-call run complete: {} week(s), {} roster member(s), {} unassigned",
                run.schedule().size(), run.roster().size(), run.schedule().unassignedCount());
    }
}
