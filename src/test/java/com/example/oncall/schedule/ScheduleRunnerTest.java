package com.example.oncall.schedule;

import com.example.oncall.calendar.DateListLoader;
import com.example.oncall.calendar.UnavailabilityLoader;
import com.example.oncall.config.OnCallSettings;
import com.example.oncall.exception.ScheduleGenerationException;
import com.example.oncall.roster.RosterLoader;
import com.example.oncall.roster.RosterShuffler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleRunnerTest {

    @TempDir
    Path dir;

    @Test
    void run_printsTableAndWritesCsv() throws Exception {
        Files.writeString(dir.resolve("team.txt"), "Alice\nBob\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("holidays.txt"), "2024-01-03\n", StandardCharsets.UTF_8);
        Path csv = dir.resolve("export").resolve("schedule.csv");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        ScheduleRunner runner = runner(settings("2024-01-01", 3, csv.toString()), buffer);
        runner.run();

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("On-call schedule 2024-01-01 to 2024-01-21 (3 week(s))");
        assertThat(printed).contains("Unassigned weeks: 0");
        assertThat(Files.readAllLines(csv, StandardCharsets.UTF_8)).containsExactly(
                "Week,Start Date,End Date,Assigned To,Has Holiday,Has Patching",
                "1,2024-01-01,2024-01-07,Alice,true,false",
                "2,2024-01-08,2024-01-14,Bob,false,false",
                "3,2024-01-15,2024-01-21,Alice,false,false");
    }

    @Test
    void run_missingTeamFileAbortsWithConfigurationError() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ScheduleRunner runner = runner(settings("2024-01-01", 3, ""), buffer);

        assertThatThrownBy(() -> runner.run())
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting(e -> ((ScheduleGenerationException) e).getErrorCode())
                .isEqualTo(ScheduleGenerationException.ROSTER_NOT_FOUND);
        assertThat(buffer.size()).isZero();
    }

    private OnCallSettings settings(String start, int weeks, String csvPath) {
        return new OnCallSettings(
                dir.resolve("team.txt").toUri().toString(),
                dir.resolve("holidays.txt").toUri().toString(),
                dir.resolve("patching.txt").toUri().toString(),
                dir.resolve("unavailability.txt").toUri().toString(),
                start, weeks, csvPath);
    }

    private ScheduleRunner runner(OnCallSettings settings, ByteArrayOutputStream buffer) {
        ScheduleService service = new ScheduleService(settings, new DefaultResourceLoader(),
                new RosterLoader(RosterShuffler.identity()), new DateListLoader(), new UnavailabilityLoader(),
                new ScheduleBuilder());
        return new ScheduleRunner(service, new ScheduleConsoleRenderer(), new ScheduleCsvExporter(), settings,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }
}
