package com.example.oncall.roster;

import com.example.oncall.exception.ScheduleGenerationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterLoaderTest {

    @Test
    void load_trimsNamesAndSkipsBlankLines(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("team.txt");
        Files.writeString(file, "  Alice\n\nBob  \n\t\nCarol\n", StandardCharsets.UTF_8);

        Roster roster = new RosterLoader(RosterShuffler.identity()).load(new FileSystemResource(file));

        assertThat(roster.members()).containsExactly("Alice", "Bob", "Carol");
    }

    @Test
    void load_appliesShufflerOnce(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("team.txt");
        Files.writeString(file, "Alice\nBob\nCarol\n", StandardCharsets.UTF_8);
        List<List<String>> calls = new ArrayList<>();
        RosterShuffler reverse = members -> {
            calls.add(members);
            List<String> copy = new ArrayList<>(members);
            Collections.reverse(copy);
            return copy;
        };

        Roster roster = new RosterLoader(reverse).load(new FileSystemResource(file));

        assertThat(calls).hasSize(1);
        assertThat(roster.members()).containsExactly("Carol", "Bob", "Alice");
    }

    @Test
    void load_missingFileIsConfigurationError(@TempDir Path dir) {
        RosterLoader loader = new RosterLoader(RosterShuffler.identity());

        assertThatThrownBy(() -> loader.load(new FileSystemResource(dir.resolve("team.txt"))))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting(e -> ((ScheduleGenerationException) e).getErrorCode())
                .isEqualTo(ScheduleGenerationException.ROSTER_NOT_FOUND);
    }

    @Test
    void load_fileWithoutNamesIsConfigurationError(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("team.txt");
        Files.writeString(file, "\n   \n", StandardCharsets.UTF_8);
        RosterLoader loader = new RosterLoader(RosterShuffler.identity());

        assertThatThrownBy(() -> loader.load(new FileSystemResource(file)))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting(e -> ((ScheduleGenerationException) e).getErrorCode())
                .isEqualTo(ScheduleGenerationException.EMPTY_ROSTER);
    }
}
