package work.mcps.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectConfigTest {

    @Test
    void readsRunAndLogSections(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ProjectConfig.FILE_NAME), String.join("\n",
            "[run]",
            "timeout = \"45s\"",
            "env-file = \"local.env\"",
            "",
            "[log]",
            "level = \"debug\""
        ));

        var config = ProjectConfig.load(dir);

        assertEquals(Optional.of(Duration.ofSeconds(45)), config.timeout());
        assertEquals(Optional.of(dir.resolve("local.env")), config.envFile());
        assertEquals(Optional.of("debug"), config.logLevel());
    }

    @Test
    void missingFileIsEmpty(@TempDir Path dir) {
        assertEquals(ProjectConfig.empty(), ProjectConfig.load(dir));
    }

    @Test
    void invalidTomlIsRejected(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class, () -> ProjectConfig.parse("[run\ntimeout = ", dir));
    }
}
