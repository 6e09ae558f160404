package work.mcps.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotenvLoaderTest {

    @Test
    void parsesAssignmentsQuotesAndComments() {
        var values = DotenvLoader.parse(List.of(
            "# credentials",
            "API_KEY=abc123",
            "export REGION = eu-west-1",
            "GREETING=\"hello\\nworld\"",
            "RAW='a # not a comment'",
            "MODE=fast # trailing",
            "not a pair",
            ""
        ));

        assertEquals(Map.of(
            "API_KEY", "abc123",
            "REGION", "eu-west-1",
            "GREETING", "hello\nworld",
            "RAW", "a # not a comment",
            "MODE", "fast"
        ), values);
    }

    @Test
    void processEnvironmentWins() {
        var merged = DotenvLoader.merge(Map.of("A", "file", "B", "file"), Map.of("B", "process"));

        assertEquals(Map.of("A", "file", "B", "process"), merged);
    }

    @Test
    void loadsFilesAndIgnoresMissingOnes(@TempDir Path dir) throws Exception {
        Path file = dir.resolve(".env");
        Files.writeString(file, "TOKEN=secret\n");

        assertEquals(Map.of("TOKEN", "secret"), DotenvLoader.load(file));
        assertEquals(Map.of(), DotenvLoader.load(dir.resolve("missing.env")));
    }
}
