package work.mcps.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Optional {@code mcps.toml} next to a script:
 * <pre>
 * [run]
 * timeout = "30s"
 * env-file = ".env"
 *
 * [log]
 * level = "info"
 * </pre>
 */
public record ProjectConfig(Optional<Duration> timeout, Optional<Path> envFile, Optional<String> logLevel) {
    public static final String FILE_NAME = "mcps.toml";

    public static ProjectConfig empty() {
        return new ProjectConfig(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static ProjectConfig load(Path directory) {
        Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return empty();
        }
        try {
            return parse(Files.readString(file), directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + file, ex);
        }
    }

    static ProjectConfig parse(String raw, Path directory) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid " + FILE_NAME + ": " + result.errors().get(0).toString());
        }
        Optional<Duration> timeout = Optional.ofNullable(result.getString("run.timeout")).flatMap(DurationParser::parse);
        Optional<Path> envFile = Optional.ofNullable(result.getString("run.env-file")).map(directory::resolve);
        Optional<String> logLevel = Optional.ofNullable(result.getString("log.level"));
        return new ProjectConfig(timeout, envFile, logLevel);
    }
}
