package work.mcps.runtime;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Where {@code print} (without a message sink) and {@code log.*} write their lines.
 */
public interface ScriptConsole {
    void out(String line);

    void err(String line);

    static ScriptConsole of(PrintStream out, PrintStream err) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        return new ScriptConsole() {
            @Override
            public void out(String line) {
                out.println(line);
            }

            @Override
            public void err(String line) {
                err.println(line);
            }
        };
    }

    static ScriptConsole standard() {
        return of(System.out, System.err);
    }
}
