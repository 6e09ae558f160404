package work.mcps.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import work.mcps.runtime.InputHandler;

/**
 * Answers {@code input(...)} from a terminal: prints the prompt and reads one line on a background thread.
 */
final class ConsoleInputHandler implements InputHandler {
    private final BufferedReader reader;
    private final PrintWriter out;
    private final Executor executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "mcps-input");
        thread.setDaemon(true);
        return thread;
    });

    ConsoleInputHandler(InputStream in, PrintWriter out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public CompletableFuture<String> prompt(String message) {
        return CompletableFuture.supplyAsync(() -> {
            out.print(message.endsWith(" ") || message.isEmpty() ? message : message + " ");
            out.flush();
            try {
                String line = reader.readLine();
                return line == null ? "" : line;
            } catch (IOException ex) {
                throw new UncheckedIOException("Unable to read user input", ex);
            }
        }, executor);
    }
}
