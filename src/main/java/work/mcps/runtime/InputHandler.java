package work.mcps.runtime;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface InputHandler {
    CompletableFuture<String> prompt(String message);
}
