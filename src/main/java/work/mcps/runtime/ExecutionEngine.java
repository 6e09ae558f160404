package work.mcps.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mcps.codegen.GeneratedScript;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;

/**
 * Runs generated scripts on GraalJS. Each run gets its own context and driver thread; runs share only the
 * underlying polyglot engine, so concurrent runs are independent.
 *
 * <p>The deadline starts when {@link #execute} is called and covers context start-up. When it elapses the
 * caller gets a timeout immediately and the context is cancelled in the background.
 */
public final class ExecutionEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger RUN_IDS = new AtomicInteger();

    private final Engine engine;

    public ExecutionEngine() {
        this.engine = Engine.newBuilder("js")
            .option("engine.WarnInterpreterOnly", "false")
            .build();
    }

    public ExecutionResult execute(GeneratedScript script, ExecutionOptions options) {
        var started = Instant.now();
        long deadline = System.nanoTime() + options.timeout().toNanos();
        int runId = RUN_IDS.incrementAndGet();
        var run = new ScriptRun(script, options, engine);
        ExecutorService driver = Executors.newSingleThreadExecutor(driverThreads(runId));
        driver.execute(run::drive);
        driver.shutdown();
        LOG.debug("Run {} started (timeout {})", runId, options.timeout());
        try {
            Object result;
            if (options.timeout().isZero()) {
                run.ready().get();
                result = run.outcome().get();
            } else {
                run.ready().get(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                result = run.outcome().get(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            }
            var outcome = new ExecutionOutcome(ScriptRun.bindings(result), Duration.between(started, Instant.now()));
            LOG.debug("Run {} completed in {} ms", runId, outcome.elapsed().toMillis());
            return ExecutionResult.success(outcome);
        } catch (TimeoutException ex) {
            LOG.warn("Run {} exceeded its {} ms budget", runId, options.timeout().toMillis());
            run.cancel();
            driver.shutdownNow();
            return ExecutionResult.failure(new ExecutionError(
                ErrorKind.TIMEOUT,
                "Script execution timed out after " + options.timeout().toMillis() + "ms"
            ));
        } catch (ExecutionException ex) {
            ScriptException failure = classify(ex.getCause());
            LOG.debug("Run {} failed: {}", runId, failure.describe());
            return ExecutionResult.failure(ExecutionError.from(failure));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            run.cancel();
            driver.shutdownNow();
            return ExecutionResult.failure(new ExecutionError(ErrorKind.RUNTIME, "Interrupted while waiting for the script"));
        }
    }

    private static ScriptException classify(Throwable cause) {
        if (cause instanceof ScriptException scriptError) {
            return scriptError;
        }
        String message = cause == null ? "Unknown failure" : cause.getMessage();
        return new ScriptException(ErrorKind.RUNTIME, "JavaScript engine failure: " + message, cause);
    }

    private static ThreadFactory driverThreads(int runId) {
        return runnable -> {
            Thread thread = new Thread(runnable, "mcps-run-" + runId);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Closes the engine, cancelling runs still executing. A run abandoned while its context was starting may
     * still hold the engine; that is logged, not thrown.
     */
    @Override
    public void close() {
        try {
            engine.close(true);
        } catch (IllegalStateException | PolyglotException ex) {
            LOG.debug("Engine close failed: {}", ex.getMessage());
        }
    }
}
