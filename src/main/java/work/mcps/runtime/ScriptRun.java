package work.mcps.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mcps.codegen.GeneratedScript;
import work.mcps.error.ErrorKind;
import work.mcps.error.ScriptException;

/**
 * One execution of a generated script. All guest access happens on the thread running {@link #drive()}:
 * host futures complete wherever they like and post their continuation to the mailbox, which the driver
 * drains in arrival order until the main promise settles.
 */
final class ScriptRun {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptRun.class);

    private static final String PROMISE_FACTORY =
        "(register) => new Promise((resolve, reject) => register(resolve, reject))";
    private static final String ERROR_FACTORY = "(message) => new Error(message)";

    private final GeneratedScript script;
    private final ExecutionOptions options;
    private final Engine engine;
    private final BlockingQueue<Runnable> mailbox = new LinkedBlockingQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final CompletableFuture<Object> outcome = new CompletableFuture<>();
    private final List<ScriptException> hostFailures = new CopyOnWriteArrayList<>();
    private final List<ToolServerClient> clients = new CopyOnWriteArrayList<>();
    private boolean closed;
    private volatile boolean cancelled;
    private volatile Context context;
    private Value promiseFactory;
    private Value errorFactory;

    ScriptRun(GeneratedScript script, ExecutionOptions options, Engine engine) {
        this.script = script;
        this.options = options;
        this.engine = engine;
    }

    CompletableFuture<Void> ready() {
        return ready;
    }

    CompletableFuture<Object> outcome() {
        return outcome;
    }

    ExecutionOptions options() {
        return options;
    }

    Context context() {
        return context;
    }

    void drive() {
        Context built;
        try {
            built = Context.newBuilder("js")
                .engine(engine)
                .allowHostAccess(HostAccess.EXPLICIT)
                .allowHostClassLookup(className -> false)
                .allowCreateThread(false)
                .allowNativeAccess(false)
                .allowExperimentalOptions(true)
                .option("js.ecmascript-version", "2023")
                .build();
        } catch (RuntimeException ex) {
            ready.completeExceptionally(ex);
            closeResources(false);
            return;
        }
        if (!attach(built)) {
            LOG.debug("Script run cancelled before its context was ready");
            built.close(true);
            ready.completeExceptionally(new ScriptException(ErrorKind.TIMEOUT, "Script run cancelled"));
            return;
        }
        try {
            promiseFactory = context.eval("js", PROMISE_FACTORY);
            errorFactory = context.eval("js", ERROR_FACTORY);
            new HostBridge(this).install(context.getBindings("js"));
        } catch (RuntimeException ex) {
            ready.completeExceptionally(ex);
            closeResources(false);
            return;
        }
        ready.complete(null);
        try {
            Source source = Source.newBuilder("js", "(async function() {\n" + script.code() + "\n})", "script.mjs").buildLiteral();
            Value main = context.eval(source).execute();
            settle(main, outcome);
            loop();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            outcome.completeExceptionally(new ScriptException(ErrorKind.RUNTIME, "Script run interrupted", ex));
        } catch (PolyglotException ex) {
            if (ex.isCancelled() || cancelled) {
                LOG.debug("Script run cancelled");
                outcome.completeExceptionally(new ScriptException(ErrorKind.TIMEOUT, "Script run cancelled", ex));
            } else {
                outcome.completeExceptionally(classify(ex));
            }
        } catch (RuntimeException ex) {
            outcome.completeExceptionally(ex);
        } finally {
            closeResources(false);
        }
    }

    private void loop() throws InterruptedException {
        while (!outcome.isDone()) {
            Runnable task = mailbox.poll();
            if (task == null) {
                if (inFlight.get() == 0) {
                    // continuations are queued before the counter drops, so an empty queue here is final
                    task = mailbox.poll();
                    if (task == null) {
                        outcome.completeExceptionally(new ScriptException(
                            ErrorKind.RUNTIME,
                            "Script never settles: it is waiting with no pending host calls"
                        ));
                        return;
                    }
                } else {
                    task = mailbox.take();
                }
            }
            task.run();
        }
    }

    /**
     * Abandons the run: the engine stops waiting and the guest context is torn down in the background.
     * An in-flight host call is not aborted.
     */
    void cancel() {
        cancelled = true;
        Thread reaper = new Thread(() -> closeResources(true), "mcps-reaper");
        reaper.setDaemon(true);
        reaper.start();
    }

    /**
     * Publishes the context unless the run was already closed; a context built after cancellation is never used.
     */
    private synchronized boolean attach(Context built) {
        if (closed) {
            return false;
        }
        context = built;
        return true;
    }

    private void closeResources(boolean cancel) {
        Context current;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            current = context;
        }
        for (ToolServerClient client : clients) {
            client.close().exceptionally(error -> {
                LOG.warn("Failed to close tool server client: {}", error.getMessage());
                return null;
            });
        }
        if (current == null) {
            return;
        }
        try {
            current.close(cancel);
        } catch (IllegalStateException | PolyglotException ex) {
            LOG.debug("Context close failed: {}", ex.getMessage());
        }
    }

    void registerClient(ToolServerClient client) {
        clients.add(client);
    }

    // --- Host calls ---

    /**
     * Wraps a host future in a guest promise. The future may complete on any thread; the promise settles on
     * the driver with {@code onDriver} applied to the result.
     */
    Value pending(CompletableFuture<?> future, Function<Object, Object> onDriver) {
        Value[] settlers = new Value[2];
        Value promise = promiseFactory.execute((ProxyExecutable) args -> {
            settlers[0] = args[0];
            settlers[1] = args[1];
            return null;
        });
        inFlight.incrementAndGet();
        future.whenComplete((result, error) -> {
            mailbox.add(() -> {
                if (error != null) {
                    reject(settlers[1], unwrap(error));
                    return;
                }
                Object mapped;
                try {
                    mapped = onDriver.apply(result);
                } catch (RuntimeException ex) {
                    reject(settlers[1], ex);
                    return;
                }
                settlers[0].execute(GuestValues.toGuest(context, mapped));
            });
            inFlight.decrementAndGet();
        });
        return promise;
    }

    /**
     * Calls a guest function from any thread. The call itself runs on the driver; the returned future
     * completes once the function's promise settles.
     */
    CompletableFuture<Object> invokeOnDriver(Value function, List<Object> arguments) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        mailbox.add(() -> {
            try {
                List<Value> guestArgs = new ArrayList<>(arguments.size());
                for (Object argument : arguments) {
                    guestArgs.add(GuestValues.toGuest(context, argument));
                }
                settle(function.execute(guestArgs.toArray()), result);
            } catch (PolyglotException ex) {
                result.completeExceptionally(classify(ex));
            }
        });
        return result;
    }

    private void settle(Value value, CompletableFuture<Object> target) {
        if (value != null && value.canInvokeMember("then")) {
            ProxyExecutable resolve = args -> {
                target.complete(GuestValues.toJava(args.length > 0 ? args[0] : null));
                return null;
            };
            ProxyExecutable reject = args -> {
                target.completeExceptionally(classify(args.length > 0 ? args[0] : null));
                return null;
            };
            value.invokeMember("then", resolve, reject);
            return;
        }
        target.complete(GuestValues.toJava(value));
    }

    private void reject(Value rejectFunction, Throwable error) {
        ScriptException failure = error instanceof ScriptException scriptError
            ? scriptError
            : new ScriptException(ErrorKind.RUNTIME, String.valueOf(error.getMessage()), error);
        LOG.warn("Host call failed: {}", failure.getMessage());
        rejectFunction.execute(errorFactory.execute(record(failure).getMessage()));
    }

    /**
     * Remembers a failure handed to the guest so the final rejection can be classified by its message.
     */
    ScriptException record(ScriptException failure) {
        hostFailures.add(failure);
        return failure;
    }

    // --- Classification ---

    private ScriptException classify(PolyglotException ex) {
        if (ex.isHostException()) {
            return fromHost(ex.asHostException());
        }
        return byMessage(ex.getMessage());
    }

    private ScriptException classify(Value reason) {
        if (reason == null || reason.isNull()) {
            return new ScriptException(ErrorKind.RUNTIME, "Script failed without a reason");
        }
        if (reason.isHostObject() && reason.asHostObject() instanceof Throwable thrown) {
            return fromHost(thrown);
        }
        if (reason.isException()) {
            try {
                reason.throwException();
            } catch (PolyglotException ex) {
                if (ex.isHostException()) {
                    return fromHost(ex.asHostException());
                }
            }
        }
        if (reason.hasMember("message") && reason.getMember("message").isString()) {
            return byMessage(reason.getMember("message").asString());
        }
        return byMessage(GuestValues.render(reason));
    }

    private ScriptException fromHost(Throwable thrown) {
        if (thrown instanceof ScriptException scriptError) {
            return scriptError;
        }
        return byMessage(String.valueOf(thrown.getMessage()));
    }

    private ScriptException byMessage(String message) {
        for (int i = hostFailures.size() - 1; i >= 0; i--) {
            ScriptException failure = hostFailures.get(i);
            if (message != null && (message.equals(failure.getMessage()) || message.endsWith(": " + failure.getMessage()))) {
                return failure;
            }
        }
        return new ScriptException(ErrorKind.RUNTIME, message);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static Map<String, Object> bindings(Object result) {
        if (result instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return Map.of();
    }
}
