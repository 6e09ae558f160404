package work.mcps.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import work.mcps.codegen.HostFunctions;
import work.mcps.error.DeclarationException;
import work.mcps.error.ErrorKind;
import work.mcps.error.HostConfigurationException;
import work.mcps.error.ScriptException;

/**
 * Installs the bridge functions and declaration hooks into a run's global scope.
 */
final class HostBridge {
    private static final Set<String> AGENT_KEYS = Set.of("model", "description", "systemPrompt", "tools", "temperature", "maxTokens");

    // Set and Map become callable without `new`.
    private static final String COLLECTION_FACTORIES = String.join("\n",
        "(function() {",
        "  const NativeSet = Set, NativeMap = Map;",
        "  const makeSet = function Set(iterable) { return new NativeSet(iterable); };",
        "  makeSet.prototype = NativeSet.prototype;",
        "  const makeMap = function Map(iterable) { return new NativeMap(iterable); };",
        "  makeMap.prototype = NativeMap.prototype;",
        "  globalThis.Set = makeSet;",
        "  globalThis.Map = makeMap;",
        "})()"
    );

    private final ScriptRun run;
    private final ExecutionOptions options;

    HostBridge(ScriptRun run) {
        this.run = run;
        this.options = run.options();
    }

    void install(Value bindings) {
        run.context().eval("js", COLLECTION_FACTORIES);
        bindings.putMember("print", guarded(this::print));
        bindings.putMember("log", log());
        bindings.putMember("env", new EnvironmentObject());
        bindings.putMember("input", guarded(this::input));
        bindings.putMember("addMessage", guarded(this::addMessage));
        bindings.putMember(HostFunctions.CONNECT_TOOL_SERVER, guarded(this::connectToolServer));
        bindings.putMember(HostFunctions.CREATE_MODEL, guarded(this::createModel));
        bindings.putMember(HostFunctions.CREATE_TOOL, guarded(this::createTool));
        bindings.putMember(HostFunctions.CREATE_AGENT, guarded(this::createAgent));
    }

    /**
     * Host failures are recorded before they reach the guest so the run can classify the final rejection.
     */
    private ProxyExecutable guarded(ProxyExecutable function) {
        return args -> {
            try {
                return function.execute(args);
            } catch (PolyglotException ex) {
                throw ex;
            } catch (ScriptException ex) {
                throw run.record(ex);
            } catch (RuntimeException ex) {
                throw run.record(new ScriptException(ErrorKind.RUNTIME, String.valueOf(ex.getMessage()), ex));
            }
        };
    }

    // --- Console ---

    private Object print(Value... args) {
        String text = GuestValues.render(args);
        MessageSink sink = options.messageSink();
        if (sink != null) {
            sink.accept(new AppMessage("", text));
        } else {
            options.console().out(text);
        }
        return null;
    }

    private ProxyObject log() {
        Map<String, Object> levels = new LinkedHashMap<>();
        levels.put("debug", logFunction("DEBUG", false));
        levels.put("info", logFunction("INFO", false));
        levels.put("warn", logFunction("WARN", true));
        levels.put("error", logFunction("ERROR", true));
        return ProxyObject.fromMap(levels);
    }

    private ProxyExecutable logFunction(String level, boolean toErr) {
        return guarded(args -> {
            String text = GuestValues.render(args);
            String line = text.isEmpty() ? "[" + level + "]" : "[" + level + "] " + text;
            if (toErr) {
                options.console().err(line);
            } else {
                options.console().out(line);
            }
            return null;
        });
    }

    private Object addMessage(Value... args) {
        MessageSink sink = options.messageSink();
        if (sink == null || args.length == 0) {
            return null;
        }
        Map<String, Object> event = GuestValues.toJavaObject(args[0]);
        Object title = event.get("title");
        Object body = event.get("body");
        sink.accept(new AppMessage(title == null ? "" : String.valueOf(title), body == null ? "" : String.valueOf(body)));
        return null;
    }

    // --- Input ---

    private Object input(Value... args) {
        InputHandler handler = options.inputHandler();
        if (handler == null) {
            throw new HostConfigurationException(HostConfigurationException.INPUT_HANDLER_MISSING);
        }
        String message = args.length > 0 ? GuestValues.render(args[0]) : "";
        return run.pending(handler.prompt(message), answer -> answer);
    }

    // --- Declarations ---

    private Object createModel(Value... args) {
        String name = args[0].asString();
        ModelFactory factory = options.modelFactory();
        if (factory == null) {
            throw new HostConfigurationException("Model factory not configured (model \"" + name + "\")");
        }
        Object model = factory.create(name, GuestValues.toJavaObject(args[1]));
        return new GuestHandles.ModelHandle(name, model);
    }

    private Object createTool(Value... args) {
        String name = args[0].asString();
        Map<String, Object> schema = GuestValues.toJavaObject(args[1]);
        Value function = args[2];
        List<String> parameters = List.copyOf(schema.keySet());
        Tool tool = new Tool(name, "", schema, arguments -> {
            List<Object> positional = new ArrayList<>(parameters.size());
            for (String parameter : parameters) {
                positional.add(arguments.get(parameter));
            }
            return run.invokeOnDriver(function, positional);
        });
        return new GuestHandles.ToolHandle(tool, function);
    }

    private Object connectToolServer(Value... args) {
        String name = args[0].asString();
        ToolServerClientFactory factory = options.toolServerFactory();
        if (factory == null) {
            throw new HostConfigurationException("Tool server client factory not configured (mcp \"" + name + "\")");
        }
        ToolServerClient client = factory.create(name, GuestValues.toJavaObject(args[1]));
        run.registerClient(client);
        return run.pending(
            client.connect().thenCompose(connected -> client.listTools()),
            descriptors -> toolServer(name, client, descriptors)
        );
    }

    private GuestHandles.ToolServerHandle toolServer(String name, ToolServerClient client, Object rawDescriptors) {
        List<Tool> tools = new ArrayList<>();
        Map<String, ProxyExecutable> functions = new LinkedHashMap<>();
        if (rawDescriptors instanceof List<?> descriptors) {
            for (Object raw : descriptors) {
                ToolDescriptor descriptor = (ToolDescriptor) raw;
                Map<String, Object> schema = new LinkedHashMap<>();
                for (String parameter : descriptor.parameterNames()) {
                    schema.put(parameter, Map.of("kind", "any"));
                }
                tools.add(new Tool(descriptor.name(), descriptor.description(), schema,
                    arguments -> client.callTool(descriptor.name(), arguments).thenApply(GuestHandles::unwrapToolResult)));
                functions.put(descriptor.name(), guarded(callArgs -> run.pending(
                    client.callTool(descriptor.name(), toolArguments(descriptor, callArgs)),
                    GuestHandles::unwrapToolResult
                )));
            }
        }
        return new GuestHandles.ToolServerHandle(name, tools, functions);
    }

    /**
     * A single plain-object argument is passed through; anything else is mapped positionally onto the
     * advertised parameter names.
     */
    private static Map<String, Object> toolArguments(ToolDescriptor descriptor, Value[] args) {
        if (args.length == 1 && args[0].hasMembers() && !args[0].hasArrayElements() && !args[0].isProxyObject()
            && !args[0].canExecute()) {
            return GuestValues.toJavaObject(args[0]);
        }
        List<String> names = descriptor.parameterNames();
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < args.length && i < names.size(); i++) {
            arguments.put(names.get(i), GuestValues.toJava(args[i]));
        }
        return arguments;
    }

    private Object createAgent(Value... args) {
        String name = args[0].asString();
        Value config = args[1];
        Value modelValue = config.hasMember("model") ? config.getMember("model") : null;
        if (modelValue == null || !modelValue.isProxyObject()
            || !(modelValue.asProxyObject() instanceof GuestHandles.ModelHandle model)) {
            throw new DeclarationException(name, "Agent \"" + name + "\" must specify a model reference");
        }
        AgentFactory factory = options.agentFactory();
        if (factory == null) {
            throw new HostConfigurationException("Agent factory not configured (agent \"" + name + "\")");
        }
        List<Tool> tools = ToolReference.flatten(name, toolReferences(config));
        Map<String, Object> extra = new LinkedHashMap<>();
        for (String key : config.getMemberKeys()) {
            if (!AGENT_KEYS.contains(key)) {
                extra.put(key, GuestValues.toJava(config.getMember(key)));
            }
        }
        AgentDefinition definition = new AgentDefinition(
            name,
            model.unwrap(),
            stringMember(config, "description"),
            stringMember(config, "systemPrompt"),
            tools,
            config.hasMember("temperature") && config.getMember("temperature").isNumber() ? config.getMember("temperature").asDouble() : null,
            config.hasMember("maxTokens") && config.getMember("maxTokens").fitsInInt() ? config.getMember("maxTokens").asInt() : null,
            extra
        );
        Agent agent = factory.create(definition);
        return new GuestHandles.AgentHandle(agent, guarded(runArgs -> delegate(agent, runArgs)));
    }

    private Object delegate(Agent agent, Value... args) {
        Object prompt = args.length == 0 ? "" : args[0];
        if (prompt instanceof Value value) {
            prompt = value.isProxyObject() && value.asProxyObject() instanceof GuestHandles.ConversationHandle conversation
                ? conversation.unwrap()
                : GuestValues.render(value);
        }
        return run.pending(agent.run(prompt), conversation -> conversation);
    }

    private static List<ToolReference> toolReferences(Value config) {
        List<ToolReference> references = new ArrayList<>();
        if (!config.hasMember("tools")) {
            return references;
        }
        Value tools = config.getMember("tools");
        if (!tools.hasArrayElements()) {
            references.add(reference(tools));
            return references;
        }
        for (long i = 0; i < tools.getArraySize(); i++) {
            references.add(reference(tools.getArrayElement(i)));
        }
        return references;
    }

    private static ToolReference reference(Value element) {
        if (element.isProxyObject()) {
            Object proxy = element.asProxyObject();
            if (proxy instanceof GuestHandles.ToolHandle tool) {
                return new ToolReference.Single(tool.unwrap());
            }
            if (proxy instanceof GuestHandles.ToolServerHandle server) {
                return server.unwrap();
            }
        }
        return new ToolReference.Raw(element.canExecute() ? "function" : GuestValues.render(element));
    }

    private static String stringMember(Value config, String key) {
        if (!config.hasMember(key)) {
            return null;
        }
        Value value = config.getMember(key);
        return value.isNull() ? null : GuestValues.render(value);
    }

    /**
     * {@code env}: unset names read as undefined, writes fail.
     */
    private final class EnvironmentObject implements ProxyObject {
        @Override
        public Object getMember(String key) {
            return options.environment().get(key).orElse(null);
        }

        @Override
        public Object getMemberKeys() {
            return ProxyArray.fromArray();
        }

        @Override
        public boolean hasMember(String key) {
            return options.environment().get(key).isPresent();
        }

        @Override
        public void putMember(String key, Value value) {
            try {
                options.environment().set(key, GuestValues.render(value));
            } catch (UnsupportedOperationException ex) {
                throw run.record(new ScriptException(ErrorKind.RUNTIME, ex.getMessage(), ex));
            }
        }
    }
}
