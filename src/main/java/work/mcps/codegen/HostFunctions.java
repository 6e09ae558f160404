package work.mcps.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Names the runtime provides to generated code: the declaration hooks and the globals scripts may use
 * without assigning them first.
 */
public final class HostFunctions {
    public static final String CONNECT_TOOL_SERVER = "__connectToolServer";
    public static final String CREATE_MODEL = "__createModel";
    public static final String CREATE_TOOL = "__createTool";
    public static final String CREATE_AGENT = "__createAgent";
    public static final String AGENT_ENTRYPOINT = "run";

    public static final List<String> BUILT_IN_GLOBALS = List.of(
        "print", "log", "env", "input", "addMessage",
        "Set", "Map", "JSON",
        "null", "undefined",
        "Math", "Date", "Object", "Array", "String", "Number", "Boolean", "RegExp",
        "parseInt", "parseFloat", "isNaN", "isFinite",
        "encodeURIComponent", "decodeURIComponent", "encodeURI", "decodeURI"
    );

    private HostFunctions() {}

    /**
     * Names visible at the top of every program: the built-ins followed by the hoisted declaration names.
     */
    public static List<String> initialScope(List<String> declarationNames) {
        List<String> names = new ArrayList<>(BUILT_IN_GLOBALS);
        names.addAll(declarationNames);
        return names;
    }
}
