package work.mcps.error;

public final class UndefinedReferenceException extends ScriptException {
    private final String name;

    public UndefinedReferenceException(String name, String context) {
        super(ErrorKind.REFERENCE, "Undefined variable: '" + name + "'" + (context == null || context.isBlank() ? "" : " in " + context));
        this.name = name;
    }

    public String name() {
        return name;
    }
}
