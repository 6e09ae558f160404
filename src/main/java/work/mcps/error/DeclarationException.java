package work.mcps.error;

/**
 * A declaration is missing a required field or refers to something it cannot use.
 */
public final class DeclarationException extends ScriptException {
    private final String declarationName;

    public DeclarationException(String declarationName, String message) {
        super(ErrorKind.DECLARATION, message);
        this.declarationName = declarationName;
    }

    public String declarationName() {
        return declarationName;
    }
}
