package work.mcps.error;

/**
 * Failure classes reported by the compiler pipeline and the execution engine.
 */
public enum ErrorKind {
    SYNTAX("SyntaxError"),
    DECLARATION("DeclarationError"),
    REFERENCE("ReferenceError"),
    TYPE_ANNOTATION("TypeAnnotationError"),
    TIMEOUT("TimeoutError"),
    HOST_CONFIGURATION("HostConfigurationError"),
    RUNTIME("RuntimeError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
