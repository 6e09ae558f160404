package work.mcps.error;

/**
 * A bridge function or collaborator factory the script needs was not configured.
 */
public final class HostConfigurationException extends ScriptException {
    public static final String INPUT_HANDLER_MISSING = "User input handler not configured";

    public HostConfigurationException(String message) {
        super(ErrorKind.HOST_CONFIGURATION, message);
    }
}
