package work.mcps.error;

public final class TypeAnnotationException extends ScriptException {
    public TypeAnnotationException(String message) {
        super(ErrorKind.TYPE_ANNOTATION, message);
    }
}
