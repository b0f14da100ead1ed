package errors;

/**
 * Base type for every failure raised while constructing or extending a code property graph.
 *
 * The subject is the qualified name of the function (or the name of the module) the failure
 * concerns, so the pipeline can report it next to the error.
 */
public abstract class CpgException extends Exception {

    private final String subject;

    protected CpgException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    protected CpgException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    /** Short, stable name of the failure category, e.g. {@code MalformedControlStructure}. */
    public String getCategory() {
        String simple = getClass().getSimpleName();
        return simple.endsWith("Exception") ? simple.substring(0, simple.length() - "Exception".length()) : simple;
    }
}
