package assembly;

import errors.CpgException;

/** A function left out of its module record, and why. */
public final class FunctionFailure {

    private final String qualifiedName;
    private final String category;
    private final String message;
    private final transient CpgException error;

    public FunctionFailure(String qualifiedName, CpgException error) {
        this.qualifiedName = qualifiedName;
        this.category = error.getCategory();
        this.message = error.getMessage();
        this.error = error;
    }

    public String getQualifiedName() { return qualifiedName; }
    public String getCategory() { return category; }
    public String getMessage() { return message; }
    public CpgException getError() { return error; }

    @Override
    public String toString() {
        return qualifiedName + ": " + category + " - " + message;
    }
}
