package errors;

/**
 * A variable is read where no definition dominates the read, or is defined nowhere in the function.
 */
public class UnresolvedVariableReferenceException extends CpgException {

    private final String variableName;

    public UnresolvedVariableReferenceException(String function, String variableName, String message) {
        super(function, message);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
