package errors;

/**
 * Two functions of one module resolve to the same qualified name.
 */
public class DuplicateFunctionNameException extends CpgException {

    private final String qualifiedName;

    public DuplicateFunctionNameException(String module, String qualifiedName) {
        super(module, "Module " + module + " declares " + qualifiedName + " more than once");
        this.qualifiedName = qualifiedName;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }
}
