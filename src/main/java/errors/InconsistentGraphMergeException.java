package errors;

/**
 * A CFG or DFG node refers to a source position that the function's AST does not contain.
 */
public class InconsistentGraphMergeException extends CpgException {

    public InconsistentGraphMergeException(String function, String message) {
        super(function, message);
    }
}
