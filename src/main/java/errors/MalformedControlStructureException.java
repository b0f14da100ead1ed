package errors;

/**
 * A branch or loop construct is missing a clause it needs, e.g. a switch without cases.
 */
public class MalformedControlStructureException extends CpgException {

    public MalformedControlStructureException(String function, String message) {
        super(function, message);
    }
}
