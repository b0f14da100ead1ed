package errors;

/**
 * Reading or writing graph artifacts failed.
 */
public class CpgIoException extends RuntimeException {

    public CpgIoException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
