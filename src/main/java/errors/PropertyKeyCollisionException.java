package errors;

/**
 * An analysis tried to attach a property under a key another analysis already owns.
 */
public class PropertyKeyCollisionException extends CpgException {

    private final String key;

    public PropertyKeyCollisionException(String owner, String key) {
        super(owner, "Property key '" + key + "' is already attached to " + owner);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
