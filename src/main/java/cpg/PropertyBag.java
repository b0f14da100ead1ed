package cpg;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import errors.PropertyKeyCollisionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only results attached by analyses. Keys are namespaced by analysis identity
 * ({@code "taint"}, {@code "centrality.betweenness"}); values are free-form Gson trees.
 *
 * A key can be attached once. Graph construction never reads or writes a bag.
 */
public final class PropertyBag {

    private final String owner;
    private final Map<String, JsonElement> entries = new LinkedHashMap<>();

    public PropertyBag(String owner) {
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }

    public synchronized void attach(String key, JsonElement value) throws PropertyKeyCollisionException {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Property key must not be empty");
        }
        if (entries.containsKey(key)) {
            throw new PropertyKeyCollisionException(owner, key);
        }
        entries.put(key, value.deepCopy());
    }

    public void attach(String key, String value) throws PropertyKeyCollisionException {
        attach(key, new JsonPrimitive(value));
    }

    public void attach(String key, Number value) throws PropertyKeyCollisionException {
        attach(key, new JsonPrimitive(value));
    }

    public synchronized Optional<JsonElement> get(String key) {
        JsonElement value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    public synchronized boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public synchronized Map<String, JsonElement> snapshot() {
        Map<String, JsonElement> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : entries.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().deepCopy());
        }
        return Collections.unmodifiableMap(copy);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PropertyBag)) return false;
        return snapshot().equals(((PropertyBag) obj).snapshot());
    }

    @Override
    public int hashCode() {
        return snapshot().hashCode();
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
