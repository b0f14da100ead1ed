package cpg;

import ast.AstNode;
import ast.FunctionSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the functions a call may resolve to: qualified name to entry node id, plus
 * the owner, simple name and arity used to match call sites. Built once per module before any
 * function is unified and shared read-only by all workers.
 */
public final class SymbolTable {

    public static final SymbolTable EMPTY = new Builder().build();

    private final Map<String, Entry> entries;

    private SymbolTable(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> entryIdOf(String qualifiedName) {
        Entry entry = entries.get(qualifiedName);
        return entry == null ? Optional.empty() : Optional.of(entry.entryId);
    }

    public boolean contains(String qualifiedName) {
        return entries.containsKey(qualifiedName);
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (Entry entry : entries.values()) {
            map.put(entry.qualifiedName, entry.entryId);
        }
        return map;
    }

    /**
     * Resolves a CALL node made from a function of {@code callerOwner}.
     *
     * Calls without receiver or on {@code this} look in the caller's owner, calls on {@code super}
     * in the other owners, and calls on a known owner type in that owner. Any other receiver is
     * dispatched at runtime and stays unresolved. Only a unique (owner, name, arity) match resolves.
     *
     * @return the callee's qualified name
     */
    public Optional<String> resolve(String callerOwner, AstNode call) {
        String name = call.getName();
        String arityText = call.getAttribute("arity");
        if (name == null || arityText == null) {
            return Optional.empty();
        }
        int arity = Integer.parseInt(arityText);
        String receiver = call.getAttribute("receiver");

        List<Entry> matches = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (!entry.simpleName.equals(name) || entry.arity != arity) {
                continue;
            }
            if (receiver == null || "this".equals(receiver)) {
                if (sameOwner(entry.owner, callerOwner)) matches.add(entry);
            } else if ("super".equals(receiver)) {
                if (!sameOwner(entry.owner, callerOwner)) matches.add(entry);
            } else if (isOwnerType(receiver) && ownerMatches(entry.owner, receiver)) {
                matches.add(entry);
            }
        }
        return matches.size() == 1 ? Optional.of(matches.get(0).qualifiedName) : Optional.empty();
    }

    private boolean isOwnerType(String receiver) {
        for (Entry entry : entries.values()) {
            if (ownerMatches(entry.owner, receiver)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameOwner(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static boolean ownerMatches(String owner, String typeName) {
        return owner != null && (owner.equals(typeName) || owner.endsWith("." + typeName));
    }

    private static final class Entry {
        final String qualifiedName;
        final String entryId;
        final String owner;
        final String simpleName;
        final int arity;

        Entry(String qualifiedName, String entryId, String owner, String simpleName, int arity) {
            this.qualifiedName = qualifiedName;
            this.entryId = entryId;
            this.owner = owner;
            this.simpleName = simpleName;
            this.arity = arity;
        }
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        public Builder add(String qualifiedName, String owner, String simpleName, int arity) {
            entries.put(qualifiedName, new Entry(qualifiedName, CpgIds.entry(qualifiedName), owner, simpleName, arity));
            return this;
        }

        public Builder add(FunctionSource function) {
            return add(function.getQualifiedName(), function.getOwner(), function.getSimpleName(), function.getArity());
        }

        public Builder addAll(SymbolTable other) {
            entries.putAll(other.entries);
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(entries);
        }
    }
}
