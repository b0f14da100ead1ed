package cpg;

import ast.SourcePositionId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup tables over one {@link CodePropertyGraph}: by source position (one construct
 * may have AST, CFG and DFG facets), by role, and from each node to its containing parent.
 */
public final class NodeMappings {

    private final Map<SourcePositionId, List<String>> bySourcePosition;
    private final Map<CpgRole, Set<String>> byRole;
    private final Map<String, String> containment;

    NodeMappings(Map<SourcePositionId, List<String>> bySourcePosition, Map<CpgRole, Set<String>> byRole,
                 Map<String, String> containment) {
        Map<SourcePositionId, List<String>> positions = new LinkedHashMap<>();
        for (Map.Entry<SourcePositionId, List<String>> entry : bySourcePosition.entrySet()) {
            positions.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        Map<CpgRole, Set<String>> roles = new EnumMap<>(CpgRole.class);
        for (Map.Entry<CpgRole, Set<String>> entry : byRole.entrySet()) {
            roles.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        this.bySourcePosition = Collections.unmodifiableMap(positions);
        this.byRole = Collections.unmodifiableMap(roles);
        this.containment = Collections.unmodifiableMap(new LinkedHashMap<>(containment));
    }

    public Map<SourcePositionId, List<String>> getBySourcePosition() { return bySourcePosition; }
    public Map<CpgRole, Set<String>> getByRole() { return byRole; }
    public Map<String, String> getContainment() { return containment; }

    public List<String> nodesAt(SourcePositionId position) {
        return bySourcePosition.getOrDefault(position, Collections.emptyList());
    }

    public Set<String> nodesWithRole(CpgRole role) {
        return byRole.getOrDefault(role, Collections.emptySet());
    }

    public Optional<String> parentOf(String nodeId) {
        return Optional.ofNullable(containment.get(nodeId));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeMappings)) return false;
        NodeMappings other = (NodeMappings) obj;
        return bySourcePosition.equals(other.bySourcePosition) && byRole.equals(other.byRole)
                && containment.equals(other.containment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bySourcePosition.size(), byRole.size(), containment.size());
    }
}
