package cpg;

import ast.SourcePositionId;
import errors.AmbiguousContainmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link NodeMappings} with one pass over the nodes and one over the edges.
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    public NodeMappings build(CodePropertyGraph cpg) throws AmbiguousContainmentException {
        Map<SourcePositionId, List<String>> bySourcePosition = new LinkedHashMap<>();
        Map<CpgRole, Set<String>> byRole = new EnumMap<>(CpgRole.class);
        for (CPGNode node : cpg.getNodes()) {
            if (node.getSourcePosition() != null) {
                bySourcePosition.computeIfAbsent(node.getSourcePosition(), k -> new ArrayList<>()).add(node.getId());
            }
            byRole.computeIfAbsent(node.getRole(), k -> new LinkedHashSet<>()).add(node.getId());
        }

        Map<String, String> containment = new HashMap<>();
        for (CPGEdge edge : cpg.getEdges()) {
            if (!edge.getKind().isContainment()) {
                continue;
            }
            String previous = containment.putIfAbsent(edge.getTo(), edge.getFrom());
            if (previous != null) {
                throw new AmbiguousContainmentException(cpg.getName(), edge.getTo(),
                        cpg.getName() + ": node " + edge.getTo() + " is contained by both " + previous
                                + " and " + edge.getFrom());
            }
        }
        // Keep containment in node order so equal graphs give equal mappings.
        Map<String, String> ordered = new LinkedHashMap<>();
        for (CPGNode node : cpg.getNodes()) {
            String parent = containment.get(node.getId());
            if (parent != null) {
                ordered.put(node.getId(), parent);
            }
        }

        logger.debug("Indexed {}: {} positions, {} roles, {} contained nodes",
                cpg.getName(), bySourcePosition.size(), byRole.size(), ordered.size());
        return new NodeMappings(bySourcePosition, byRole, ordered);
    }
}
