package ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues and resolves {@link SourcePositionId}s.
 *
 * Ids are handed out from a monotonically increasing counter and are never reissued, even after
 * {@link #retire(SourcePositionId)}. This is the only shared mutable structure of the pipeline,
 * so every operation is safe to call from several threads.
 */
public class SourcePositionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SourcePositionRegistry.class);

    private final AtomicLong counter = new AtomicLong(1);
    private final Map<SourcePositionId, SourcePosition> positions = new ConcurrentHashMap<>();
    private final Set<SourcePositionId> retired = ConcurrentHashMap.newKeySet();

    public SourcePositionId register(SourcePosition position) {
        SourcePositionId id = new SourcePositionId(counter.getAndIncrement());
        positions.put(id, position == null ? SourcePosition.unknown(null) : position);
        return id;
    }

    /**
     * @return the position registered for {@code id}, empty if the id was never issued or is retired.
     */
    public Optional<SourcePosition> resolve(SourcePositionId id) {
        if (id == null || retired.contains(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(positions.get(id));
    }

    public boolean isLive(SourcePositionId id) {
        return id != null && positions.containsKey(id) && !retired.contains(id);
    }

    /**
     * Removes a construct. The id stays reserved.
     */
    public void retire(SourcePositionId id) {
        if (positions.remove(id) != null) {
            retired.add(id);
            logger.debug("Retired source position {}", id);
        }
    }

    public int size() {
        return positions.size();
    }
}
