package ast;

import java.util.Objects;

/**
 * Opaque, stable identifier of one source construct. Issued by {@link SourcePositionRegistry}.
 */
public final class SourcePositionId implements Comparable<SourcePositionId> {

    private final long value;

    public SourcePositionId(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(SourcePositionId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourcePositionId)) return false;
        return value == ((SourcePositionId) obj).value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "sp" + value;
    }
}
