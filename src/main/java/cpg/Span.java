package cpg;

import java.util.Objects;

/** Inclusive line range of a source construct. */
public final class Span {

    private final int startLine;
    private final int endLine;

    public Span(int startLine, int endLine) {
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Span)) return false;
        Span other = (Span) obj;
        return startLine == other.startLine && endLine == other.endLine;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, endLine);
    }

    @Override
    public String toString() {
        return startLine + "-" + endLine;
    }
}
