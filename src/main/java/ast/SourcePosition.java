package ast;

import java.util.Objects;

/**
 * Where a construct lives in its source file. Lines and columns are 1-based, 0 when unknown.
 */
public final class SourcePosition {

    private final String path;
    private final int beginLine;
    private final int beginColumn;
    private final int endLine;
    private final int endColumn;
    private final String description;

    public SourcePosition(String path, int beginLine, int beginColumn, int endLine, int endColumn, String description) {
        this.path = path;
        this.beginLine = beginLine;
        this.beginColumn = beginColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.description = description;
    }

    public static SourcePosition unknown(String description) {
        return new SourcePosition(null, 0, 0, 0, 0, description);
    }

    public String getPath() { return path; }
    public int getBeginLine() { return beginLine; }
    public int getBeginColumn() { return beginColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }
    public String getDescription() { return description; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourcePosition)) return false;
        SourcePosition other = (SourcePosition) obj;
        return beginLine == other.beginLine && beginColumn == other.beginColumn
                && endLine == other.endLine && endColumn == other.endColumn
                && Objects.equals(path, other.path) && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, beginLine, beginColumn, endLine, endColumn, description);
    }

    @Override
    public String toString() {
        return (path == null ? "<unknown>" : path) + ":" + beginLine + ":" + beginColumn;
    }
}
