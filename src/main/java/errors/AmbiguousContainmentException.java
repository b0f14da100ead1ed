package errors;

public class AmbiguousContainmentException extends CpgException {

    private final String nodeId;

    public AmbiguousContainmentException(String graph, String nodeId, String message) {
        super(graph, message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
