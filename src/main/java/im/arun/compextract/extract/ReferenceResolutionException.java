package im.arun.compextract.extract;

/**
 * An extracted node could not be linked to a registered component resource.
 * Only happens when transformation runs before every group is registered.
 */
public class ReferenceResolutionException extends IllegalStateException {

    private final String nodeId;
    private final String structuralHash;

    public ReferenceResolutionException(String nodeId, String nodeName, String structuralHash) {
        super(String.format("No component resource registered for node %s (%s), structural hash %s",
                nodeId, nodeName, structuralHash));
        this.nodeId = nodeId;
        this.structuralHash = structuralHash;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getStructuralHash() {
        return structuralHash;
    }
}
