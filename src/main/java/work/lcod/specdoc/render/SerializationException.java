package work.lcod.specdoc.render;

import work.lcod.specdoc.shared.SpecDocException;

/**
 * The document model rejected a node that passed validation (for example a font size Word cannot
 * represent). {@code nodeIndex} is -1 for failures that concern the package as a whole.
 */
public final class SerializationException extends SpecDocException {
    private final int nodeIndex;
    private final String nodeType;

    public SerializationException(int nodeIndex, String nodeType, String message, Throwable cause) {
        super("serialization_error", message, cause);
        this.nodeIndex = nodeIndex;
        this.nodeType = nodeType;
    }

    public SerializationException(int nodeIndex, String nodeType, String message) {
        this(nodeIndex, nodeType, message, null);
    }

    public int nodeIndex() {
        return nodeIndex;
    }

    public String nodeType() {
        return nodeType;
    }

    @Override
    public String getMessage() {
        if (nodeIndex < 0) {
            return nodeType + ": " + super.getMessage();
        }
        return "node #" + nodeIndex + " (" + nodeType + "): " + super.getMessage();
    }
}
