package work.lcod.specdoc.assembly;

import java.util.Optional;
import work.lcod.specdoc.shared.SpecDocException;

/**
 * A chapter builder failed, returned nothing usable, or broke a cross-chapter invariant.
 */
public final class AssemblyException extends SpecDocException {
    private final int chapterIndex;
    private final String chapterId;
    private final String nodeType;

    public AssemblyException(int chapterIndex, String chapterId, String nodeType, String message, Throwable cause) {
        super("assembly_error", message, cause);
        this.chapterIndex = chapterIndex;
        this.chapterId = chapterId;
        this.nodeType = nodeType;
    }

    public AssemblyException(int chapterIndex, String chapterId, String nodeType, String message) {
        this(chapterIndex, chapterId, nodeType, message, null);
    }

    public int chapterIndex() {
        return chapterIndex;
    }

    public String chapterId() {
        return chapterId;
    }

    public Optional<String> nodeType() {
        return Optional.ofNullable(nodeType);
    }

    @Override
    public String getMessage() {
        var prefix = "chapter #" + chapterIndex + " '" + chapterId + "'";
        if (nodeType != null) {
            prefix += ", " + nodeType;
        }
        return prefix + ": " + super.getMessage();
    }
}
