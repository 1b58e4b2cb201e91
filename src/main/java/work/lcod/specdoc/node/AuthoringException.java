package work.lcod.specdoc.node;

import java.util.OptionalInt;
import work.lcod.specdoc.shared.SpecDocException;

/**
 * A content node failed construction-time validation. Raised by node constructors and the
 * primitive library; the assembler re-raises it with the owning chapter attached.
 */
public final class AuthoringException extends SpecDocException {
    private final String nodeType;
    private final Integer chapterIndex;
    private final String chapterId;

    public AuthoringException(String nodeType, String message) {
        this(nodeType, message, null, null);
    }

    private AuthoringException(String nodeType, String message, Integer chapterIndex, String chapterId) {
        super("authoring_error", message);
        this.nodeType = nodeType;
        this.chapterIndex = chapterIndex;
        this.chapterId = chapterId;
    }

    public AuthoringException inChapter(int index, String id) {
        var located = new AuthoringException(nodeType, super.getMessage(), index, id);
        located.initCause(this);
        return located;
    }

    public String nodeType() {
        return nodeType;
    }

    public OptionalInt chapterIndex() {
        return chapterIndex == null ? OptionalInt.empty() : OptionalInt.of(chapterIndex);
    }

    public String chapterId() {
        return chapterId;
    }

    @Override
    public String getMessage() {
        var base = super.getMessage();
        if (chapterId == null) {
            return nodeType + ": " + base;
        }
        return "chapter #" + chapterIndex + " '" + chapterId + "', " + nodeType + ": " + base;
    }
}
