package work.lcod.specdoc.chapter;

import java.util.Objects;

/**
 * Named slot of a manifest. The id appears in every diagnostic about the chapter.
 */
public record ChapterEntry(String id, ChapterModule module) {
    public ChapterEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Chapter id must not be blank");
        }
        Objects.requireNonNull(module, "module");
    }
}
