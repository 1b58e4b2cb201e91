package work.lcod.specdoc.chapter;

import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.primitives.Primitives;

/**
 * Builds one chapter. Implementations are pure: no state, no I/O, the same content on every call.
 * The {@link Primitives} handle is the primitive library bound to the process style.
 */
@FunctionalInterface
public interface ChapterModule {
    Content build(Primitives primitives);
}
