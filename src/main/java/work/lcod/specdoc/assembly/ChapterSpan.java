package work.lcod.specdoc.assembly;

/**
 * Where a chapter landed in the assembled stream: nodes {@code [start, end)}.
 */
public record ChapterSpan(int index, String id, int start, int end) {
    public int size() {
        return end - start;
    }
}
