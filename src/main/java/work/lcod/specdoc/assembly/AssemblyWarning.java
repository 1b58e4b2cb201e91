package work.lcod.specdoc.assembly;

/**
 * Non-fatal finding recorded during assembly (narrow table, skipped section number).
 */
public record AssemblyWarning(int chapterIndex, String chapterId, String message) {
    @Override
    public String toString() {
        return "chapter #" + chapterIndex + " '" + chapterId + "': " + message;
    }
}
