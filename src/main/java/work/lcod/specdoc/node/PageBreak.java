package work.lcod.specdoc.node;

/**
 * Forced page boundary; serialized as exactly one section break.
 */
public record PageBreak() implements ContentNode {
    @Override
    public String type() {
        return "page_break";
    }
}
