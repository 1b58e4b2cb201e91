package work.lcod.specdoc.node;

/**
 * Empty vertical space of {@code height} layout units.
 */
public record Spacer(int height) implements ContentNode {
    public Spacer {
        if (height < 0) {
            throw new AuthoringException("spacer", "height must be non-negative, got " + height);
        }
    }

    @Override
    public String type() {
        return "spacer";
    }
}
