package work.lcod.specdoc.node;

/**
 * Chapter (level 1), section (level 2) or subsection (level 3) heading.
 */
public record Heading(int level, String text) implements ContentNode {
    public static final int MAX_LEVEL = 3;

    public Heading {
        if (level < 1 || level > MAX_LEVEL) {
            throw new AuthoringException("heading", "level must be between 1 and " + MAX_LEVEL + ", got " + level);
        }
        text = Texts.requireText("heading", "text", text);
    }

    @Override
    public String type() {
        return "heading";
    }
}
