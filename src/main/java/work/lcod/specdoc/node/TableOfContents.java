package work.lcod.specdoc.node;

/**
 * Placeholder for a static table of contents. The serializer fills it with every part heading and
 * every heading up to {@code maxLevel}, wherever they occur in the document.
 */
public record TableOfContents(String title, int maxLevel) implements ContentNode {
    public TableOfContents {
        title = Texts.requireText("table_of_contents", "title", title);
        if (maxLevel < 1 || maxLevel > Heading.MAX_LEVEL) {
            throw new AuthoringException("table_of_contents", "maxLevel must be between 1 and " + Heading.MAX_LEVEL);
        }
    }

    @Override
    public String type() {
        return "table_of_contents";
    }
}
