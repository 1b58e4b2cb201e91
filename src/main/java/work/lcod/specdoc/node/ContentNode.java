package work.lcod.specdoc.node;

/**
 * One unit of the document tree. Every variant validates itself on construction, so an invalid
 * node cannot exist.
 */
public sealed interface ContentNode extends Content
    permits Heading, PartHeading, Paragraph, Run, Table, CodeBlock, LabeledBlock, Spacer, PageBreak,
        Rule, TableOfContents {

    /**
     * Short, stable name of the variant used in diagnostics ({@code "table"}, {@code "heading"}).
     */
    String type();
}
