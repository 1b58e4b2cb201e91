package work.lcod.specdoc.chapter.reference;

import java.util.List;
import work.lcod.specdoc.chapter.ChapterModule;
import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.primitives.Primitives;

final class FoundationsChapter implements ChapterModule {
    static final String ID = "01-foundations";

    @Override
    public Content build(Primitives lib) {
        return Fragment.of(
            lib.partHeading("PART I: FOUNDATIONS"),
            lib.chapterHeading("Chapter 1: Purpose"),
            lib.p(
                "This document is produced by the generator it describes. Every chapter is a pure function that "
                    + "returns content nodes; the assembler concatenates them in manifest order and the serializer "
                    + "writes a single paginated document with one shared set of styles."
            ),
            lib.h2("1.1 Content Nodes"),
            lib.pRuns(
                lib.bold("Closed vocabulary. "),
                "Headings, paragraphs, runs, tables, code blocks, labeled blocks, spacers, rules and page breaks "
                    + "are the only node kinds. Each validates its own fields when it is constructed, so a malformed "
                    + "node never reaches the serializer."
            ),
            lib.definition(
                "Definition 1.1 (Fragment).",
                "An ordered sequence of nodes returned by a builder in place of a single node. Fragments are "
                    + "flattened exactly one level during assembly."
            ),
            lib.table(
                List.of("Node", "Produced by", "Notes"),
                List.of(
                    List.of("Heading", "chapterHeading, h2, h3", "Levels 1 to 3; bookmarked for the contents page."),
                    List.of("PartHeading", "partHeading", "Upper-cased; opens a new page."),
                    List.of("Table", "table", "Column widths must fit the content column."),
                    List.of("CodeBlock", "codeBlock", "One shaded line per source line.")
                ),
                List.of(2000, 2600, 4760)
            ),
            lib.h2("1.2 Style Constants"),
            lib.pRuns(
                "Fonts, colors and page geometry live in one immutable value created before the first chapter runs. "
                    + "The inline code style, for example, is ",
                lib.code("Primitives.code(text)"),
                ", which applies the code font on the code background."
            )
        );
    }
}
