package work.lcod.specdoc.chapter.reference;

import java.util.List;
import work.lcod.specdoc.chapter.ChapterModule;
import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.primitives.Primitives;

final class SerializationChapter implements ChapterModule {
    static final String ID = "03-serialization";

    @Override
    public Content build(Primitives lib) {
        return Fragment.of(
            lib.partHeading("PART II: OUTPUT"),
            lib.chapterHeading("Chapter 3: Serialization"),
            lib.p(
                "The serializer makes one pass to number and bookmark headings, then a second pass that emits each "
                    + "node. Page breaks close a section; every section shares the page size, margins, header and "
                    + "footer."
            ),
            lib.h2("3.1 Tables"),
            lib.p("Declared column widths are written verbatim to the table grid and to every cell."),
            lib.table(
                List.of("Property", "Value", "Unit", "Source"),
                List.of(
                    List.of("Page width", "12240", "twips", "style"),
                    List.of("Content width", "9360", "twips", "style"),
                    List.of("Body size", "23", "half-points", "style"),
                    List.of("Code size", "17", "half-points", "style")
                )
            ),
            lib.h2("3.2 Reproducibility"),
            lib.p(
                "Package timestamps are pinned to the issue date and the archive is rewritten with fixed entry "
                    + "times, so identical input yields identical bytes."
            ),
            lib.h3("3.2.1 Atomic publication"),
            lib.p("The artifact is written to a temporary file beside the target and moved into place.")
        );
    }
}
