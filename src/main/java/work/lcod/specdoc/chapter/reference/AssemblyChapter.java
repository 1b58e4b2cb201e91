package work.lcod.specdoc.chapter.reference;

import work.lcod.specdoc.chapter.ChapterModule;
import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.primitives.Primitives;

final class AssemblyChapter implements ChapterModule {
    static final String ID = "02-assembly";

    @Override
    public Content build(Primitives lib) {
        return Fragment.of(
            lib.chapterHeading("Chapter 2: Assembly"),
            lib.p(
                "The assembler walks the manifest strictly in order. A builder that fails aborts the run before "
                    + "any byte is serialized; the error names the chapter that raised it."
            ),
            lib.theorem(
                "Theorem 2.1 (Order preservation).",
                "For chapters A and B with A declared before B, every node produced by A precedes every node "
                    + "produced by B in the assembled stream."
            ),
            lib.h2("2.1 Normalization"),
            lib.p(
                "A single node becomes a one-element sequence and a fragment contributes its nodes in order. "
                    + "An empty result is rejected."
            ),
            lib.codeBlock(
                "for (ChapterEntry entry : manifest.chapters()) {\n"
                    + "    var nodes = normalize(entry.module().build(primitives));\n"
                    + "    stream.addAll(nodes);\n"
                    + "}"
            ),
            lib.h2("2.2 Validation"),
            lib.p(
                "Tables wider than the content column are authoring errors. Narrower tables, skipped section "
                    + "numbers and similar irregularities are reported as warnings."
            ),
            lib.ruleLight()
        );
    }
}
