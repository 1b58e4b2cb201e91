package work.lcod.specdoc.chapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.node.PageBreak;
import work.lcod.specdoc.node.TableOfContents;
import work.lcod.specdoc.primitives.Primitives;
import work.lcod.specdoc.style.StyleConstants;
import work.lcod.specdoc.support.SpecDocTestSupport;

class DocumentManifestTest {
    private final Primitives lib = new Primitives(StyleConstants.defaults());

    @Test
    void frontMatterComesFirst() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .cover()
            .tableOfContents("Contents")
            .chapter("body", primitives -> primitives.p("text"))
            .build();

        var ids = manifest.chapters().stream().map(ChapterEntry::id).toList();
        assertEquals(List.of(DocumentManifest.COVER_ID, DocumentManifest.CONTENTS_ID, "body"), ids);
    }

    @Test
    void tableOfContentsIsFollowedByPageBreak() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata()).tableOfContents("Contents").build();
        var fragment = (Fragment) manifest.chapters().get(0).module().build(lib);
        assertEquals(new TableOfContents("Contents", 2), fragment.nodes().get(0));
        assertTrue(fragment.nodes().get(1) instanceof PageBreak);
    }

    @Test
    void rejectsDuplicateChapterIds() {
        var builder = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("same", primitives -> primitives.p("a"))
            .chapter("same", primitives -> primitives.p("b"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsBlankChapterIds() {
        assertThrows(IllegalArgumentException.class, () -> new ChapterEntry(" ", primitives -> primitives.p("a")));
    }

    @Test
    void metadataRequiresTitle() {
        assertThrows(IllegalArgumentException.class, () -> DocumentMetadata.titled("", SpecDocTestSupport.ISSUED));
    }
}
