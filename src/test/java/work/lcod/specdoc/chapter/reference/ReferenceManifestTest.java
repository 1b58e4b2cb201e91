package work.lcod.specdoc.chapter.reference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.specdoc.assembly.Assembler;
import work.lcod.specdoc.render.DocxSerializer;
import work.lcod.specdoc.style.StyleConstants;
import work.lcod.specdoc.support.SpecDocTestSupport;

class ReferenceManifestTest {
    private final StyleConstants style = StyleConstants.defaults();

    @Test
    void assemblesWithoutWarnings() {
        var assembled = new Assembler(style).assemble(ReferenceManifest.create(true));

        assertTrue(assembled.warnings().isEmpty(), assembled.warnings().toString());
        assertEquals(3, assembled.pageBreakCount());
    }

    @Test
    void frontMatterIsOptional() {
        var manifest = ReferenceManifest.create(false);
        var ids = manifest.chapters().stream().map(entry -> entry.id()).toList();
        assertEquals(List.of(FoundationsChapter.ID, AssemblyChapter.ID, SerializationChapter.ID), ids);
        assertEquals(1, new Assembler(style).assemble(manifest).pageBreakCount());
    }

    @Test
    void buildingTwiceYieldsIdenticalDocuments() throws Exception {
        var first = render();
        var second = render();

        assertArrayEquals(first, second);
        try (var document = SpecDocTestSupport.open(first)) {
            assertEquals(4, SpecDocTestSupport.sectionCount(document));
            assertEquals("SpecDoc Engine", document.getProperties().getCoreProperties().getTitle());
        }
    }

    private byte[] render() {
        var manifest = ReferenceManifest.create(true);
        var assembled = new Assembler(style).assemble(manifest);
        return new DocxSerializer(manifest.metadata()).serialize(assembled.nodes(), style);
    }
}
