package work.lcod.specdoc.assembly;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.specdoc.chapter.DocumentManifest;
import work.lcod.specdoc.node.AuthoringException;
import work.lcod.specdoc.node.ContentNode;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.node.PageBreak;
import work.lcod.specdoc.node.Paragraph;
import work.lcod.specdoc.node.PartHeading;
import work.lcod.specdoc.node.Table;
import work.lcod.specdoc.primitives.Primitives;
import work.lcod.specdoc.style.StyleConstants;
import work.lcod.specdoc.support.SpecDocTestSupport;

class AssemblerTest {
    private final StyleConstants style = StyleConstants.defaults();
    private final Assembler assembler = new Assembler(style);

    @Test
    void preservesManifestOrder() {
        var forward = assembler.assemble(manifest("one", "two", "three"));
        var reversed = assembler.assemble(manifest("three", "two", "one"));

        assertEquals(List.of("one", "two", "three"), texts(forward.nodes()));
        assertEquals(List.of("three", "two", "one"), texts(reversed.nodes()));
    }

    @Test
    void flattensFragmentsAndKeepsSingleNodes() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("single", lib -> lib.p("alone"))
            .chapter("fragment", lib -> Fragment.of(lib.h2("1.1 A"), lib.p("x"), lib.codeBlock("a\nb")))
            .build();

        var assembled = assembler.assemble(manifest);

        assertEquals(1 + 4, assembled.nodes().size());
        var span = assembled.chapter("fragment").orElseThrow();
        assertEquals(1, span.start());
        assertEquals(4, span.size());
        assertEquals(List.of("heading", "paragraph", "code_block", "spacer"), assembled.nodesOf(span).stream().map(ContentNode::type).toList());
    }

    @Test
    void insertsPageBreakBeforeEachPartExceptTheFirst() {
        var assembled = assembler.assemble(SpecDocTestSupport.abcManifest(List.of(4680, 4680)));

        assertEquals(2, assembled.pageBreakCount());
        assertInstanceOf(PartHeading.class, assembled.nodes().get(0));
        var b = assembled.chapter("ChapterB").orElseThrow();
        assertInstanceOf(PageBreak.class, assembled.nodes().get(b.start() - 1));
    }

    @Test
    void doesNotDoubleAnExistingPageBreak() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("intro", lib -> Fragment.of(lib.p("intro"), lib.pageBreak()))
            .chapter("part", lib -> Fragment.of(lib.partHeading("PART I: X"), lib.p("x")))
            .build();

        var assembled = assembler.assemble(manifest);

        assertEquals(1, assembled.pageBreakCount());
        assertEquals(List.of("paragraph", "page_break", "part_heading", "rule", "paragraph"), assembled.nodes().stream().map(ContentNode::type).toList());
    }

    @Test
    void everyPartHeadingStartsANewPage() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("parts", lib -> Fragment.of(
                lib.partHeading("PART I: ONE"),
                lib.p("one"),
                lib.partHeading("PART II: TWO"),
                lib.p("two")
            ))
            .chapter("late", lib -> Fragment.of(lib.spacer(), lib.partHeading("PART III: THREE")))
            .build();

        var assembled = assembler.assemble(manifest);

        assertEquals(2, assembled.pageBreakCount());
        assertEquals(
            List.of("part_heading", "rule", "paragraph", "page_break", "part_heading", "rule", "paragraph",
                "spacer", "page_break", "part_heading", "rule"),
            assembled.nodes().stream().map(ContentNode::type).toList()
        );
        assertEquals(7, assembled.chapter("parts").orElseThrow().size());
    }

    @Test
    void stopsAtFirstFailingChapter() {
        var invoked = new AtomicInteger();
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("ok", lib -> {
                invoked.incrementAndGet();
                return lib.p("fine");
            })
            .chapter("broken", lib -> {
                invoked.incrementAndGet();
                throw new IllegalStateException("data file missing");
            })
            .chapter("never", lib -> {
                invoked.incrementAndGet();
                return lib.p("unreachable");
            })
            .build();

        var ex = assertThrows(AssemblyException.class, () -> assembler.assemble(manifest));

        assertEquals(2, invoked.get());
        assertEquals(1, ex.chapterIndex());
        assertEquals("broken", ex.chapterId());
        assertTrue(ex.getMessage().contains("data file missing"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void tooWideTableNamesTheChapter() {
        var ex = assertThrows(
            AuthoringException.class,
            () -> assembler.assemble(SpecDocTestSupport.abcManifest(List.of(5000, 5000)))
        );

        assertEquals("ChapterB", ex.chapterId());
        assertEquals(1, ex.chapterIndex().getAsInt());
        assertEquals("table", ex.nodeType());
        assertTrue(ex.getMessage().contains("ChapterB"));
    }

    @Test
    void tableBuiltWithoutPrimitivesIsStillChecked() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("raw", lib -> new Table(List.of("A"), List.of(), List.of(9361)))
            .build();

        var ex = assertThrows(AuthoringException.class, () -> assembler.assemble(manifest));
        assertEquals("raw", ex.chapterId());
    }

    @Test
    void overflowingWidthsOnRawTableAreRejected() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("huge", lib -> new Table(List.of("A", "B"), List.of(), List.of(Integer.MAX_VALUE, 2)))
            .build();

        var ex = assertThrows(AuthoringException.class, () -> assembler.assemble(manifest));
        assertEquals("huge", ex.chapterId());
        assertEquals("table", ex.nodeType());
    }

    @Test
    void builderErrorsKeepChapterContext() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("ok", lib -> lib.p("fine"))
            .chapter("recursive", lib -> {
                throw new StackOverflowError();
            })
            .build();

        var ex = assertThrows(AssemblyException.class, () -> assembler.assemble(manifest));
        assertEquals(1, ex.chapterIndex());
        assertEquals("recursive", ex.chapterId());
        assertTrue(ex.getMessage().contains("StackOverflowError"), ex.getMessage());
        assertInstanceOf(StackOverflowError.class, ex.getCause());
    }

    @Test
    void emptyChapterIsRejected() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("empty", lib -> Fragment.empty())
            .build();

        var ex = assertThrows(AssemblyException.class, () -> assembler.assemble(manifest));
        assertEquals("empty", ex.chapterId());
    }

    @Test
    void nullChapterIsRejected() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("null", lib -> null)
            .build();

        assertThrows(AssemblyException.class, () -> assembler.assemble(manifest));
    }

    @Test
    void duplicatePartOrdinalIsRejected() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("first", lib -> lib.partHeading("PART II: ONE"))
            .chapter("second", lib -> lib.partHeading("PART II: TWO"))
            .build();

        var ex = assertThrows(AssemblyException.class, () -> assembler.assemble(manifest));
        assertEquals("second", ex.chapterId());
        assertEquals("part_heading", ex.nodeType().orElseThrow());
        assertTrue(ex.getMessage().contains("first"));
    }

    @Test
    void irregularitiesBecomeWarnings() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("loose", lib -> Fragment.of(
                lib.h2("3.1 First"),
                lib.h2("3.3 Skipped"),
                lib.table(List.of("A", "B"), List.of(), List.of(1000, 1000))
            ))
            .build();

        var assembled = assembler.assemble(manifest);

        assertEquals(2, assembled.warnings().size());
        assertTrue(assembled.warnings().get(0).message().contains("3.1"));
        assertTrue(assembled.warnings().get(1).message().contains("narrower"));
    }

    @Test
    void consecutiveSectionsProduceNoWarnings() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("tidy", lib -> Fragment.of(lib.h2("1.1 A"), lib.h3("1.1.1 B"), lib.h2("1.2 C")))
            .build();

        assertFalse(assembler.assemble(manifest).warnings().iterator().hasNext());
    }

    @Test
    void oversizedSectionNumbersAreNotSequenced() {
        var manifest = DocumentManifest.builder(SpecDocTestSupport.metadata())
            .chapter("big", lib -> Fragment.of(lib.h2("3.1 First"), lib.h2("3.99999999999 Big")))
            .build();

        var assembled = assembler.assemble(manifest);

        assertEquals(2, assembled.nodes().size());
        assertTrue(assembled.warnings().isEmpty());
    }

    @Test
    void rejectsPrimitivesBoundToAnotherStyle() {
        var other = new Primitives(style.toBuilder().bodyFont("Georgia").build());
        var manifest = manifest("x");
        assertThrows(IllegalArgumentException.class, () -> assembler.assemble(manifest, other));
    }

    private static DocumentManifest manifest(String... texts) {
        var builder = DocumentManifest.builder(SpecDocTestSupport.metadata());
        for (String text : texts) {
            builder.chapter(text, lib -> lib.p(text));
        }
        return builder.build();
    }

    private static List<String> texts(List<ContentNode> nodes) {
        var texts = new ArrayList<String>();
        for (ContentNode node : nodes) {
            if (node instanceof Paragraph paragraph) {
                texts.add(paragraph.text());
            }
        }
        return texts;
    }
}
