package work.lcod.specdoc.chapter.reference;

import java.time.LocalDate;
import work.lcod.specdoc.chapter.DocumentManifest;
import work.lcod.specdoc.chapter.DocumentMetadata;

/**
 * The compiled-in document: a short description of the generator, rendered by the generator.
 */
public final class ReferenceManifest {
    public static final LocalDate ISSUED = LocalDate.of(2026, 1, 15);

    private ReferenceManifest() {}

    public static DocumentMetadata metadata() {
        return new DocumentMetadata(
            "SpecDoc Engine",
            "Technical Specification",
            "lcod team",
            "0.1.0",
            ISSUED,
            "SpecDoc Engine Technical Specification",
            false
        );
    }

    public static DocumentManifest create(boolean frontMatter) {
        var builder = DocumentManifest.builder(metadata());
        if (frontMatter) {
            builder.cover().tableOfContents("TABLE OF CONTENTS");
        }
        return builder
            .chapter(FoundationsChapter.ID, new FoundationsChapter())
            .chapter(AssemblyChapter.ID, new AssemblyChapter())
            .chapter(SerializationChapter.ID, new SerializationChapter())
            .build();
    }
}
