package work.lcod.specdoc.chapter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.lcod.specdoc.node.Fragment;

/**
 * Ordered registry of chapters. Manifest order is the only thing that decides document order.
 */
public record DocumentManifest(DocumentMetadata metadata, List<ChapterEntry> chapters) {
    public static final String COVER_ID = "front-matter/cover";
    public static final String CONTENTS_ID = "front-matter/contents";

    public DocumentManifest {
        Objects.requireNonNull(metadata, "metadata");
        chapters = List.copyOf(Objects.requireNonNull(chapters, "chapters"));
        var seen = new HashSet<String>();
        for (ChapterEntry entry : chapters) {
            if (!seen.add(entry.id())) {
                throw new IllegalArgumentException("Duplicate chapter id in manifest: " + entry.id());
            }
        }
    }

    public static Builder builder(DocumentMetadata metadata) {
        return new Builder(metadata);
    }

    public int size() {
        return chapters.size();
    }

    public static final class Builder {
        private final DocumentMetadata metadata;
        private final List<ChapterEntry> chapters = new ArrayList<>();

        private Builder(DocumentMetadata metadata) {
            this.metadata = Objects.requireNonNull(metadata, "metadata");
        }

        /**
         * Title page built from the metadata (title, subtitle, version, issue date, author).
         */
        public Builder cover() {
            var details = new ArrayList<String>();
            if (!metadata.version().isBlank()) {
                details.add("Version " + metadata.version());
            }
            details.add(metadata.issued().toString());
            if (!metadata.author().isBlank()) {
                details.add(metadata.author());
            }
            var lines = List.copyOf(details);
            return chapter(COVER_ID, lib -> lib.cover(metadata.title(), metadata.subtitle(), lines));
        }

        public Builder tableOfContents(String title) {
            return chapter(CONTENTS_ID, lib -> Fragment.of(lib.tableOfContents(title), lib.pageBreak()));
        }

        public Builder chapter(String id, ChapterModule module) {
            chapters.add(new ChapterEntry(id, module));
            return this;
        }

        public DocumentManifest build() {
            return new DocumentManifest(metadata, chapters);
        }
    }
}
