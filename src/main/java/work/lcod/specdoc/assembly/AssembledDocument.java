package work.lcod.specdoc.assembly;

import java.util.List;
import java.util.Optional;
import work.lcod.specdoc.node.ContentNode;
import work.lcod.specdoc.node.PageBreak;

/**
 * Flat, validated node stream ready for serialization.
 */
public record AssembledDocument(List<ContentNode> nodes, List<ChapterSpan> chapters, List<AssemblyWarning> warnings) {
    public AssembledDocument {
        nodes = List.copyOf(nodes);
        chapters = List.copyOf(chapters);
        warnings = List.copyOf(warnings);
    }

    public Optional<ChapterSpan> chapter(String id) {
        return chapters.stream().filter(span -> span.id().equals(id)).findFirst();
    }

    public List<ContentNode> nodesOf(ChapterSpan span) {
        return nodes.subList(span.start(), span.end());
    }

    public long pageBreakCount() {
        return nodes.stream().filter(PageBreak.class::isInstance).count();
    }
}
