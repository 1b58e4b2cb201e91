package work.lcod.specdoc.assembly;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.specdoc.chapter.ChapterEntry;
import work.lcod.specdoc.chapter.DocumentManifest;
import work.lcod.specdoc.node.AuthoringException;
import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.node.ContentNode;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.node.Heading;
import work.lcod.specdoc.node.PageBreak;
import work.lcod.specdoc.node.PartHeading;
import work.lcod.specdoc.node.Table;
import work.lcod.specdoc.primitives.Primitives;
import work.lcod.specdoc.style.StyleConstants;

/**
 * Runs the chapter builders of a manifest strictly in order and concatenates their output into
 * one flat stream. A page break is placed in front of every part heading unless the stream is
 * still empty or already ends on one.
 *
 * <p>The first failure aborts the whole assembly; no partial stream is ever returned.
 */
public final class Assembler {
    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);
    private static final Pattern SECTION_NUMBER = Pattern.compile("^(\\d{1,9}(?:\\.\\d{1,9}){1,2})\\b");

    private final StyleConstants style;

    public Assembler(StyleConstants style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public AssembledDocument assemble(DocumentManifest manifest) {
        return assemble(manifest, new Primitives(style));
    }

    public AssembledDocument assemble(DocumentManifest manifest, Primitives primitives) {
        Objects.requireNonNull(manifest, "manifest");
        if (primitives.style() != style) {
            throw new IllegalArgumentException("Primitives must share the assembler's style instance");
        }
        var nodes = new ArrayList<ContentNode>();
        var spans = new ArrayList<ChapterSpan>();
        var warnings = new ArrayList<AssemblyWarning>();
        var partOwners = new HashMap<Integer, String>();

        var chapters = manifest.chapters();
        for (int index = 0; index < chapters.size(); index++) {
            var entry = chapters.get(index);
            LOG.debug("Building chapter #{} '{}'", index, entry.id());
            var chapterNodes = normalize(index, entry, invoke(index, entry, primitives));
            validate(index, entry, chapterNodes, partOwners, warnings);

            int start = -1;
            for (ContentNode node : chapterNodes) {
                if (node instanceof PartHeading && !nodes.isEmpty() && !(nodes.get(nodes.size() - 1) instanceof PageBreak)) {
                    nodes.add(new PageBreak());
                }
                if (start < 0) {
                    start = nodes.size();
                }
                nodes.add(node);
            }
            spans.add(new ChapterSpan(index, entry.id(), start, nodes.size()));
        }

        warnings.forEach(warning -> LOG.warn("{}", warning));
        LOG.debug("Assembled {} nodes from {} chapters", nodes.size(), chapters.size());
        return new AssembledDocument(nodes, spans, warnings);
    }

    private Content invoke(int index, ChapterEntry entry, Primitives primitives) {
        try {
            return entry.module().build(primitives);
        } catch (AuthoringException ex) {
            throw ex.inChapter(index, entry.id());
        } catch (OutOfMemoryError ex) {
            throw ex;
        } catch (Exception | Error ex) {
            var reason = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            throw new AssemblyException(index, entry.id(), null, "chapter builder failed: " + reason, ex);
        }
    }

    private List<ContentNode> normalize(int index, ChapterEntry entry, Content result) {
        List<ContentNode> chapterNodes;
        if (result instanceof ContentNode node) {
            chapterNodes = List.of(node);
        } else if (result instanceof Fragment fragment) {
            chapterNodes = fragment.nodes();
        } else {
            throw new AssemblyException(index, entry.id(), null, "chapter builder returned no content");
        }
        if (chapterNodes.isEmpty()) {
            throw new AssemblyException(index, entry.id(), null, "chapter builder returned an empty fragment");
        }
        return chapterNodes;
    }

    private void validate(
        int index,
        ChapterEntry entry,
        List<ContentNode> chapterNodes,
        Map<Integer, String> partOwners,
        List<AssemblyWarning> warnings
    ) {
        var lastNumbers = new HashMap<String, Integer>();
        for (ContentNode node : chapterNodes) {
            if (node instanceof Table table) {
                checkTableWidth(index, entry, table, warnings);
            } else if (node instanceof PartHeading part) {
                var ordinal = part.ordinal();
                if (ordinal.isPresent()) {
                    var owner = partOwners.putIfAbsent(ordinal.getAsInt(), entry.id());
                    if (owner != null) {
                        throw new AssemblyException(
                            index,
                            entry.id(),
                            part.type(),
                            "part ordinal " + ordinal.getAsInt() + " is already claimed by chapter '" + owner + "'"
                        );
                    }
                }
            } else if (node instanceof Heading heading) {
                checkSectionNumber(index, entry, heading, lastNumbers, warnings);
            }
        }
    }

    private void checkTableWidth(int index, ChapterEntry entry, Table table, List<AssemblyWarning> warnings) {
        long total = table.totalWidth();
        long available = style.pageContentWidth();
        if (total > available) {
            throw new AuthoringException(
                table.type(),
                "column widths " + table.colWidths() + " sum to " + total
                    + ", exceeding the page content width " + available
            ).inChapter(index, entry.id());
        }
        if (total < available) {
            warnings.add(new AssemblyWarning(
                index,
                entry.id(),
                "table '" + table.headerRow().get(0) + "' is " + (available - total) + " units narrower than the page"
            ));
        }
    }

    private void checkSectionNumber(
        int index,
        ChapterEntry entry,
        Heading heading,
        Map<String, Integer> lastNumbers,
        List<AssemblyWarning> warnings
    ) {
        var matcher = SECTION_NUMBER.matcher(heading.text());
        if (!matcher.find()) {
            return;
        }
        var number = matcher.group(1);
        int split = number.lastIndexOf('.');
        var parent = number.substring(0, split);
        int current = Integer.parseInt(number.substring(split + 1));
        var previous = lastNumbers.put(parent, current);
        if (previous != null && current != previous + 1 && current != 1) {
            warnings.add(new AssemblyWarning(
                index,
                entry.id(),
                "heading jump from " + parent + "." + previous + " to " + number
            ));
        }
    }
}
