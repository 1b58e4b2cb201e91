package work.lcod.specdoc.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import work.lcod.specdoc.node.ContentNode;
import work.lcod.specdoc.node.Heading;
import work.lcod.specdoc.node.PartHeading;

/**
 * Heading structure of a node stream, computed in a single left-to-right pass: bookmark names,
 * optional section numbers ({@code 2}, {@code 2.1}, {@code 2.1.3}) and the entries of the static
 * table of contents. Part headings are level 0.
 */
public final class Outline {
    private final List<Entry> entries;
    private final Map<Integer, Entry> byNode;

    private Outline(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
        var index = new HashMap<Integer, Entry>();
        entries.forEach(entry -> index.put(entry.nodeIndex(), entry));
        this.byNode = index;
    }

    public static Outline of(List<ContentNode> nodes, boolean numbered) {
        var entries = new ArrayList<Entry>();
        var counters = new int[Heading.MAX_LEVEL];
        for (int index = 0; index < nodes.size(); index++) {
            var node = nodes.get(index);
            if (node instanceof PartHeading part) {
                entries.add(entry(entries.size() + 1, index, 0, part.text(), ""));
            } else if (node instanceof Heading heading) {
                int level = heading.level();
                counters[level - 1]++;
                for (int deeper = level; deeper < counters.length; deeper++) {
                    counters[deeper] = 0;
                }
                var number = numbered ? number(counters, level) : "";
                entries.add(entry(entries.size() + 1, index, level, heading.text(), number));
            }
        }
        return new Outline(entries);
    }

    private static Entry entry(int id, int nodeIndex, int level, String text, String number) {
        return new Entry(id, nodeIndex, level, text, number, "_toc_" + id);
    }

    private static String number(int[] counters, int level) {
        var joiner = new StringJoiner(".");
        for (int i = 0; i < level; i++) {
            joiner.add(Integer.toString(counters[i]));
        }
        return joiner.toString();
    }

    public Optional<Entry> at(int nodeIndex) {
        return Optional.ofNullable(byNode.get(nodeIndex));
    }

    public List<Entry> entries() {
        return entries;
    }

    /**
     * Part headings plus headings no deeper than {@code maxLevel}, in document order.
     */
    public List<Entry> contents(int maxLevel) {
        var selected = new ArrayList<Entry>();
        for (Entry entry : entries) {
            if (entry.level() <= maxLevel) {
                selected.add(entry);
            }
        }
        return selected;
    }

    public record Entry(int id, int nodeIndex, int level, String text, String number, String bookmark) {
        public String displayText() {
            return number.isEmpty() ? text : number + " " + text;
        }
    }
}
