package work.lcod.specdoc.node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of nodes. A fragment never nests: building one from other fragments splices
 * their nodes in place.
 */
public record Fragment(List<ContentNode> nodes) implements Content {
    private static final Fragment EMPTY = new Fragment(List.of());

    public Fragment {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }

    public static Fragment empty() {
        return EMPTY;
    }

    public static Fragment of(Content... parts) {
        return of(Arrays.asList(parts));
    }

    public static Fragment of(List<? extends Content> parts) {
        var flat = new ArrayList<ContentNode>();
        for (Content part : parts) {
            if (part == null) {
                throw new AuthoringException("fragment", "null content at position " + flat.size());
            }
            if (part instanceof ContentNode node) {
                flat.add(node);
            } else if (part instanceof Fragment fragment) {
                flat.addAll(fragment.nodes());
            }
        }
        return new Fragment(flat);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
