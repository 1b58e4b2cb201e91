package work.lcod.specdoc.node;

import java.util.Objects;

/**
 * Horizontal hairline divider.
 */
public record Rule(Weight weight) implements ContentNode {
    public Rule {
        Objects.requireNonNull(weight, "weight");
    }

    @Override
    public String type() {
        return "rule";
    }

    public enum Weight {
        ACCENT,
        LIGHT
    }
}
