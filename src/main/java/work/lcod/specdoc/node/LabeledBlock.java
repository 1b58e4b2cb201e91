package work.lcod.specdoc.node;

import java.util.Objects;

/**
 * Formal definition or theorem: a bold-italic label followed by its statement.
 */
public record LabeledBlock(Kind kind, String label, String body) implements ContentNode {
    public LabeledBlock {
        Objects.requireNonNull(kind, "kind");
        label = Texts.requireText(kind.nodeType(), "label", label);
        body = Texts.requireText(kind.nodeType(), "body", body);
    }

    @Override
    public String type() {
        return kind.nodeType();
    }

    public enum Kind {
        DEFINITION("definition"),
        THEOREM("theorem");

        private final String nodeType;

        Kind(String nodeType) {
            this.nodeType = nodeType;
        }

        public String nodeType() {
            return nodeType;
        }
    }
}
