package work.lcod.specdoc.node;

import java.util.List;
import java.util.Objects;

/**
 * Block of one or more styled runs.
 */
public record Paragraph(List<Run> runs, Alignment alignment) implements ContentNode {
    public Paragraph {
        if (runs == null || runs.isEmpty()) {
            throw new AuthoringException("paragraph", "at least one run is required");
        }
        if (runs.stream().anyMatch(Objects::isNull)) {
            throw new AuthoringException("paragraph", "runs must not contain null");
        }
        runs = List.copyOf(runs);
        alignment = Objects.requireNonNullElse(alignment, Alignment.JUSTIFIED);
    }

    public Paragraph(List<Run> runs) {
        this(runs, Alignment.JUSTIFIED);
    }

    public String text() {
        var builder = new StringBuilder();
        runs.forEach(run -> builder.append(run.text()));
        return builder.toString();
    }

    @Override
    public String type() {
        return "paragraph";
    }

    public enum Alignment {
        JUSTIFIED,
        LEFT,
        CENTER
    }
}
