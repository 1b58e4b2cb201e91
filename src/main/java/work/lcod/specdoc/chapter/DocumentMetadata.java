package work.lcod.specdoc.chapter;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Document-level information: cover text, running header and package properties. {@code issued}
 * is also written as the creation date, so it must be fixed for output to be reproducible.
 */
public record DocumentMetadata(
    String title,
    String subtitle,
    String author,
    String version,
    LocalDate issued,
    String headerText,
    boolean numberHeadings
) {
    public DocumentMetadata {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Document title must not be blank");
        }
        subtitle = Objects.requireNonNullElse(subtitle, "");
        author = Objects.requireNonNullElse(author, "");
        version = Objects.requireNonNullElse(version, "");
        Objects.requireNonNull(issued, "issued");
        headerText = Objects.requireNonNullElse(headerText, "");
    }

    public static DocumentMetadata titled(String title, LocalDate issued) {
        return new DocumentMetadata(title, "", "", "", issued, "", false);
    }
}
