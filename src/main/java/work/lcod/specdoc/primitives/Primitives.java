package work.lcod.specdoc.primitives;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.lcod.specdoc.node.AuthoringException;
import work.lcod.specdoc.node.CodeBlock;
import work.lcod.specdoc.node.Content;
import work.lcod.specdoc.node.Fragment;
import work.lcod.specdoc.node.Heading;
import work.lcod.specdoc.node.LabeledBlock;
import work.lcod.specdoc.node.PageBreak;
import work.lcod.specdoc.node.Paragraph;
import work.lcod.specdoc.node.PartHeading;
import work.lcod.specdoc.node.Rule;
import work.lcod.specdoc.node.Run;
import work.lcod.specdoc.node.Spacer;
import work.lcod.specdoc.node.Table;
import work.lcod.specdoc.node.TableOfContents;
import work.lcod.specdoc.style.StyleConstants;

/**
 * Constructors for every content node, bound to one {@link StyleConstants}. Constructors that
 * produce several structural units (part headings, tables, code blocks, the cover) return a
 * {@link Fragment}; all others return a single node.
 *
 * <p>Nothing here has side effects: calling the same constructor twice yields equal values.
 */
public final class Primitives {
    private static final int COVER_TITLE_SIZE = 56;
    private static final int COVER_SUBTITLE_SIZE = 32;
    private static final int COVER_TOP_SPACE = 2880;

    private final StyleConstants style;

    public Primitives(StyleConstants style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public StyleConstants style() {
        return style;
    }

    // --- text ---

    public Paragraph p(String text) {
        return new Paragraph(List.of(run(text)));
    }

    public Paragraph p(Run... runs) {
        return new Paragraph(Arrays.asList(runs));
    }

    /**
     * Mixed paragraph: plain strings become default runs, {@link Run}s are kept as they are.
     * {@code pRuns(bold("Key. "), "value text")}
     */
    public Paragraph pRuns(Object... parts) {
        var runs = new ArrayList<Run>(parts.length);
        for (Object part : parts) {
            if (part instanceof Run run) {
                runs.add(run);
            } else if (part instanceof String text) {
                runs.add(run(text));
            } else {
                throw new AuthoringException(
                    "paragraph",
                    "runs must be strings or Run values, got " + (part == null ? "null" : part.getClass().getSimpleName())
                );
            }
        }
        return new Paragraph(runs);
    }

    public Paragraph centered(Run... runs) {
        return new Paragraph(Arrays.asList(runs), Paragraph.Alignment.CENTER);
    }

    public Run run(String text) {
        return Run.plain(text);
    }

    public Run bold(String text) {
        return Run.plain(text).withBold(true);
    }

    public Run italic(String text) {
        return Run.plain(text).withItalic(true);
    }

    /**
     * Inline code: code font and size on the code background.
     */
    public Run code(String text) {
        var palette = style.palette();
        return Run.plain(text)
            .withFont(style.codeFont())
            .withSize(style.codeSize())
            .withColor(palette.codeText())
            .withShading(palette.codeFill());
    }

    // --- headings ---

    /**
     * Part title followed by the accent rule. The page break in front of a part is inserted by the
     * assembler, which knows whether the stream already ends on one.
     */
    public Fragment partHeading(String text) {
        return Fragment.of(new PartHeading(text), rule());
    }

    public Heading chapterHeading(String text) {
        return new Heading(1, text);
    }

    public Heading h2(String text) {
        return new Heading(2, text);
    }

    public Heading h3(String text) {
        return new Heading(3, text);
    }

    // --- rules ---

    public Rule rule() {
        return new Rule(Rule.Weight.ACCENT);
    }

    public Rule ruleLight() {
        return new Rule(Rule.Weight.LIGHT);
    }

    // --- definitions and theorems ---

    public LabeledBlock definition(String label, String body) {
        return new LabeledBlock(LabeledBlock.Kind.DEFINITION, label, body);
    }

    public LabeledBlock theorem(String label, String body) {
        return new LabeledBlock(LabeledBlock.Kind.THEOREM, label, body);
    }

    // --- code ---

    /**
     * Multi-line listing; the source is split on line feeds and followed by the standard spacer.
     */
    public Fragment codeBlock(String source) {
        if (source == null) {
            throw new AuthoringException("code_block", "source must not be null");
        }
        var lines = Arrays.asList(source.split("\n", -1));
        return Fragment.of(new CodeBlock(lines), spacer());
    }

    // --- tables ---

    public Fragment table(List<String> headers, List<List<String>> rows) {
        if (headers == null || headers.isEmpty()) {
            throw new AuthoringException("table", "header row must not be empty");
        }
        return table(headers, rows, evenWidths(headers.size()));
    }

    /**
     * Table with explicit widths. Widths must match the column count and fit the content column.
     */
    public Fragment table(List<String> headers, List<List<String>> rows, List<Integer> colWidths) {
        var table = new Table(headers, rows, colWidths);
        if (table.totalWidth() > (long) style.pageContentWidth()) {
            throw new AuthoringException(
                "table",
                "column widths " + table.colWidths() + " sum to " + table.totalWidth()
                    + ", exceeding the page content width " + style.pageContentWidth()
            );
        }
        return Fragment.of(table, spacer());
    }

    /**
     * Equal widths summing exactly to the content width; the remainder goes to the last column.
     */
    public List<Integer> evenWidths(int columns) {
        if (columns <= 0) {
            throw new AuthoringException("table", "column count must be positive, got " + columns);
        }
        int width = style.pageContentWidth() / columns;
        var widths = new ArrayList<>(Collections.nCopies(columns, width));
        widths.set(columns - 1, width + style.pageContentWidth() - width * columns);
        return List.copyOf(widths);
    }

    // --- layout ---

    public Spacer spacer() {
        return new Spacer(style.spacerHeight());
    }

    public Spacer spacer(int height) {
        return new Spacer(height);
    }

    public PageBreak pageBreak() {
        return new PageBreak();
    }

    // --- front matter ---

    /**
     * Title page: title, accent rule, subtitle and detail lines, closed by a page break.
     */
    public Fragment cover(String title, String subtitle, List<String> details) {
        var palette = style.palette();
        var parts = new ArrayList<Content>();
        parts.add(spacer(COVER_TOP_SPACE));
        parts.add(centered(bold(title).withSize(COVER_TITLE_SIZE).withColor(palette.headingColor())));
        parts.add(rule());
        if (subtitle != null && !subtitle.isBlank()) {
            parts.add(centered(italic(subtitle).withSize(COVER_SUBTITLE_SIZE).withColor(palette.subheadingColor())));
        }
        if (details != null && !details.isEmpty()) {
            parts.add(spacer(style.spacerHeight() * 4));
            for (String line : details) {
                parts.add(centered(run(line)));
            }
        }
        parts.add(pageBreak());
        return Fragment.of(parts);
    }

    public TableOfContents tableOfContents(String title) {
        return new TableOfContents(title, 2);
    }
}
