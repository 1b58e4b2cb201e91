package work.lcod.specdoc.style;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Builds {@link StyleConstants} from an optional TOML override file. Keys that are absent keep
 * their default; unknown keys are rejected so typos do not silently fall back.
 *
 * <pre>
 * body_font = "Georgia"
 * body_size = 22
 * accent_color = "2E5090"
 *
 * [margins]
 * left = 1080
 * right = 1080
 *
 * [palette]
 * heading_color = "102030"
 * </pre>
 */
public final class StyleLoader {
    private static final Set<String> KNOWN_KEYS = Set.of(
        "body_font", "body_size", "code_font", "code_size", "dark_color", "accent_color",
        "page_width", "page_height", "page_content_width", "spacer_height",
        "margins.top", "margins.bottom", "margins.left", "margins.right",
        "palette.heading_color", "palette.subheading_color", "palette.secondary_accent_color",
        "palette.table_header_fill", "palette.table_header_text", "palette.table_alt_row_fill",
        "palette.code_fill", "palette.code_text"
    );

    private StyleLoader() {}

    public static StyleConstants load(Path path) {
        if (path == null) {
            return StyleConstants.defaults();
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Style file not found: " + path);
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read style file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static StyleConstants parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid style file: " + messages);
        }
        rejectUnknownKeys(result);

        var builder = StyleConstants.builder();
        var defaults = StyleConstants.defaults();
        applyString(result, "body_font", builder::bodyFont);
        applyInt(result, "body_size", builder::bodySize);
        applyString(result, "code_font", builder::codeFont);
        applyInt(result, "code_size", builder::codeSize);
        applyString(result, "dark_color", builder::darkColor);
        applyString(result, "accent_color", builder::accentColor);
        applyInt(result, "page_width", builder::pageWidth);
        applyInt(result, "page_height", builder::pageHeight);
        applyInt(result, "page_content_width", builder::pageContentWidth);
        applyInt(result, "spacer_height", builder::spacerHeight);

        TomlTable margins = result.getTable("margins");
        if (margins != null) {
            var base = defaults.margins();
            builder.margins(new Margins(
                intOr(margins, "top", base.top()),
                intOr(margins, "bottom", base.bottom()),
                intOr(margins, "left", base.left()),
                intOr(margins, "right", base.right())
            ));
        }

        TomlTable palette = result.getTable("palette");
        if (palette != null) {
            var base = defaults.palette();
            builder.palette(new Palette(
                stringOr(palette, "heading_color", base.headingColor()),
                stringOr(palette, "subheading_color", base.subheadingColor()),
                stringOr(palette, "secondary_accent_color", base.secondaryAccentColor()),
                stringOr(palette, "table_header_fill", base.tableHeaderFill()),
                stringOr(palette, "table_header_text", base.tableHeaderText()),
                stringOr(palette, "table_alt_row_fill", base.tableAltRowFill()),
                stringOr(palette, "code_fill", base.codeFill()),
                stringOr(palette, "code_text", base.codeText())
            ));
        }
        return builder.build();
    }

    private static void rejectUnknownKeys(TomlParseResult result) {
        var unknown = new LinkedHashSet<String>();
        for (String key : result.dottedKeySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown style keys: " + String.join(", ", unknown));
        }
    }

    private static void applyString(TomlTable table, String key, Consumer<String> setter) {
        if (table.contains(key)) {
            setter.accept(readString(table, key));
        }
    }

    private static void applyInt(TomlTable table, String key, IntConsumer setter) {
        if (table.contains(key)) {
            setter.accept(readInt(table, key));
        }
    }

    private static String stringOr(TomlTable table, String key, String fallback) {
        return table.contains(key) ? readString(table, key) : fallback;
    }

    private static int intOr(TomlTable table, String key, int fallback) {
        return table.contains(key) ? readInt(table, key) : fallback;
    }

    private static String readString(TomlTable table, String key) {
        if (!table.isString(key)) {
            throw new IllegalArgumentException("Style key '" + key + "' must be a string");
        }
        return table.getString(key);
    }

    private static int readInt(TomlTable table, String key) {
        if (!table.isLong(key)) {
            throw new IllegalArgumentException("Style key '" + key + "' must be an integer");
        }
        long value = table.getLong(key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Style key '" + key + "' is out of range: " + value);
        }
        return (int) value;
    }
}
