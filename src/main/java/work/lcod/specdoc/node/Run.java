package work.lcod.specdoc.node;

import java.util.Locale;
import work.lcod.specdoc.style.HexColor;

/**
 * Styled span of text. {@code color}, {@code size}, {@code font} and {@code shading} are optional:
 * a {@code null} value inherits the document default at serialization, an explicit value always
 * wins. Sizes are half-points.
 */
public record Run(String text, boolean bold, boolean italic, String color, Integer size, String font, String shading)
    implements ContentNode {

    public Run {
        text = Texts.orEmpty(text);
        color = optionalColor("color", color);
        shading = optionalColor("shading", shading);
        if (size != null && size <= 0) {
            throw new AuthoringException("run", "size must be positive, got " + size);
        }
        if (font != null && font.isBlank()) {
            throw new AuthoringException("run", "font must not be blank when set");
        }
    }

    public static Run plain(String text) {
        return new Run(text, false, false, null, null, null, null);
    }

    public Run withBold(boolean value) {
        return new Run(text, value, italic, color, size, font, shading);
    }

    public Run withItalic(boolean value) {
        return new Run(text, bold, value, color, size, font, shading);
    }

    public Run withColor(String value) {
        return new Run(text, bold, italic, value, size, font, shading);
    }

    public Run withSize(Integer value) {
        return new Run(text, bold, italic, color, value, font, shading);
    }

    public Run withFont(String value) {
        return new Run(text, bold, italic, color, size, value, shading);
    }

    public Run withShading(String value) {
        return new Run(text, bold, italic, color, size, font, value);
    }

    private static String optionalColor(String field, String value) {
        if (value == null) {
            return null;
        }
        if (!HexColor.isValid(value)) {
            throw new AuthoringException("run", field + " must be a 6-digit hex color, got: " + value);
        }
        return value.toUpperCase(Locale.ROOT);
    }

    @Override
    public String type() {
        return "run";
    }
}
