package work.lcod.specdoc.style;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Six-digit RGB hex colors as used by WordprocessingML ({@code 1B2A4A}, no leading {@code #}).
 */
public final class HexColor {
    private static final Pattern HEX = Pattern.compile("[0-9A-Fa-f]{6}");

    private HexColor() {}

    public static boolean isValid(String value) {
        return value != null && HEX.matcher(value).matches();
    }

    public static String require(String value, String field) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(field + " must be a 6-digit hex color, got: " + value);
        }
        return value.toUpperCase(Locale.ROOT);
    }
}
