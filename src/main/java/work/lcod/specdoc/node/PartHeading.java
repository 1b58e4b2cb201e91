package work.lcod.specdoc.node;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Top-level part title such as {@code PART II: CRYPTOGRAPHIC PRIMITIVES}. Text is kept upper-cased.
 */
public record PartHeading(String text) implements ContentNode {
    private static final Pattern ORDINAL = Pattern.compile("^PART\\s+([IVXLCDM]+)\\b");
    private static final Map<Character, Integer> ROMAN = Map.of(
        'I', 1, 'V', 5, 'X', 10, 'L', 50, 'C', 100, 'D', 500, 'M', 1000
    );

    public PartHeading {
        text = Texts.requireText("part_heading", "text", text).toUpperCase(Locale.ROOT);
    }

    /**
     * Value of the roman numeral following {@code PART}, if the heading carries one.
     */
    public OptionalInt ordinal() {
        var matcher = ORDINAL.matcher(text);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(romanValue(matcher.group(1)));
    }

    static int romanValue(String numeral) {
        int total = 0;
        for (int i = 0; i < numeral.length(); i++) {
            int value = ROMAN.get(numeral.charAt(i));
            int next = i + 1 < numeral.length() ? ROMAN.get(numeral.charAt(i + 1)) : 0;
            total += value < next ? -value : value;
        }
        return total;
    }

    @Override
    public String type() {
        return "part_heading";
    }
}
