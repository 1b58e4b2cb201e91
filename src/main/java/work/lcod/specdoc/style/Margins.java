package work.lcod.specdoc.style;

/**
 * Page margins in layout units (twentieths of a point).
 */
public record Margins(int top, int bottom, int left, int right) {
    public Margins {
        if (top < 0 || bottom < 0 || left < 0 || right < 0) {
            throw new IllegalArgumentException("Margins must be non-negative");
        }
    }

    public static Margins uniform(int value) {
        return new Margins(value, value, value, value);
    }

    public int horizontal() {
        return left + right;
    }
}
