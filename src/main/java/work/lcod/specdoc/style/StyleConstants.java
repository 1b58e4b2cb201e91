package work.lcod.specdoc.style;

import java.util.Objects;

/**
 * Process-wide visual defaults. Created once before any chapter is built and shared by reference
 * with the primitive library and the serializer.
 *
 * <p>Widths, heights and margins are layout units (twentieths of a point); font sizes are
 * half-points, as in WordprocessingML.
 */
public record StyleConstants(
    String bodyFont,
    int bodySize,
    String codeFont,
    int codeSize,
    String darkColor,
    String accentColor,
    Palette palette,
    int pageWidth,
    int pageHeight,
    int pageContentWidth,
    Margins margins,
    int spacerHeight
) {
    public StyleConstants {
        bodyFont = requireText(bodyFont, "bodyFont");
        codeFont = requireText(codeFont, "codeFont");
        requirePositive(bodySize, "bodySize");
        requirePositive(codeSize, "codeSize");
        darkColor = HexColor.require(darkColor, "darkColor");
        accentColor = HexColor.require(accentColor, "accentColor");
        Objects.requireNonNull(palette, "palette");
        Objects.requireNonNull(margins, "margins");
        requirePositive(pageWidth, "pageWidth");
        requirePositive(pageHeight, "pageHeight");
        requirePositive(pageContentWidth, "pageContentWidth");
        if (pageContentWidth > pageWidth - margins.horizontal()) {
            throw new IllegalArgumentException(
                "pageContentWidth " + pageContentWidth + " exceeds the printable width "
                    + (pageWidth - margins.horizontal())
            );
        }
        if (margins.top() + margins.bottom() >= pageHeight) {
            throw new IllegalArgumentException("Vertical margins leave no printable height");
        }
        if (spacerHeight < 0) {
            throw new IllegalArgumentException("spacerHeight must be non-negative");
        }
    }

    /**
     * Garamond on US Letter with one-inch margins: a 9360-unit content column.
     */
    public static StyleConstants defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .bodyFont(bodyFont)
            .bodySize(bodySize)
            .codeFont(codeFont)
            .codeSize(codeSize)
            .darkColor(darkColor)
            .accentColor(accentColor)
            .palette(palette)
            .pageWidth(pageWidth)
            .pageHeight(pageHeight)
            .pageContentWidth(pageContentWidth)
            .margins(margins)
            .spacerHeight(spacerHeight);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    private static void requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }

    public static final class Builder {
        private String bodyFont = "Garamond";
        private int bodySize = 23;
        private String codeFont = "Consolas";
        private int codeSize = 17;
        private String darkColor = "2C2C2C";
        private String accentColor = "C9A96E";
        private Palette palette = Palette.defaults();
        private int pageWidth = 12240;
        private int pageHeight = 15840;
        private Integer pageContentWidth;
        private Margins margins = Margins.uniform(1440);
        private int spacerHeight = 200;

        public Builder bodyFont(String bodyFont) {
            this.bodyFont = bodyFont;
            return this;
        }

        public Builder bodySize(int bodySize) {
            this.bodySize = bodySize;
            return this;
        }

        public Builder codeFont(String codeFont) {
            this.codeFont = codeFont;
            return this;
        }

        public Builder codeSize(int codeSize) {
            this.codeSize = codeSize;
            return this;
        }

        public Builder darkColor(String darkColor) {
            this.darkColor = darkColor;
            return this;
        }

        public Builder accentColor(String accentColor) {
            this.accentColor = accentColor;
            return this;
        }

        public Builder palette(Palette palette) {
            this.palette = palette;
            return this;
        }

        public Builder pageWidth(int pageWidth) {
            this.pageWidth = pageWidth;
            return this;
        }

        public Builder pageHeight(int pageHeight) {
            this.pageHeight = pageHeight;
            return this;
        }

        /**
         * Explicit content width; when never set, the printable width between the margins is used.
         */
        public Builder pageContentWidth(int pageContentWidth) {
            this.pageContentWidth = pageContentWidth;
            return this;
        }

        public Builder margins(Margins margins) {
            this.margins = margins;
            return this;
        }

        public Builder spacerHeight(int spacerHeight) {
            this.spacerHeight = spacerHeight;
            return this;
        }

        public StyleConstants build() {
            Objects.requireNonNull(margins, "margins");
            int contentWidth = pageContentWidth != null ? pageContentWidth : pageWidth - margins.horizontal();
            return new StyleConstants(
                bodyFont,
                bodySize,
                codeFont,
                codeSize,
                darkColor,
                accentColor,
                palette,
                pageWidth,
                pageHeight,
                contentWidth,
                margins,
                spacerHeight
            );
        }
    }
}
