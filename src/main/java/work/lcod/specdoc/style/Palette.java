package work.lcod.specdoc.style;

/**
 * Secondary colors used by headings, rules, tables and code.
 */
public record Palette(
    String headingColor,
    String subheadingColor,
    String secondaryAccentColor,
    String tableHeaderFill,
    String tableHeaderText,
    String tableAltRowFill,
    String codeFill,
    String codeText
) {
    public Palette {
        headingColor = HexColor.require(headingColor, "headingColor");
        subheadingColor = HexColor.require(subheadingColor, "subheadingColor");
        secondaryAccentColor = HexColor.require(secondaryAccentColor, "secondaryAccentColor");
        tableHeaderFill = HexColor.require(tableHeaderFill, "tableHeaderFill");
        tableHeaderText = HexColor.require(tableHeaderText, "tableHeaderText");
        tableAltRowFill = HexColor.require(tableAltRowFill, "tableAltRowFill");
        codeFill = HexColor.require(codeFill, "codeFill");
        codeText = HexColor.require(codeText, "codeText");
    }

    public static Palette defaults() {
        return new Palette("1B2A4A", "2E5090", "B8B0A2", "1B2A4A", "FFFFFF", "FAF7F0", "F5F3EF", "3A3A3A");
    }
}
