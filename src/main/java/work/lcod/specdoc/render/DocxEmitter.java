package work.lcod.specdoc.render;

import java.math.BigInteger;
import java.util.List;
import org.apache.poi.wp.usermodel.HeaderFooterType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.TableWidthType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBookmark;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHyperlink;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTMarkupRange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPBdr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPageSz;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSectPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTShd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSimpleField;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabStop;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblGrid;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblLayoutType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STShd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabTlc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblLayoutType;
import work.lcod.specdoc.chapter.DocumentMetadata;
import work.lcod.specdoc.node.CodeBlock;
import work.lcod.specdoc.node.ContentNode;
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
 * Translates content nodes into WordprocessingML through the XWPF model. One instance writes one
 * document; {@link #prepare} must run before the first {@link #emit}.
 */
final class DocxEmitter {
    static final int MAX_RUN_SIZE = 3276;

    private static final String TABLE_BORDER_COLOR = "CCCCCC";
    private static final String HEADER_TEXT_COLOR = "666666";
    private static final int HEADER_FOOTER_DISTANCE = 720;
    private static final int INDENT_STEP = 360;

    private final XWPFDocument document;
    private final StyleConstants style;
    private final Outline outline;
    private CTSectPr sectionTemplate;

    DocxEmitter(XWPFDocument document, StyleConstants style, Outline outline) {
        this.document = document;
        this.style = style;
        this.outline = outline;
    }

    /**
     * Styles part, running header and footer, page geometry. The resulting section properties are
     * the template every page break copies.
     */
    void prepare(DocumentMetadata metadata) {
        defineStyles();
        if (!metadata.headerText().isEmpty()) {
            var header = document.createHeader(HeaderFooterType.DEFAULT);
            var paragraph = header.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.RIGHT);
            border(paragraph, style.palette().secondaryAccentColor(), 4, 4);
            addRun(paragraph, Run.plain(metadata.headerText()).withSize(Math.max(2, style.bodySize() - 5)).withColor(HEADER_TEXT_COLOR));
        }
        var footer = document.createFooter(HeaderFooterType.DEFAULT);
        var pageNumber = footer.createParagraph();
        pageNumber.setAlignment(ParagraphAlignment.CENTER);
        field(pageNumber, "PAGE", "1", Run.plain("").withSize(Math.max(2, style.bodySize() - 5)).withColor(HEADER_TEXT_COLOR));

        var body = document.getDocument().getBody();
        CTSectPr section = body.isSetSectPr() ? body.getSectPr() : body.addNewSectPr();
        CTPageSz size = section.isSetPgSz() ? section.getPgSz() : section.addNewPgSz();
        size.setW(BigInteger.valueOf(style.pageWidth()));
        size.setH(BigInteger.valueOf(style.pageHeight()));
        CTPageMar margins = section.isSetPgMar() ? section.getPgMar() : section.addNewPgMar();
        margins.setTop(BigInteger.valueOf(style.margins().top()));
        margins.setBottom(BigInteger.valueOf(style.margins().bottom()));
        margins.setLeft(BigInteger.valueOf(style.margins().left()));
        margins.setRight(BigInteger.valueOf(style.margins().right()));
        margins.setHeader(BigInteger.valueOf(HEADER_FOOTER_DISTANCE));
        margins.setFooter(BigInteger.valueOf(HEADER_FOOTER_DISTANCE));
        margins.setGutter(BigInteger.ZERO);
        sectionTemplate = (CTSectPr) section.copy();
    }

    void emit(ContentNode node, int index) {
        if (node instanceof Heading heading) {
            heading(heading, index);
        } else if (node instanceof PartHeading part) {
            partHeading(part, index);
        } else if (node instanceof Paragraph paragraph) {
            paragraph(paragraph.runs(), paragraph.alignment());
        } else if (node instanceof Run run) {
            paragraph(List.of(run), Paragraph.Alignment.JUSTIFIED);
        } else if (node instanceof Table table) {
            table(table);
        } else if (node instanceof CodeBlock code) {
            codeBlock(code);
        } else if (node instanceof LabeledBlock block) {
            labeledBlock(block);
        } else if (node instanceof Spacer spacer) {
            var paragraph = document.createParagraph();
            paragraph.setSpacingBefore(0);
            paragraph.setSpacingAfter(spacer.height());
        } else if (node instanceof PageBreak) {
            var paragraph = document.createParagraph();
            pPr(paragraph).setSectPr((CTSectPr) sectionTemplate.copy());
        } else if (node instanceof Rule rule) {
            rule(rule);
        } else if (node instanceof TableOfContents contents) {
            tableOfContents(contents);
        } else {
            throw new IllegalArgumentException("Unsupported node type " + node.type());
        }
    }

    private void defineStyles() {
        var styles = document.createStyles();
        CTFonts fonts = CTFonts.Factory.newInstance();
        fonts.setAscii(style.bodyFont());
        fonts.setHAnsi(style.bodyFont());
        fonts.setCs(style.bodyFont());
        fonts.setEastAsia(style.bodyFont());
        styles.setDefaultFonts(fonts);
        for (int level = 1; level <= Heading.MAX_LEVEL; level++) {
            CTStyle heading = CTStyle.Factory.newInstance();
            heading.setStyleId("Heading" + level);
            heading.setType(STStyleType.PARAGRAPH);
            heading.addNewName().setVal("heading " + level);
            heading.addNewUiPriority().setVal(BigInteger.valueOf(9));
            heading.addNewQFormat();
            var properties = heading.addNewPPr();
            properties.addNewKeepNext();
            properties.addNewOutlineLvl().setVal(BigInteger.valueOf(level - 1));
            styles.addStyle(new XWPFStyle(heading, styles));
        }
    }

    // --- headings ---

    private void heading(Heading heading, int index) {
        var palette = style.palette();
        var paragraph = document.createParagraph();
        paragraph.setStyle("Heading" + heading.level());
        pPr(paragraph).addNewKeepNext();
        pPr(paragraph).addNewKeepLines();
        var text = outline.at(index).map(Outline.Entry::displayText).orElse(heading.text());
        int before = heading.level() == 1 ? 360 : heading.level() == 2 ? 280 : 200;
        paragraph.setSpacingBefore(before);
        paragraph.setSpacingAfter(heading.level() == 1 ? 200 : heading.level() == 2 ? 160 : 120);
        var run = switch (heading.level()) {
            case 1 -> Run.plain(text).withBold(true).withSize(32).withColor(palette.headingColor());
            case 2 -> Run.plain(text).withBold(true).withSize(26).withColor(palette.subheadingColor());
            default -> Run.plain(text).withBold(true).withSize(style.bodySize()).withColor(style.darkColor());
        };
        bookmarked(paragraph, index, run);
    }

    private void partHeading(PartHeading part, int index) {
        var paragraph = document.createParagraph();
        paragraph.setStyle("Heading1");
        paragraph.setAlignment(ParagraphAlignment.CENTER);
        paragraph.setSpacingBefore(0);
        paragraph.setSpacingAfter(120);
        pPr(paragraph).addNewKeepNext();
        var run = Run.plain(part.text()).withBold(true).withSize(36).withColor(style.palette().headingColor());
        var written = bookmarked(paragraph, index, run);
        written.setCharacterSpacing(80);
    }

    private XWPFRun bookmarked(XWPFParagraph paragraph, int index, Run run) {
        var entry = outline.at(index).orElse(null);
        if (entry == null) {
            return addRun(paragraph, run);
        }
        CTBookmark start = paragraph.getCTP().addNewBookmarkStart();
        start.setName(entry.bookmark());
        start.setId(BigInteger.valueOf(entry.id()));
        var written = addRun(paragraph, run);
        CTMarkupRange end = paragraph.getCTP().addNewBookmarkEnd();
        end.setId(BigInteger.valueOf(entry.id()));
        return written;
    }

    // --- text ---

    private void paragraph(List<Run> runs, Paragraph.Alignment alignment) {
        var paragraph = document.createParagraph();
        paragraph.setAlignment(alignment(alignment));
        paragraph.setSpacingAfter(120);
        paragraph.setSpacingBetween(1.15);
        pPr(paragraph).addNewWidowControl();
        for (Run run : runs) {
            addRun(paragraph, run);
        }
    }

    private static ParagraphAlignment alignment(Paragraph.Alignment alignment) {
        return switch (alignment) {
            case CENTER -> ParagraphAlignment.CENTER;
            case LEFT -> ParagraphAlignment.LEFT;
            case JUSTIFIED -> ParagraphAlignment.BOTH;
        };
    }

    /**
     * Appends a run, filling every unset attribute from the style constants.
     */
    private XWPFRun addRun(XWPFParagraph paragraph, Run run) {
        var written = paragraph.createRun();
        format(written, run);
        return written;
    }

    private void format(XWPFRun written, Run run) {
        int size = run.size() != null ? run.size() : style.bodySize();
        if (size > MAX_RUN_SIZE) {
            throw new IllegalArgumentException(
                "font size " + size + " half-points exceeds the maximum of " + MAX_RUN_SIZE
            );
        }
        if (!run.text().isEmpty()) {
            written.setText(run.text());
        }
        written.setFontFamily(run.font() != null ? run.font() : style.bodyFont());
        written.setFontSize(size / 2.0);
        written.setColor(run.color() != null ? run.color() : style.darkColor());
        written.setBold(run.bold());
        written.setItalic(run.italic());
        if (run.shading() != null) {
            CTRPr properties = written.getCTR().isSetRPr() ? written.getCTR().getRPr() : written.getCTR().addNewRPr();
            CTShd shading = properties.addNewShd();
            shading.setVal(STShd.CLEAR);
            shading.setColor("auto");
            shading.setFill(run.shading());
        }
    }

    // --- blocks ---

    private void table(Table table) {
        var palette = style.palette();
        int columns = table.columnCount();
        XWPFTable written = document.createTable(table.bodyRows().size() + 1, columns);
        written.setWidthType(TableWidthType.DXA);
        written.setWidth(Long.toString(table.totalWidth()));
        CTTblPr properties = written.getCTTbl().getTblPr();
        CTTblLayoutType layout = properties.isSetTblLayout() ? properties.getTblLayout() : properties.addNewTblLayout();
        layout.setType(STTblLayoutType.FIXED);
        written.setCellMargins(60, 100, 60, 100);
        written.setTopBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);
        written.setBottomBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);
        written.setLeftBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);
        written.setRightBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);
        written.setInsideHBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);
        written.setInsideVBorder(XWPFBorderType.SINGLE, 4, 0, TABLE_BORDER_COLOR);

        CTTblGrid grid = written.getCTTbl().getTblGrid() != null
            ? written.getCTTbl().getTblGrid()
            : written.getCTTbl().addNewTblGrid();
        while (grid.sizeOfGridColArray() > 0) {
            grid.removeGridCol(0);
        }
        for (Integer width : table.colWidths()) {
            grid.addNewGridCol().setW(BigInteger.valueOf(width));
        }

        int cellSize = Math.max(2, style.bodySize() - 3);
        var header = written.getRow(0);
        header.setRepeatHeader(true);
        header.setCantSplitRow(true);
        for (int column = 0; column < columns; column++) {
            var cell = header.getCell(column);
            sizeCell(cell, table.colWidths().get(column));
            cell.setColor(palette.tableHeaderFill());
            var run = Run.plain(table.headerRow().get(column))
                .withBold(true)
                .withSize(cellSize)
                .withColor(palette.tableHeaderText());
            cellRun(cell, run).setCharacterSpacing(20);
        }
        for (int row = 0; row < table.bodyRows().size(); row++) {
            var bodyRow = written.getRow(row + 1);
            bodyRow.setCantSplitRow(true);
            var cells = table.bodyRows().get(row);
            for (int column = 0; column < columns; column++) {
                var cell = bodyRow.getCell(column);
                sizeCell(cell, table.colWidths().get(column));
                if (row % 2 == 1) {
                    cell.setColor(palette.tableAltRowFill());
                }
                cellRun(cell, Run.plain(cells.get(column)).withSize(cellSize));
            }
        }
    }

    private static void sizeCell(XWPFTableCell cell, int width) {
        cell.setWidthType(TableWidthType.DXA);
        cell.setWidth(Integer.toString(width));
    }

    private XWPFRun cellRun(XWPFTableCell cell, Run run) {
        var paragraph = cell.getParagraphs().isEmpty() ? cell.addParagraph() : cell.getParagraphs().get(0);
        paragraph.setSpacingBefore(0);
        paragraph.setSpacingAfter(0);
        return addRun(paragraph, run);
    }

    private void codeBlock(CodeBlock code) {
        var palette = style.palette();
        for (String line : code.lines()) {
            var paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.LEFT);
            paragraph.setSpacingBefore(0);
            paragraph.setSpacingAfter(0);
            paragraph.setSpacingBetween(1.0);
            paragraph.setIndentationLeft(120);
            shade(paragraph, palette.codeFill());
            var borders = pBdr(paragraph);
            line(borders.addNewLeft(), palette.secondaryAccentColor(), 12, 6);
            var run = Run.plain(line.isEmpty() ? " " : line)
                .withFont(style.codeFont())
                .withSize(style.codeSize())
                .withColor(palette.codeText());
            addRun(paragraph, run);
        }
    }

    private void labeledBlock(LabeledBlock block) {
        var palette = style.palette();
        boolean theorem = block.kind() == LabeledBlock.Kind.THEOREM;
        var paragraph = document.createParagraph();
        paragraph.setAlignment(ParagraphAlignment.BOTH);
        paragraph.setSpacingBefore(160);
        paragraph.setSpacingAfter(theorem ? 120 : 80);
        paragraph.setSpacingBetween(1.15);
        paragraph.setIndentationLeft(INDENT_STEP);
        var accent = theorem ? palette.subheadingColor() : style.accentColor();
        line(pBdr(paragraph).addNewLeft(), accent, 12, 8);
        addRun(paragraph, Run.plain(block.label() + " ").withBold(true).withItalic(!theorem).withColor(palette.headingColor()));
        addRun(paragraph, Run.plain(block.body()).withItalic(theorem));
    }

    private void rule(Rule rule) {
        var paragraph = document.createParagraph();
        boolean accent = rule.weight() == Rule.Weight.ACCENT;
        paragraph.setSpacingBefore(accent ? 120 : 80);
        paragraph.setSpacingAfter(accent ? 240 : 160);
        var color = accent ? style.accentColor() : style.palette().secondaryAccentColor();
        border(paragraph, color, accent ? 12 : 4, 4);
    }

    private void tableOfContents(TableOfContents contents) {
        var palette = style.palette();
        var title = document.createParagraph();
        title.setAlignment(ParagraphAlignment.CENTER);
        title.setSpacingAfter(200);
        addRun(title, Run.plain(contents.title()).withBold(true).withSize(28).withColor(palette.headingColor()));

        for (Outline.Entry entry : outline.contents(contents.maxLevel())) {
            boolean part = entry.level() == 0;
            var paragraph = document.createParagraph();
            paragraph.setAlignment(ParagraphAlignment.LEFT);
            paragraph.setSpacingBefore(part ? 160 : 0);
            paragraph.setSpacingAfter(part ? 80 : 40);
            paragraph.setIndentationLeft(Math.max(0, entry.level() - 1) * INDENT_STEP);
            CTTabStop stop = pPr(paragraph).addNewTabs().addNewTab();
            stop.setVal(STTabJc.RIGHT);
            stop.setLeader(STTabTlc.DOT);
            stop.setPos(BigInteger.valueOf(style.pageContentWidth()));

            CTHyperlink link = paragraph.getCTP().addNewHyperlink();
            link.setAnchor(entry.bookmark());
            CTR textRun = link.addNewR();
            var linked = new XWPFHyperlinkRun(link, textRun, paragraph);
            format(linked, Run.plain(entry.displayText()).withBold(part));
            link.addNewR().addNewTab();
            field(paragraph, "PAGEREF " + entry.bookmark() + " \\h", "", Run.plain(""));
        }
        document.enforceUpdateFields();
    }

    // --- low-level helpers ---

    private void field(XWPFParagraph paragraph, String instruction, String placeholder, Run format) {
        CTSimpleField field = paragraph.getCTP().addNewFldSimple();
        field.setInstr(" " + instruction + " ");
        CTR result = field.addNewR();
        format(new XWPFRun(result, paragraph), format);
        if (!placeholder.isEmpty()) {
            result.addNewT().setStringValue(placeholder);
        }
    }

    private static CTPPr pPr(XWPFParagraph paragraph) {
        var ctp = paragraph.getCTP();
        return ctp.isSetPPr() ? ctp.getPPr() : ctp.addNewPPr();
    }

    private static CTPBdr pBdr(XWPFParagraph paragraph) {
        var properties = pPr(paragraph);
        return properties.isSetPBdr() ? properties.getPBdr() : properties.addNewPBdr();
    }

    private static void border(XWPFParagraph paragraph, String color, int size, int space) {
        line(pBdr(paragraph).addNewBottom(), color, size, space);
    }

    private static void line(CTBorder border, String color, int size, int space) {
        border.setVal(STBorder.SINGLE);
        border.setSz(BigInteger.valueOf(size));
        border.setSpace(BigInteger.valueOf(space));
        border.setColor(color);
    }

    private static void shade(XWPFParagraph paragraph, String fill) {
        CTShd shading = pPr(paragraph).addNewShd();
        shading.setVal(STShd.CLEAR);
        shading.setColor("auto");
        shading.setFill(fill);
    }
}
