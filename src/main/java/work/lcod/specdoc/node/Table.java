package work.lcod.specdoc.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Header row plus body rows with explicit column widths in layout units. Every row has exactly
 * one cell per declared width.
 */
public record Table(List<String> headerRow, List<List<String>> bodyRows, List<Integer> colWidths) implements ContentNode {
    public Table {
        if (headerRow == null || headerRow.isEmpty()) {
            throw new AuthoringException("table", "header row must not be empty");
        }
        if (colWidths == null || colWidths.size() != headerRow.size()) {
            throw new AuthoringException(
                "table",
                "expected " + headerRow.size() + " column widths, got " + (colWidths == null ? 0 : colWidths.size())
            );
        }
        for (Integer width : colWidths) {
            if (width == null || width <= 0) {
                throw new AuthoringException("table", "column widths must be positive, got " + colWidths);
            }
        }
        headerRow = cells(headerRow);
        var rows = new ArrayList<List<String>>();
        var source = bodyRows == null ? List.<List<String>>of() : bodyRows;
        for (int index = 0; index < source.size(); index++) {
            var row = source.get(index);
            int count = row == null ? 0 : row.size();
            if (count != headerRow.size()) {
                throw new AuthoringException(
                    "table",
                    "row " + index + " has " + count + " cells, expected " + headerRow.size()
                );
            }
            rows.add(cells(row));
        }
        bodyRows = List.copyOf(rows);
        colWidths = List.copyOf(colWidths);
    }

    public int columnCount() {
        return headerRow.size();
    }

    public long totalWidth() {
        return colWidths.stream().mapToLong(Integer::longValue).sum();
    }

    private static List<String> cells(List<String> raw) {
        var copy = new ArrayList<String>(raw.size());
        raw.forEach(cell -> copy.add(Texts.orEmpty(cell)));
        return List.copyOf(copy);
    }

    @Override
    public String type() {
        return "table";
    }
}
