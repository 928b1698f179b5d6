package sh.harold.flotilla.cluster.command;

import java.util.ArrayList;
import java.util.List;

/**
 * ASCII table formatter for chat output
 */
public class TableFormatter {

    private final List<String> headers = new ArrayList<>();
    private final List<Integer> columnWidths = new ArrayList<>();
    private final List<List<String>> rows = new ArrayList<>();

    /**
     * Add headers to the table
     *
     * @param headers The column headers
     * @return This formatter for chaining
     */
    public TableFormatter addHeaders(String... headers) {
        for (String header : headers) {
            this.headers.add(header);
            this.columnWidths.add(header.length());
        }
        return this;
    }

    /**
     * Add a row to the table
     *
     * @param values The row values
     * @return This formatter for chaining
     */
    public TableFormatter addRow(String... values) {
        List<String> row = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < values.length && values[i] != null ? values[i] : "";
            row.add(value);
            if (value.length() > columnWidths.get(i)) {
                columnWidths.set(i, value.length());
            }
        }
        rows.add(row);
        return this;
    }

    /**
     * Build the formatted table, one chat line per table line
     *
     * @param title Title line, centered in the top border
     * @return The table lines
     */
    public List<String> build(String title) {
        int totalWidth = columnWidths.stream().mapToInt(Integer::intValue).sum()
                + (columnWidths.size() - 1) * 3 + 4;

        List<String> lines = new ArrayList<>();
        lines.add(titleBorder(title, totalWidth));
        lines.add(line(headers));
        lines.add("+" + "-".repeat(totalWidth - 2) + "+");
        for (List<String> row : rows) {
            lines.add(line(row));
        }
        lines.add("+" + "-".repeat(totalWidth - 2) + "+");
        return lines;
    }

    private String line(List<String> values) {
        StringBuilder sb = new StringBuilder("| ");
        for (int i = 0; i < values.size(); i++) {
            sb.append(padRight(values.get(i), columnWidths.get(i)));
            if (i < values.size() - 1) {
                sb.append(" | ");
            }
        }
        return sb.append(" |").toString();
    }

    private static String titleBorder(String title, int totalWidth) {
        String label = " " + title + " ";
        int dashes = totalWidth - 2 - label.length();
        if (dashes < 2) {
            return "+-" + label + "-+";
        }
        int left = dashes / 2;
        return "+" + "-".repeat(left) + label + "-".repeat(dashes - left) + "+";
    }

    private static String padRight(String text, int length) {
        if (text.length() >= length) {
            return text;
        }
        return text + " ".repeat(length - text.length());
    }
}
