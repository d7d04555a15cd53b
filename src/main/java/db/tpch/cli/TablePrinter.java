package db.tpch.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Simple ASCII table printer for load summaries.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<String> headers, List<List<Object>> rows, PrintStream out) {
        if (rows == null || rows.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (List<Object> r : rows) {
            for (int i = 0; i < colCount; i++) {
                String s = String.valueOf(r.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildRow(headers, widths));
        out.println(divLine);
        for (List<Object> r : rows) {
            out.println(buildRow(r, widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildRow(List<?> vals, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String s = String.valueOf(vals.get(i));
            sb.append(' ').append(pad(s, widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
