package db.tpch.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TablePrinterTest {
    private static String print(List<String> headers, List<List<Object>> rows) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        TablePrinter.print(headers, rows, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void columnsWidenToLongestValue() {
        String out = print(List.of("table", "rows"), List.of(List.of("lineitem", 6001215), List.of("region", 5)));
        List<String> lines = out.lines().toList();
        assertEquals("+----------+---------+", lines.get(0));
        assertEquals("| table    | rows    |", lines.get(1));
        assertEquals("| lineitem | 6001215 |", lines.get(3));
        assertEquals("| region   | 5       |", lines.get(4));
        assertEquals("(2 row(s))", lines.get(6));
    }

    @Test
    void emptyResult() {
        assertEquals("(0 row(s))", print(List.of("table"), List.of()).strip());
    }
}
