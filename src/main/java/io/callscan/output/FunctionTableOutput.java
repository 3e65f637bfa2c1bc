package io.callscan.output;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Function;

/**
 * Prints the function listing as an aligned console table.
 */
public class FunctionTableOutput {

    private static final String[] HEADERS =
        {"File", "Function", "Line", "Parameters", "Returns", "Externals", "FunctionCalls"};

    private final PrintStream out;

    public FunctionTableOutput() {
        this(System.out);
    }

    public FunctionTableOutput(PrintStream out) {
        this.out = out;
    }

    public void print(List<FunctionRecord> records) {
        if (records.isEmpty()) {
            out.println("No functions found.");
            return;
        }

        List<Function<FunctionRecord, String>> cells = List.of(
            FunctionRecord::file,
            FunctionRecord::function,
            r -> Integer.toString(r.line()),
            r -> cell(r.parameters()),
            r -> cell(r.returns()),
            r -> cell(r.externals()),
            r -> cell(r.calls())
        );

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
            for (FunctionRecord record : records) {
                widths[i] = Math.max(widths[i], cells.get(i).apply(record).length());
            }
        }

        printRow(HEADERS, widths);
        int total = 0;
        for (int width : widths) {
            total += width;
        }
        out.println("-".repeat(total + 3 * (widths.length - 1)));

        for (FunctionRecord record : records) {
            String[] row = new String[HEADERS.length];
            for (int i = 0; i < row.length; i++) {
                row[i] = cells.get(i).apply(record);
            }
            printRow(row, widths);
        }
    }

    private void printRow(String[] values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            // last column is not padded
            sb.append(i == values.length - 1 ? values[i] : pad(values[i], widths[i]));
        }
        out.println(sb);
    }

    private static String cell(List<String> values) {
        return values.isEmpty() ? CsvExporter.NONE : String.join(", ", values);
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(width - value.length());
    }
}
