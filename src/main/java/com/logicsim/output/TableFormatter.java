package com.logicsim.output;

import com.logicsim.table.TruthTable;
import com.logicsim.table.TruthTableRow;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Console rendering: centered fixed-width columns separated by {@code |}, a dashed rule
 * under the header, and the expression itself as the title of the output column.
 */
public class TableFormatter implements TableWriter {
    private static final int MIN_VARIABLE_WIDTH = 8;
    private static final int MIN_OUTPUT_WIDTH = 10;
    private static final String SEPARATOR = " | ";

    // StringBuilder pool, one row at a time
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(128));

    private final boolean booleanWords;

    public TableFormatter() {
        this(false);
    }

    /**
     * @param booleanWords render {@code True}/{@code False} instead of {@code 1}/{@code 0}
     */
    public TableFormatter(boolean booleanWords) {
        this.booleanWords = booleanWords;
    }

    public String format(String expression, TruthTable table) {
        StringWriter out = new StringWriter();
        try {
            write(expression, table.variables(), table.rows().stream(), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    @Override
    public void write(String expression, ImmutableSortedSet<String> variables, Stream<TruthTableRow> rows, Writer out)
            throws IOException {
        int variableWidth = Math.max(MIN_VARIABLE_WIDTH, variables.collectInt(String::length).maxIfEmpty(0) + 2);
        int outputWidth = Math.max(MIN_OUTPUT_WIDTH, expression.length() + 2);

        String header = formatHeader(expression, variables, variableWidth, outputWidth);
        out.write(header);
        out.write('\n');
        out.write("-".repeat(header.length()));
        out.write('\n');

        Iterator<TruthTableRow> iterator = rows.iterator();
        while (iterator.hasNext()) {
            out.write(formatRow(iterator.next(), variableWidth, outputWidth));
            out.write('\n');
        }
        out.flush();
    }

    private String formatHeader(String expression, ImmutableSortedSet<String> variables,
                                int variableWidth, int outputWidth) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (String variable : variables) {
            center(variable, variableWidth, sb);
            sb.append(SEPARATOR);
        }
        center(expression, outputWidth, sb);
        return sb.toString();
    }

    private String formatRow(TruthTableRow row, int variableWidth, int outputWidth) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (int i = 0; i < row.inputs().size(); i++) {
            center(render(row.inputs().get(i)), variableWidth, sb);
            sb.append(SEPARATOR);
        }
        center(render(row.output()), outputWidth, sb);
        return sb.toString();
    }

    private String render(boolean value) {
        if (booleanWords) {
            return value ? "True" : "False";
        }
        return value ? "1" : "0";
    }

    // Odd padding goes to the right.
    private static void center(String text, int width, StringBuilder sb) {
        int padding = Math.max(0, width - text.length());
        int left = padding / 2;
        sb.append(" ".repeat(left)).append(text).append(" ".repeat(padding - left));
    }
}
