package com.logicsim.output;

import com.logicsim.table.TruthTable;
import com.logicsim.table.TruthTableRow;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.tinylog.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Delimited-text export: a header of the variable names followed by {@code Output},
 * then one line per row with {@code 0}/{@code 1} values.
 * Variable names are single letters, so nothing ever needs quoting.
 */
public class CsvExporter implements TableWriter {
    public static final String OUTPUT_COLUMN = "Output";

    private final char delimiter;

    public CsvExporter() {
        this(',');
    }

    public CsvExporter(char delimiter) {
        this.delimiter = delimiter;
    }

    public void export(TruthTable table, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(null, table.variables(), table.rows().stream(), out);
        }
        Logger.info("Exported {} rows to {}", table.size(), file);
    }

    /**
     * The expression is not part of the export and may be {@code null}.
     */
    @Override
    public void write(String expression, ImmutableSortedSet<String> variables, Stream<TruthTableRow> rows, Writer out)
            throws IOException {
        StringBuilder sb = new StringBuilder(variables.size() * 2 + OUTPUT_COLUMN.length() + 1);
        for (String variable : variables) {
            sb.append(variable).append(delimiter);
        }
        sb.append(OUTPUT_COLUMN).append('\n');
        out.write(sb.toString());

        Iterator<TruthTableRow> iterator = rows.iterator();
        while (iterator.hasNext()) {
            TruthTableRow row = iterator.next();
            sb.setLength(0);
            row.inputs().each(value -> sb.append(value ? '1' : '0').append(delimiter));
            sb.append(row.output() ? '1' : '0').append('\n');
            out.write(sb.toString());
        }
        out.flush();
    }
}
