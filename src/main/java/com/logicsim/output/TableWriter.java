package com.logicsim.output;

import com.logicsim.table.TruthTableRow;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

import java.io.IOException;
import java.io.Writer;
import java.util.stream.Stream;

/**
 * Renders truth-table rows in one output format.
 */
public interface TableWriter {

    /**
     * Writes a header derived from {@code expression} and {@code variables}, then every row
     * in stream order. Rows are consumed as they arrive.
     */
    void write(String expression, ImmutableSortedSet<String> variables, Stream<TruthTableRow> rows, Writer out)
            throws IOException;
}
