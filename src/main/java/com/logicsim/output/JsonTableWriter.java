package com.logicsim.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.logicsim.expr.Assignment;
import com.logicsim.table.TruthTableRow;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * JSON rendering built on Jackson's streaming generator:
 * <pre>{@code
 * {"expression":"A XOR B","variables":["A","B"],
 *  "rows":[{"inputs":{"A":false,"B":false},"output":false}, ...]}
 * }</pre>
 */
public class JsonTableWriter implements TableWriter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public JsonTableWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    @Override
    public void write(String expression, ImmutableSortedSet<String> variables, Stream<TruthTableRow> rows, Writer out)
            throws IOException {
        try (JsonGenerator generator = createGenerator(out)) {
            generator.writeStartObject();
            generator.writeStringField("expression", expression);

            generator.writeArrayFieldStart("variables");
            for (String variable : variables) {
                generator.writeString(variable);
            }
            generator.writeEndArray();

            generator.writeArrayFieldStart("rows");
            Iterator<TruthTableRow> iterator = rows.iterator();
            while (iterator.hasNext()) {
                writeRow(generator, variables, iterator.next());
            }
            generator.writeEndArray();

            generator.writeEndObject();
        }
        out.write('\n');
        out.flush();
    }

    private void writeRow(JsonGenerator generator, ImmutableSortedSet<String> variables, TruthTableRow row)
            throws IOException {
        Assignment assignment = row.assignment();
        generator.writeStartObject();
        generator.writeObjectFieldStart("inputs");
        for (String variable : variables) {
            generator.writeBooleanField(variable, assignment.valueOf(variable));
        }
        generator.writeEndObject();
        generator.writeBooleanField("output", row.output());
        generator.writeEndObject();
    }

    private JsonGenerator createGenerator(Writer out) throws IOException {
        JsonGenerator generator = factory.createGenerator(out);
        // the caller owns the writer
        generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            generator.useDefaultPrettyPrinter();
        }
        return generator;
    }
}
