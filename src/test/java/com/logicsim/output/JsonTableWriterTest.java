package com.logicsim.output;

import com.logicsim.expr.ExpressionParser;
import com.logicsim.table.TruthTable;
import com.logicsim.table.TruthTableGenerator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class JsonTableWriterTest {
    private final ExpressionParser parser = new ExpressionParser();
    private final TruthTableGenerator generator = new TruthTableGenerator();

    private String write(String expression, boolean prettyPrint) throws IOException {
        TruthTable table = generator.generate(parser.parse(expression));
        StringWriter out = new StringWriter();
        new JsonTableWriter(prettyPrint).write(expression, table.variables(), table.rows().stream(), out);
        return out.toString();
    }

    @Test
    public void testCompactOutput() throws IOException {
        String expected = "{\"expression\":\"A XOR B\",\"variables\":[\"A\",\"B\"],\"rows\":["
                + "{\"inputs\":{\"A\":false,\"B\":false},\"output\":false},"
                + "{\"inputs\":{\"A\":false,\"B\":true},\"output\":true},"
                + "{\"inputs\":{\"A\":true,\"B\":false},\"output\":true},"
                + "{\"inputs\":{\"A\":true,\"B\":true},\"output\":false}]}\n";

        assertEquals(expected, write("A XOR B", false));
    }

    @Test
    public void testPrettyOutput() throws IOException {
        String output = write("NOT A", true);

        assertTrue(output.contains("\"expression\" : \"NOT A\""));
        assertTrue(output.contains("\"output\" : true"));
        assertTrue(output.split("\n").length > 5);
    }

    @Test
    public void testFormatsCreateMatchingWriters() {
        assertInstanceOf(TableFormatter.class, OutputFormat.TABLE.createWriter(false, false));
        assertInstanceOf(CsvExporter.class, OutputFormat.CSV.createWriter(false, false));
        assertInstanceOf(JsonTableWriter.class, OutputFormat.JSON.createWriter(false, true));
    }
}
