package com.logicsim.output;

import com.logicsim.expr.ExpressionParser;
import com.logicsim.table.TruthTable;
import com.logicsim.table.TruthTableGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TableFormatterTest {
    private final ExpressionParser parser = new ExpressionParser();
    private final TruthTableGenerator generator = new TruthTableGenerator();

    private TruthTable table(String expression) {
        return generator.generate(parser.parse(expression));
    }

    @Test
    public void testFormatsHeaderRuleAndRows() {
        String expected = String.join("\n",
                "   A     |    B     |  A XOR B  ",
                "--------------------------------",
                "   0     |    0     |     0     ",
                "   0     |    1     |     1     ",
                "   1     |    0     |     1     ",
                "   1     |    1     |     0     ",
                "");

        assertEquals(expected, new TableFormatter().format("A XOR B", table("A XOR B")));
    }

    @Test
    public void testBooleanWords() {
        String output = new TableFormatter(true).format("A XOR B", table("A XOR B"));
        String[] lines = output.split("\n");

        assertEquals(6, lines.length);
        assertEquals(" False   |   True   |    True   ", lines[3]);
    }

    @Test
    public void testLongExpressionWidensOutputColumn() {
        String expression = "(A AND B) OR (NOT C)";
        String[] lines = new TableFormatter().format(expression, table(expression)).split("\n");

        assertEquals(3 * (8 + 3) + expression.length() + 2, lines[0].length());
        assertTrue(lines[0].endsWith(" " + expression + " "));
        assertEquals(lines[0].length(), lines[1].length());
        assertEquals(2 + 8, lines.length);
    }
}
