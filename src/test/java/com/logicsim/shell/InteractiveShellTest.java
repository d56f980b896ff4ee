package com.logicsim.shell;

import com.logicsim.expr.ExpressionParser;
import com.logicsim.output.CsvExporter;
import com.logicsim.output.TableWriter;
import com.logicsim.store.FileLastExpressionStore;
import com.logicsim.table.TruthTableGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class InteractiveShellTest {
    @TempDir
    Path dir;

    private String run(String input, FileLastExpressionStore store) throws IOException {
        return run(input, new CsvExporter(), store);
    }

    private String run(String input, TableWriter writer, FileLastExpressionStore store) throws IOException {
        InteractiveShell shell = new InteractiveShell(
                new ExpressionParser(), new TruthTableGenerator(), writer, store);
        StringWriter out = new StringWriter();
        shell.run(new BufferedReader(new StringReader(input)), new PrintWriter(out));
        return out.toString();
    }

    @Test
    public void testEvaluatesUntilQuit() throws IOException {
        FileLastExpressionStore store = new FileLastExpressionStore(dir.resolve(".last_expr"));

        String output = run("A XOR B\n\nfoo\nQUIT\nA AND B\n", store);

        assertTrue(output.startsWith("=".repeat(60)));
        assertTrue(output.contains("Truth Table:"));
        assertTrue(output.contains("A,B,Output\n0,0,0\n0,1,1\n1,0,1\n1,1,0\n"));
        assertTrue(output.contains("Please enter a valid expression."));
        assertTrue(output.contains("Error: Unknown token: FOO at position 0"));
        assertTrue(output.contains("Goodbye!"));
        assertFalse(output.contains("1,1,1"), "input after quit must not be evaluated");
        assertEquals(Optional.of("A XOR B"), store.load());
    }

    @Test
    public void testEndOfInputStopsTheLoop() throws IOException {
        String output = run("(A AND B\n", null);

        assertTrue(output.contains("Error: Mismatched parentheses: unmatched '(' at position 0"));
        assertFalse(output.contains("Goodbye!"));
        assertTrue(output.endsWith(InteractiveShell.PROMPT + System.lineSeparator()));
    }

    @Test
    public void testRejectedExpressionIsNotRemembered() throws IOException {
        FileLastExpressionStore store = new FileLastExpressionStore(dir.resolve(".last_expr"));

        run("A AND\nquit\n", store);

        assertEquals(Optional.empty(), store.load());
    }

    @Test
    public void testNonAsciiLetterIsReportedAndLoopContinues() throws IOException {
        String output = run("É AND A\nA\nquit\n", null);

        assertTrue(output.contains("Error: Unknown token: É at position 0"));
        assertTrue(output.contains("A,Output\n0,0\n1,1\n"));
        assertTrue(output.contains("Goodbye!"));
    }

    @Test
    public void testDeepNestingIsReportedAndLoopContinues() throws IOException {
        String nested = "(".repeat(ExpressionParser.MAX_DEPTH + 1) + "A" + ")".repeat(ExpressionParser.MAX_DEPTH + 1);

        String output = run(nested + "\n" + "NOT ".repeat(10_000) + "A\nquit\n", null);

        assertEquals(2, output.split("Error: Expression nested too deeply", -1).length - 1);
        assertTrue(output.contains("Goodbye!"));
    }

    @Test
    public void testFailureWhileWritingDoesNotEndTheLoop() throws IOException {
        CsvExporter csv = new CsvExporter();
        TableWriter failing = (expression, variables, rows, out) -> {
            if (variables.contains("Z")) {
                throw new IllegalStateException("Table for Z failed");
            }
            csv.write(expression, variables, rows, out);
        };

        String output = run("Z OR A\nB\nquit\n", failing, null);

        assertTrue(output.contains("Error: Table for Z failed"));
        assertTrue(output.contains("B,Output\n0,0\n1,1\n"));
        assertTrue(output.contains("Goodbye!"));
    }
}
