package com.logicsim.shell;

import com.logicsim.expr.ExpressionNode;
import com.logicsim.expr.ExpressionParser;
import com.logicsim.expr.ExpressionSyntaxException;
import com.logicsim.output.TableWriter;
import com.logicsim.store.LastExpressionStore;
import com.logicsim.table.TruthTableGenerator;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.tinylog.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Line-oriented loop: read an expression, print its truth table, repeat until
 * {@code quit} or end of input. Bad expressions are reported and the loop goes on.
 */
public class InteractiveShell {
    static final String PROMPT = "Enter expression: ";
    static final String QUIT = "quit";

    private final ExpressionParser parser;
    private final TruthTableGenerator generator;
    private final TableWriter writer;
    private final LastExpressionStore store;

    /**
     * @param store where accepted expressions are remembered, {@code null} to remember nothing
     */
    public InteractiveShell(ExpressionParser parser, TruthTableGenerator generator, TableWriter writer,
                            LastExpressionStore store) {
        this.parser = parser;
        this.generator = generator;
        this.writer = writer;
        this.store = store;
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        printBanner(out);

        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }

            String expression = line.strip();
            if (expression.toLowerCase(Locale.ROOT).equals(QUIT)) {
                out.println("Goodbye!");
                break;
            }
            if (expression.isEmpty()) {
                out.println("Please enter a valid expression.");
                continue;
            }

            try {
                process(expression, out);
            } catch (RuntimeException e) {
                Logger.debug(e, "Could not evaluate {}", expression);
                out.println("Error: " + e.getMessage());
                out.println();
            }
        }
        out.flush();
    }

    /**
     * @return whether a table was printed
     */
    boolean process(String expression, PrintWriter out) throws IOException {
        ExpressionNode tree;
        try {
            tree = parser.parse(expression);
        } catch (ExpressionSyntaxException e) {
            Logger.debug("Rejected {} ({})", expression, e.kind());
            out.println("Error: " + e.getMessage());
            out.println();
            return false;
        }

        ImmutableSortedSet<String> variables = tree.variables();
        if (variables.isEmpty()) {
            out.println("No variables detected in expression");
            out.println();
            return false;
        }

        out.println();
        out.println("Truth Table:");
        out.println("-".repeat(60));
        writer.write(expression, variables, generator.stream(tree, variables), out);
        out.println();
        remember(expression);
        return true;
    }

    private void remember(String expression) {
        if (store == null) {
            return;
        }
        try {
            store.save(expression);
        } catch (IOException e) {
            Logger.warn(e, "Could not save the last expression");
        }
    }

    private static void printBanner(PrintWriter out) {
        out.println("=".repeat(60));
        out.println("Digital Logic Simulator");
        out.println("=".repeat(60));
        out.println();
        out.println("Enter a Boolean expression using:");
        out.println("  - Variables: Single uppercase letters (A, B, C, ...)");
        out.println("  - Gates: AND, OR, NOT, NAND, NOR, XOR");
        out.println("  - Example: " + LastExpressionStore.DEFAULT_EXPRESSION);
        out.println();
        out.println("Type '" + QUIT + "' to exit.");
        out.println();
    }
}
