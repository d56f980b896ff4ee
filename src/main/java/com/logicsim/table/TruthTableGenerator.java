package com.logicsim.table;

import com.logicsim.expr.Assignment;
import com.logicsim.expr.Evaluator;
import com.logicsim.expr.ExpressionNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.primitive.MutableObjectBooleanMap;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.impl.collector.Collectors2;
import org.eclipse.collections.impl.factory.primitive.BooleanLists;
import org.eclipse.collections.impl.factory.primitive.ObjectBooleanMaps;
import org.tinylog.Logger;

import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Enumerates every assignment of a variable set and evaluates an expression for each.
 * <p>
 * Row {@code k} gives the {@code i}-th variable (in sorted order) the value of bit
 * {@code n-1-i} of {@code k}, so the first variable is the most significant bit and
 * false comes before true in every column.
 * </p>
 */
public class TruthTableGenerator {
    static final int MAX_VARIABLES = 30;

    private final Evaluator evaluator;

    public TruthTableGenerator() {
        this(new Evaluator());
    }

    public TruthTableGenerator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    public TruthTable generate(ExpressionNode expression) {
        return generate(expression, expression.variables());
    }

    public TruthTable generate(ExpressionNode expression, ImmutableSortedSet<String> variables) {
        ImmutableList<TruthTableRow> rows = stream(expression, variables).collect(Collectors2.toImmutableList());
        return new TruthTable(expression, variables, rows);
    }

    /**
     * Lazily produces the {@code 2^n} rows; empty when there are no variables.
     *
     * @throws IllegalArgumentException if there are more than {@value #MAX_VARIABLES} variables
     */
    public Stream<TruthTableRow> stream(ExpressionNode expression, ImmutableSortedSet<String> variables) {
        int n = variables.size();
        if (n > MAX_VARIABLES) {
            throw new IllegalArgumentException(
                    "Too many variables for a truth table (" + n + ", max: " + MAX_VARIABLES + ")");
        }
        if (n == 0) {
            Logger.debug("No variables in {}, truth table is empty", expression);
            return Stream.empty();
        }

        ImmutableList<String> columns = variables.toList().toImmutable();
        Logger.debug("Enumerating {} rows over {}", 1 << n, columns);
        return IntStream.range(0, 1 << n).mapToObj(index -> row(expression, columns, assignmentFor(columns, index)));
    }

    public static Assignment assignmentFor(ImmutableList<String> columns, int index) {
        int n = columns.size();
        MutableObjectBooleanMap<String> values = ObjectBooleanMaps.mutable.empty();
        for (int i = 0; i < n; i++) {
            values.put(columns.get(i), ((index >> (n - 1 - i)) & 1) == 1);
        }
        return new Assignment(values.toImmutable());
    }

    /**
     * Builds the row a single assignment would occupy in the table over {@code columns}.
     *
     * @throws com.logicsim.expr.UndefinedVariableException if the assignment misses a column
     */
    public TruthTableRow row(ExpressionNode expression, ImmutableList<String> columns, Assignment assignment) {
        int n = columns.size();
        boolean[] inputs = new boolean[n];
        int index = 0;
        for (int i = 0; i < n; i++) {
            inputs[i] = assignment.valueOf(columns.get(i));
            if (inputs[i]) {
                index |= 1 << (n - 1 - i);
            }
        }
        boolean output = evaluator.evaluate(expression, assignment);
        Logger.trace("Row {}: {} -> {}", index, assignment, output);
        return new TruthTableRow(index, BooleanLists.immutable.with(inputs), assignment, output);
    }
}
