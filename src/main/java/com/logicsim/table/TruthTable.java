package com.logicsim.table;

import com.logicsim.expr.ExpressionNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;

/**
 * All rows for an expression, in binary counting order over {@link #variables()}.
 */
public record TruthTable(ExpressionNode expression,
                         ImmutableSortedSet<String> variables,
                         ImmutableList<TruthTableRow> rows) {

    public enum Status {
        OK,
        NO_VARIABLES
    }

    public Status status() {
        return variables.isEmpty() ? Status.NO_VARIABLES : Status.OK;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return how many rows evaluate to true
     */
    public int trueCount() {
        return rows.count(TruthTableRow::output);
    }
}
