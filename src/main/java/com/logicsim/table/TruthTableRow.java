package com.logicsim.table;

import com.logicsim.expr.Assignment;
import org.eclipse.collections.api.list.primitive.ImmutableBooleanList;

/**
 * One line of a truth table.
 *
 * @param index      position in the table, also the inputs read as a binary number
 * @param inputs     variable values in column order
 * @param assignment the same values keyed by variable name
 * @param output     value of the expression for this assignment
 */
public record TruthTableRow(int index, ImmutableBooleanList inputs, Assignment assignment, boolean output) {
}
