package com.logicsim.expr;

import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.factory.SortedSets;

import java.util.Objects;

/**
 * Immutable expression tree produced by {@link ExpressionParser}.
 * Every node owns its children; trees are never shared or cyclic.
 */
public sealed interface ExpressionNode {

    record Var(String name) implements ExpressionNode {
        public Var {
            Objects.requireNonNull(name, "name");
            if (name.length() != 1 || !Tokenizer.isVariableLetter(name.charAt(0))) {
                throw new IllegalArgumentException("Variable must be a single letter A-Z: " + name);
            }
        }
    }

    record Not(ExpressionNode operand) implements ExpressionNode {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Binary(Gate gate, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public Binary {
            Objects.requireNonNull(gate, "gate");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            if (gate.isUnary()) {
                throw new IllegalArgumentException("Binary node needs a binary gate, got " + gate);
            }
        }
    }

    /**
     * @return the names of all variables in this tree, sorted and without duplicates
     */
    default ImmutableSortedSet<String> variables() {
        MutableSortedSet<String> names = SortedSets.mutable.empty();
        collectVariables(this, names);
        return names.toImmutable();
    }

    private static void collectVariables(ExpressionNode node, MutableSortedSet<String> names) {
        if (node instanceof Var v) {
            names.add(v.name());
        } else if (node instanceof Not n) {
            collectVariables(n.operand(), names);
        } else if (node instanceof Binary b) {
            collectVariables(b.left(), names);
            collectVariables(b.right(), names);
        }
    }
}
