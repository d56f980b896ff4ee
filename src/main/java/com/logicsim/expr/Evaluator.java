package com.logicsim.expr;

/**
 * Computes the value of an expression tree for one assignment.
 * Pure and stateless; one instance can evaluate many trees from many threads.
 */
public class Evaluator {

    /**
     * @throws UndefinedVariableException if the tree names a variable the assignment lacks
     */
    public boolean evaluate(ExpressionNode node, Assignment assignment) {
        if (node instanceof ExpressionNode.Var v) {
            return assignment.valueOf(v.name());
        }
        if (node instanceof ExpressionNode.Not n) {
            return !evaluate(n.operand(), assignment);
        }
        if (node instanceof ExpressionNode.Binary b) {
            boolean left = evaluate(b.left(), assignment);
            boolean right = evaluate(b.right(), assignment);
            return b.gate().apply(left, right);
        }
        throw new IllegalArgumentException("Unsupported node: " + node);
    }
}
