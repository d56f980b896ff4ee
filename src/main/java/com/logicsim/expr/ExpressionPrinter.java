package com.logicsim.expr;

/**
 * Renders a tree as infix text that {@link ExpressionParser} reads back into an equal tree.
 * Every binary node and every negated compound is wrapped in parentheses.
 */
public class ExpressionPrinter {

    public String print(ExpressionNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, sb);
        return sb.toString();
    }

    private void print(ExpressionNode node, StringBuilder sb) {
        if (node instanceof ExpressionNode.Var v) {
            sb.append(v.name());
        } else if (node instanceof ExpressionNode.Not n) {
            sb.append("NOT ");
            print(n.operand(), sb);
        } else if (node instanceof ExpressionNode.Binary b) {
            sb.append('(');
            print(b.left(), sb);
            sb.append(' ').append(b.gate().keyword()).append(' ');
            print(b.right(), sb);
            sb.append(')');
        }
    }
}
