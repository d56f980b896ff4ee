package com.logicsim.expr;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Checks that every parenthesis in a raw expression string has a partner.
 */
public class ParenthesisValidator {

    /**
     * @throws ExpressionSyntaxException of kind {@code MISMATCHED_PARENTHESES} pointing at
     *         the first unmatched ')' or, failing that, the first unmatched '('
     */
    public void validate(String expression) {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                open.push(i);
            } else if (c == ')') {
                if (open.isEmpty()) {
                    throw ExpressionSyntaxException.mismatchedParentheses(')', i);
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            throw ExpressionSyntaxException.mismatchedParentheses('(', open.peekLast());
        }
    }
}
