package com.logicsim.expr;

/**
 * Thrown when an expression cannot be turned into an expression tree.
 * <p>
 * The {@link Kind} tells callers what went wrong without parsing the message;
 * {@link #offendingText()} and {@link #position()} point at the culprit where one exists.
 * </p>
 */
public class ExpressionSyntaxException extends RuntimeException {

    public enum Kind {
        EMPTY_EXPRESSION,
        MISMATCHED_PARENTHESES,
        UNKNOWN_TOKEN,
        MISSING_OPERAND,
        TOO_DEEPLY_NESTED
    }

    private final Kind kind;
    private final String offendingText;
    private final int position;

    public ExpressionSyntaxException(Kind kind, String message, String offendingText, int position) {
        super(message);
        this.kind = kind;
        this.offendingText = offendingText;
        this.position = position;
    }

    public static ExpressionSyntaxException emptyExpression() {
        return new ExpressionSyntaxException(Kind.EMPTY_EXPRESSION,
                "Expression cannot be null or empty", null, -1);
    }

    public static ExpressionSyntaxException mismatchedParentheses(char paren, int position) {
        return new ExpressionSyntaxException(Kind.MISMATCHED_PARENTHESES,
                "Mismatched parentheses: unmatched '" + paren + "' at position " + position,
                String.valueOf(paren), position);
    }

    public static ExpressionSyntaxException unknownToken(String text, int position) {
        return new ExpressionSyntaxException(Kind.UNKNOWN_TOKEN,
                "Unknown token: " + text + " at position " + position, text, position);
    }

    public static ExpressionSyntaxException missingOperand(String after, int position) {
        String message = after == null
                ? "Missing operand at position " + position
                : "Missing operand after '" + after + "' at position " + position;
        return new ExpressionSyntaxException(Kind.MISSING_OPERAND, message, after, position);
    }

    public static ExpressionSyntaxException nestedTooDeep(String opening, int position, int maxDepth) {
        return new ExpressionSyntaxException(Kind.TOO_DEEPLY_NESTED,
                "Expression nested too deeply at '" + opening + "' at position " + position + " (max: " + maxDepth + ")",
                opening, position);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the text that caused the failure, or {@code null} when there is none
     */
    public String offendingText() {
        return offendingText;
    }

    /**
     * @return zero-based offset into the expression, or -1 when not applicable
     */
    public int position() {
        return position;
    }
}
