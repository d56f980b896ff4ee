package com.logicsim.expr;

/**
 * An assignment handed to the evaluator did not cover a variable of the expression.
 * This is a caller bug, the variable set and the assignment were derived from different trees.
 */
public class UndefinedVariableException extends IllegalStateException {

    private final String variable;

    public UndefinedVariableException(String variable) {
        super("Undefined variable: " + variable);
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
