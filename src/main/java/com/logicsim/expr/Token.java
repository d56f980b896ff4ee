package com.logicsim.expr;

/**
 * A lexical unit of an expression.
 *
 * @param type     token type
 * @param text     text as it should be reported (operators in canonical uppercase)
 * @param gate     operator kind, only set for {@link Type#OPERATOR}
 * @param position offset of the first character in the input
 */
public record Token(Type type, String text, Gate gate, int position) {

    public enum Type {
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        VARIABLE,
        UNKNOWN
    }

    public static Token operator(Gate gate, int position) {
        return new Token(Type.OPERATOR, gate.keyword(), gate, position);
    }

    public static Token leftParen(int position) {
        return new Token(Type.LEFT_PAREN, "(", null, position);
    }

    public static Token rightParen(int position) {
        return new Token(Type.RIGHT_PAREN, ")", null, position);
    }

    public static Token variable(char name, int position) {
        return new Token(Type.VARIABLE, String.valueOf(name), null, position);
    }

    public static Token unknown(String text, int position) {
        return new Token(Type.UNKNOWN, text, null, position);
    }

    public boolean isOperator(Gate candidate) {
        return type == Type.OPERATOR && gate == candidate;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
