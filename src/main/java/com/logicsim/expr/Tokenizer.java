package com.logicsim.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits an expression into {@link Token}s in a single left-to-right pass.
 * <p>
 * Operator keywords match case-insensitively, longest first, and only on word
 * boundaries. A variable is one letter {@code A} to {@code Z} not followed by a letter
 * or digit; other uppercase letters, such as {@code É}, are not variables.
 * A run of letters and digits that is neither becomes a single unknown token, any
 * other stray character an unknown token of its own. The tokenizer never fails;
 * rejecting unknown tokens is up to the parser.
 * </p>
 */
public class Tokenizer {

    public ImmutableList<Token> tokenize(String expression) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int length = expression.length();
        int i = 0;

        while (i < length) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            Gate gate = matchOperator(expression, i);
            if (gate != null) {
                tokens.add(Token.operator(gate, i));
                i += gate.keyword().length();
                continue;
            }

            if (c == '(') {
                tokens.add(Token.leftParen(i));
                i++;
                continue;
            }
            if (c == ')') {
                tokens.add(Token.rightParen(i));
                i++;
                continue;
            }

            if (isVariableLetter(c) && !isWordChar(expression, i + 1)) {
                tokens.add(Token.variable(c, i));
                i++;
                continue;
            }

            if (Character.isLetterOrDigit(c)) {
                int end = i;
                while (isWordChar(expression, end)) {
                    end++;
                }
                tokens.add(Token.unknown(expression.substring(i, end), i));
                i = end;
                continue;
            }

            tokens.add(Token.unknown(String.valueOf(c), i));
            i++;
        }

        return tokens.toImmutable();
    }

    private static Gate matchOperator(String expression, int start) {
        if (isWordChar(expression, start - 1)) {
            return null;
        }
        for (Gate gate : Gate.MATCH_ORDER) {
            String keyword = gate.keyword();
            if (matchesKeyword(expression, start, keyword) && !isWordChar(expression, start + keyword.length())) {
                return gate;
            }
        }
        return null;
    }

    static boolean isVariableLetter(char c) {
        return c >= 'A' && c <= 'Z';
    }

    // ASCII-only case folding
    private static boolean matchesKeyword(String expression, int start, String keyword) {
        if (start + keyword.length() > expression.length()) {
            return false;
        }
        for (int k = 0; k < keyword.length(); k++) {
            if (toUpperAscii(expression.charAt(start + k)) != keyword.charAt(k)) {
                return false;
            }
        }
        return true;
    }

    static char toUpperAscii(char c) {
        return c >= 'a' && c <= 'z' ? (char) (c - ('a' - 'A')) : c;
    }

    private static boolean isWordChar(String expression, int index) {
        return index >= 0 && index < expression.length() && Character.isLetterOrDigit(expression.charAt(index));
    }
}
