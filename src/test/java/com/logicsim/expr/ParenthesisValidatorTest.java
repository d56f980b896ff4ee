package com.logicsim.expr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ParenthesisValidatorTest {
    private final ParenthesisValidator validator = new ParenthesisValidator();

    @ParameterizedTest
    @ValueSource(strings = {"A", "(A)", "((A AND B) OR (C))", "(A) AND (B)", "no parentheses at all"})
    public void testBalancedExpressionsPass(String expression) {
        assertDoesNotThrow(() -> validator.validate(expression));
    }

    @ParameterizedTest
    @CsvSource({
        "'A AND (B', (, 6",
        "'(A AND (B)', (, 0",
        "'A AND B)', ), 7",
        "')A(', ), 0"
    })
    public void testUnbalancedExpressionsReportTheCulprit(String expression, char paren, int position) {
        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                () -> validator.validate(expression));

        assertEquals(ExpressionSyntaxException.Kind.MISMATCHED_PARENTHESES, e.kind());
        assertEquals(String.valueOf(paren), e.offendingText());
        assertEquals(position, e.position());
    }

    @Test
    public void testMessageMentionsMismatchedParentheses() {
        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                () -> validator.validate("(A"));

        assertEquals("Mismatched parentheses: unmatched '(' at position 0", e.getMessage());
    }
}
