package com.logicsim.expr;

import org.eclipse.collections.api.list.ImmutableList;
import org.tinylog.Logger;

/**
 * Turns an infix Boolean expression into an {@link ExpressionNode} tree.
 * <p>
 * Precedence, loosest first: {@code OR NOR XOR}, then {@code AND NAND}, then the
 * unary {@code NOT}. Binary operators associate to the left, so a chain splits at
 * its rightmost operator of the loosest tier present, whichever operator of that
 * tier it is: {@code A OR B XOR C} is {@code (A OR B) XOR C}.
 * </p>
 * <p>
 * {@code NAND} and {@code NOR} are reduced on the way in: {@code A NAND B} becomes
 * {@code NOT (A AND B)} and {@code A NOR B} becomes {@code NOT (A OR B)}.
 * </p>
 * <p>
 * ASCII letters are upper-cased before tokenizing, so {@code a and b} names the
 * variables {@code A} and {@code B}; every other character is left as is, which keeps
 * positions aligned with the input. Parentheses and {@code NOT} may nest at most
 * {@value #MAX_DEPTH} levels deep. Instances hold no state and can be shared.
 * </p>
 */
public class ExpressionParser {
    public static final int MAX_DEPTH = 256;

    private static final int LOOSEST_TIER = Gate.OR.tier();
    private static final int TIGHTEST_BINARY_TIER = Gate.AND.tier();

    private final Tokenizer tokenizer;
    private final ParenthesisValidator validator;

    public ExpressionParser() {
        this(new Tokenizer(), new ParenthesisValidator());
    }

    public ExpressionParser(Tokenizer tokenizer, ParenthesisValidator validator) {
        this.tokenizer = tokenizer;
        this.validator = validator;
    }

    /**
     * @throws ExpressionSyntaxException if the expression is blank, has unbalanced parentheses,
     *         contains anything but operators, parentheses and single-letter variables, or lacks an operand
     */
    public ExpressionNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw ExpressionSyntaxException.emptyExpression();
        }

        validator.validate(expression);

        String normalized = upperCaseAscii(expression);
        ImmutableList<Token> tokens = tokenizer.tokenize(normalized);
        Logger.trace("Tokens for {} -> {}", expression, tokens);

        Token unknown = tokens.detect(token -> token.type() == Token.Type.UNKNOWN);
        if (unknown != null) {
            throw ExpressionSyntaxException.unknownToken(unknown.text(), unknown.position());
        }

        Cursor cursor = new Cursor(tokens, normalized.length());
        ExpressionNode tree = parseTier(cursor, LOOSEST_TIER);
        if (cursor.hasNext()) {
            Token residual = cursor.peek();
            throw ExpressionSyntaxException.unknownToken(residual.text(), residual.position());
        }

        Logger.debug("Parsed {} into {}", expression, tree);
        return tree;
    }

    private ExpressionNode parseTier(Cursor cursor, int tier) {
        if (tier > TIGHTEST_BINARY_TIER) {
            return parseUnary(cursor);
        }

        ExpressionNode left = parseTier(cursor, tier + 1);
        while (cursor.atBinaryOperatorOfTier(tier)) {
            Gate gate = cursor.next().gate();
            ExpressionNode right = parseTier(cursor, tier + 1);
            left = combine(gate, left, right);
        }
        return left;
    }

    private ExpressionNode parseUnary(Cursor cursor) {
        if (cursor.hasNext() && cursor.peek().isOperator(Gate.NOT)) {
            cursor.enter(cursor.next());
            ExpressionNode operand = parseUnary(cursor);
            cursor.leave();
            return new ExpressionNode.Not(operand);
        }
        return parsePrimary(cursor);
    }

    private ExpressionNode parsePrimary(Cursor cursor) {
        if (!cursor.hasNext()) {
            throw cursor.missingOperand();
        }

        Token token = cursor.peek();
        switch (token.type()) {
            case VARIABLE -> {
                cursor.next();
                return new ExpressionNode.Var(token.text());
            }
            case LEFT_PAREN -> {
                cursor.enter(cursor.next());
                ExpressionNode inner = parseTier(cursor, LOOSEST_TIER);
                cursor.leave();
                if (!cursor.hasNext()) {
                    throw ExpressionSyntaxException.mismatchedParentheses('(', token.position());
                }
                Token closing = cursor.next();
                if (closing.type() != Token.Type.RIGHT_PAREN) {
                    throw ExpressionSyntaxException.unknownToken(closing.text(), closing.position());
                }
                return inner;
            }
            default -> throw cursor.missingOperand();
        }
    }

    private static ExpressionNode combine(Gate gate, ExpressionNode left, ExpressionNode right) {
        return switch (gate) {
            case AND, OR, XOR -> new ExpressionNode.Binary(gate, left, right);
            case NAND -> new ExpressionNode.Not(new ExpressionNode.Binary(Gate.AND, left, right));
            case NOR -> new ExpressionNode.Not(new ExpressionNode.Binary(Gate.OR, left, right));
            case NOT -> throw new IllegalArgumentException("NOT is not a binary operator");
        };
    }

    private static String upperCaseAscii(String expression) {
        char[] chars = expression.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            chars[i] = Tokenizer.toUpperAscii(chars[i]);
        }
        return new String(chars);
    }

    /**
     * Read position over the token list of one {@link #parse} call.
     */
    private static final class Cursor {
        private final ImmutableList<Token> tokens;
        private final int inputLength;
        private int index;
        private int depth;

        Cursor(ImmutableList<Token> tokens, int inputLength) {
            this.tokens = tokens;
            this.inputLength = inputLength;
        }

        boolean hasNext() {
            return index < tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }

        boolean atBinaryOperatorOfTier(int tier) {
            if (!hasNext()) {
                return false;
            }
            Token token = peek();
            return token.type() == Token.Type.OPERATOR && !token.gate().isUnary() && token.gate().tier() == tier;
        }

        void enter(Token opening) {
            if (++depth > MAX_DEPTH) {
                throw ExpressionSyntaxException.nestedTooDeep(opening.text(), opening.position(), MAX_DEPTH);
            }
        }

        void leave() {
            depth--;
        }

        ExpressionSyntaxException missingOperand() {
            Token previous = index > 0 ? tokens.get(index - 1) : null;
            int position = hasNext() ? peek().position() : inputLength;
            return ExpressionSyntaxException.missingOperand(previous == null ? null : previous.text(), position);
        }
    }
}
