package com.logicsim.expr;

/**
 * The gate operators an expression may use.
 * <p>
 * Tiers run from loosest to tightest binding: {@code OR, NOR, XOR} split first,
 * then {@code AND, NAND}, and {@code NOT} is the unary prefix that binds tightest.
 * <p>
 * Each gate is a two-input truth table. Bit {@code 2a + b} of the mask is the output
 * for inputs {@code a, b}; {@code NOT} negates its first input and ignores the second.
 */
public enum Gate {
    AND(2, 0b1000),
    OR(1, 0b1110),
    NOT(3, 0b0011),
    NAND(2, 0b0111),
    NOR(1, 0b0001),
    XOR(1, 0b0110);

    // Longest keyword first so NAND/NOR are tried before AND/NOT/OR.
    static final Gate[] MATCH_ORDER = {NAND, NOR, AND, OR, NOT, XOR};

    private final int tier;
    private final int truthTable;

    Gate(int tier, int truthTable) {
        this.tier = tier;
        this.truthTable = truthTable;
    }

    public boolean apply(boolean a, boolean b) {
        int bit = (a ? 2 : 0) + (b ? 1 : 0);
        return (truthTable >> bit & 1) == 1;
    }

    public int tier() {
        return tier;
    }

    public boolean isUnary() {
        return this == NOT;
    }

    public String keyword() {
        return name();
    }
}
