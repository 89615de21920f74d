package com.complexity.analyzer.analysis;

/**
 * How a recursive call shrinks its input: divided by a constant, reduced by a constant, or unknown.
 */
public final class CallReduction {

    public enum Kind {
        DIVIDE, SUBTRACT, UNKNOWN
    }

    private static final CallReduction UNKNOWN = new CallReduction(Kind.UNKNOWN, 0);

    private final Kind kind;
    private final int amount;

    private CallReduction(Kind kind, int amount) {
        this.kind = kind;
        this.amount = amount;
    }

    public static CallReduction divide(int divisor) {
        return new CallReduction(Kind.DIVIDE, divisor);
    }

    public static CallReduction subtract(int decrement) {
        return new CallReduction(Kind.SUBTRACT, decrement);
    }

    public static CallReduction unknown() {
        return UNKNOWN;
    }

    public Kind getKind() {
        return kind;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        return kind == Kind.UNKNOWN ? "unknown" : kind.name().toLowerCase() + "(" + amount + ")";
    }
}
