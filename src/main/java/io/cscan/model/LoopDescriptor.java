package io.cscan.model;

import java.util.Optional;

/**
 * Integer loop reduced to {@code var = initial; var OP bound; var STEP= delta}.
 *
 * @param variable  loop variable name
 * @param initial   value before the first condition test
 * @param condition relational operator, with the variable on the left
 * @param bound     right-hand side of the condition
 * @param step      how the variable changes once per iteration
 * @param delta     step operand, always positive after normalization
 * @param range     value range of the variable's declared type, when narrow
 */
public record LoopDescriptor(
        String variable,
        long initial,
        RelationalOperator condition,
        long bound,
        StepOperator step,
        long delta,
        TypeRange range
) {

    public LoopDescriptor {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("variable cannot be null or blank");
        }
        if (condition == null || step == null) {
            throw new IllegalArgumentException("condition and step are required");
        }
    }

    public Optional<TypeRange> typeRange() {
        return Optional.ofNullable(range);
    }

    /**
     * Relational operators usable in a loop condition.
     */
    public enum RelationalOperator {
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        EQ("=="),
        NE("!=");

        private final String symbol;

        RelationalOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(long left, long right) {
            return switch (this) {
                case LT -> left < right;
                case LE -> left <= right;
                case GT -> left > right;
                case GE -> left >= right;
                case EQ -> left == right;
                case NE -> left != right;
            };
        }

        /**
         * Returns the operator that holds when the operands are swapped ({@code a < b} iff {@code b > a}).
         */
        public RelationalOperator mirrored() {
            return switch (this) {
                case LT -> GT;
                case LE -> GE;
                case GT -> LT;
                case GE -> LE;
                case EQ, NE -> this;
            };
        }

        public static Optional<RelationalOperator> fromSymbol(String symbol) {
            for (RelationalOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Arithmetic applied to the loop variable once per iteration.
     */
    public enum StepOperator {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/");

        private final String symbol;

        StepOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Applies the step with C integer semantics.
         *
         * @throws ArithmeticException on 64-bit overflow or division by zero
         */
        public long apply(long value, long delta) {
            return switch (this) {
                case ADD -> Math.addExact(value, delta);
                case SUB -> Math.subtractExact(value, delta);
                case MUL -> Math.multiplyExact(value, delta);
                case DIV -> value / delta;
            };
        }

        public boolean isAdditive() {
            return this == ADD || this == SUB;
        }

        public static Optional<StepOperator> fromSymbol(String symbol) {
            for (StepOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }
}
