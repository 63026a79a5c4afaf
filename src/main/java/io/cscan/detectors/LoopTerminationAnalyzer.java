package io.cscan.detectors;

import io.cscan.model.LoopDescriptor;
import io.cscan.model.LoopDescriptor.RelationalOperator;
import io.cscan.model.LoopDescriptor.StepOperator;
import io.cscan.model.TypeRange;
import io.cscan.patterns.CPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Decides whether an integer loop reduced to a {@link LoopDescriptor} can exit.
 * <p>
 * Additive steps are decided in closed form: a step moving away from the bound, a step that
 * never changes the variable, or a {@code !=}/{@code ==} target that the step jumps over.
 * Multiplicative steps are executed abstractly up to the iteration ceiling. Anything that
 * overflows or leaves the variable's type is inconclusive.
 */
public class LoopTerminationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LoopTerminationAnalyzer.class);

    private static final Set<String> TRUE_CONDITIONS = Set.of("1", "true", "!0", "!NULL", "1==1", "1!=0");

    public enum Outcome {
        TERMINATES,
        NON_TERMINATING,
        INCONCLUSIVE
    }

    /**
     * Result of analyzing one loop.
     *
     * @param outcome what was decided
     * @param reason  short explanation, used in the finding message
     */
    public record Verdict(Outcome outcome, String reason) {

        static Verdict terminates(String reason) {
            return new Verdict(Outcome.TERMINATES, reason);
        }

        static Verdict infinite(String reason) {
            return new Verdict(Outcome.NON_TERMINATING, reason);
        }

        static Verdict inconclusive(String reason) {
            return new Verdict(Outcome.INCONCLUSIVE, reason);
        }

        public boolean isInfinite() {
            return outcome == Outcome.NON_TERMINATING;
        }
    }

    private final int iterationCeiling;

    public LoopTerminationAnalyzer(int iterationCeiling) {
        if (iterationCeiling < 1) {
            throw new IllegalArgumentException("iterationCeiling must be positive");
        }
        this.iterationCeiling = iterationCeiling;
    }

    /**
     * Returns true for conditions that are always true: {@code 1}, {@code true}, {@code !0},
     * {@code 1==1}, any other non-zero integer literal, and so on.
     */
    public static boolean isConstantTrue(String condition) {
        String c = condition.replaceAll("\\s+", "");
        while (c.startsWith("(") && c.endsWith(")")) {
            c = c.substring(1, c.length() - 1);
        }
        if (TRUE_CONDITIONS.contains(c)) {
            return true;
        }
        OptionalLong literal = CPatterns.parseIntegerLiteral(c);
        return literal.isPresent() && literal.getAsLong() != 0;
    }

    /**
     * Decides whether the loop exits.
     *
     * @param loop          the reduced loop
     * @param testAfterBody true for do-while, where the body runs once before the first test
     */
    public Verdict evaluate(LoopDescriptor loop, boolean testAfterBody) {
        Verdict verdict = decide(loop, testAfterBody);
        log.debug("Loop over '{}' ({} {} {}, {} {}): {} - {}", loop.variable(), loop.initial(),
                loop.condition().symbol(), loop.bound(), loop.step().symbol(), loop.delta(),
                verdict.outcome(), verdict.reason());
        return verdict;
    }

    private Verdict decide(LoopDescriptor loop, boolean testAfterBody) {
        String var = loop.variable();
        RelationalOperator op = loop.condition();
        StepOperator step = loop.step();
        long delta = loop.delta();
        long bound = loop.bound();

        if (op == RelationalOperator.EQ && step.isAdditive() && delta != 0) {
            long distance;
            try {
                distance = Math.subtractExact(bound, loop.initial());
            } catch (ArithmeticException e) {
                return Verdict.inconclusive("distance to the bound overflows");
            }
            if (distance != 0 && distance % delta != 0) {
                return Verdict.infinite(String.format(
                        "'%s' starts at %d and moves by %d, so it never equals %d",
                        var, loop.initial(), delta, bound));
            }
        }

        long value = loop.initial();
        if (testAfterBody) {
            try {
                value = step.apply(value, delta);
            } catch (ArithmeticException e) {
                return Verdict.inconclusive("first step overflows");
            }
        }
        if (!op.test(value, bound)) {
            return Verdict.terminates("condition is false on the first test");
        }
        if (neverChanges(step, delta)) {
            return Verdict.infinite(String.format("'%s' never changes, so '%s %s %d' stays true",
                    var, var, op.symbol(), bound));
        }

        Optional<TypeRange> range = loop.typeRange();
        if (range.isPresent() && alwaysTrueWithin(range.get(), op, bound)) {
            TypeRange r = range.get();
            return Verdict.infinite(String.format(
                    "'%s' is %s (range %d to %d), so '%s %s %d' is always true",
                    var, r.typeName(), r.min(), r.max(), var, op.symbol(), bound));
        }

        if (step.isAdditive()) {
            return decideAdditive(var, op, step == StepOperator.ADD, delta, value, bound);
        }
        return simulate(loop, value);
    }

    private static boolean neverChanges(StepOperator step, long delta) {
        return step.isAdditive() ? delta == 0 : delta == 1;
    }

    private static boolean alwaysTrueWithin(TypeRange range, RelationalOperator op, long bound) {
        return switch (op) {
            case LT -> range.max() < bound;
            case LE -> range.max() <= bound;
            case GT -> range.min() > bound;
            case GE -> range.min() >= bound;
            case NE -> !range.contains(bound);
            case EQ -> false;
        };
    }

    private static Verdict decideAdditive(String var, RelationalOperator op, boolean increasing,
                                          long delta, long value, long bound) {
        String direction = increasing ? "increases" : "decreases";
        switch (op) {
            case LT, LE -> {
                return increasing
                        ? Verdict.terminates("counts up to the bound")
                        : Verdict.infinite(String.format("'%s' %s but the loop runs while '%s %s %d'",
                                var, direction, var, op.symbol(), bound));
            }
            case GT, GE -> {
                return !increasing
                        ? Verdict.terminates("counts down to the bound")
                        : Verdict.infinite(String.format("'%s' %s but the loop runs while '%s %s %d'",
                                var, direction, var, op.symbol(), bound));
            }
            case NE -> {
                long distance;
                try {
                    distance = Math.subtractExact(bound, value);
                } catch (ArithmeticException e) {
                    return Verdict.inconclusive("distance to the bound overflows");
                }
                boolean towards = increasing ? distance > 0 : distance < 0;
                if (towards && distance % delta == 0) {
                    return Verdict.terminates("reaches the bound exactly");
                }
                return Verdict.infinite(String.format("'%s' starts at %d and %s by %d, so it never equals %d",
                        var, value, direction, delta, bound));
            }
            default -> {
                return Verdict.terminates("any change makes the condition false");
            }
        }
    }

    private Verdict simulate(LoopDescriptor loop, long start) {
        long value = start;
        for (int i = 1; i <= iterationCeiling; i++) {
            long next;
            try {
                next = loop.step().apply(value, loop.delta());
            } catch (ArithmeticException e) {
                return Verdict.inconclusive("step arithmetic overflows");
            }
            if (next == value) {
                return Verdict.infinite(String.format("'%s' gets stuck at %d, so '%s %s %d' stays true",
                        loop.variable(), value, loop.variable(), loop.condition().symbol(), loop.bound()));
            }
            if (loop.typeRange().isPresent() && !loop.typeRange().get().contains(next)) {
                return Verdict.inconclusive("value leaves the variable's type");
            }
            value = next;
            if (!loop.condition().test(value, loop.bound())) {
                return Verdict.terminates("exits after " + i + " iterations");
            }
        }
        return Verdict.infinite(String.format("condition '%s %s %d' is still true after %d iterations",
                loop.variable(), loop.condition().symbol(), loop.bound(), iterationCeiling));
    }
}
