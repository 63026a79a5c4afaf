package io.cscan.detectors;

import io.cscan.detectors.LoopBody.Modification;
import io.cscan.detectors.LoopTerminationAnalyzer.Verdict;
import io.cscan.model.ErrorType;
import io.cscan.model.LoopDescriptor;
import io.cscan.model.LoopDescriptor.RelationalOperator;
import io.cscan.model.LoopDescriptor.StepOperator;
import io.cscan.model.TypeRange;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Assignment;
import io.cscan.patterns.CPatterns.Declaration;
import io.cscan.patterns.CPatterns.Declarator;
import io.cscan.patterns.CPatterns.TargetKind;
import io.cscan.patterns.NumericTypes;
import io.cscan.source.Clause;
import io.cscan.source.Clause.Kind;
import io.cscan.source.Clause.LoopKind;
import io.cscan.source.SourceText;
import io.cscan.state.AnalysisContext;
import io.cscan.state.AnalysisContext.PendingDo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects numeric and control-flow problems:
 * integer literals that do not fit a narrow variable, loops that can never exit,
 * and floating-point loop counters.
 *
 * Loops are reduced to {@code var = init; var OP bound; var STEP delta} and handed to
 * {@link LoopTerminationAnalyzer}. Loops that do not reduce are left alone, except that a
 * loop variable whose only update is {@code var = var} never changes.
 */
public class NumericControlFlowDetector implements Detector {

    private static final Pattern CONDITION = Pattern.compile("^(.+?)\\s*(<=|>=|==|!=|<|>)\\s*(.+)$");

    private static final Pattern STEP_VALUE = Pattern.compile("^([A-Za-z_]\\w*)\\s*([-+*/])\\s*(.+)$");

    private static final Map<String, StepOperator> COMPOUND_STEPS = Map.of(
            "+=", StepOperator.ADD,
            "-=", StepOperator.SUB,
            "*=", StepOperator.MUL,
            "/=", StepOperator.DIV);

    @Override
    public String id() {
        return "numeric-control-flow";
    }

    @Override
    public ErrorType.Module module() {
        return ErrorType.Module.NUMERIC_CONTROL_FLOW;
    }

    @Override
    public String description() {
        return "Detects narrowing overflow, infinite loops and floating-point loop counters";
    }

    @Override
    public void inspect(AnalysisContext ctx, Clause clause) {
        if (clause.kind() == Kind.STATEMENT) {
            checkOverflow(ctx, clause);
        } else if (clause.kind() == Kind.LOOP) {
            checkLoop(ctx, clause);
        }
    }

    // ---------------------------------------------------------------- type overflow

    private void checkOverflow(AnalysisContext ctx, Clause clause) {
        Optional<Declaration> decl = CPatterns.parseDeclaration(clause.text(), ctx.typedefNames());
        if (decl.isPresent()) {
            if (decl.get().isTypedef()) {
                return;
            }
            for (Declarator d : decl.get().declarators()) {
                if (d.hasInitializer() && d.pointerDepth() == 0 && !d.array()) {
                    checkLiteralFits(ctx, d.name(), decl.get().baseType(), d.initializer());
                }
            }
            return;
        }
        Optional<Assignment> assignment = CPatterns.parseAssignment(clause.text());
        if (assignment.isEmpty() || !assignment.get().isPlain()) {
            return;
        }
        Assignment a = assignment.get();
        CPatterns.classifyTarget(a.target())
                .filter(t -> t.kind() == TargetKind.PLAIN)
                .flatMap(t -> ctx.lookup(t.base(), clause))
                .filter(s -> !s.isPointer() && !s.isArray())
                .ifPresent(s -> checkLiteralFits(ctx, s.name(), s.baseType(), a.value()));
    }

    private void checkLiteralFits(AnalysisContext ctx, String name, String baseType, String value) {
        Optional<TypeRange> range = NumericTypes.rangeOf(baseType);
        if (range.isEmpty()) {
            return;
        }
        OptionalLong literal = CPatterns.parseIntegerLiteral(value);
        if (literal.isEmpty() || range.get().contains(literal.getAsLong())) {
            return;
        }
        TypeRange r = range.get();
        ctx.report(name, ErrorType.TYPE_OVERFLOW,
                String.format("Value %d does not fit in '%s' of type %s (range %d to %d)",
                        literal.getAsLong(), name, r.typeName(), r.min(), r.max()),
                String.format("Use a wider type such as int for '%s', or keep the value within %d to %d",
                        name, r.min(), r.max()));
    }

    // ---------------------------------------------------------------- loops

    private void checkLoop(AnalysisContext ctx, Clause clause) {
        String header = clause.header();
        if (header == null) {
            return;
        }
        String init = "";
        String condition;
        String step = "";
        if (clause.loopKind() == LoopKind.FOR) {
            List<String> parts = SourceText.splitTopLevel(header, ';');
            if (parts.size() != 3) {
                return;
            }
            init = parts.get(0).trim();
            condition = parts.get(1).trim();
            step = parts.get(2).trim();
        } else {
            condition = header.trim();
        }

        Optional<LoopBody> found = LoopBody.of(ctx, clause);
        if (found.isEmpty()) {
            return;
        }
        LoopBody body = found.get();

        if (condition.isEmpty() || LoopTerminationAnalyzer.isConstantTrue(condition)) {
            if (!body.hasExit()) {
                reportInfinite(ctx, clause, "the condition is always true and the body has no break or return",
                        "Add a break or return that runs when the work is done, or use a real loop condition");
            }
            return;
        }

        Matcher m = CONDITION.matcher(condition);
        if (!m.matches()) {
            return;
        }
        String left = m.group(1).trim();
        String right = m.group(3).trim();
        Optional<RelationalOperator> op = RelationalOperator.fromSymbol(m.group(2));
        if (op.isEmpty()) {
            return;
        }
        String variable;
        String boundText;
        RelationalOperator relation;
        if (CPatterns.isPlainIdentifier(left) && !ctx.macroConstants().containsKey(left)) {
            variable = left;
            boundText = right;
            relation = op.get();
        } else if (CPatterns.isPlainIdentifier(right)) {
            variable = right;
            boundText = left;
            relation = op.get().mirrored();
        } else {
            return;
        }

        LoopContext loop = new LoopContext(ctx, clause, variable, init);
        if (clause.loopKind() == LoopKind.FOR && loop.isFloating()) {
            checkFloatLoop(ctx, clause, variable, relation, step);
            return;
        }
        if (loop.baseType == null || loop.pointer || body.hasExit()) {
            return;
        }

        boolean selfAssigned = isOnlySelfAssigned(loop, step, body);
        String selfAssignedReason = String.format(
                "'%s' is only assigned to itself, so '%s' never changes once the loop starts", variable, condition);
        String suggestion = String.format(
                "Check the condition and the update of '%s' so the loop can reach its exit", variable);
        Optional<LoopDescriptor> descriptor = describe(loop, relation, boundText, step, body);
        if (descriptor.isEmpty()) {
            boolean stableBound = loop.constant(boundText).isPresent()
                    && (!CPatterns.isPlainIdentifier(boundText) || body.modificationsOf(boundText.trim()).isEmpty());
            if (selfAssigned && stableBound && loop.neverWrittenElsewhere()) {
                reportInfinite(ctx, clause, selfAssignedReason, suggestion);
            }
            return;
        }
        LoopTerminationAnalyzer analyzer = new LoopTerminationAnalyzer(ctx.config().iterationCeiling());
        Verdict verdict = analyzer.evaluate(descriptor.get(), clause.loopKind() == LoopKind.DO_WHILE);
        if (verdict.isInfinite()) {
            reportInfinite(ctx, clause, selfAssigned ? selfAssignedReason : verdict.reason(), suggestion);
        }
    }

    /**
     * True when the loop's single write to its variable is {@code var = var}.
     */
    private static boolean isOnlySelfAssigned(LoopContext loop, String stepText, LoopBody body) {
        if (!body.closed()) {
            return false;
        }
        List<Modification> writes = new ArrayList<>(
                LoopBody.modificationsOf(loop.variable, SourceText.maskLiterals(stepText)));
        writes.addAll(body.modificationsOf(loop.variable));
        return writes.size() == 1 && isSelfAssignment(loop, writes.get(0));
    }

    private static boolean isSelfAssignment(LoopContext loop, Modification write) {
        return write.operator().equals("=")
                && CPatterns.stripCastsAndParens(write.operand()).equals(loop.variable);
    }

    private Optional<LoopDescriptor> describe(LoopContext loop, RelationalOperator relation, String boundText,
                                              String stepText, LoopBody body) {
        if (!body.closed()) {
            return Optional.empty();
        }
        Optional<Long> bound = loop.constant(boundText);
        if (bound.isEmpty()) {
            return Optional.empty();
        }
        if (CPatterns.isPlainIdentifier(boundText) && !body.modificationsOf(boundText.trim()).isEmpty()) {
            return Optional.empty();
        }
        Optional<Long> initial = loop.initialValue();
        if (initial.isEmpty()) {
            return Optional.empty();
        }

        String masked = SourceText.maskLiterals(stepText);
        List<Modification> stepWrites = LoopBody.modificationsOf(loop.variable, masked);
        List<Modification> bodyWrites = body.modificationsOf(loop.variable);
        Modification write;
        if (!stepWrites.isEmpty()) {
            if (stepWrites.size() != 1 || !bodyWrites.isEmpty()) {
                return Optional.empty();
            }
            write = stepWrites.get(0);
        } else if (bodyWrites.size() == 1) {
            write = bodyWrites.get(0);
        } else if (bodyWrites.isEmpty() && loop.neverWrittenElsewhere()) {
            write = new Modification("+=", "0");
        } else {
            return Optional.empty();
        }

        return toStep(loop, write).map(s -> new LoopDescriptor(
                loop.variable, initial.get(), relation, bound.get(), s.operator, s.delta,
                NumericTypes.rangeOf(loop.baseType).orElse(null)));
    }

    private record Step(StepOperator operator, long delta) {}

    private static Optional<Step> toStep(LoopContext loop, Modification write) {
        switch (write.operator()) {
            case "++" -> {
                return Optional.of(new Step(StepOperator.ADD, 1));
            }
            case "--" -> {
                return Optional.of(new Step(StepOperator.SUB, 1));
            }
            case "=" -> {
                if (isSelfAssignment(loop, write)) {
                    return Optional.of(new Step(StepOperator.ADD, 0));
                }
                Matcher m = STEP_VALUE.matcher(write.operand());
                if (!m.matches() || !m.group(1).equals(loop.variable)) {
                    return Optional.empty();
                }
                return StepOperator.fromSymbol(m.group(2))
                        .flatMap(op -> normalized(op, loop.constant(m.group(3))));
            }
            default -> {
                StepOperator op = COMPOUND_STEPS.get(write.operator());
                return op == null ? Optional.empty() : normalized(op, loop.constant(write.operand()));
            }
        }
    }

    /**
     * Makes the delta non-negative: {@code i += -1} becomes {@code i -= 1}.
     */
    private static Optional<Step> normalized(StepOperator op, Optional<Long> delta) {
        if (delta.isEmpty()) {
            return Optional.empty();
        }
        long d = delta.get();
        if (d >= 0) {
            return Optional.of(new Step(op, d));
        }
        if (d == Long.MIN_VALUE) {
            return Optional.empty();
        }
        return switch (op) {
            case ADD -> Optional.of(new Step(StepOperator.SUB, -d));
            case SUB -> Optional.of(new Step(StepOperator.ADD, -d));
            default -> Optional.empty();
        };
    }

    private void checkFloatLoop(AnalysisContext ctx, Clause clause, String variable,
                                RelationalOperator relation, String step) {
        boolean exactCompare = relation == RelationalOperator.EQ || relation == RelationalOperator.NE;
        boolean fractionalStep = false;
        for (Modification write : LoopBody.modificationsOf(variable, SourceText.maskLiterals(step))) {
            String operand = write.operand();
            Matcher m = STEP_VALUE.matcher(operand);
            if (m.matches()) {
                operand = m.group(3);
            }
            if (CPatterns.isFractionalLiteral(operand)) {
                fractionalStep = true;
            }
        }
        if (!exactCompare && !fractionalStep) {
            return;
        }
        String problem = exactCompare
                ? String.format("compared with '%s'", relation.symbol())
                : "stepped by a fractional value";
        ctx.report(variable, ErrorType.FLOAT_LOOP_PRECISION,
                String.format("Floating-point loop variable '%s' is %s; rounding error can change the "
                        + "number of iterations", variable, problem),
                "Use an integer counter and compute the floating-point value from it inside the loop");
    }

    private static void reportInfinite(AnalysisContext ctx, Clause clause, String reason, String suggestion) {
        ctx.report("loop@" + clause.column(), ErrorType.INFINITE_LOOP, "Infinite loop: " + reason, suggestion);
    }

    /**
     * What is known about the loop variable where the loop starts.
     */
    private static final class LoopContext {
        private final AnalysisContext ctx;
        private final Clause clause;
        private final String variable;
        private final String init;
        private final Map<String, Long> snapshot;
        private final VariableState binding;
        private String baseType;
        private boolean pointer;
        private String declaredInit;
        private boolean declaredInHeader;

        LoopContext(AnalysisContext ctx, Clause clause, String variable, String init) {
            this.ctx = ctx;
            this.clause = clause;
            this.variable = variable;
            this.init = init;
            this.snapshot = clause.loopKind() == LoopKind.DO_WHILE
                    ? ctx.closedDo().map(PendingDo::constants).orElse(Map.of())
                    : null;
            this.binding = ctx.lookup(variable, clause).orElse(null);
            if (binding != null) {
                baseType = binding.baseType();
                pointer = binding.isPointer() || binding.isArray();
            }
            if (!init.isEmpty()) {
                CPatterns.parseDeclaration(init, ctx.typedefNames()).ifPresent(decl -> {
                    for (Declarator d : decl.declarators()) {
                        if (d.name().equals(variable)) {
                            baseType = decl.baseType();
                            pointer = d.pointerDepth() > 0 || d.array();
                            declaredInit = d.hasInitializer() ? d.initializer() : null;
                            declaredInHeader = true;
                        }
                    }
                });
            }
        }

        boolean isFloating() {
            return baseType != null && !pointer && NumericTypes.isFloating(baseType);
        }

        /**
         * Integer value of a literal, macro or variable as of the loop's start.
         */
        Optional<Long> constant(String expression) {
            String e = CPatterns.stripCastsAndParens(expression);
            if (snapshot != null && CPatterns.isPlainIdentifier(e) && !ctx.macroConstants().containsKey(e)) {
                return Optional.ofNullable(snapshot.get(e));
            }
            return ctx.constantValue(e, clause);
        }

        Optional<Long> initialValue() {
            if (declaredInit != null) {
                return constant(declaredInit);
            }
            for (String part : SourceText.splitTopLevel(init, ',')) {
                Optional<Assignment> a = CPatterns.parseAssignment(part);
                if (a.isPresent() && a.get().isPlain() && a.get().target().trim().equals(variable)) {
                    return constant(a.get().value());
                }
            }
            return constant(variable);
        }

        /**
         * A local whose address was never taken can only change where the loop changes it.
         */
        boolean neverWrittenElsewhere() {
            if (declaredInHeader) {
                return true;
            }
            return binding != null
                    && binding.functionIndex() != 0
                    && !binding.isStatic()
                    && !binding.addressTaken();
        }
    }
}
