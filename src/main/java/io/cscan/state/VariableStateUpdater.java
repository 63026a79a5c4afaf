package io.cscan.state;

import io.cscan.model.NullGuard;
import io.cscan.model.SymbolicValue;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Assignment;
import io.cscan.patterns.CPatterns.Call;
import io.cscan.patterns.CPatterns.Declaration;
import io.cscan.patterns.CPatterns.Declarator;
import io.cscan.patterns.CPatterns.IdentifierUse;
import io.cscan.patterns.CPatterns.Target;
import io.cscan.patterns.CPatterns.TargetKind;
import io.cscan.source.Clause;
import io.cscan.source.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a clause's effects to the variable store, after the detectors have inspected it.
 * <p>
 * Per clause: declarations, assignments (with pointer copies, allocations and NULL writes),
 * then calls ({@code free}, escapes into unknown functions), address-of uses, increments,
 * and non-null tests in conditions.
 */
public class VariableStateUpdater {

    private static final Logger log = LoggerFactory.getLogger(VariableStateUpdater.class);

    private static final Pattern NESTED_ASSIGNMENT = Pattern.compile("\\(\\s*[A-Za-z_]\\w*\\s*=(?!=)");

    public void apply(AnalysisContext ctx, Clause clause) {
        switch (clause.kind()) {
            case DIRECTIVE -> applyDirective(ctx, clause);
            case STATEMENT -> {
                if (!applyDeclaration(ctx, clause)) {
                    applyExpression(ctx, clause, clause.text(), null);
                }
            }
            case RETURN -> applyExpression(ctx, clause, clause.text().substring("return".length()), null);
            case CONDITION -> {
                applyExpression(ctx, clause, clause.text(), null);
                markNullGuards(ctx, clause);
            }
            default -> {
            }
        }
    }

    private void applyDirective(AnalysisContext ctx, Clause clause) {
        CPatterns.includedHeader(clause.text()).ifPresent(ctx.includedHeaders()::add);
        CPatterns.defineConstant(clause.text())
                .ifPresent(macro -> ctx.macroConstants().put(macro.name(), macro.value()));
    }

    // ---------------------------------------------------------------- declarations

    private boolean applyDeclaration(AnalysisContext ctx, Clause clause) {
        Optional<Declaration> parsed = CPatterns.parseDeclaration(clause.text(), ctx.typedefNames());
        if (parsed.isEmpty()) {
            if (clause.terminated()) {
                CPatterns.parseFunctionHeader(clause.text(), ctx.typedefNames())
                        .ifPresent(prototype -> ctx.userFunctions().add(prototype.name()));
            }
            return false;
        }
        Declaration decl = parsed.get();
        if (decl.isTypedef()) {
            for (Declarator d : decl.declarators()) {
                ctx.typedefNames().put(d.name(), decl.aggregate() && d.pointerDepth() == 0);
            }
            return true;
        }

        int depth = ctx.depthAt(clause);
        boolean fileScope = depth == 0;
        boolean staticStorage = decl.isStatic() || decl.isExtern();
        for (Declarator d : decl.declarators()) {
            SymbolicValue initial = SymbolicValue.UNKNOWN;
            if (!d.hasInitializer() && decl.isStatic() && !fileScope && d.pointerDepth() > 0) {
                initial = SymbolicValue.NULL;
            }
            VariableState state = VariableState.builder()
                    .name(d.name())
                    .baseType(decl.baseType())
                    .pointerDepth(d.pointerDepth())
                    .array(d.array())
                    .aggregate(decl.aggregate() && d.pointerDepth() == 0)
                    .isStatic(staticStorage)
                    .declLine(clause.lineNumber())
                    .scopeDepth(depth)
                    .functionIndex(ctx.currentFunction(clause.column()))
                    .initialized(d.hasInitializer() || staticStorage)
                    .symbolicValue(initial)
                    .build();
            ctx.store().declare(state);
            log.debug("Declared {}", state);
            if (d.hasInitializer()) {
                applyValue(ctx, clause, state, d.initializer());
                applySideEffects(ctx, clause, d.initializer(), d.name());
            }
        }
        return true;
    }

    // ---------------------------------------------------------------- expressions

    private void applyExpression(AnalysisContext ctx, Clause clause, String text, String outerTarget) {
        String assignedName = outerTarget;
        Optional<Assignment> assignment = CPatterns.parseAssignment(text);
        if (assignment.isPresent()) {
            Assignment a = assignment.get();
            String value = a.value();
            if (CPatterns.parseAssignment(value).isPresent()) {
                // a = b = value: the inner write happens first
                applyExpression(ctx, clause, value, null);
                value = CPatterns.parseAssignment(value).get().value();
            }
            Optional<Target> target = CPatterns.classifyTarget(a.target());
            if (target.isPresent()) {
                assignedName = target.get().base();
                applyAssignment(ctx, clause, a, target.get(), value);
            }
        } else {
            applyNestedAssignments(ctx, clause, text);
        }
        applySideEffects(ctx, clause, text, assignedName);
    }

    /**
     * Handles assignments wrapped in parentheses, as in {@code if ((fp = fopen(name, "r")) == NULL)}.
     */
    private void applyNestedAssignments(AnalysisContext ctx, Clause clause, String text) {
        String masked = SourceText.maskLiterals(text);
        Matcher m = NESTED_ASSIGNMENT.matcher(masked);
        while (m.find()) {
            int open = m.start();
            int close = SourceText.matchingParen(masked, open);
            if (close < 0) {
                return;
            }
            String inner = text.substring(open + 1, close);
            CPatterns.parseAssignment(inner).ifPresent(a -> CPatterns.classifyTarget(a.target())
                    .filter(t -> t.kind() == TargetKind.PLAIN)
                    .ifPresent(t -> applyAssignment(ctx, clause, a, t, a.value())));
        }
    }

    private void applyAssignment(AnalysisContext ctx, Clause clause, Assignment a, Target target, String value) {
        Optional<VariableState> binding = ctx.lookup(target.base(), clause);
        if (target.kind() != TargetKind.PLAIN) {
            markEscapedValue(ctx, clause, value);
            if (binding.isPresent() && target.kind() != TargetKind.DEREF) {
                VariableState base = binding.get();
                if (base.isArray() || base.isAggregate() || !base.isPointer()) {
                    base.setInitialized(true);
                }
            }
            return;
        }
        if (binding.isEmpty()) {
            return;
        }
        VariableState state = binding.get();
        if (a.isPlain()) {
            applyValue(ctx, clause, state, value);
            if (state.functionIndex() == 0 || state.isStatic()) {
                markEscapedValue(ctx, clause, value);
            }
            return;
        }
        Long folded = fold(state.constantValue(), a.operator(), ctx.constantValue(value, clause).orElse(null));
        if (folded != null && !state.isPointer()) {
            state.markConstant(clause.lineNumber(), folded);
        } else {
            state.clearConstant();
            state.setInitialized(true);
        }
    }

    /**
     * Applies {@code state = value} for a plain assignment or an initializer.
     */
    private void applyValue(AnalysisContext ctx, Clause clause, VariableState state, String value) {
        int line = clause.lineNumber();
        String v = CPatterns.stripCastsAndParens(value);
        if (CPatterns.isAllocation(value) || CPatterns.isAllocation(v)) {
            state.markAllocated(line);
            return;
        }
        if (state.isPointer() && CPatterns.isNullValue(v)) {
            state.markNull(line);
            return;
        }
        if (state.isPointer() && CPatterns.isPlainIdentifier(v)) {
            Optional<VariableState> source = ctx.lookup(v, clause);
            if (source.isPresent() && source.get().isPointer() && !source.get().isArray()) {
                state.copyFrom(source.get(), line);
                return;
            }
        }
        if (!state.isPointer()) {
            Optional<Long> constant = ctx.constantValue(v, clause);
            if (constant.isPresent()) {
                state.markConstant(line, constant.get());
                return;
            }
        }
        state.markAssigned(line, SymbolicValue.OTHER_EXPR);
    }

    private void applySideEffects(AnalysisContext ctx, Clause clause, String text, String assignedName) {
        int line = clause.lineNumber();
        for (Call call : CPatterns.calls(text)) {
            applyCall(ctx, clause, call, assignedName);
        }

        String masked = SourceText.maskSizeof(SourceText.maskLiterals(text));
        for (IdentifierUse use : CPatterns.identifiers(masked)) {
            if (!CPatterns.isAddressOf(masked, use.start())) {
                continue;
            }
            ctx.lookup(use.name(), clause).ifPresent(state -> {
                if (state.symbolicValue() == SymbolicValue.NULL || state.symbolicValue() == SymbolicValue.UNKNOWN) {
                    state.markAssigned(line, SymbolicValue.OTHER_EXPR);
                }
                state.markAddressTaken();
            });
        }

        for (String name : CPatterns.incremented(masked)) {
            ctx.lookup(name, clause).ifPresent(state -> {
                state.clearConstant();
                state.setInitialized(true);
            });
        }
    }

    private void applyCall(AnalysisContext ctx, Clause clause, Call call, String assignedName) {
        int line = clause.lineNumber();
        if (call.name().equals("free")) {
            if (call.arguments().isEmpty()) {
                return;
            }
            String arg = CPatterns.stripCastsAndParens(call.arguments().get(0));
            if (!CPatterns.isPlainIdentifier(arg)) {
                return;
            }
            ctx.lookup(arg, clause).filter(VariableState::isPointer).ifPresent(state -> {
                state.markFreed(line);
                if (state.aliasOf() != null) {
                    state.aliasOf().markFreed(line);
                }
                for (VariableState alias : ctx.store().aliasesOf(state)) {
                    alias.markFreed(line);
                }
            });
            return;
        }

        if (call.name().equals("realloc") && !call.arguments().isEmpty()) {
            String moved = CPatterns.stripCastsAndParens(call.arguments().get(0));
            if (CPatterns.isPlainIdentifier(moved) && !moved.equals(assignedName)) {
                ctx.lookup(moved, clause)
                        .filter(s -> s.symbolicValue() == SymbolicValue.ALLOCATED)
                        .ifPresent(s -> s.markAssigned(line, SymbolicValue.OTHER_EXPR));
            }
        }

        boolean library = ctx.config().isLibraryFunction(call.name());
        for (String argument : call.arguments()) {
            String arg = CPatterns.stripCastsAndParens(argument);
            if (!CPatterns.isPlainIdentifier(arg)) {
                continue;
            }
            ctx.lookup(arg, clause).ifPresent(state -> {
                if (state.isArray()) {
                    state.setInitialized(true);
                }
                if (!library && state.symbolicValue() == SymbolicValue.ALLOCATED) {
                    state.setEscaped(true);
                }
            });
        }
    }

    /**
     * An allocated pointer stored into a member, element or global outlives its variable.
     */
    private void markEscapedValue(AnalysisContext ctx, Clause clause, String value) {
        String v = CPatterns.stripCastsAndParens(value);
        if (!CPatterns.isPlainIdentifier(v)) {
            return;
        }
        ctx.lookup(v, clause)
                .filter(s -> s.symbolicValue() == SymbolicValue.ALLOCATED)
                .ifPresent(s -> s.setEscaped(true));
    }

    /**
     * A non-null test guards the branch it controls: the braced block or the single statement
     * after the header. {@code p == NULL} and {@code !p} guard nothing.
     */
    private void markNullGuards(AnalysisContext ctx, Clause clause) {
        for (String name : CPatterns.nonNullTested(clause.text())) {
            ctx.lookup(name, clause)
                    .filter(VariableState::isPointer)
                    .ifPresent(s -> s.setNullGuard(guardFor(ctx, clause)));
        }
    }

    private static NullGuard guardFor(AnalysisContext ctx, Clause clause) {
        int line = clause.lineNumber();
        int depth = ctx.depthAt(clause);
        List<String> lines = ctx.strippedLines();
        String masked = SourceText.maskLiterals(lines.get(line - 1));
        int close = headerEnd(masked, clause.column() + clause.text().length());
        if (close < 0) {
            return NullGuard.braced(depth, line + 1);
        }
        int body = SourceText.skipSpaces(masked, close + 1);
        if (body < masked.length()) {
            return masked.charAt(body) == '{' ? NullGuard.braced(depth, line) : NullGuard.unbraced(depth, line);
        }
        for (int next = line + 1; next <= lines.size(); next++) {
            String text = lines.get(next - 1).trim();
            if (!text.isEmpty()) {
                return text.startsWith("{") ? NullGuard.braced(depth, next) : NullGuard.unbraced(depth, next);
            }
        }
        return NullGuard.unbraced(depth, line);
    }

    // the ')' closing the control header that holds the condition
    private static int headerEnd(String masked, int from) {
        int depth = 0;
        for (int i = from; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private static Long fold(Long current, String operator, Long operand) {
        if (current == null || operand == null) {
            return null;
        }
        try {
            return switch (operator) {
                case "+=" -> Math.addExact(current, operand);
                case "-=" -> Math.subtractExact(current, operand);
                case "*=" -> Math.multiplyExact(current, operand);
                case "/=" -> operand == 0 ? null : current / operand;
                case "%=" -> operand == 0 ? null : current % operand;
                default -> null;
            };
        } catch (ArithmeticException e) {
            log.debug("Constant folding overflowed: {} {} {}", current, operator, operand);
            return null;
        }
    }
}
