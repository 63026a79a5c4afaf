package io.cscan.detectors;

import io.cscan.model.ErrorType;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Assignment;
import io.cscan.patterns.CPatterns.Call;
import io.cscan.patterns.CPatterns.IdentifierUse;
import io.cscan.patterns.CPatterns.Target;
import io.cscan.patterns.CPatterns.TargetKind;
import io.cscan.source.Clause;
import io.cscan.source.SourceText;
import io.cscan.state.AnalysisContext;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects reads of variables that were declared without an initializer and not
 * written since. File-scope variables are only checked where file-scope code reads them;
 * inside a function another function may have written them.
 *
 * Writes are plain assignments, {@code &x} (the callee may fill it in) and {@code scanf}
 * destinations. Dereferenced pointers are left to {@link MemorySafetyDetector}, which
 * reports them as wild pointers.
 */
public class UninitializedVariableDetector implements Detector {

    private static final Map<String, Integer> SCANF_FORMAT_INDEX = Map.of(
            "scanf", 0,
            "fscanf", 1,
            "sscanf", 1);

    @Override
    public String id() {
        return "uninitialized-variable";
    }

    @Override
    public ErrorType.Module module() {
        return ErrorType.Module.UNINITIALIZED_VARIABLE;
    }

    @Override
    public String description() {
        return "Detects variables read before they are assigned";
    }

    @Override
    public void inspect(AnalysisContext ctx, Clause clause) {
        if (!clause.isExpression()) {
            return;
        }
        for (String expression : MemorySafetyDetector.expressionsOf(ctx, clause)) {
            checkReads(ctx, clause, expression);
        }
    }

    private void checkReads(AnalysisContext ctx, Clause clause, String expression) {
        String masked = SourceText.maskSizeof(SourceText.maskLiterals(expression));
        Set<String> destinations = scanfDestinations(expression);
        String writtenBase = writtenAggregateBase(expression);
        boolean baseSkipped = false;

        for (IdentifierUse use : CPatterns.identifiers(masked)) {
            String name = use.name();
            if (CPatterns.KEYWORDS.contains(name) || destinations.contains(name)) {
                continue;
            }
            if (!baseSkipped && name.equals(writtenBase)) {
                baseSkipped = true;
                continue;
            }
            if (CPatterns.isMemberAccess(masked, use.start()) || CPatterns.isAddressOf(masked, use.start())) {
                continue;
            }
            char next = SourceText.nextNonSpace(masked, use.end());
            if (next == '(' || isWrite(masked, use)) {
                continue;
            }
            Optional<VariableState> binding = ctx.lookup(name, clause);
            if (binding.isEmpty() || !isTracked(binding.get()) || !ctx.declaredHere(binding.get(), clause)) {
                continue;
            }
            VariableState state = binding.get();
            if (state.isPointer() && !state.isArray() && CPatterns.isDereferenced(masked, use)) {
                continue;
            }
            if (state.isArray() && next != '[') {
                continue;
            }
            ctx.report(name, ErrorType.UNINITIALIZED_VARIABLE,
                    String.format("Variable '%s' is used before it is initialized", name),
                    String.format("Initialize '%s' when declaring it, e.g. '%s %s = 0;'",
                            name, state.baseType(), name));
        }
    }

    private static boolean isTracked(VariableState state) {
        return !state.initialized()
                && !state.isParameter()
                && !state.isAggregate()
                && !state.isStatic();
    }

    /**
     * An identifier directly followed by '=' (not '==') is the target of a plain assignment.
     */
    private static boolean isWrite(String masked, IdentifierUse use) {
        int at = SourceText.skipSpaces(masked, use.end());
        return at < masked.length() && masked.charAt(at) == '='
                && (at + 1 >= masked.length() || masked.charAt(at + 1) != '=');
    }

    /**
     * Base of an element or member write such as {@code a[i] = 0} or {@code s.x = 1}.
     */
    private static String writtenAggregateBase(String expression) {
        Optional<Assignment> assignment = CPatterns.parseAssignment(expression);
        if (assignment.isEmpty() || !assignment.get().isPlain()) {
            return null;
        }
        return CPatterns.classifyTarget(assignment.get().target())
                .filter(t -> t.kind() == TargetKind.ELEMENT || t.kind() == TargetKind.MEMBER)
                .map(Target::base)
                .orElse(null);
    }

    private static Set<String> scanfDestinations(String expression) {
        Set<String> names = new HashSet<>();
        for (Call call : CPatterns.calls(expression)) {
            Integer formatIndex = SCANF_FORMAT_INDEX.get(call.name());
            if (formatIndex == null) {
                continue;
            }
            for (int i = formatIndex + 1; i < call.arguments().size(); i++) {
                String arg = CPatterns.stripCastsAndParens(call.arguments().get(i));
                if (CPatterns.isPlainIdentifier(arg)) {
                    names.add(arg);
                }
            }
        }
        return names;
    }
}
