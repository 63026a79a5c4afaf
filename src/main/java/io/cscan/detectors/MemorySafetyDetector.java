package io.cscan.detectors;

import io.cscan.model.ErrorType;
import io.cscan.model.SymbolicValue;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Call;
import io.cscan.patterns.CPatterns.Declaration;
import io.cscan.patterns.CPatterns.Declarator;
import io.cscan.patterns.CPatterns.Dereference;
import io.cscan.source.Clause;
import io.cscan.source.Clause.Kind;
import io.cscan.source.SourceText;
import io.cscan.state.AnalysisContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects unsafe pointer use and lost allocations.
 *
 * Dereferences ({@code *p}, {@code p->x}, {@code p[i]}) are checked against the pointer's
 * tracked state:
 * - NULL outside the branch of a non-null test: null pointer dereference
 * - never initialized: wild pointer dereference
 * - already freed: use after free, reported as a wild pointer dereference
 *
 * A return of {@code &local}, or of a local array, hands the caller a dangling pointer.
 *
 * At end of file, every allocation still held by a variable that was not freed,
 * returned or stored elsewhere is reported as a leak at its allocation line.
 */
public class MemorySafetyDetector implements Detector {

    private static final Pattern ADDRESS_OF = Pattern.compile("^&\\s*([A-Za-z_]\\w*)\\s*(?:\\[[^\\]]*\\])?$");

    @Override
    public String id() {
        return "memory-safety";
    }

    @Override
    public ErrorType.Module module() {
        return ErrorType.Module.MEMORY_SAFETY;
    }

    @Override
    public String description() {
        return "Detects null and wild pointer dereferences, double frees and memory leaks";
    }

    @Override
    public void inspect(AnalysisContext ctx, Clause clause) {
        if (!clause.isExpression()) {
            return;
        }
        for (String expression : expressionsOf(ctx, clause)) {
            checkDereferences(ctx, clause, expression);
            checkFrees(ctx, clause, expression);
        }
        if (clause.kind() == Kind.RETURN) {
            checkReturnedAddress(ctx, clause);
        }
    }

    /**
     * Declarations only evaluate their initializers; the declarator's own '*' is not a dereference.
     */
    static List<String> expressionsOf(AnalysisContext ctx, Clause clause) {
        if (clause.kind() == Kind.STATEMENT) {
            Optional<Declaration> decl = CPatterns.parseDeclaration(clause.text(), ctx.typedefNames());
            if (decl.isPresent()) {
                List<String> initializers = new ArrayList<>();
                for (Declarator d : decl.get().declarators()) {
                    if (d.hasInitializer()) {
                        initializers.add(d.initializer());
                    }
                }
                return initializers;
            }
        }
        if (clause.kind() == Kind.RETURN) {
            return List.of(clause.text().substring("return".length()));
        }
        return List.of(clause.text());
    }

    private void checkDereferences(AnalysisContext ctx, Clause clause, String expression) {
        String masked = SourceText.maskSizeof(SourceText.maskLiterals(expression));
        for (Dereference deref : CPatterns.dereferences(masked)) {
            Optional<VariableState> binding = ctx.lookup(deref.name(), clause);
            if (binding.isEmpty() || !binding.get().isPointer() || binding.get().isArray()) {
                continue;
            }
            VariableState state = binding.get();
            String name = state.name();
            if (state.symbolicValue() == SymbolicValue.FREED) {
                ctx.report(name, ErrorType.WILD_POINTER_DEREFERENCE,
                        String.format("Use after free: pointer '%s' is dereferenced after being freed on line %d",
                                name, state.freedLine()),
                        String.format("Do not access '%s' after free(); set it to NULL after freeing "
                                + "and allocate again before reuse", name));
            } else if (state.symbolicValue() == SymbolicValue.NULL
                    && !state.isNullGuardedAt(clause.lineNumber(), ctx.depthAt(clause))
                    && !guardedEarlier(masked, deref, clause)) {
                ctx.report(name, ErrorType.NULL_POINTER_DEREFERENCE,
                        String.format("Null pointer dereference: '%s' is NULL here", name),
                        String.format("Assign '%s' a valid address, or check 'if (%s != NULL)' before using it",
                                name, name));
            } else if (!state.initialized() && ctx.declaredHere(state, clause)) {
                ctx.report(name, ErrorType.WILD_POINTER_DEREFERENCE,
                        String.format("Wild pointer dereference: '%s' is used before it points anywhere", name),
                        String.format("Initialize '%s' before use, e.g. '%s = malloc(...)' or '%s = NULL'",
                                name, name, name));
            }
        }
    }

    /**
     * In a condition such as {@code p && p->next}, an earlier mention of the pointer is its guard.
     */
    private static boolean guardedEarlier(String masked, Dereference deref, Clause clause) {
        if (clause.kind() != Kind.CONDITION) {
            return false;
        }
        Pattern mention = Pattern.compile("(?<![\\w.])" + Pattern.quote(deref.name()) + "\\b");
        return mention.matcher(masked.substring(0, deref.position())).find();
    }

    private void checkReturnedAddress(AnalysisContext ctx, Clause clause) {
        String value = CPatterns.stripCastsAndParens(clause.text().substring("return".length()));
        Matcher m = ADDRESS_OF.matcher(value);
        boolean addressOf = m.matches();
        String name = addressOf ? m.group(1) : value;
        if (!CPatterns.isPlainIdentifier(name)) {
            return;
        }
        ctx.lookup(name, clause)
                .filter(s -> s.functionIndex() != 0 && ctx.declaredHere(s, clause) && !s.isStatic())
                .filter(s -> addressOf || s.isArray())
                .ifPresent(s -> ctx.report(name, ErrorType.RETURN_LOCAL_ADDRESS,
                        String.format("Function returns the address of local variable '%s', "
                                + "which no longer exists once the function returns", name),
                        String.format("Return memory from malloc(), make '%s' static, "
                                + "or let the caller pass in the storage", name)));
    }

    private void checkFrees(AnalysisContext ctx, Clause clause, String expression) {
        for (Call call : CPatterns.calls(expression)) {
            if (!call.name().equals("free") || call.arguments().isEmpty()) {
                continue;
            }
            String arg = CPatterns.stripCastsAndParens(call.arguments().get(0));
            if (!CPatterns.isPlainIdentifier(arg)) {
                continue;
            }
            ctx.lookup(arg, clause)
                    .filter(VariableState::isPointer)
                    .filter(s -> s.symbolicValue() == SymbolicValue.FREED)
                    .ifPresent(s -> ctx.report(arg, ErrorType.DOUBLE_FREE,
                            String.format("Double free: '%s' was already freed on line %d", arg, s.freedLine()),
                            String.format("Free '%s' exactly once, and set it to NULL after free()", arg)));
        }
    }

    @Override
    public void finish(AnalysisContext ctx) {
        for (VariableState state : ctx.store().history()) {
            if (state.symbolicValue() != SymbolicValue.ALLOCATED || state.allocLine() < 1 || isStaticLocal(state)) {
                continue;
            }
            if (isReleased(ctx, state)) {
                continue;
            }
            VariableState origin = state.aliasOf() != null && state.aliasOf().allocLine() == state.allocLine()
                    ? state.aliasOf()
                    : state;
            if (origin != state && origin.symbolicValue() == SymbolicValue.ALLOCATED && !isStaticLocal(origin)) {
                // reported through the original pointer
                continue;
            }
            String name = state.name();
            ctx.reportAt(state.allocLine(), name, ErrorType.MEMORY_LEAK,
                    String.format("Memory leak: memory allocated to '%s' is never freed", name),
                    String.format("Call free(%s) when the memory is no longer needed, or return it to the caller",
                            name));
        }
    }

    private static boolean isReleased(AnalysisContext ctx, VariableState state) {
        List<VariableState> related = new ArrayList<>();
        related.add(state);
        if (state.aliasOf() != null) {
            related.add(state.aliasOf());
        }
        related.addAll(ctx.store().aliasesOf(state));
        for (VariableState s : related) {
            if (s.escaped() || s.symbolicValue() == SymbolicValue.FREED || isStaticLocal(s)
                    || isReturned(ctx, s.name(), state.allocLine())) {
                return true;
            }
        }
        return false;
    }

    // a static local keeps its allocation across calls
    private static boolean isStaticLocal(VariableState state) {
        return state.isStatic() && state.functionIndex() != 0;
    }

    private static boolean isReturned(AnalysisContext ctx, String name, int fromLine) {
        Pattern returned = Pattern.compile("\\breturn\\b[^;]*\\b" + Pattern.quote(name) + "\\b");
        List<String> lines = ctx.strippedLines();
        for (int i = fromLine - 1; i < lines.size(); i++) {
            if (returned.matcher(lines.get(i)).find()) {
                return true;
            }
        }
        return false;
    }
}
