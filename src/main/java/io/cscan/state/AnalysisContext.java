package io.cscan.state;

import io.cscan.config.CheckerConfig;
import io.cscan.model.ErrorType;
import io.cscan.model.Finding;
import io.cscan.model.VariableState;
import io.cscan.patterns.CPatterns;
import io.cscan.patterns.CPatterns.Declarator;
import io.cscan.patterns.CPatterns.FunctionSignature;
import io.cscan.source.Clause;
import io.cscan.source.Clause.Kind;
import io.cscan.source.Clause.LoopKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything known about one file while it is being analyzed.
 * <p>
 * A context is created per {@code analyze} call and handed to every detector, so nothing
 * is shared between files. Detectors read it and report findings into it; only
 * {@link VariableStateUpdater} and {@link #track(Clause)} change the tracked state.
 */
public class AnalysisContext {

    /**
     * A {@code do} whose closing {@code while} has not been seen yet.
     *
     * @param lineNumber line of the {@code do}
     * @param column     column of the {@code do}
     * @param depth      scope depth at the {@code do}
     * @param constants  known integer values of visible variables when the body started
     */
    public record PendingDo(int lineNumber, int column, int depth, Map<String, Long> constants) {}

    private final CheckerConfig config;
    private final List<String> rawLines;
    private final List<String> strippedLines;
    private final ScopeTracker scope = new ScopeTracker();
    private final VariableStore store = new VariableStore();
    private final List<Finding> findings = new ArrayList<>();
    private final Set<String> reported = new HashSet<>();

    private final Set<String> includedHeaders = new LinkedHashSet<>();
    private final Set<String> userFunctions = new LinkedHashSet<>();
    private final Map<String, Boolean> typedefNames = new LinkedHashMap<>();
    private final Map<String, Long> macroConstants = new LinkedHashMap<>();

    private final Deque<PendingDo> pendingDos = new ArrayDeque<>();
    private PendingDo closedDo;

    private int functionCount;
    private int aggregateDepth = -1;
    private boolean aggregateIsTypedef;
    private int lineNumber;

    public AnalysisContext(CheckerConfig config, List<String> rawLines, List<String> strippedLines) {
        if (rawLines.size() != strippedLines.size()) {
            throw new IllegalArgumentException("stripped lines must match raw lines one to one");
        }
        this.config = config;
        this.rawLines = List.copyOf(rawLines);
        this.strippedLines = List.copyOf(strippedLines);
    }

    // ---------------------------------------------------------------- line lifecycle

    public void beginLine(int lineNumber) {
        this.lineNumber = lineNumber;
        this.closedDo = null;
        scope.beginLine(strippedLines.get(lineNumber - 1));
    }

    /**
     * Commits the line's depth change and releases bindings whose scope closed on it.
     */
    public void endLine() {
        store.endLine(lineNumber, scope.minDepth(), scope.endDepth());
        if (scope.endLine()) {
            store.release(lineNumber, scope.minDepth(), scope.endDepth());
        }
        if (aggregateDepth >= 0 && scope.depth() <= aggregateDepth && !aggregateIsTypedef) {
            aggregateDepth = -1;
        }
    }

    /**
     * Structural bookkeeping that must happen before detectors see a clause: function bodies,
     * struct member lists and do-while pairing.
     *
     * @return the clause to analyze (a closing {@code while} is relabeled DO_WHILE),
     *         or null when the clause was structural only
     */
    public Clause track(Clause clause) {
        int depth = scope.depthAt(clause.column());

        if (aggregateDepth >= 0) {
            if (depth > aggregateDepth) {
                return null;
            }
            boolean typedef = aggregateIsTypedef;
            aggregateDepth = -1;
            aggregateIsTypedef = false;
            if (typedef && clause.kind() == Kind.STATEMENT) {
                for (String name : clause.text().split(",")) {
                    String typeName = name.replace("*", "").trim();
                    if (CPatterns.isPlainIdentifier(typeName)) {
                        typedefNames.put(typeName, true);
                    }
                }
                return null;
            }
        }

        switch (clause.kind()) {
            case DO -> {
                pendingDos.push(new PendingDo(clause.lineNumber(), clause.column(), depth, visibleConstants()));
                return clause;
            }
            case LOOP -> {
                if (clause.loopKind() == LoopKind.WHILE && clause.terminated()
                        && !pendingDos.isEmpty() && pendingDos.peek().depth() == depth) {
                    closedDo = pendingDos.pop();
                    return clause.withLoopKind(LoopKind.DO_WHILE);
                }
                return clause;
            }
            case STATEMENT -> {
                if (clause.opensBlock() && CPatterns.isAggregateHead(clause.text())) {
                    aggregateDepth = depth;
                    aggregateIsTypedef = CPatterns.isTypedefHead(clause.text());
                    return null;
                }
                if (!clause.terminated() && depth == 0) {
                    Optional<FunctionSignature> signature =
                            CPatterns.parseFunctionHeader(clause.text(), typedefNames);
                    if (signature.isPresent()) {
                        enterFunction(signature.get(), clause);
                        return null;
                    }
                }
                return clause;
            }
            default -> {
                return clause;
            }
        }
    }

    private void enterFunction(FunctionSignature signature, Clause clause) {
        functionCount++;
        userFunctions.add(signature.name());
        for (int i = 0; i < signature.parameters().size(); i++) {
            Declarator p = signature.parameters().get(i);
            String type = signature.parameterTypes().get(i);
            store.declare(VariableState.builder()
                    .name(p.name())
                    .baseType(type)
                    .pointerDepth(p.pointerDepth())
                    .aggregate(p.pointerDepth() == 0 && typedefNames.getOrDefault(type, type.startsWith("struct ")
                            || type.startsWith("union ")))
                    .parameter(true)
                    .declLine(clause.lineNumber())
                    .scopeDepth(1)
                    .functionIndex(functionCount)
                    .initialized(true)
                    .build());
        }
    }

    private Map<String, Long> visibleConstants() {
        Map<String, Long> constants = new LinkedHashMap<>();
        int function = currentFunction(0);
        for (VariableState state : store.liveBindings()) {
            if (state.constantValue() != null
                    && (state.functionIndex() == function || state.functionIndex() == 0)) {
                constants.put(state.name(), state.constantValue());
            }
        }
        return constants;
    }

    // ---------------------------------------------------------------- lookups

    /**
     * Function body owning code at the given column of the current line; 0 at file scope.
     */
    public int currentFunction(int column) {
        return scope.depthAt(column) > 0 ? functionCount : 0;
    }

    /**
     * True when the binding was declared in the body the clause is in, or both are at file scope.
     * A file-scope binding used inside a function is not.
     */
    public boolean declaredHere(VariableState state, Clause clause) {
        return state.functionIndex() == currentFunction(clause.column());
    }

    public Optional<VariableState> lookup(String name, Clause clause) {
        return store.lookup(name, currentFunction(clause.column()));
    }

    public int depthAt(Clause clause) {
        return scope.depthAt(clause.column());
    }

    /**
     * Integer value of a literal, a {@code #define} constant, or a variable with a known value.
     */
    public Optional<Long> constantValue(String expression, Clause clause) {
        var literal = CPatterns.parseIntegerLiteral(expression);
        if (literal.isPresent()) {
            return Optional.of(literal.getAsLong());
        }
        String name = expression.trim();
        if (macroConstants.containsKey(name)) {
            return Optional.of(macroConstants.get(name));
        }
        if (CPatterns.isPlainIdentifier(name)) {
            return lookup(name, clause).map(VariableState::constantValue);
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------- findings

    /**
     * Records a finding at the current line unless the same key was already reported.
     */
    public void report(String key, ErrorType type, String message, String suggestion) {
        reportAt(lineNumber, key, type, message, suggestion);
    }

    public void reportAt(int line, String key, ErrorType type, String message, String suggestion) {
        if (!reported.add(type.name() + ":" + line + ":" + key)) {
            return;
        }
        findings.add(Finding.builder()
                .lineNumber(line)
                .errorType(type)
                .severity(type.defaultSeverity())
                .message(message)
                .suggestion(suggestion)
                .codeSnippet(rawLines.get(line - 1).trim())
                .moduleName(type.module().displayName())
                .build());
    }

    public List<Finding> findings() {
        return Collections.unmodifiableList(findings);
    }

    // ---------------------------------------------------------------- accessors

    public CheckerConfig config() {
        return config;
    }

    public VariableStore store() {
        return store;
    }

    public List<String> strippedLines() {
        return strippedLines;
    }

    public Set<String> includedHeaders() {
        return includedHeaders;
    }

    public Set<String> userFunctions() {
        return userFunctions;
    }

    public Map<String, Boolean> typedefNames() {
        return typedefNames;
    }

    public Map<String, Long> macroConstants() {
        return macroConstants;
    }

    /**
     * The do-while opened by the {@code while} clause just relabeled on this line, if any.
     */
    public Optional<PendingDo> closedDo() {
        return Optional.ofNullable(closedDo);
    }
}
