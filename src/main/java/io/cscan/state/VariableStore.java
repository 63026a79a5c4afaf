package io.cscan.state;

import io.cscan.model.SymbolicValue;
import io.cscan.model.VariableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Live variable bindings of one file, in declaration order.
 * <p>
 * Bindings leave the store when their scope closes. Bindings that still hold an allocation
 * are kept aside instead, so leak detection sees them at end of file.
 */
public class VariableStore {

    private static final Logger log = LoggerFactory.getLogger(VariableStore.class);

    private final List<VariableState> live = new ArrayList<>();
    private final List<VariableState> retained = new ArrayList<>();
    private final List<VariableState> history = new ArrayList<>();

    /**
     * Adds a binding. A live binding with the same name in the same function and scope is replaced.
     */
    public void declare(VariableState state) {
        Iterator<VariableState> it = live.iterator();
        while (it.hasNext()) {
            VariableState existing = it.next();
            if (existing.name().equals(state.name())
                    && existing.functionIndex() == state.functionIndex()
                    && existing.scopeDepth() == state.scopeDepth()) {
                it.remove();
                retire(existing);
            }
        }
        live.add(state);
        history.add(state);
    }

    /**
     * Finds the innermost visible binding: one from the given function body, or a file-scope one.
     */
    public Optional<VariableState> lookup(String name, int functionIndex) {
        for (int i = live.size() - 1; i >= 0; i--) {
            VariableState state = live.get(i);
            if (state.name().equals(name)
                    && (state.functionIndex() == functionIndex || state.functionIndex() == 0)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    /**
     * Drops bindings whose scope closed on the given line.
     *
     * @param line       the line being finished
     * @param minDepth   lowest depth reached on the line, applied to bindings declared earlier
     * @param endDepth   depth at end of line, applied to bindings declared on this line
     */
    public void release(int line, int minDepth, int endDepth) {
        Iterator<VariableState> it = live.iterator();
        while (it.hasNext()) {
            VariableState state = it.next();
            int threshold = state.declLine() == line ? endDepth : minDepth;
            if (state.scopeDepth() > threshold) {
                it.remove();
                retire(state);
            }
        }
    }

    /**
     * Lets live bindings expire their null guards at the end of a line.
     */
    public void endLine(int line, int minDepth, int endDepth) {
        for (VariableState state : live) {
            state.endLine(line, minDepth, endDepth);
        }
    }

    private void retire(VariableState state) {
        if (state.symbolicValue() == SymbolicValue.ALLOCATED) {
            state.setOutOfScope(true);
            retained.add(state);
            log.debug("Retaining out-of-scope allocation {}", state);
        }
    }

    /**
     * Returns bindings that were copied from the given one.
     */
    public List<VariableState> aliasesOf(VariableState source) {
        List<VariableState> aliases = new ArrayList<>();
        for (VariableState state : history) {
            if (state.aliasOf() == source) {
                aliases.add(state);
            }
        }
        return aliases;
    }

    public List<VariableState> liveBindings() {
        return Collections.unmodifiableList(live);
    }

    public List<VariableState> retainedBindings() {
        return Collections.unmodifiableList(retained);
    }

    /**
     * Every binding ever declared, in declaration order.
     */
    public List<VariableState> history() {
        return Collections.unmodifiableList(history);
    }
}
