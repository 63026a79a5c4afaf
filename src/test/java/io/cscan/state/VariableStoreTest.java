package io.cscan.state;

import io.cscan.model.NullGuard;
import io.cscan.model.SymbolicValue;
import io.cscan.model.VariableState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VariableStoreTest {

    private VariableStore store;

    @BeforeEach
    void setUp() {
        store = new VariableStore();
    }

    @Test
    void lookup_findsInnermostBinding() {
        store.declare(variable("x", 1, 1, 1));
        VariableState inner = variable("x", 2, 2, 1);
        store.declare(inner);

        assertThat(store.lookup("x", 1)).contains(inner);
    }

    @Test
    void lookup_seesFileScopeFromAnyFunction() {
        VariableState global = variable("counter", 1, 0, 0);
        store.declare(global);

        assertThat(store.lookup("counter", 3)).contains(global);
    }

    @Test
    void lookup_doesNotSeeOtherFunctionsLocals() {
        store.declare(variable("x", 2, 1, 1));

        assertThat(store.lookup("x", 2)).isEmpty();
    }

    @Test
    void declare_replacesSameNameInSameScope() {
        store.declare(variable("x", 1, 1, 1));
        VariableState redeclared = variable("x", 2, 1, 1);
        store.declare(redeclared);

        assertThat(store.liveBindings()).containsExactly(redeclared);
        assertThat(store.history()).hasSize(2);
    }

    @Test
    void release_dropsBindingsDeeperThanLineMinimum() {
        VariableState outer = variable("a", 1, 1, 1);
        VariableState inner = variable("b", 2, 2, 1);
        store.declare(outer);
        store.declare(inner);

        store.release(5, 1, 1);

        assertThat(store.liveBindings()).containsExactly(outer);
    }

    @Test
    void release_retainsAllocatedBindings() {
        VariableState p = variable("p", 2, 2, 1);
        p.markAllocated(2);
        store.declare(p);

        store.release(4, 1, 1);

        assertThat(store.liveBindings()).isEmpty();
        assertThat(store.retainedBindings()).containsExactly(p);
        assertThat(p.outOfScope()).isTrue();
        assertThat(p.symbolicValue()).isEqualTo(SymbolicValue.ALLOCATED);
    }

    @Test
    void release_usesEndDepthForBindingsDeclaredOnTheLine() {
        // "} int y; {" style line: y is declared after the dip
        VariableState y = variable("y", 6, 1, 1);
        store.declare(y);

        store.release(6, 0, 1);

        assertThat(store.liveBindings()).containsExactly(y);
    }

    @Test
    void aliasesOf_findsCopies() {
        VariableState p = variable("p", 1, 1, 1);
        p.markAllocated(1);
        VariableState q = variable("q", 2, 1, 1);
        store.declare(p);
        store.declare(q);

        q.copyFrom(p, 2);

        assertThat(store.aliasesOf(p)).containsExactly(q);
        assertThat(q.allocLine()).isEqualTo(1);
    }

    @Test
    void aliasesOf_dropsCopiesWrittenSince() {
        VariableState p = variable("p", 1, 1, 1);
        p.markAllocated(1);
        VariableState q = variable("q", 2, 1, 1);
        store.declare(p);
        store.declare(q);

        q.copyFrom(p, 2);
        q.markAllocated(3);

        assertThat(store.aliasesOf(p)).isEmpty();
        assertThat(q.aliasOf()).isNull();
    }

    @Test
    void aliasesOf_dropsCopiesWhenSourceIsWrittenAgain() {
        VariableState p = variable("p", 1, 1, 1);
        p.markAllocated(1);
        VariableState q = variable("q", 2, 1, 1);
        store.declare(p);
        store.declare(q);

        q.copyFrom(p, 2);
        p.markNull(3);

        assertThat(store.aliasesOf(p)).isEmpty();
        assertThat(q.symbolicValue()).isEqualTo(SymbolicValue.ALLOCATED);
    }

    @Test
    void endLine_expiresNullGuardWhenItsBlockCloses() {
        VariableState p = variable("p", 1, 1, 1);
        p.markNull(1);
        store.declare(p);
        p.setNullGuard(NullGuard.braced(1, 2));

        store.endLine(2, 1, 2);
        assertThat(p.isNullGuardedAt(3, 2)).isTrue();
        assertThat(p.isNullGuardedAt(3, 1)).isFalse();

        store.endLine(4, 1, 1);
        assertThat(p.isNullGuardedAt(5, 2)).isFalse();
    }

    private static VariableState variable(String name, int line, int depth, int function) {
        return VariableState.builder()
                .name(name)
                .baseType("int")
                .pointerDepth(1)
                .declLine(line)
                .scopeDepth(depth)
                .functionIndex(function)
                .build();
    }
}
