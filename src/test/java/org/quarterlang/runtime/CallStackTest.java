package org.quarterlang.runtime;

import org.quarterlang.compiler.ir.IrImm;
import org.quarterlang.compiler.ir.IrVar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CallStackTest {

    private CallStack stack;
    private CallFrame outer;
    private CallFrame inner;

    @BeforeEach
    void setUp() {
        stack = new CallStack();
        outer = new CallFrame("<main>");
        outer.bind("x", 1);
        outer.bind("y", 10);
        inner = new CallFrame("f");
        inner.bind("x", 2);
        stack.push(outer);
        stack.push(inner);
    }

    @Test
    @Tag("unit")
    void resolvesInnermostBindingFirst() {
        assertThat(stack.resolve(new IrVar("x"))).isEqualTo(2L);
        assertThat(stack.resolve(new IrVar("y"))).isEqualTo(10L);
        assertThat(stack.resolve(new IrImm(-3))).isEqualTo(-3L);
    }

    @Test
    @Tag("unit")
    void assignWritesTopFrameOnly() {
        stack.assign("y", 20);

        assertThat(inner.lookup("y")).isEqualTo(20L);
        assertThat(outer.lookup("y")).isEqualTo(10L);
        assertThat(stack.resolveName("y")).isEqualTo(20L);
    }

    @Test
    @Tag("unit")
    void unboundNameFallsBackToIntegerText() {
        assertThat(stack.resolveName("-7")).isEqualTo(-7L);
        assertThatThrownBy(() -> stack.resolveName("z"))
                .isInstanceOf(ExecutionException.class)
                .hasMessage("Cannot resolve 'z': it is not bound in any frame and is not an integer.");
    }

    @Test
    @Tag("unit")
    void listsFramesInnermostFirst() {
        inner.moveTo("entry", 3);

        assertThat(stack.depth()).isEqualTo(2);
        assertThat(stack.frames()).containsExactly(inner, outer);
        assertThat(stack.top()).isSameAs(inner);
        assertThat(inner).hasToString("f at entry#3");
        assertThat(outer).hasToString("<main>");
    }

    @Test
    @Tag("unit")
    void topOfEmptyStackFails() {
        stack.pop();
        stack.pop();

        assertThat(stack.isEmpty()).isTrue();
        assertThatThrownBy(() -> stack.top()).isInstanceOf(IllegalStateException.class);
    }
}
