package org.parable.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CallStackTest {

    @Test
    void pushStopsAtMaximumDepth() {
        CallStack stack = new CallStack(2);

        assertThat(stack.push(new CallFrame(FrameKind.CALL, 1, 5, 0))).isTrue();
        assertThat(stack.push(new CallFrame(FrameKind.CASE, 2, 9, 0))).isTrue();
        assertThat(stack.push(new CallFrame(FrameKind.CALL, 3, 2, 0))).isFalse();

        assertThat(stack.depth()).isEqualTo(2);
        assertThat(stack.isFull()).isTrue();
        assertThat(stack.toList()).extracting(CallFrame::address).containsExactly(2, 1);
    }

    @Test
    void popReturnsFramesInReverseOrder() {
        CallStack stack = new CallStack(4);
        stack.push(new CallFrame(FrameKind.CALL, 1, 5, 0));
        stack.push(new CallFrame(FrameKind.CALL, 2, 7, 0));

        assertThat(stack.pop().address()).isEqualTo(2);
        assertThat(stack.peek().address()).isEqualTo(1);
        assertThat(stack.pop().position()).isEqualTo(5);
        assertThat(stack.isEmpty()).isTrue();
        assertThatThrownBy(stack::pop).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void clearEmptiesTheStack() {
        CallStack stack = new CallStack(4);
        stack.push(new CallFrame(FrameKind.CALL, 1, 5, 0));

        stack.clear();

        assertThat(stack.depth()).isZero();
        assertThatThrownBy(() -> new CallStack(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
