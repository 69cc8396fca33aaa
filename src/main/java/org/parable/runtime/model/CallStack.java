package org.parable.runtime.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A call stack with a fixed maximum depth. Overflow is not an error here: {@link #push}
 * reports it and the caller decides how to recover.
 */
public final class CallStack {

    private final int maxDepth;
    private final Deque<CallFrame> frames = new ArrayDeque<>();

    public CallStack(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Maximum call depth must not be negative, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @param frame the frame to push
     * @return false if the stack is full and the frame was not pushed
     */
    public boolean push(CallFrame frame) {
        if (frames.size() >= maxDepth) {
            return false;
        }
        frames.push(frame);
        return true;
    }

    /**
     * @return the most recent frame
     * @throws java.util.NoSuchElementException if the stack is empty
     */
    public CallFrame pop() {
        return frames.pop();
    }

    public CallFrame peek() {
        return frames.peek();
    }

    public int depth() {
        return frames.size();
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public boolean isFull() {
        return frames.size() >= maxDepth;
    }

    public void clear() {
        frames.clear();
    }

    /**
     * @return the frames from innermost to outermost
     */
    public List<CallFrame> toList() {
        return List.copyOf(frames);
    }
}
