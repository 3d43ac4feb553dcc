package com.codeparse.core.state;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stack of nested context frames: the single source of truth for "what am I currently inside".
 *
 * <p>The bottom frame is always the {@link ContextType#MODULE} frame created by the constructor and
 * can never be popped. Frames whose type {@linkplain ContextType#introducesScope() introduces a
 * scope} receive a scope id built from the path of scope frames above the module, for example
 * {@code module/class:Greeter/function:greet}. A second scope with the same path segment under the
 * same parent gets a {@code #2}, {@code #3}, ... suffix so scope ids stay unique.
 *
 * <p>Not thread-safe. Each parse creates its own instance.
 *
 * @since 1.0.0
 */
public class ParserState {

    public static final String MODULE_SCOPE = "module";

    private final Deque<ContextFrame> frames = new ArrayDeque<>();
    private final Map<String, String> scopeParents = new LinkedHashMap<>();
    private final Map<String, Integer> segmentCounts = new HashMap<>();

    public ParserState() {
        frames.push(new ContextFrame(ContextType.MODULE, Map.of(), 0, MODULE_SCOPE));
        scopeParents.put(MODULE_SCOPE, null);
    }

    /**
     * Pushes a new frame.
     *
     * @param type frame type
     * @param metadata frame metadata (may be null)
     * @param startIndex index of the token that opened the construct
     * @return the pushed frame
     */
    public ContextFrame push(ContextType type, Map<String, Object> metadata, int startIndex) {
        String scopeId = currentScopeId();
        if (type.introducesScope()) {
            scopeId = newScopeId(scopeId, type, metadata);
            scopeParents.put(scopeId, currentScopeId());
        }
        ContextFrame frame = new ContextFrame(type, metadata, startIndex, scopeId);
        frames.push(frame);
        return frame;
    }

    private String newScopeId(String parent, ContextType type, Map<String, Object> metadata) {
        Object name = metadata != null ? metadata.get(ContextFrame.NAME) : null;
        String segment = type.label() + (name != null ? ":" + name : "");
        String base = parent + "/" + segment;
        int count = segmentCounts.merge(base, 1, Integer::sum);
        return count == 1 ? base : base + "#" + count;
    }

    /**
     * Pops the top frame.
     *
     * @return the popped frame
     * @throws IllegalStateException if only the module frame is left
     */
    public ContextFrame pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("The module frame cannot be popped");
        }
        return frames.pop();
    }

    /**
     * Pops frames until {@code frame} has been removed. Used when recovery must close several
     * constructs at once. Does nothing if {@code frame} is not on the stack.
     *
     * @param frame frame to unwind to (inclusive)
     * @return number of frames popped
     */
    public int popTo(ContextFrame frame) {
        boolean onStack = frames.stream().anyMatch(candidate -> candidate == frame);
        if (!onStack || frame == frames.peekLast()) {
            return 0;
        }
        int popped = 0;
        ContextFrame top;
        do {
            top = frames.pop();
            popped++;
        } while (top != frame);
        return popped;
    }

    public ContextFrame current() {
        return frames.peek();
    }

    public ContextType currentType() {
        return current().type();
    }

    /**
     * Check if any frame on the stack is of one of the given types.
     */
    public boolean isIn(ContextType... types) {
        for (ContextFrame frame : frames) {
            for (ContextType type : types) {
                if (frame.type() == type) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the innermost frame of the given type.
     */
    public Optional<ContextFrame> nearest(ContextType type) {
        for (ContextFrame frame : frames) {
            if (frame.type() == type) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the innermost frame that introduces a scope.
     */
    public ContextFrame currentScopeFrame() {
        Iterator<ContextFrame> it = frames.iterator();
        while (it.hasNext()) {
            ContextFrame frame = it.next();
            if (frame.type().introducesScope()) {
                return frame;
            }
        }
        return frames.peekLast();
    }

    public String currentScopeId() {
        return current().scopeId();
    }

    /**
     * Returns the number of frames on the stack, including the module frame.
     */
    public int depth() {
        return frames.size();
    }

    /**
     * Returns the parent scope id recorded when {@code scopeId} was entered.
     */
    public Optional<String> parentScopeOf(String scopeId) {
        return Optional.ofNullable(scopeParents.get(scopeId));
    }

    /**
     * Returns all scope ids entered so far mapped to their parents (the module maps to null).
     */
    public Map<String, String> scopeParents() {
        return Collections.unmodifiableMap(scopeParents);
    }
}
