package org.slowpy.rt;

/**
 * The depth of nested comparisons on the current thread. A comparison
 * of containers compares their elements, and so may recurse without
 * end on structures that contain themselves. Each level is counted
 * here, and beyond {@link #RECURSION_LIMIT} we raise
 * {@link RecursionError} rather than overflow the Java stack.
 * <p>
 * Use as a resource in a try-with-resources construct, around any
 * method body that should count against the limit.
 */
final class RecursionState implements AutoCloseable {

    /**
     * Maximum recursion depth after which we will raise
     * {@code RecursionError}
     */
    static final int RECURSION_LIMIT = 1000;

    /** Recursion state of the current thread. */
    private static final ThreadLocal<RecursionState> current =
            ThreadLocal.withInitial(RecursionState::new);

    private int depth = 0;

    private RecursionState() {}

    /**
     * Count one more level of recursion on the current thread.
     *
     * @param what is recursing (completes the message)
     * @return the state, to be closed on leaving the level
     * @throws RecursionError if the limit has been reached
     */
    static RecursionState enter(String what) throws RecursionError {
        RecursionState s = current.get();
        if (s.depth >= RECURSION_LIMIT) {
            throw new RecursionError(
                    "maximum recursion depth exceeded in %s", what);
        }
        s.depth += 1;
        return s;
    }

    /** @return the depth on the current thread */
    static int depth() { return current.get().depth; }

    @Override
    public void close() { --depth; }
}
