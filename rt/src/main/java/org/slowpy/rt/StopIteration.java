package org.slowpy.rt;

/**
 * The Python {@code StopIteration} exception. The iterator protocol in
 * {@link Iterators} signals exhaustion by returning {@code null}; this
 * exception is for the built-in {@code next()}, where Python semantics
 * require it.
 */
public class StopIteration extends PyException {

    private static final long serialVersionUID = 1L;

    public StopIteration() { super(""); }
}
