package org.slowpy.rt;

/**
 * Thrown when the host breaks the access discipline of a {@link PyRef}:
 * it asks for a view of an object that conflicts with a view already
 * open, or touches the object with no view open at all.
 */
public class BorrowError extends InterpreterError {

    private static final long serialVersionUID = 1L;

    public BorrowError(String msg, Object... args) { super(msg, args); }
}
