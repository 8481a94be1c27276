package org.slowpy.rt;

/** The Python {@code RecursionError} exception. */
public class RecursionError extends RuntimeError {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public RecursionError(String msg, Object... args) { super(msg, args); }
}
