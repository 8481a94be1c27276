package org.slowpy.rt;

/** The Python {@code ArithmeticError} exception. */
public class ArithmeticError extends PyException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ArithmeticError(String msg, Object... args) { super(msg, args); }
}
