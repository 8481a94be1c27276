package org.slowpy.rt;

/** The Python {@code OverflowError} exception. */
public class OverflowError extends ArithmeticError {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public OverflowError(String msg, Object... args) { super(msg, args); }
}
