package org.slowpy.rt;

/** The Python {@code IndexError} exception. */
public class IndexError extends LookupError {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public IndexError(String msg, Object... args) { super(msg, args); }
}
