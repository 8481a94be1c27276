package org.slowpy.rt;

/** The Python {@code Exception} exception. */
public class PyException extends BaseException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PyException(String msg, Object... args) { super(msg, args); }
}
