package org.slowpy.rt;

/** The Python {@code TypeError} exception. */
public class TypeError extends PyException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public TypeError(String msg, Object... args) { super(msg, args); }
}
