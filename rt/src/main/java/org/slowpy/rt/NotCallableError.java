package org.slowpy.rt;

/**
 * Raised when a call is attempted on an object that is not callable.
 * Python reports this as a {@code TypeError}, and so do we, but the
 * evaluator can tell it apart from other type errors.
 */
public class NotCallableError extends TypeError {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public NotCallableError(String msg, Object... args) {
        super(msg, args);
    }

    @Override
    public String getPythonName() { return "TypeError"; }
}
