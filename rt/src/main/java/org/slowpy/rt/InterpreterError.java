package org.slowpy.rt;

/**
 * Internal error thrown when the Python implementation cannot be relied
 * on to work. A Python exception (that might be caught in Python code)
 * is not then appropriate. Typically thrown for misuse of the runtime by
 * the host interpreter, that is, for a bug rather than a condition of
 * the user's program.
 */
public class InterpreterError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
    }

    public InterpreterError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
    }
}
