package org.slowpy.rt;

/**
 * The Python {@code ZeroDivisionError} exception, raised when the
 * divisor of an integer division is zero.
 */
public class DivisionByZeroError extends ArithmeticError {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DivisionByZeroError(String msg, Object... args) {
        super(msg, args);
    }

    @Override
    public String getPythonName() { return "ZeroDivisionError"; }
}
