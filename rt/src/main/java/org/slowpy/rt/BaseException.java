package org.slowpy.rt;

/**
 * The Python {@code BaseException} exception. Every failure that Python
 * code could provoke, and that the evaluator may turn into a Python
 * exception object, is thrown as a sub-class of this.
 */
public class BaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public BaseException(String msg, Object... args) {
        super(String.format(msg, args));
    }

    /**
     * The name of the Python exception type this represents, by
     * default the simple name of the Java class.
     *
     * @return Python type name
     */
    public String getPythonName() { return getClass().getSimpleName(); }

    @Override
    public String toString() {
        String msg = getMessage();
        return msg.isEmpty() ? getPythonName()
                : getPythonName() + ": " + msg;
    }
}
