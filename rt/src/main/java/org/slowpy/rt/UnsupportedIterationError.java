package org.slowpy.rt;

/**
 * Raised when an iterator is requested over, or advanced on, an object
 * that does not support iteration. Python reports this as a
 * {@code TypeError}.
 */
public class UnsupportedIterationError extends TypeError {

    private static final long serialVersionUID = 1L;

    public UnsupportedIterationError(String msg, Object... args) {
        super(msg, args);
    }

    @Override
    public String getPythonName() { return "TypeError"; }
}
