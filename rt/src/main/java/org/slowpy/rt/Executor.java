package org.slowpy.rt;

import java.util.List;

/**
 * The capability that an interpreter offers to functions implemented in
 * Java. A {@link NativeFunction} sees the interpreter only through this
 * interface, never through its frames or stack. Handles returned are
 * owned by the caller.
 */
public interface Executor {

    /**
     * Call an object, which may require the interpreter to run a
     * function compiled from Python.
     *
     * @param callable object to call
     * @param args positional arguments (borrowed)
     * @return result (owned)
     * @throws BaseException raised by the call
     */
    PyRef call(PyRef callable, List<PyRef> args) throws BaseException;

    /**
     * Make a {@code str}.
     *
     * @param s value
     * @return new object
     */
    PyRef newStr(String s);

    /**
     * Make a {@code bool}.
     *
     * @param b value
     * @return new object
     */
    PyRef newBool(boolean b);

    /** @return the {@code None} object */
    PyRef getNone();

    /** @return the type object {@code type} */
    PyRef getType();

    /** @return the context of the interpreter */
    Context context();
}
