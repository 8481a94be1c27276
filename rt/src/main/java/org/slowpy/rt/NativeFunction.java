package org.slowpy.rt;

import java.util.List;

/**
 * The signature of a function implemented in Java and callable from
 * Python. It sees the interpreter only through the {@link Executor}
 * capability. A normal return is the first outcome; a
 * {@link BaseException} thrown is the second.
 */
@FunctionalInterface
public interface NativeFunction {

    /**
     * Call the function.
     *
     * @param rt capability of the calling interpreter
     * @param args positional arguments (borrowed)
     * @return the result (owned by the caller)
     * @throws BaseException to signal a Python exception
     */
    PyRef call(Executor rt, List<PyRef> args) throws BaseException;
}
