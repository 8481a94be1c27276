package org.slowpy.rt;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compare CPython {@code Objects/call.c}: {@code PyObject_Call*}. */
public class Callables {

    private static final Logger logger =
            LoggerFactory.getLogger(Callables.class);

    private Callables() {} // no instances

    /**
     * Call an object with positional arguments. A built-in function is
     * called directly. A function defined in Python is passed to the
     * executor, which alone can run compiled code.
     *
     * @param rt capability of the calling interpreter
     * @param callable target
     * @param args positional arguments (borrowed)
     * @return the return from the call to the object (owned)
     * @throws NotCallableError if target is not callable
     * @throws BaseException for errors raised in the function
     */
    public static PyRef call(Executor rt, PyRef callable, List<PyRef> args)
            throws NotCallableError, BaseException {
        switch (callable.getTag()) {
            case NATIVE_FUNCTION:
                PyJavaFunction f =
                        callable.read(o -> (PyJavaFunction)o.getKind());
                logger.atTrace().setMessage("call {} with {} arguments")
                        .addArgument(f.getName()).addArgument(args.size())
                        .log();
                // No view is open while the function runs.
                return f.getFunction().call(rt, args);
            case FUNCTION:
                return rt.call(callable, args);
            default:
                throw new NotCallableError(OBJECT_NOT_CALLABLE,
                        callable.getTag().getTypeName());
        }
    }

    /**
     * Call an object with positional arguments.
     *
     * @param rt capability of the calling interpreter
     * @param callable target
     * @param args positional arguments (borrowed)
     * @return the return from the call to the object (owned)
     * @throws NotCallableError if target is not callable
     * @throws BaseException for errors raised in the function
     */
    public static PyRef call(Executor rt, PyRef callable, PyRef... args)
            throws NotCallableError, BaseException {
        return call(rt, callable, List.of(args));
    }

    /**
     * Whether an object may be called.
     *
     * @param o object
     * @return {@code true} if {@code o} is a function
     */
    public static boolean isCallable(PyRef o) {
        Kind.Tag tag = o.getTag();
        return tag == Kind.Tag.NATIVE_FUNCTION || tag == Kind.Tag.FUNCTION;
    }

    static final String OBJECT_NOT_CALLABLE =
            "'%.200s' object is not callable";
}
