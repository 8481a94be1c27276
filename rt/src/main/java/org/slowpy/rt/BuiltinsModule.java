package org.slowpy.rt;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code builtins} module: a module object whose attributes are
 * functions implemented in Java. These functions use only the
 * {@link Executor} capability they are given.
 */
public class BuiltinsModule {

    private static final Logger logger =
            LoggerFactory.getLogger(BuiltinsModule.class);

    private BuiltinsModule() {} // no instances

    /**
     * Create the {@code builtins} module in the given context.
     *
     * @param ctx in which to create the module
     * @return the module (owned)
     */
    public static PyRef create(Context ctx) {
        PyRef module = ctx.newModule("builtins");
        try (PyRef.Borrow b = module.borrowMut()) {
            PyObject m = b.get();
            define(ctx, m, "callable", BuiltinsModule::callable);
            define(ctx, m, "iter", BuiltinsModule::iter);
            define(ctx, m, "len", BuiltinsModule::len);
            define(ctx, m, "next", BuiltinsModule::next);
            define(ctx, m, "str", BuiltinsModule::str);
            define(ctx, m, "type", BuiltinsModule::type);
            logger.atDebug().setMessage("builtins defines {}")
                    .addArgument(m.getAttributeNames()).log();
        }
        return module;
    }

    private static void define(Context ctx, PyObject module, String name,
            NativeFunction f) {
        module.setAttribute(name, ctx.newNativeFunction(name, f));
    }

    // Functions ------------------------------------------------------

    /** Implementation of Python {@code callable(o)}. */
    static PyRef callable(Executor rt, List<PyRef> args) {
        checkArgs("callable", args, 1);
        return rt.newBool(Callables.isCallable(args.get(0)));
    }

    /** Implementation of Python {@code iter(o)}. */
    static PyRef iter(Executor rt, List<PyRef> args) {
        checkArgs("iter", args, 1);
        return Iterators.iter(rt.context(), args.get(0));
    }

    /** Implementation of Python {@code len(o)}. */
    static PyRef len(Executor rt, List<PyRef> args) {
        checkArgs("len", args, 1);
        return rt.context().newInt(Abstract.size(args.get(0)));
    }

    /**
     * Implementation of Python {@code next(it)}, which raises
     * {@link StopIteration} when the iterator is exhausted.
     */
    static PyRef next(Executor rt, List<PyRef> args) {
        checkArgs("next", args, 1);
        PyRef item = Iterators.next(args.get(0));
        if (item == null) { throw new StopIteration(); }
        return item;
    }

    /** Implementation of Python {@code str(o)}. */
    static PyRef str(Executor rt, List<PyRef> args) {
        checkArgs("str", args, 1);
        return rt.newStr(Abstract.str(args.get(0)));
    }

    /**
     * Implementation of Python {@code type(o)}. The type of the root
     * type object, which has no type link, is itself.
     */
    static PyRef type(Executor rt, List<PyRef> args) {
        checkArgs("type", args, 1);
        PyRef t = args.get(0).read(PyObject::getType);
        return t != null ? t.share() : rt.getType();
    }

    /**
     * Check the number of arguments to a function.
     *
     * @param name of function
     * @param args supplied
     * @param n number expected
     * @throws TypeError if the number is wrong
     */
    private static void checkArgs(String name, List<PyRef> args, int n)
            throws TypeError {
        if (args.size() != n) {
            throw new TypeError(
                    "%s() takes exactly %d argument%s (%d given)", name,
                    n, n == 1 ? "" : "s", args.size());
        }
    }
}
