package org.slowpy.rt;

import java.util.List;

/**
 * An {@link Executor} able to call only functions implemented in Java.
 * It serves a host that has no evaluator of compiled code, and tests. A
 * function defined in Python cannot be run here, and calling one raises
 * {@link NotImplementedError}.
 */
public class NativeExecutor implements Executor {

    private final Context context;

    /**
     * Create an executor for objects of the given context.
     *
     * @param context of the objects
     */
    public NativeExecutor(Context context) { this.context = context; }

    @Override
    public PyRef call(PyRef callable, List<PyRef> args)
            throws BaseException {
        if (callable.getTag() == Kind.Tag.FUNCTION) {
            throw new NotImplementedError(
                    "no evaluator for functions defined in Python");
        }
        return Callables.call(this, callable, args);
    }

    @Override
    public PyRef newStr(String s) { return context.newStr(s); }

    @Override
    public PyRef newBool(boolean b) { return context.newBool(b); }

    @Override
    public PyRef getNone() { return context.getNone(); }

    @Override
    public PyRef getType() { return context.getTypeType(); }

    @Override
    public Context context() { return context; }
}
