package org.slowpy.rt;

/**
 * Binary arithmetic on objects. Compare CPython {@code abstract.h}:
 * {@code PyNumber_*}. The implementation is found in the
 * {@link OperatorTable} of the context by the kinds of the operands, and
 * a combination the table does not define raises {@link TypeError}.
 * Each method opens read views on both operands while it works, and
 * returns a new object (owned by the caller).
 */
public class Number {

    private Number() {} // no instances

    /** Python {@code v+w} */
    public static PyRef add(Context ctx, PyRef v, PyRef w)
            throws PyException {
        return binaryOp(ctx, BinaryOp.ADD, v, w);
    }

    /** Python {@code v-w} */
    public static PyRef subtract(Context ctx, PyRef v, PyRef w)
            throws PyException {
        return binaryOp(ctx, BinaryOp.SUB, v, w);
    }

    /** Python {@code v*w} */
    public static PyRef multiply(Context ctx, PyRef v, PyRef w)
            throws PyException {
        return binaryOp(ctx, BinaryOp.MUL, v, w);
    }

    /** Python {@code v/w} on integers, truncating towards zero. */
    public static PyRef divide(Context ctx, PyRef v, PyRef w)
            throws PyException {
        return binaryOp(ctx, BinaryOp.DIV, v, w);
    }

    /**
     * Apply a binary operation to two objects.
     *
     * @param ctx context supplying the operator table and result type
     * @param op operation
     * @param v left operand
     * @param w right operand
     * @return new object holding the result
     * @throws TypeError if the operation is not defined for the operands
     * @throws PyException for errors in the operation (such as
     *     {@link OverflowError})
     */
    public static PyRef binaryOp(Context ctx, BinaryOp op, PyRef v,
            PyRef w) throws TypeError, PyException {
        Kind result;
        try (PyRef.Borrow bv = v.borrow(); PyRef.Borrow bw = w.borrow()) {
            Kind a = bv.get().getKind();
            Kind b = bw.get().getKind();
            try {
                result = ctx.getOperators()
                        .lookup(op, a.getTag(), b.getTag()).apply(a, b);
            } catch (OperatorTable.EmptyException e) {
                throw typeError(op, a, b);
            }
        }
        return ctx.newObject(result);
    }

    /** Create a {@code TypeError} for the named binary op. */
    static TypeError typeError(BinaryOp op, Kind v, Kind w) {
        return new TypeError(
                "unsupported operand type(s) for %.100s: "
                        + "'%.100s' and '%.100s'",
                op.getSymbol(), v.getTag().getTypeName(),
                w.getTag().getTypeName());
    }
}
