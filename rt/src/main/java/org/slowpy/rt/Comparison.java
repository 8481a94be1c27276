package org.slowpy.rt;

/**
 * The rich comparison operations. Equality is defined between two
 * objects of the same kind when that kind is {@link Kind.Equatable},
 * and ordering when it is {@link Kind.Orderable}. Every other pairing
 * raises {@link TypeError}: we never guess that unlike objects are
 * unequal, nor invent an order.
 */
public enum Comparison {

    /** The {@code __lt__} operation. */
    LT("<") {

        @Override
        boolean test(PyRef v, PyRef w) {
            return order(this, v, w) < 0;
        }
    },

    /** The {@code __le__} operation. */
    LE("<=") {

        @Override
        boolean test(PyRef v, PyRef w) {
            return order(this, v, w) <= 0;
        }
    },

    /** The {@code __eq__} operation. */
    EQ("==") {

        @Override
        boolean test(PyRef v, PyRef w) { return equal(v, w); }
    },

    /** The {@code __ne__} operation. */
    NE("!=") {

        @Override
        boolean test(PyRef v, PyRef w) { return !equal(v, w); }
    },

    /** The {@code __gt__} operation. */
    GT(">") {

        @Override
        boolean test(PyRef v, PyRef w) {
            return order(this, v, w) > 0;
        }
    },

    /** The {@code __ge__} operation. */
    GE(">=") {

        @Override
        boolean test(PyRef v, PyRef w) {
            return order(this, v, w) >= 0;
        }
    };

    final String text;

    Comparison(String text) { this.text = text; }

    /** @return the operator as written in Python */
    public String getText() { return text; }

    /**
     * Apply this comparison to two objects.
     *
     * @param v left operand
     * @param w right operand
     * @return the outcome
     * @throws TypeError if the operands do not support it
     */
    abstract boolean test(PyRef v, PyRef w) throws TypeError;

    /**
     * Apply this comparison to two objects, and make a {@code bool}
     * object of the outcome.
     *
     * @param ctx to make the result
     * @param v left operand
     * @param w right operand
     * @return new {@code bool} object
     * @throws TypeError if the operands do not support it
     */
    public PyRef apply(Context ctx, PyRef v, PyRef w) throws TypeError {
        return ctx.newBool(test(v, w));
    }

    /**
     * Python {@code v == w}, where {@code v} and {@code w} have the same
     * kind and it supports equality. Lists compare element by element,
     * stopping at the first unequal pair.
     *
     * @param v left operand
     * @param w right operand
     * @return whether equal
     * @throws TypeError if the operands cannot be compared for equality
     * @throws RecursionError if lists are nested too deeply (or contain
     *     themselves)
     */
    public static boolean equal(PyRef v, PyRef w)
            throws TypeError, RecursionError {
        try (RecursionState r = RecursionState.enter("comparison");
                PyRef.Borrow bv = v.borrow();
                PyRef.Borrow bw = w.borrow()) {
            Kind a = bv.get().getKind();
            Kind b = bw.get().getKind();
            if (a.getTag() != b.getTag()
                    || !(a instanceof Kind.Equatable)) {
                throw notSupported(EQ, a, b);
            }
            // Identity implies equality (and ends self-recursion).
            return v == w || ((Kind.Equatable)a).equalTo(b);
        }
    }

    /**
     * Order {@code v} relative to {@code w}, where they have the same
     * kind and it supports ordering. A failure is reported as if from
     * {@code <}: use {@link #order(Comparison, PyRef, PyRef)} to name
     * another operator.
     *
     * @param v left operand
     * @param w right operand
     * @return negative, zero or positive as {@code v<w}, {@code v==w} or
     *     {@code v>w}
     * @throws TypeError if the operands cannot be ordered
     */
    public static int compare(PyRef v, PyRef w) throws TypeError {
        return order(LT, v, w);
    }

    /**
     * Order {@code v} relative to {@code w}, where they have the same
     * kind and it supports ordering.
     *
     * @param op to name in the message if the operands cannot be ordered
     * @param v left operand
     * @param w right operand
     * @return negative, zero or positive as {@code v<w}, {@code v==w} or
     *     {@code v>w}
     * @throws TypeError if the operands cannot be ordered
     */
    public static int order(Comparison op, PyRef v, PyRef w)
            throws TypeError {
        try (PyRef.Borrow bv = v.borrow(); PyRef.Borrow bw = w.borrow()) {
            Kind a = bv.get().getKind();
            Kind b = bw.get().getKind();
            if (a.getTag() != b.getTag()
                    || !(a instanceof Kind.Orderable)) {
                throw notSupported(op, a, b);
            }
            return ((Kind.Orderable)a).compareWith(b);
        }
    }

    private static TypeError notSupported(Comparison op, Kind v, Kind w) {
        return new TypeError(
                "'%s' not supported between instances of '%.100s' and "
                        + "'%.100s'",
                op.text, v.getTag().getTypeName(),
                w.getTag().getTypeName());
    }
}
