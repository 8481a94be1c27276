package org.slowpy.rt;

/**
 * The Python {@code int} object, limited here to the range of a 32-bit
 * signed integer. Arithmetic that leaves this range raises
 * {@link OverflowError} rather than wrapping.
 */
public final class PyLong extends Kind
        implements Kind.Equatable, Kind.Orderable {

    final int value;

    /**
     * Construct from a Java {@code int}.
     *
     * @param value of the integer
     */
    public PyLong(int value) { this.value = value; }

    /** @return the value */
    public int getValue() { return value; }

    @Override
    public Tag getTag() { return Tag.INT; }

    @Override
    void render(Renderer r) { r.append(Integer.toString(value)); }

    @Override
    public boolean equalTo(Kind other) {
        return value == ((PyLong)other).value;
    }

    @Override
    public int compareWith(Kind other) {
        return Integer.compare(value, ((PyLong)other).value);
    }

    // slot functions -------------------------------------------------

    static Kind add(Kind v, Kind w) {
        try {
            return new PyLong(Math.addExact(valueOf(v), valueOf(w)));
        } catch (ArithmeticException ae) {
            throw new OverflowError(INT_OVERFLOW, "addition");
        }
    }

    static Kind sub(Kind v, Kind w) {
        try {
            return new PyLong(Math.subtractExact(valueOf(v), valueOf(w)));
        } catch (ArithmeticException ae) {
            throw new OverflowError(INT_OVERFLOW, "subtraction");
        }
    }

    static Kind mul(Kind v, Kind w) {
        try {
            return new PyLong(Math.multiplyExact(valueOf(v), valueOf(w)));
        } catch (ArithmeticException ae) {
            throw new OverflowError(INT_OVERFLOW, "multiplication");
        }
    }

    /** Division truncating towards zero (Java semantics). */
    static Kind div(Kind v, Kind w) {
        int a = valueOf(v), b = valueOf(w);
        if (b == 0) {
            throw new DivisionByZeroError("integer division by zero");
        } else if (a == Integer.MIN_VALUE && b == -1) {
            throw new OverflowError(INT_OVERFLOW, "division");
        }
        return new PyLong(a / b);
    }

    private static final String INT_OVERFLOW =
            "integer %s result out of range";

    /**
     * Check the argument is a {@code PyLong} and return its value.
     *
     * @param v ought to be a {@code PyLong}
     * @return the {@link #value} field of {@code v}
     * @throws InterpreterError if {@code v} is not compatible
     */
    static int valueOf(Kind v) throws InterpreterError {
        try {
            return ((PyLong)v).value;
        } catch (ClassCastException cce) {
            throw typeMismatch(v, Tag.INT);
        }
    }

    /** Helper to create an exception for internal type error. */
    static InterpreterError typeMismatch(Kind v, Tag expected) {
        return new InterpreterError(
                "'%s' argument to slot where '%s' expected",
                v.getTag().getTypeName(), expected.getTypeName());
    }
}
