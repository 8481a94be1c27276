package org.slowpy.rt;

/** The Python {@code str} object. */
public final class PyUnicode extends Kind implements Kind.Equatable {

    final String value;

    /**
     * Construct from a Java {@code String}.
     *
     * @param value of the string
     */
    public PyUnicode(String value) { this.value = value; }

    /** @return the value */
    public String getValue() { return value; }

    @Override
    public Tag getTag() { return Tag.STR; }

    @Override
    void render(Renderer r) { r.append(value); }

    @Override
    public boolean equalTo(Kind other) {
        return value.equals(((PyUnicode)other).value);
    }

    // slot functions -------------------------------------------------

    static Kind add(Kind v, Kind w) {
        String a = valueOf(v), b = valueOf(w);
        if ((long)a.length() + b.length() > MAX_LENGTH) {
            throw new OverflowError("strings are too large to concat");
        }
        return new PyUnicode(a.concat(b));
    }

    /** Repetition: a count of zero or less gives the empty string. */
    static Kind mul(Kind v, Kind w) {
        String s = valueOf(v);
        int n = PyLong.valueOf(w);
        if (n <= 0 || s.isEmpty()) {
            return new PyUnicode("");
        } else if ((long)s.length() * n > MAX_LENGTH) {
            throw new OverflowError("repeated string is too long");
        }
        return new PyUnicode(s.repeat(n));
    }

    /**
     * Length of the longest {@code str} we will make. A Java array may
     * have at most {@code Integer.MAX_VALUE - 8} elements, and a string
     * may need two bytes of array for each {@code char}.
     */
    static final int MAX_LENGTH = (Integer.MAX_VALUE - 8) / 2;

    private static String valueOf(Kind v) throws InterpreterError {
        try {
            return ((PyUnicode)v).value;
        } catch (ClassCastException cce) {
            throw PyLong.typeMismatch(v, Tag.STR);
        }
    }
}
