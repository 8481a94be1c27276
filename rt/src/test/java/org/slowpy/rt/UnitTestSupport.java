package org.slowpy.rt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs.
 */
class UnitTestSupport {

    /**
     * The value of an {@code int} object.
     *
     * @param v handle on an {@code int}
     * @return its value
     */
    static int intValue(PyRef v) {
        return v.read(o -> ((PyLong)o.getKind()).getValue());
    }

    /**
     * The value of a {@code str} object.
     *
     * @param v handle on a {@code str}
     * @return its value
     */
    static String strValue(PyRef v) {
        return v.read(o -> ((PyUnicode)o.getKind()).getValue());
    }

    /**
     * The value of a {@code bool} object.
     *
     * @param v handle on a {@code bool}
     * @return its value
     */
    static boolean boolValue(PyRef v) {
        return v.read(o -> ((PyBool)o.getKind()).getValue());
    }

    /**
     * Make a {@code list} of {@code int} objects.
     *
     * @param ctx in which to make them
     * @param values of the elements
     * @return new list
     */
    static PyRef intList(Context ctx, int... values) {
        List<PyRef> elements = new ArrayList<>();
        for (int v : values) { elements.add(ctx.newInt(v)); }
        return ctx.newList(elements);
    }

    /**
     * Append an element to a list through a write view.
     *
     * @param list to append to
     * @param e element (given)
     */
    static void append(PyRef list, PyRef e) {
        try (PyRef.Borrow b = list.borrowMut()) {
            ((PyList)b.get().getKind()).append(e);
        }
    }

    /**
     * Assert that an object is of the given kind and renders as
     * expected.
     *
     * @param tag expected
     * @param expected rendering
     * @param actual object
     */
    static void assertRendered(Kind.Tag tag, String expected, PyRef actual) {
        assertEquals(tag, actual.getTag());
        assertEquals(expected, Abstract.str(actual));
    }
}
