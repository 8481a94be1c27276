package org.slowpy.rt;

/**
 * The "abstract object" interface: operations on any object, in the
 * manner of CPython {@code abstract.h}. Each method opens the views it
 * needs on the handles it is given, and closes them before it returns.
 * Handles returned are owned by the caller.
 */
public class Abstract {

    private Abstract() {} // no instances

    /**
     * Python {@code str(o)}.
     *
     * @param o object
     * @return its rendering
     */
    public static String str(PyRef o) { return o.read(PyObject::str); }

    /**
     * Name of the Python type of {@code o}.
     *
     * @param o object
     * @return its type name
     */
    public static String typeName(PyRef o) {
        return o.getTag().getTypeName();
    }

    /**
     * Python truth of {@code o}: {@code None} is false, a {@code bool}
     * is its value, an {@code int} is true when not zero, and a
     * {@code str}, {@code list}, {@code tuple} or {@code dict} when not
     * empty. Anything else is true.
     *
     * @param o object
     * @return truth of {@code o}
     */
    public static boolean isTrue(PyRef o) {
        try (PyRef.Borrow b = o.borrow()) {
            Kind k = b.get().getKind();
            switch (k.getTag()) {
                case NONE:
                    return false;
                case BOOL:
                    return ((PyBool)k).getValue();
                case INT:
                    return ((PyLong)k).getValue() != 0;
                case STR:
                    return !((PyUnicode)k).getValue().isEmpty();
                case LIST:
                case TUPLE:
                case DICT:
                    return lengthOf(k) != 0;
                default:
                    return true;
            }
        }
    }

    /**
     * Python {@code len(o)}. The length of a {@code str} is in code
     * points.
     *
     * @param o object
     * @return its length
     * @throws TypeError if {@code o} has no length
     */
    public static int size(PyRef o) throws TypeError {
        try (PyRef.Borrow b = o.borrow()) {
            return lengthOf(b.get().getKind());
        }
    }

    private static int lengthOf(Kind k) throws TypeError {
        if (k instanceof PyUnicode) {
            String s = ((PyUnicode)k).getValue();
            return s.codePointCount(0, s.length());
        } else if (k instanceof PyList) {
            return ((PyList)k).size();
        } else if (k instanceof PyTuple) {
            return ((PyTuple)k).size();
        } else if (k instanceof PyDict) {
            return ((PyDict)k).size();
        }
        throw new TypeError(HAS_NO_LEN, k.getTag().getTypeName());
    }

    // Attribute access -----------------------------------------------

    /**
     * Python {@code o.name}: look in the attribute table of the object,
     * then in that of its type.
     *
     * @param o object
     * @param name of attribute
     * @return value (owned)
     * @throws AttributeError if the name is not found
     */
    public static PyRef getAttr(PyRef o, String name)
            throws AttributeError {
        try (PyRef.Borrow b = o.borrow()) {
            PyObject obj = b.get();
            PyRef v = obj.getAttribute(name);
            if (v != null) { return v.share(); }
            PyRef type = obj.getType();
            if (type != null && type != o) {
                v = type.read(t -> t.getAttribute(name));
                if (v != null) { return v.share(); }
            }
        }
        throw noAttribute(o, name);
    }

    /**
     * Python {@code hasattr(o, name)}.
     *
     * @param o object
     * @param name of attribute
     * @return {@code true} if {@link #getAttr(PyRef, String)} would
     *     succeed
     */
    public static boolean hasAttr(PyRef o, String name) {
        try {
            getAttr(o, name).release();
            return true;
        } catch (AttributeError ae) {
            return false;
        }
    }

    /**
     * Python {@code o.name = v}: set in the attribute table of the
     * object.
     *
     * @param o object
     * @param name of attribute
     * @param v value (shared)
     */
    public static void setAttr(PyRef o, String name, PyRef v) {
        PyRef value = v.share();
        try (PyRef.Borrow b = o.borrowMut()) {
            b.get().setAttribute(name, value);
        }
    }

    /**
     * Python {@code del o.name}: remove from the attribute table of the
     * object.
     *
     * @param o object
     * @param name of attribute
     * @throws AttributeError if the object has no such attribute of its
     *     own
     */
    public static void delAttr(PyRef o, String name) throws AttributeError {
        PyRef old;
        try (PyRef.Borrow b = o.borrowMut()) {
            old = b.get().removeAttribute(name);
        }
        if (old == null) { throw noAttribute(o, name); }
        old.release();
    }

    private static AttributeError noAttribute(PyRef o, String name) {
        return new AttributeError(NO_ATTRIBUTE, typeName(o), name);
    }

    // Item access ----------------------------------------------------

    /**
     * Python {@code o[key]} where {@code o} is a {@code list},
     * {@code tuple} or {@code str} indexed by an {@code int} (negative
     * counting from the end), or a {@code dict} with a {@code str} key.
     *
     * @param ctx to make a result where necessary
     * @param o object
     * @param key index or key
     * @return the item (owned)
     * @throws TypeError if {@code o} is not subscriptable, or by a key
     *     of this type
     * @throws IndexError if an index is out of range
     * @throws KeyError if a key is not present in a {@code dict}
     */
    public static PyRef getItem(Context ctx, PyRef o, PyRef key)
            throws TypeError, IndexError, KeyError {
        try (PyRef.Borrow bo = o.borrow(); PyRef.Borrow bk = key.borrow()) {
            Kind k = bo.get().getKind();
            Kind kk = bk.get().getKind();
            if (k instanceof PyDict) {
                String s = keyOf(k, kk);
                PyRef v = ((PyDict)k).get(s);
                if (v == null) { throw new KeyError("'%s'", s); }
                return v.share();
            } else if (k instanceof PyList) {
                PyList list = (PyList)k;
                return list.get(indexOf(k, kk, list.size())).share();
            } else if (k instanceof PyTuple) {
                PyTuple tuple = (PyTuple)k;
                return tuple.get(indexOf(k, kk, tuple.size())).share();
            } else if (k instanceof PyUnicode) {
                // Index by code point, not by UTF-16 char.
                String s = ((PyUnicode)k).getValue();
                int i = indexOf(k, kk, s.codePointCount(0, s.length()));
                int start = s.offsetByCodePoints(0, i);
                return ctx.newStr(
                        s.substring(start, s.offsetByCodePoints(start, 1)));
            }
            throw new TypeError(NOT_SUBSCRIPTABLE, typeName(o));
        }
    }

    /**
     * Python {@code o[key] = v} where {@code o} is a {@code list}
     * indexed by an {@code int} (negative counting from the end), or a
     * {@code dict} with a {@code str} key.
     *
     * @param o object
     * @param key index or key
     * @param v value (shared)
     * @throws TypeError if {@code o} does not support item assignment,
     *     or by a key of this type
     * @throws IndexError if an index is out of range
     */
    public static void setItem(PyRef o, PyRef key, PyRef v)
            throws TypeError, IndexError {
        // Read the key before writing o: they may be the same object.
        Kind kk = key.read(PyObject::getKind);
        try (PyRef.Borrow bo = o.borrowMut()) {
            Kind k = bo.get().getKind();
            if (k instanceof PyDict) {
                ((PyDict)k).put(keyOf(k, kk), v.share());
            } else if (k instanceof PyList) {
                PyList list = (PyList)k;
                list.set(indexOf(k, kk, list.size()), v.share());
            } else {
                throw new TypeError(NOT_ITEM_ASSIGNMENT, typeName(o));
            }
        }
    }

    /** The text of a key, which must be a {@code str}. */
    private static String keyOf(Kind container, Kind key)
            throws TypeError {
        if (key instanceof PyUnicode) {
            return ((PyUnicode)key).getValue();
        }
        throw new TypeError("%s keys must be str, not %s",
                container.getTag().getTypeName(),
                key.getTag().getTypeName());
    }

    /**
     * An index into a sequence of the given size, where a negative index
     * counts from the end.
     */
    private static int indexOf(Kind seq, Kind key, int size)
            throws TypeError, IndexError {
        if (!(key instanceof PyLong)) {
            throw new TypeError(
                    "%s indices must be integers, not %s",
                    seq.getTag().getTypeName(),
                    key.getTag().getTypeName());
        }
        int i = ((PyLong)key).getValue();
        if (i < 0) { i += size; }
        if (i < 0 || i >= size) {
            throw new IndexError("%s index out of range",
                    seq.getTag().getTypeName());
        }
        return i;
    }

    private static final String HAS_NO_LEN =
            "object of type '%.200s' has no len()";
    private static final String NO_ATTRIBUTE =
            "'%.50s' object has no attribute '%.400s'";
    private static final String NOT_SUBSCRIPTABLE =
            "'%.200s' object is not subscriptable";
    private static final String NOT_ITEM_ASSIGNMENT =
            "'%.200s' object does not support item assignment";
}
