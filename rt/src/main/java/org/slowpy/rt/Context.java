package org.slowpy.rt;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The holder, for one interpreter instance, of the canonical type
 * objects, the {@code None} object and the operator table, and the
 * source of newly-made objects correctly linked to their types. There is
 * no global context: every component that makes objects is given one.
 * <p>
 * The type objects are made in a definite order. The object
 * {@code type} comes first, and its own type link is absent (rather than
 * pointing to itself, which would be a reference cycle). Every other
 * type object then has {@code type} as its type. These objects, and
 * {@code None}, are held by the context for as long as it exists.
 * <p>
 * Each factory method makes a new object every time it is called, even
 * for equal values, and returns the only handle on it. Every handle a
 * context returns is owned by the caller.
 */
public class Context {

    /** Logger for the context. */
    static final Logger logger = LoggerFactory.getLogger(Context.class);

    /** The type objects of the built-in kinds, by kind. */
    private final Map<Kind.Tag, PyRef> types =
            new EnumMap<>(Kind.Tag.class);

    /** The type object {@code type}. */
    private final PyRef typeType;

    /** The {@code None} object. */
    private final PyRef none;

    /** Arithmetic operations available in this context. */
    private final OperatorTable operators;

    /** Create a context and the built-in type objects. */
    public Context() {
        this.typeType = PyObject.createRoot(new PyClass("type"));
        types.put(Kind.Tag.CLASS, typeType);
        for (Kind.Tag tag : Kind.Tag.values()) {
            if (tag != Kind.Tag.CLASS) {
                logger.atDebug().setMessage("creating type {}")
                        .addArgument(tag.getTypeName()).log();
                types.put(tag, PyObject
                        .create(new PyClass(tag.getTypeName()), typeType));
            }
        }
        this.none = newObject(new PyNone());
        this.operators = OperatorTable.withBuiltinRules();
        logger.atInfo().setMessage("Context ready with {} built-in types")
                .addArgument(types.size()).log();
    }

    /** @return the type object {@code type} (owned) */
    public PyRef getTypeType() { return typeType.share(); }

    /** @return the type object {@code int} (owned) */
    public PyRef getIntType() { return typeFor(Kind.Tag.INT); }

    /**
     * The type object of objects of the given kind.
     *
     * @param tag of the kind
     * @return the type object (owned)
     */
    public PyRef typeFor(Kind.Tag tag) { return types.get(tag).share(); }

    /** @return the {@code None} object (owned) */
    public PyRef getNone() { return none.share(); }

    /** @return the arithmetic operations of this context */
    public OperatorTable getOperators() { return operators; }

    /**
     * Make an object of the given kind, linked to the type object for
     * that kind.
     *
     * @param kind of the new object
     * @return new object
     */
    public PyRef newObject(Kind kind) {
        return PyObject.create(kind, types.get(kind.getTag()));
    }

    /**
     * Make an {@code int}.
     *
     * @param value of the int
     * @return new object
     */
    public PyRef newInt(int value) { return newObject(new PyLong(value)); }

    /**
     * Make a {@code str}.
     *
     * @param value of the str
     * @return new object
     */
    public PyRef newStr(String value) {
        return newObject(new PyUnicode(value));
    }

    /**
     * Make a {@code bool}.
     *
     * @param value of the bool
     * @return new object
     */
    public PyRef newBool(boolean value) {
        return newObject(new PyBool(value));
    }

    /**
     * Make a {@code list} of handles the caller gives up to the list.
     *
     * @param elements of the list (given)
     * @return new object
     */
    public PyRef newList(List<PyRef> elements) {
        return newObject(new PyList(elements));
    }

    /**
     * Make a {@code list} of handles the caller gives up to the list.
     *
     * @param elements of the list (given)
     * @return new object
     */
    public PyRef newList(PyRef... elements) {
        return newList(Arrays.asList(elements));
    }

    /**
     * Make a {@code tuple} of handles the caller gives up to the tuple.
     *
     * @param elements of the tuple (given)
     * @return new object
     */
    public PyRef newTuple(List<PyRef> elements) {
        return newObject(new PyTuple(elements));
    }

    /**
     * Make a {@code tuple} of handles the caller gives up to the tuple.
     *
     * @param elements of the tuple (given)
     * @return new object
     */
    public PyRef newTuple(PyRef... elements) {
        return newObject(new PyTuple(elements));
    }

    /** @return new empty {@code dict} */
    public PyRef newDict() { return newObject(new PyDict()); }

    /**
     * Make a {@code dict} from a map whose value handles the caller
     * gives up to the dictionary.
     *
     * @param map initial content (values given)
     * @return new object
     */
    public PyRef newDict(Map<String, PyRef> map) {
        return newObject(new PyDict(map));
    }

    /**
     * Make an iterator at the start of the given object. Whether the
     * object can be iterated is only checked when the iterator is
     * advanced. (Use {@link Iterators#iter(Context, PyRef)} to check
     * first.)
     *
     * @param target to iterate (shared)
     * @return new object
     */
    public PyRef newIterator(PyRef target) {
        return newObject(new PyIterator(target.share()));
    }

    /**
     * Make a {@code slice}.
     *
     * @param start or {@code null}
     * @param stop or {@code null}
     * @param step or {@code null}
     * @return new object
     */
    public PyRef newSlice(Integer start, Integer stop, Integer step) {
        return newObject(new PySlice(start, stop, step));
    }

    /**
     * Make a marker for an unresolved name.
     *
     * @param name not found
     * @return new object
     */
    public PyRef newNameError(String name) {
        return newObject(new PyNameError(name));
    }

    /**
     * Make a {@code code} object.
     *
     * @param code compiled program (opaque)
     * @return new object
     */
    public PyRef newCode(Object code) { return newObject(new PyCode(code)); }

    /**
     * Make a function defined by a compiled program.
     *
     * @param code compiled program (opaque)
     * @return new object
     */
    public PyRef newFunction(Object code) {
        return newObject(new PyFunction(code));
    }

    /**
     * Make a {@code module} object with no members.
     *
     * @param name of module
     * @return new object
     */
    public PyRef newModule(String name) {
        return newObject(new PyModule(name));
    }

    /**
     * Make a class, an object whose type is {@code type}.
     *
     * @param name of class
     * @return new object
     */
    public PyRef newClass(String name) {
        return newObject(new PyClass(name));
    }

    /**
     * Make a built-in function.
     *
     * @param name of the function
     * @param function implementation
     * @return new object
     */
    public PyRef newNativeFunction(String name, NativeFunction function) {
        return newObject(new PyJavaFunction(name, function));
    }
}
