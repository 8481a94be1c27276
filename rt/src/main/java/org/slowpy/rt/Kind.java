package org.slowpy.rt;

import java.util.function.Consumer;

/**
 * The value carried by a {@link PyObject}. There is one concrete
 * (final) sub-class for each kind of object the runtime supports, and
 * the set is closed: only this package can add to it. Each kind must
 * say how it renders, so a new kind without a rendering will not
 * compile.
 * <p>
 * Capabilities that only some kinds have are expressed by the nested
 * interfaces {@link Equatable} and {@link Orderable}, which
 * {@link Comparison} checks before it dispatches.
 */
public abstract class Kind {

    /** Constants identifying each kind, with the Python type name. */
    public enum Tag {
        STR("str"), //
        INT("int"), //
        BOOL("bool"), //
        LIST("list"), //
        TUPLE("tuple"), //
        DICT("dict"), //
        ITERATOR("iterator"), //
        SLICE("slice"), //
        NAME_ERROR("NameError"), //
        CODE("code"), //
        FUNCTION("function"), //
        MODULE("module"), //
        NONE("NoneType"), //
        CLASS("type"), //
        NATIVE_FUNCTION("builtin_function_or_method");

        private final String typeName;

        Tag(String typeName) { this.typeName = typeName; }

        /** @return name of the Python type of objects of this kind */
        public String getTypeName() { return typeName; }
    }

    /** A kind that supports {@code ==} with others of the same tag. */
    public interface Equatable {

        /**
         * Whether this value equals another of the same tag.
         *
         * @param other of the same tag as this
         * @return {@code true} if equal
         */
        boolean equalTo(Kind other);
    }

    /** A kind that supports ordering with others of the same tag. */
    public interface Orderable {

        /**
         * Compare this value with another of the same tag.
         *
         * @param other of the same tag as this
         * @return negative, zero or positive, as for
         *     {@link Comparable#compareTo(Object)}
         */
        int compareWith(Kind other);
    }

    /** The object this kind belongs to, once attached. */
    private PyObject owner;

    Kind() {}

    /** @return the tag identifying this kind */
    public abstract Kind.Tag getTag();

    /**
     * Append the rendering of this value to the renderer.
     *
     * @param r to receive the text
     */
    abstract void render(Renderer r);

    /**
     * Apply an action to every handle held by this value. Kinds that
     * hold none need not override this.
     *
     * @param action to apply
     */
    void forEachReference(Consumer<PyRef> action) {}

    /**
     * Bind this kind to the object that carries it. A kind belongs to
     * one object for life.
     */
    final void attach(PyObject object) {
        if (owner != null) {
            throw new InterpreterError(
                    "%s value already belongs to an object",
                    getTag().getTypeName());
        }
        owner = object;
    }

    /** @return the object carrying this value */
    final PyObject getOwner() { return owner; }

    /** Check a read (or write) view is open on the owning object. */
    final void checkReadable() throws BorrowError {
        if (owner != null) { owner.checkReadable(); }
    }

    /** Check the write view is open on the owning object. */
    final void checkWritable() throws BorrowError {
        if (owner != null) { owner.checkWritable(); }
    }
}
