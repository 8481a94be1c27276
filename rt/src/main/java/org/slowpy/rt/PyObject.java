package org.slowpy.rt;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A Python object: exactly one {@link Kind}, fixed at construction, a
 * link to the object representing its type, and an open table of
 * attributes. Objects are only ever created wrapped in a {@link PyRef},
 * through {@link #create(Kind, PyRef)} or the factories of
 * {@link Context}, and are reached only through views opened on that
 * handle.
 * <p>
 * Handles returned by the accessors here are <i>borrowed</i>: the
 * object still holds them and the caller must {@link PyRef#share()}
 * one to keep it. Handles passed to mutators are <i>given</i>: the
 * object becomes their holder.
 */
public final class PyObject {

    private final PyRef ref;
    private final Kind kind;
    /** Type of this object, {@code null} only for {@code type} itself. */
    private final PyRef type;
    /** The {@code __dict__} of the object. */
    private final Map<String, PyRef> attributes = new HashMap<>();

    private PyObject(Kind kind, PyRef type) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.type = type;
        kind.attach(this);
        this.ref = new PyRef(this);
    }

    /**
     * Create an object of the given kind and type, with no attributes,
     * and return the only handle on it.
     *
     * @param kind of the new object
     * @param type object representing the type (shared, not given)
     * @return new handle (owned by the caller)
     */
    public static PyRef create(Kind kind, PyRef type) {
        Objects.requireNonNull(type, "type");
        return new PyObject(kind, type.share()).ref;
    }

    /**
     * Create the object that has no type link: the {@code type} object
     * made first in the bootstrap of a {@link Context}.
     *
     * @param kind of the root type object
     * @return new handle (owned by the caller)
     */
    static PyRef createRoot(PyClass kind) {
        return new PyObject(kind, null).ref;
    }

    /**
     * The tag of the kind of this object, which may be consulted without
     * opening a view, since it never changes.
     *
     * @return tag of the kind
     */
    public Kind.Tag getTag() { return kind.getTag(); }

    /**
     * The kind (value) of this object.
     *
     * @return the kind
     */
    public Kind getKind() {
        checkReadable();
        return kind;
    }

    /**
     * The type of this object (borrowed).
     *
     * @return type object or {@code null} for the root type
     */
    public PyRef getType() {
        checkReadable();
        return type;
    }

    /**
     * Look up an attribute in this object's own table (borrowed).
     *
     * @param name of attribute
     * @return value or {@code null} if not present
     */
    public PyRef getAttribute(String name) {
        checkReadable();
        return attributes.get(name);
    }

    /**
     * The names in the attribute table.
     *
     * @return unmodifiable view of the names
     */
    public Set<String> getAttributeNames() {
        checkReadable();
        return Collections.unmodifiableSet(attributes.keySet());
    }

    /**
     * Set an attribute in this object's own table, releasing any value
     * it replaces.
     *
     * @param name of attribute
     * @param value to set (given)
     */
    public void setAttribute(String name, PyRef value) {
        checkWritable();
        PyRef old = attributes.put(Objects.requireNonNull(name),
                Objects.requireNonNull(value));
        if (old != null) { old.release(); }
    }

    /**
     * Remove an attribute from this object's own table.
     *
     * @param name of attribute
     * @return the value removed (now owned by the caller) or
     *     {@code null} if not present
     */
    public PyRef removeAttribute(String name) {
        checkWritable();
        return attributes.remove(name);
    }

    /**
     * The text rendering of this object ({@code str()}).
     *
     * @return rendering
     */
    public String str() {
        checkReadable();
        return Renderer.render(this);
    }

    @Override
    public String toString() {
        // Without a view we may only say what kind it is.
        return ref.isReadable() ? str()
                : "<" + getTag().getTypeName() + ">";
    }

    /**
     * Apply an action to every handle this object holds: its type, its
     * attribute values and those held by its kind. Used in reclamation,
     * when no view can be open.
     *
     * @param action to apply
     */
    void forEachReference(Consumer<PyRef> action) {
        if (type != null) { action.accept(type); }
        attributes.values().forEach(action);
        kind.forEachReference(action);
    }

    void checkReadable() throws BorrowError {
        if (!ref.isReadable()) {
            throw new BorrowError("%s object accessed without a view",
                    getTag().getTypeName());
        }
    }

    void checkWritable() throws BorrowError {
        if (!ref.isWritable()) {
            throw new BorrowError(
                    "%s object modified without a write view",
                    getTag().getTypeName());
        }
    }
}
