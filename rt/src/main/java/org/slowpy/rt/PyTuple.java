package org.slowpy.rt;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/** The Python {@code tuple} object: an immutable sequence of handles. */
public final class PyTuple extends Kind {

    private final PyRef[] elements;

    /**
     * Construct from handles, which the tuple takes over from the
     * caller.
     *
     * @param elements of the tuple (given)
     */
    public PyTuple(PyRef... elements) {
        this.elements = Arrays.copyOf(elements, elements.length);
    }

    /**
     * Construct from a collection of handles, which the tuple takes
     * over from the caller.
     *
     * @param elements of the tuple (given)
     */
    public PyTuple(Collection<PyRef> elements) {
        this.elements = elements.toArray(new PyRef[0]);
    }

    @Override
    public Tag getTag() { return Tag.TUPLE; }

    /** @return number of elements */
    public int size() { return elements.length; }

    /**
     * Element at the given index (borrowed).
     *
     * @param i index
     * @return element
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public PyRef get(int i) { return elements[i]; }

    /** @return unmodifiable view of the elements (borrowed) */
    public List<PyRef> getElements() {
        return Collections.unmodifiableList(Arrays.asList(elements));
    }

    @Override
    void render(Renderer r) {
        r.sequence(this, "{", Arrays.asList(elements), "}");
    }

    @Override
    void forEachReference(Consumer<PyRef> action) {
        for (PyRef e : elements) { action.accept(e); }
    }
}
