package org.slowpy.rt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * The Python {@code list} object: a mutable sequence of handles, each
 * of which the list holds. Reading the list requires a view on the
 * owning object and changing it requires the write view.
 */
public final class PyList extends Kind implements Kind.Equatable {

    private final List<PyRef> elements;

    /** Construct empty. */
    public PyList() { this.elements = new ArrayList<>(); }

    /**
     * Construct from a collection of handles, which the list takes over
     * from the caller.
     *
     * @param elements of the new list (given)
     */
    public PyList(Collection<PyRef> elements) {
        this.elements = new ArrayList<>(elements);
    }

    @Override
    public Tag getTag() { return Tag.LIST; }

    /** @return number of elements */
    public int size() {
        checkReadable();
        return elements.size();
    }

    /**
     * Element at the given index (borrowed).
     *
     * @param i index
     * @return element
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public PyRef get(int i) {
        checkReadable();
        return elements.get(i);
    }

    /** @return unmodifiable view of the elements (borrowed) */
    public List<PyRef> getElements() {
        checkReadable();
        return Collections.unmodifiableList(elements);
    }

    /**
     * Append an element.
     *
     * @param e to append (given)
     */
    public void append(PyRef e) {
        checkWritable();
        elements.add(e);
    }

    /**
     * Replace the element at the given index, releasing the one
     * replaced.
     *
     * @param i index
     * @param e new element (given)
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public void set(int i, PyRef e) {
        checkWritable();
        elements.set(i, e).release();
    }

    /**
     * Remove the element at the given index.
     *
     * @param i index
     * @return the element (now owned by the caller)
     * @throws IndexOutOfBoundsException if {@code i} is out of range
     */
    public PyRef remove(int i) {
        checkWritable();
        return elements.remove(i);
    }

    /** Remove and release every element. */
    public void clear() {
        checkWritable();
        List<PyRef> old = new ArrayList<>(elements);
        elements.clear();
        old.forEach(PyRef::release);
    }

    @Override
    void render(Renderer r) {
        checkReadable();
        r.sequence(this, "[", elements, "]");
    }

    @Override
    void forEachReference(Consumer<PyRef> action) {
        elements.forEach(action);
    }

    /**
     * Lists are equal if they are the same length and their elements
     * are pairwise equal. The first unequal pair decides.
     */
    @Override
    public boolean equalTo(Kind other) {
        checkReadable();
        List<PyRef> a = elements, b = ((PyList)other).getElements();
        if (a.size() != b.size()) { return false; }
        for (int i = 0; i < a.size(); i++) {
            if (!Comparison.equal(a.get(i), b.get(i))) { return false; }
        }
        return true;
    }

    // slot functions -------------------------------------------------

    /** Concatenation, sharing the elements of both operands. */
    static Kind add(Kind v, Kind w) {
        try {
            List<PyRef> a = ((PyList)v).getElements();
            List<PyRef> b = ((PyList)w).getElements();
            List<PyRef> r = new ArrayList<>(a.size() + b.size());
            for (PyRef e : a) { r.add(e.share()); }
            for (PyRef e : b) { r.add(e.share()); }
            return new PyList(r);
        } catch (ClassCastException cce) {
            throw PyLong.typeMismatch(v instanceof PyList ? w : v,
                    Tag.LIST);
        }
    }
}
