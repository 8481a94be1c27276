package org.slowpy.rt;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Accumulates the text rendering ({@code str()}) of an object. Each
 * {@link Kind} appends itself, and containers ask for their elements in
 * turn. A container met again while its own rendering is in progress
 * renders as its brackets around {@code ...}, so that a structure that
 * contains itself renders finitely.
 */
final class Renderer {

    private final StringBuilder buf = new StringBuilder();

    /** Containers whose rendering is in progress. */
    private final Set<PyObject> active =
            Collections.newSetFromMap(new IdentityHashMap<>());

    private Renderer() {}

    /**
     * Render the given object, on which a view is already open.
     *
     * @param object to render
     * @return the rendering
     */
    static String render(PyObject object) {
        Renderer r = new Renderer();
        object.getKind().render(r);
        return r.buf.toString();
    }

    /**
     * Append text to the rendering.
     *
     * @param s text to append
     * @return this
     */
    Renderer append(String s) {
        buf.append(s);
        return this;
    }

    /**
     * Append the rendering of the object held by a handle, opening a
     * read view on it while we do so.
     *
     * @param ref handle on the object
     * @return this
     */
    Renderer append(PyRef ref) {
        try (PyRef.Borrow b = ref.borrow()) {
            b.get().getKind().render(this);
        }
        return this;
    }

    /**
     * Append the rendering of a sequence of handles, separated by
     * {@code ", "} and enclosed in the given brackets.
     *
     * @param container the kind (list or tuple) being rendered
     * @param open bracket
     * @param elements to render
     * @param close bracket
     * @return this
     */
    Renderer sequence(Kind container, String open,
            Iterable<PyRef> elements, String close) {
        return enclosed(container, open, close, () -> {
            String sep = "";
            for (PyRef e : elements) {
                buf.append(sep);
                append(e);
                sep = ", ";
            }
        });
    }

    /**
     * Append the rendering of a container, given an action that renders
     * its contents, and guard against a container that (directly or
     * indirectly) contains itself.
     *
     * @param container the kind being rendered
     * @param open bracket
     * @param close bracket
     * @param contents action rendering the contents
     * @return this
     */
    Renderer enclosed(Kind container, String open, String close,
            Runnable contents) {
        PyObject owner = container.getOwner();
        buf.append(open);
        if (owner == null || active.add(owner)) {
            try {
                contents.run();
            } finally {
                active.remove(owner);
            }
        } else {
            buf.append("...");
        }
        buf.append(close);
        return this;
    }
}
