package org.slowpy.rt;

/** The kind of the Python {@code None} object. */
public final class PyNone extends Kind {

    @Override
    public Tag getTag() { return Tag.NONE; }

    @Override
    void render(Renderer r) { r.append("None"); }
}
