package org.slowpy.rt;

/**
 * The Python {@code bool} object. Unlike Python, a {@code bool} is not
 * an {@code int} here: it takes part in no arithmetic or comparison.
 */
public final class PyBool extends Kind {

    final boolean value;

    /**
     * Construct from a Java {@code boolean}.
     *
     * @param value of the bool
     */
    public PyBool(boolean value) { this.value = value; }

    /** @return the value */
    public boolean getValue() { return value; }

    @Override
    public Tag getTag() { return Tag.BOOL; }

    @Override
    void render(Renderer r) { r.append(value ? "true" : "false"); }
}
