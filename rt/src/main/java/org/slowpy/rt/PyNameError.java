package org.slowpy.rt;

/**
 * A value marking a name that could not be resolved. This is a plain
 * value the evaluator may leave on its stack, not an exception.
 */
public final class PyNameError extends Kind {

    private final String name;

    /**
     * Construct the marker for a name.
     *
     * @param name that could not be resolved
     */
    public PyNameError(String name) { this.name = name; }

    /** @return the name that was not found */
    public String getName() { return name; }

    @Override
    public Tag getTag() { return Tag.NAME_ERROR; }

    @Override
    void render(Renderer r) {
        r.append("<NameError '").append(name).append("'>");
    }
}
