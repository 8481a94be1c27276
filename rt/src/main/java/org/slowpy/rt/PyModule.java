package org.slowpy.rt;

/**
 * The Python {@code module} object. Its members are held in the
 * attribute table of the object.
 */
public final class PyModule extends Kind {

    private final String name;

    /**
     * Construct a module of the given name.
     *
     * @param name of the module
     */
    public PyModule(String name) { this.name = name; }

    /** @return name of the module */
    public String getName() { return name; }

    @Override
    public Tag getTag() { return Tag.MODULE; }

    @Override
    void render(Renderer r) {
        r.append("<module '").append(name).append("'>");
    }
}
