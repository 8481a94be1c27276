package org.slowpy.rt;

/**
 * A Python {@code type} object, that is, a class. Only the name is
 * represented in the kind. Anything a class defines is held in the
 * attribute table of the object.
 */
public final class PyClass extends Kind {

    private final String name;

    /**
     * Construct a class of the given name.
     *
     * @param name of the class
     */
    public PyClass(String name) { this.name = name; }

    /** @return name of the class */
    public String getName() { return name; }

    @Override
    public Tag getTag() { return Tag.CLASS; }

    @Override
    void render(Renderer r) {
        r.append("<class '").append(name).append("'>");
    }
}
