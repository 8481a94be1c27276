package org.slowpy.rt;

/** A built-in function, that is, one implemented in Java. */
public final class PyJavaFunction extends Kind {

    private final String name;
    private final NativeFunction function;

    /**
     * Construct from the name and implementation.
     *
     * @param name of the function
     * @param function implementation
     */
    public PyJavaFunction(String name, NativeFunction function) {
        this.name = name;
        this.function = function;
    }

    /** @return name of the function */
    public String getName() { return name; }

    /** @return the implementation */
    public NativeFunction getFunction() { return function; }

    @Override
    public Tag getTag() { return Tag.NATIVE_FUNCTION; }

    @Override
    void render(Renderer r) {
        r.append("<built-in function ").append(name).append(">");
    }
}
