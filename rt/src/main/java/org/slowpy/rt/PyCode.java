package org.slowpy.rt;

/**
 * A Python {@code code} object. The compiled program is opaque here:
 * it is produced by the compiler, run by the evaluator, and this
 * runtime only stores it.
 */
public final class PyCode extends Kind {

    private final Object code;

    /**
     * Wrap a compiled program.
     *
     * @param code compiled program
     */
    public PyCode(Object code) { this.code = code; }

    /** @return the compiled program */
    public Object getCode() { return code; }

    @Override
    public Tag getTag() { return Tag.CODE; }

    @Override
    void render(Renderer r) { r.append("<code>"); }
}
