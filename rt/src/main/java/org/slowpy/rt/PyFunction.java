package org.slowpy.rt;

/**
 * A Python function defined in Python: a compiled program the evaluator
 * can run when the function is called. There is no closure.
 */
public final class PyFunction extends Kind {

    private final Object code;

    /**
     * Wrap a compiled program as a function.
     *
     * @param code compiled program (opaque)
     */
    public PyFunction(Object code) { this.code = code; }

    /** @return the compiled program */
    public Object getCode() { return code; }

    @Override
    public Tag getTag() { return Tag.FUNCTION; }

    @Override
    void render(Renderer r) { r.append("<func>"); }
}
