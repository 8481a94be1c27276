package org.slowpy.rt;

/**
 * The Python {@code slice} object. Any of the three parts may be absent
 * ({@code null}).
 */
public final class PySlice extends Kind {

    private final Integer start;
    private final Integer stop;
    private final Integer step;

    /**
     * Construct from the three parts, any of which may be {@code null}.
     *
     * @param start or {@code null}
     * @param stop or {@code null}
     * @param step or {@code null}
     */
    public PySlice(Integer start, Integer stop, Integer step) {
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    /** @return the start or {@code null} */
    public Integer getStart() { return start; }

    /** @return the stop or {@code null} */
    public Integer getStop() { return stop; }

    /** @return the step or {@code null} */
    public Integer getStep() { return step; }

    @Override
    public Tag getTag() { return Tag.SLICE; }

    @Override
    void render(Renderer r) {
        r.append("<slice '").append(part(start)).append(":")
                .append(part(stop)).append(":").append(part(step))
                .append("'>");
    }

    private static String part(Integer v) {
        return v == null ? "None" : v.toString();
    }
}
