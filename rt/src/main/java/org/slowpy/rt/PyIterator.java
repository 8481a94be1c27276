package org.slowpy.rt;

import java.util.function.Consumer;

/**
 * A Python iterator: a cursor over a target sequence. The position only
 * ever increases, and is compared with the length of the target as it
 * is at each step, so changes to the target during iteration are seen.
 * Once the iterator has found the end, it stays exhausted. See
 * {@link Iterators#next(PyRef)}.
 */
public final class PyIterator extends Kind {

    private int position;
    private boolean exhausted;
    private final PyRef target;

    /**
     * Construct an iterator at the start of the target.
     *
     * @param target to iterate (given)
     */
    public PyIterator(PyRef target) {
        this.position = 0;
        this.target = target;
    }

    @Override
    public Tag getTag() { return Tag.ITERATOR; }

    /** @return index of the next element to return */
    public int getPosition() {
        checkReadable();
        return position;
    }

    /** @return whether the end has been reached */
    public boolean isExhausted() {
        checkReadable();
        return exhausted;
    }

    /** @return the object iterated (borrowed) */
    public PyRef getTarget() { return target; }

    /** Move to the next element. */
    void advance() {
        checkWritable();
        position += 1;
    }

    /** Mark the end as reached, for good. */
    void exhaust() {
        checkWritable();
        exhausted = true;
    }

    @Override
    void render(Renderer r) {
        checkReadable();
        r.append("<iter pos ").append(Integer.toString(position))
                .append(" in ").append(target).append(">");
    }

    @Override
    void forEachReference(Consumer<PyRef> action) {
        action.accept(target);
    }
}
