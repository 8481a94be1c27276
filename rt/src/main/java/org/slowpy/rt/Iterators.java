package org.slowpy.rt;

/**
 * The iterator protocol. An iterator is an object of kind
 * {@link PyIterator} over a target sequence (a {@code list} or a
 * {@code tuple}).
 */
public class Iterators {

    private Iterators() {} // no instances

    /**
     * Python {@code iter(o)}: a new iterator over a list or tuple, or the
     * object itself if it is already an iterator.
     *
     * @param ctx to make the iterator
     * @param o to iterate
     * @return an iterator (owned)
     * @throws UnsupportedIterationError if {@code o} cannot be iterated
     */
    public static PyRef iter(Context ctx, PyRef o)
            throws UnsupportedIterationError {
        switch (o.getTag()) {
            case ITERATOR:
                return o.share();
            case LIST:
            case TUPLE:
                return ctx.newIterator(o);
            default:
                throw notIterable(o.getTag());
        }
    }

    /**
     * Advance an iterator: return the element of the target at the
     * current position and move on by one, or return {@code null} if the
     * position is at or beyond the end of the target. The length of the
     * target is taken at each call, so the iterator sees elements added
     * or removed since the last. Once an iterator has returned
     * {@code null} it will always return {@code null}, and does nothing
     * else.
     *
     * @param iterator to advance
     * @return next element (owned) or {@code null} when exhausted
     * @throws UnsupportedIterationError if {@code iterator} is not an
     *     iterator, or its target is not a sequence
     */
    public static PyRef next(PyRef iterator)
            throws UnsupportedIterationError {
        try (PyRef.Borrow bi = iterator.borrowMut()) {
            Kind k = bi.get().getKind();
            if (!(k instanceof PyIterator)) {
                throw new UnsupportedIterationError(NOT_ITERATOR,
                        k.getTag().getTypeName());
            }
            PyIterator it = (PyIterator)k;
            if (it.isExhausted()) { return null; }

            PyRef target = it.getTarget();
            if (target.getTag() == Kind.Tag.ITERATOR) {
                // Includes an iterator over itself (we hold its view).
                throw notIterable(target.getTag());
            }

            try (PyRef.Borrow bt = target.borrow()) {
                Kind seq = bt.get().getKind();
                PyRef item = item(seq, it.getPosition());
                if (item == null) {
                    it.exhaust();
                    return null;
                }
                it.advance();
                return item.share();
            }
        }
    }

    /**
     * The element of a sequence at an index, or {@code null} beyond the
     * end.
     */
    private static PyRef item(Kind seq, int i)
            throws UnsupportedIterationError {
        if (seq instanceof PyList) {
            PyList list = (PyList)seq;
            return i < list.size() ? list.get(i) : null;
        } else if (seq instanceof PyTuple) {
            PyTuple tuple = (PyTuple)seq;
            return i < tuple.size() ? tuple.get(i) : null;
        } else {
            throw notIterable(seq.getTag());
        }
    }

    private static UnsupportedIterationError notIterable(Kind.Tag tag) {
        return new UnsupportedIterationError(NOT_ITERABLE,
                tag.getTypeName());
    }

    private static final String NOT_ITERABLE =
            "'%.200s' object is not iterable";
    private static final String NOT_ITERATOR =
            "'%.200s' object is not an iterator";
}
