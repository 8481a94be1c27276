package org.slowpy.rt;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A shared, reference-counted handle on exactly one {@link PyObject}.
 * Several holders may have the same {@code PyRef}: each holder
 * registers itself with {@link #share()} and gives up its claim with
 * {@link #release()}. When the last holder releases the handle, the
 * object is reclaimed and the references it holds are released in turn.
 * A structure that refers to itself (through attributes or container
 * elements) keeps its own count above zero, and is never reclaimed this
 * way. Nothing collects cycles.
 * <p>
 * Access to the object follows an exclusive-or-shared discipline,
 * checked at run time. Any number of read views ({@link #borrow()}) or
 * exactly one write view ({@link #borrowMut()}) may be open at any
 * moment. A request that conflicts with an open view throws
 * {@link BorrowError}, and so does an attempt to touch the object with
 * no view open.
 * <pre>
 * try (PyRef.Borrow b = ref.borrow()) {
 *     Kind k = b.get().getKind();
 *     ...
 * }
 * </pre>
 * A {@code PyRef} is not safe for use by multiple threads. The object
 * graph of one {@link Context} must be confined to one thread.
 */
public final class PyRef {

    /** Logger for reclamation. */
    private static final Logger logger =
            LoggerFactory.getLogger(PyRef.class);

    private final PyObject object;

    /** Number of holders. Zero means reclaimed. */
    private int count = 1;

    /** Number of open read views. */
    private int readers = 0;

    /** Whether the (single) write view is open. */
    private boolean writing = false;

    /**
     * Create the handle on a newly-constructed object, with a count of
     * one, which the caller owns. Only {@link PyObject} does this.
     *
     * @param object to hold
     */
    PyRef(PyObject object) { this.object = object; }

    /**
     * Register another holder of this handle.
     *
     * @return this handle
     * @throws InterpreterError if the object has been reclaimed
     */
    public PyRef share() throws InterpreterError {
        checkLive();
        count += 1;
        return this;
    }

    /**
     * Give up one claim on this handle. If this was the last, the object
     * is reclaimed.
     *
     * @throws BorrowError if this was the last claim and a view is open
     * @throws InterpreterError if the object has been reclaimed
     */
    public void release() throws BorrowError, InterpreterError {
        checkLive();
        if (drop(this)) { reclaim(this); }
    }

    /**
     * The number of holders.
     *
     * @return number of holders (zero once reclaimed)
     */
    public int refCount() { return count; }

    /**
     * Whether the last holder released this handle.
     *
     * @return {@code true} if reclaimed
     */
    public boolean isReclaimed() { return count == 0; }

    /**
     * The kind of object held, which never changes, and which may be
     * consulted without opening a view.
     *
     * @return tag of the kind of object
     */
    public Kind.Tag getTag() { return object.getTag(); }

    /**
     * Open a shared read view on the object.
     *
     * @return the view, to be closed by the caller
     * @throws BorrowError if a write view is open
     */
    public Borrow borrow() throws BorrowError {
        checkLive();
        if (writing) {
            throw new BorrowError(ALREADY_MUTABLE, typeName());
        }
        readers += 1;
        return new Borrow(false);
    }

    /**
     * Open an exclusive write view on the object.
     *
     * @return the view, to be closed by the caller
     * @throws BorrowError if any view is open
     */
    public Borrow borrowMut() throws BorrowError {
        checkLive();
        if (writing) {
            throw new BorrowError(ALREADY_MUTABLE, typeName());
        } else if (readers > 0) {
            throw new BorrowError(ALREADY_SHARED, typeName(), readers);
        }
        writing = true;
        return new Borrow(true);
    }

    /**
     * Apply an action to the object inside a read view.
     *
     * @param <T> type of result
     * @param action to apply
     * @return result of the action
     * @throws BorrowError if a write view is open
     */
    public <T> T read(Function<? super PyObject, ? extends T> action)
            throws BorrowError {
        try (Borrow b = borrow()) {
            return action.apply(b.get());
        }
    }

    /**
     * Apply an action to the object inside a write view.
     *
     * @param <T> type of result
     * @param action to apply
     * @return result of the action
     * @throws BorrowError if any view is open
     */
    public <T> T modify(Function<? super PyObject, ? extends T> action)
            throws BorrowError {
        try (Borrow b = borrowMut()) {
            return action.apply(b.get());
        }
    }

    /** @return whether a read or write view is open */
    boolean isReadable() { return readers > 0 || writing; }

    /** @return whether the write view is open */
    boolean isWritable() { return writing; }

    @Override
    public String toString() {
        return String.format("PyRef[%s, count=%d]", typeName(), count);
    }

    private void checkLive() throws InterpreterError {
        if (count == 0) {
            throw new InterpreterError(RECLAIMED, typeName());
        }
    }

    private String typeName() { return object.getTag().getTypeName(); }

    /**
     * Remove one holder from a handle, checking that no view is open on
     * it if it is the last.
     *
     * @param ref to drop
     * @return {@code true} if that was the last holder
     */
    private static boolean drop(PyRef ref) throws BorrowError {
        if (ref.count == 1 && ref.isReadable()) {
            throw new BorrowError(RELEASED_WHILE_BORROWED, ref.typeName());
        }
        return --ref.count == 0;
    }

    /**
     * Release everything the (dead) object referenced, and everything
     * that then dies in turn. A work list keeps deep structures off the
     * Java stack.
     *
     * @param first handle just dropped to a zero count
     */
    private static void reclaim(PyRef first) {
        Deque<PyRef> dead = new ArrayDeque<>();
        dead.push(first);
        while (!dead.isEmpty()) {
            PyRef ref = dead.pop();
            logger.atTrace().setMessage("reclaiming {}")
                    .addArgument(ref.typeName()).log();
            ref.object.forEachReference(r -> {
                r.checkLive();
                if (drop(r)) { dead.push(r); }
            });
        }
    }

    private static final String ALREADY_MUTABLE =
            "%s object is already borrowed for writing";
    private static final String ALREADY_SHARED =
            "%s object is already borrowed for reading (%d views)";
    private static final String RELEASED_WHILE_BORROWED =
            "last reference to %s object released while borrowed";
    private static final String RECLAIMED =
            "use of reclaimed '%s' object";

    /**
     * An open view on the object held by a {@link PyRef}. Closing the
     * view (once) ends the borrow.
     */
    public final class Borrow implements AutoCloseable {

        private final boolean mutable;
        private boolean open = true;

        private Borrow(boolean mutable) { this.mutable = mutable; }

        /**
         * The object viewed.
         *
         * @return the object
         * @throws BorrowError if the view has been closed
         */
        public PyObject get() throws BorrowError {
            if (!open) {
                throw new BorrowError("view of %s object used after close",
                        typeName());
            }
            return object;
        }

        /** @return whether this is the write view */
        public boolean isMutable() { return mutable; }

        @Override
        public void close() {
            if (open) {
                open = false;
                if (mutable) {
                    writing = false;
                } else {
                    readers -= 1;
                }
            }
        }
    }
}
