package org.slowpy.rt;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A flat table from (operation, left kind, right kind) to the function
 * implementing that operation on those kinds. Each {@link Context} has
 * its own, loaded with the rules for the built-in kinds by
 * {@link #withBuiltinRules()}. A combination with no entry finds the
 * "empty" implementation, which throws {@link EmptyException}: the
 * caller turns that into the Python error.
 * <p>
 * {@link #register(BinaryOp, Kind.Tag, Kind.Tag, Implementation)}
 * accepts further rules, so that operations defined by a type can later
 * be consulted here without changing {@link Number}.
 */
public final class OperatorTable {

    private static final Logger logger =
            LoggerFactory.getLogger(OperatorTable.class);

    /** Thrown by the implementation of an empty table entry. */
    public static class EmptyException extends Exception {
        private static final long serialVersionUID = 1L;

        EmptyException() { super(null, null, false, false); }
    }

    /**
     * A function implementing a binary operation on two kinds. Read views
     * are open on both operands while it runs.
     */
    @FunctionalInterface
    public interface Implementation {

        /**
         * Compute the result of the operation.
         *
         * @param v left operand
         * @param w right operand
         * @return result (not yet wrapped in an object)
         * @throws EmptyException if the entry is empty
         * @throws PyException for errors in the operation
         */
        Kind apply(Kind v, Kind w) throws EmptyException, PyException;
    }

    /** The implementation found in an empty entry. */
    public static final Implementation EMPTY = (v, w) -> {
        throw new EmptyException();
    };

    private final Map<BinaryOp, Map<Kind.Tag, Map<Kind.Tag, Implementation>>>
            table = new EnumMap<>(BinaryOp.class);

    /** Construct with every entry empty. */
    public OperatorTable() {}

    /**
     * Construct a table holding the rules for the built-in kinds:
     * <table>
     * <caption>Built-in rules</caption>
     * <tr><th>op</th><th>left</th><th>right</th><th>result</th></tr>
     * <tr><td>+</td><td>int</td><td>int</td><td>checked sum</td></tr>
     * <tr><td>+</td><td>str</td><td>str</td><td>concatenation</td></tr>
     * <tr><td>+</td><td>list</td><td>list</td><td>concatenation</td></tr>
     * <tr><td>-</td><td>int</td><td>int</td><td>checked
     * difference</td></tr>
     * <tr><td>*</td><td>int</td><td>int</td><td>checked product</td></tr>
     * <tr><td>*</td><td>str</td><td>int</td><td>repetition</td></tr>
     * <tr><td>/</td><td>int</td><td>int</td><td>truncating
     * quotient</td></tr>
     * </table>
     *
     * @return new table
     */
    public static OperatorTable withBuiltinRules() {
        OperatorTable t = new OperatorTable();
        t.register(BinaryOp.ADD, Kind.Tag.INT, Kind.Tag.INT, PyLong::add);
        t.register(BinaryOp.ADD, Kind.Tag.STR, Kind.Tag.STR,
                PyUnicode::add);
        t.register(BinaryOp.ADD, Kind.Tag.LIST, Kind.Tag.LIST,
                PyList::add);
        t.register(BinaryOp.SUB, Kind.Tag.INT, Kind.Tag.INT, PyLong::sub);
        t.register(BinaryOp.MUL, Kind.Tag.INT, Kind.Tag.INT, PyLong::mul);
        t.register(BinaryOp.MUL, Kind.Tag.STR, Kind.Tag.INT,
                PyUnicode::mul);
        t.register(BinaryOp.DIV, Kind.Tag.INT, Kind.Tag.INT, PyLong::div);
        return t;
    }

    /**
     * Set the implementation of an operation on a pair of kinds,
     * replacing any already there.
     *
     * @param op operation
     * @param left kind of left operand
     * @param right kind of right operand
     * @param impl implementation
     */
    public void register(BinaryOp op, Kind.Tag left, Kind.Tag right,
            Implementation impl) {
        logger.atDebug().setMessage("register {} {} {}")
                .addArgument(left.getTypeName())
                .addArgument(op.getSymbol())
                .addArgument(right.getTypeName()).log();
        table.computeIfAbsent(op, k -> new EnumMap<>(Kind.Tag.class))
                .computeIfAbsent(left, k -> new EnumMap<>(Kind.Tag.class))
                .put(right, impl);
    }

    /**
     * Find the implementation of an operation on a pair of kinds.
     *
     * @param op operation
     * @param left kind of left operand
     * @param right kind of right operand
     * @return implementation or {@link #EMPTY}
     */
    public Implementation lookup(BinaryOp op, Kind.Tag left,
            Kind.Tag right) {
        Map<Kind.Tag, Map<Kind.Tag, Implementation>> byLeft =
                table.get(op);
        if (byLeft != null) {
            Map<Kind.Tag, Implementation> byRight = byLeft.get(left);
            if (byRight != null) {
                Implementation impl = byRight.get(right);
                if (impl != null) { return impl; }
            }
        }
        return EMPTY;
    }

    /**
     * Test whether an operation is defined on a pair of kinds.
     *
     * @param op operation
     * @param left kind of left operand
     * @param right kind of right operand
     * @return {@code true} if the entry is not empty
     */
    public boolean isDefinedFor(BinaryOp op, Kind.Tag left,
            Kind.Tag right) {
        return lookup(op, left, right) != EMPTY;
    }
}
