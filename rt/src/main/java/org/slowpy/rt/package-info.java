/**
 * The runtime value engine of the slowpy interpreter: the
 * representation of Python objects, the reference-counted handles
 * through which they are shared, and the operations (arithmetic,
 * comparison, iteration, calls, attribute and item access) the
 * evaluator applies to them.
 * <p>
 * Handles follow one convention throughout. The accessors of
 * {@link org.slowpy.rt.PyObject} and of the kinds return
 * <i>borrowed</i> handles, still held by the object. The factories of
 * {@link org.slowpy.rt.Context} and the operations in
 * {@link org.slowpy.rt.Abstract}, {@link org.slowpy.rt.Number},
 * {@link org.slowpy.rt.Comparison}, {@link org.slowpy.rt.Iterators} and
 * {@link org.slowpy.rt.Callables} return <i>owned</i> handles, which the
 * caller must eventually {@link org.slowpy.rt.PyRef#release() release}.
 * <p>
 * A Python error is thrown as a sub-class of
 * {@link org.slowpy.rt.BaseException}, for the evaluator to catch and
 * deal with. A bug in the use of the runtime is thrown as an
 * {@link org.slowpy.rt.InterpreterError}.
 */
package org.slowpy.rt;
