package org.slowpy.rt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Test calling objects through {@link Callables}, and the capability an
 * {@link Executor} offers the functions called.
 */
@DisplayName("Calling")
class CallablesTest extends UnitTestSupport {

    final Context ctx = new Context();
    final NativeExecutor rt = new NativeExecutor(ctx);

    /**
     * An executor that runs a function defined in Python by returning a
     * string, and remembers what it ran.
     */
    static class RecordingExecutor extends NativeExecutor {

        final List<PyRef> ran = new ArrayList<>();

        RecordingExecutor(Context context) { super(context); }

        @Override
        public PyRef call(PyRef callable, List<PyRef> args) {
            if (callable.getTag() == Kind.Tag.FUNCTION) {
                ran.add(callable);
                return newStr("ran with " + args.size());
            }
            return super.call(callable, args);
        }
    }

    @Nested
    @DisplayName("a built-in function")
    class BuiltIn {

        @Test
        @DisplayName("passes the arguments and returns the result")
        void callsFunction() {
            PyRef twice = ctx.newNativeFunction("twice",
                    (rt, args) -> Number.add(rt.context(), args.get(0),
                            args.get(0)));
            PyRef r = Callables.call(rt, twice, ctx.newInt(21));
            assertEquals(42, intValue(r));
        }

        @Test
        @DisplayName("propagates what it raises")
        void propagatesError() {
            PyRef bad = ctx.newNativeFunction("bad", (rt, args) -> {
                throw new ValueError("bad value %d", args.size());
            });
            ValueError e = assertThrows(ValueError.class,
                    () -> Callables.call(rt, bad));
            assertEquals("bad value 0", e.getMessage());
        }

        @Test
        @DisplayName("may modify the object called")
        void noViewDuringCall() {
            PyRef[] self = new PyRef[1];
            self[0] = ctx.newNativeFunction("f", (rt, args) -> {
                Abstract.setAttr(self[0], "called", rt.newBool(true));
                return rt.getNone();
            });
            Callables.call(rt, self[0]);
            assertTrue(Abstract.isTrue(Abstract.getAttr(self[0], "called")));
        }

        @Test
        @DisplayName("sees the interpreter through the executor")
        void executorCapability() {
            PyRef f = ctx.newNativeFunction("f", (rt, args) -> {
                PyRef items = rt.context().newList(rt.newStr("s"),
                        rt.newBool(false), rt.getNone(), rt.getType());
                return items;
            });
            assertEquals("[s, false, None, <class 'type'>]",
                    Abstract.str(Callables.call(rt, f)));
        }

        @Test
        @DisplayName("may call back through the executor")
        void callBack() {
            PyRef inner = ctx.newNativeFunction("inner",
                    (rt, args) -> rt.newStr("inner"));
            PyRef outer = ctx.newNativeFunction("outer",
                    (rt, args) -> rt.call(args.get(0), List.of()));
            assertEquals("inner",
                    strValue(Callables.call(rt, outer, inner)));
        }
    }

    @Nested
    @DisplayName("a function defined in Python")
    class Function {

        @Test
        @DisplayName("is run by the executor")
        void delegatesToExecutor() {
            RecordingExecutor recorder = new RecordingExecutor(ctx);
            PyRef f = ctx.newFunction("code");
            PyRef r = Callables.call(recorder, f, ctx.newInt(1));
            assertEquals("ran with 1", strValue(r));
            assertEquals(1, recorder.ran.size());
            assertSame(f, recorder.ran.get(0));
        }

        @Test
        @DisplayName("cannot be run by a NativeExecutor")
        void nativeExecutorCannot() {
            PyRef f = ctx.newFunction("code");
            assertThrows(NotImplementedError.class,
                    () -> Callables.call(rt, f));
        }
    }

    @Test
    @DisplayName("a non-callable raises TypeError")
    void notCallable() {
        PyRef x = ctx.newInt(5);
        NotCallableError e = assertThrows(NotCallableError.class,
                () -> Callables.call(rt, x));
        assertEquals("'int' object is not callable", e.getMessage());
        assertEquals("TypeError", e.getPythonName());
        assertTrue(e instanceof TypeError);
    }

    @Test
    @DisplayName("callable() recognises functions only")
    void isCallable() {
        assertTrue(Callables.isCallable(
                ctx.newNativeFunction("f", (rt, args) -> rt.getNone())));
        assertTrue(Callables.isCallable(ctx.newFunction("code")));
        assertFalse(Callables.isCallable(ctx.newCode("code")));
        assertFalse(Callables.isCallable(ctx.newClass("C")));
    }
}
