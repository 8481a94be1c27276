package org.slowpy.rt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Test the text rendering ({@code str()}) of every kind of object. */
@DisplayName("The rendering of")
class RenderTest extends UnitTestSupport {

    final Context ctx = new Context();

    static Stream<Arguments> simpleExamples() {
        Context ctx = new Context();
        return Stream.of( //
                Arguments.of(ctx.newInt(42), "42"), //
                Arguments.of(ctx.newInt(-3), "-3"), //
                Arguments.of(ctx.newStr("hello"), "hello"), //
                Arguments.of(ctx.newBool(true), "true"), //
                Arguments.of(ctx.newBool(false), "false"), //
                Arguments.of(ctx.getNone(), "None"), //
                Arguments.of(ctx.newClass("Foo"), "<class 'Foo'>"), //
                Arguments.of(ctx.newModule("m"), "<module 'm'>"), //
                Arguments.of(ctx.newCode(new Object()), "<code>"), //
                Arguments.of(ctx.newFunction(new Object()), "<func>"), //
                Arguments.of(
                        ctx.newNativeFunction("f",
                                (rt, args) -> rt.getNone()),
                        "<built-in function f>"), //
                Arguments.of(ctx.newSlice(1, null, null),
                        "<slice '1:None:None'>"), //
                Arguments.of(ctx.newSlice(null, 5, -1),
                        "<slice 'None:5:-1'>"), //
                Arguments.of(ctx.newNameError("x"), "<NameError 'x'>"), //
                Arguments.of(ctx.newList(), "[]"), //
                Arguments.of(ctx.newTuple(), "{}"), //
                Arguments.of(ctx.newDict(), "{}"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("simpleExamples")
    @DisplayName("simple objects")
    void simple(PyRef obj, String expected) {
        assertEquals(expected, Abstract.str(obj));
    }

    @Test
    @DisplayName("every kind is not empty")
    void everyKind() {
        for (PyRef obj : ContextTest.examples(ctx).values()) {
            assertFalse(Abstract.str(obj).isEmpty(), obj::toString);
        }
    }

    @Nested
    @DisplayName("containers")
    class Containers {

        @Test
        void list() {
            assertEquals("[1, 2]", Abstract.str(intList(ctx, 1, 2)));
        }

        @Test
        void tuple() {
            PyRef t = ctx.newTuple(ctx.newInt(1), ctx.newStr("a"));
            assertEquals("{1, a}", Abstract.str(t));
        }

        @Test
        void dict() {
            Map<String, PyRef> map = new LinkedHashMap<>();
            map.put("a", ctx.newInt(1));
            map.put("b", ctx.newStr("x"));
            assertEquals("{'a': 1, 'b': x}",
                    Abstract.str(ctx.newDict(map)));
        }

        @Test
        void nested() {
            PyRef inner = intList(ctx, 1);
            PyRef outer = ctx.newList(inner, ctx.newTuple(ctx.newInt(2)));
            assertEquals("[[1], {2}]", Abstract.str(outer));
        }

        @Test
        @DisplayName("a list that contains itself")
        void selfContaining() {
            PyRef list = intList(ctx, 1);
            append(list, list.share());
            assertEquals("[1, [...]]", Abstract.str(list));
        }

        @Test
        @DisplayName("the same list twice (not a cycle)")
        void repeatedElement() {
            PyRef inner = intList(ctx, 1);
            PyRef outer = ctx.newList(inner.share(), inner.share());
            assertEquals("[[1], [1]]", Abstract.str(outer));
        }
    }

    @Test
    @DisplayName("an iterator shows position and target")
    void iterator() {
        PyRef it = ctx.newIterator(intList(ctx, 1, 2));
        assertEquals("<iter pos 0 in [1, 2]>", Abstract.str(it));
        Iterators.next(it).release();
        assertEquals("<iter pos 1 in [1, 2]>", Abstract.str(it));
    }

    @Test
    @DisplayName("a type object")
    void typeObject() {
        assertEquals("<class 'int'>", Abstract.str(ctx.getIntType()));
        assertEquals("<class 'NoneType'>",
                Abstract.str(ctx.typeFor(Kind.Tag.NONE)));
    }

    @Test
    @DisplayName("an object seen in toString()")
    void objectToString() {
        PyRef x = ctx.newInt(7);
        assertEquals("7", x.read(PyObject::toString));
        PyObject o = x.read(obj -> obj);
        assertEquals("<int>", o.toString());
    }
}
