package org.slowpy.rt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Test the operations on any object offered by {@link Abstract}. */
@DisplayName("The abstract API")
class AbstractTest extends UnitTestSupport {

    final Context ctx = new Context();

    @Nested
    @DisplayName("for attributes")
    class Attributes {

        @Test
        @DisplayName("sets and gets an attribute")
        void setAndGet() {
            PyRef m = ctx.newModule("m");
            Abstract.setAttr(m, "x", ctx.newInt(1));
            assertEquals(1, intValue(Abstract.getAttr(m, "x")));
            assertTrue(Abstract.hasAttr(m, "x"));
        }

        @Test
        @DisplayName("releases a value replaced")
        void replaceReleases() {
            PyRef m = ctx.newModule("m");
            PyRef old = ctx.newInt(1);
            Abstract.setAttr(m, "x", old);
            assertEquals(2, old.refCount());
            Abstract.setAttr(m, "x", ctx.newInt(2));
            assertEquals(1, old.refCount());
        }

        @Test
        @DisplayName("finds an attribute of the type")
        void typeFallback() {
            PyRef intType = ctx.getIntType();
            Abstract.setAttr(intType, "answer", ctx.newInt(42));
            PyRef x = ctx.newInt(1);
            assertEquals(42, intValue(Abstract.getAttr(x, "answer")));
            // An attribute of the object hides that of the type
            Abstract.setAttr(x, "answer", ctx.newInt(6));
            assertEquals(6, intValue(Abstract.getAttr(x, "answer")));
        }

        @Test
        @DisplayName("raises AttributeError for a missing attribute")
        void missing() {
            PyRef x = ctx.newInt(1);
            AttributeError e = assertThrows(AttributeError.class,
                    () -> Abstract.getAttr(x, "foo"));
            assertEquals("'int' object has no attribute 'foo'",
                    e.getMessage());
            assertFalse(Abstract.hasAttr(x, "foo"));
            // The root type has no type to look in
            PyRef type = ctx.getTypeType();
            assertThrows(AttributeError.class,
                    () -> Abstract.getAttr(type, "foo"));
        }

        @Test
        @DisplayName("deletes an attribute")
        void delete() {
            PyRef m = ctx.newModule("m");
            PyRef v = ctx.newStr("v");
            Abstract.setAttr(m, "x", v);
            Abstract.delAttr(m, "x");
            assertEquals(1, v.refCount());
            assertFalse(Abstract.hasAttr(m, "x"));
            assertThrows(AttributeError.class,
                    () -> Abstract.delAttr(m, "x"));
        }
    }

    @Nested
    @DisplayName("for items")
    class Items {

        @Test
        @DisplayName("indexes a list from either end")
        void listIndex() {
            PyRef list = intList(ctx, 10, 20, 30);
            assertEquals(20,
                    intValue(Abstract.getItem(ctx, list, ctx.newInt(1))));
            assertEquals(30,
                    intValue(Abstract.getItem(ctx, list, ctx.newInt(-1))));
            PyRef three = ctx.newInt(3), s = ctx.newStr("a");
            IndexError e = assertThrows(IndexError.class,
                    () -> Abstract.getItem(ctx, list, three));
            assertEquals("list index out of range", e.getMessage());
            assertThrows(TypeError.class,
                    () -> Abstract.getItem(ctx, list, s));
        }

        @Test
        @DisplayName("indexes a tuple and a str")
        void tupleAndStr() {
            PyRef t = ctx.newTuple(ctx.newInt(1), ctx.newInt(2));
            assertEquals(1,
                    intValue(Abstract.getItem(ctx, t, ctx.newInt(-2))));
            PyRef s = ctx.newStr("abc");
            assertEquals("b",
                    strValue(Abstract.getItem(ctx, s, ctx.newInt(1))));
        }

        @Test
        @DisplayName("indexes a str by code point")
        void strCodePoints() {
            // U+1F600 is two chars in Java but one character in Python
            String grin = "\uD83D\uDE00";
            PyRef s = ctx.newStr("a" + grin + "b");
            assertEquals(3, Abstract.size(s));
            assertEquals(1, Abstract.size(ctx.newStr(grin)));
            assertEquals(grin,
                    strValue(Abstract.getItem(ctx, s, ctx.newInt(1))));
            assertEquals("b",
                    strValue(Abstract.getItem(ctx, s, ctx.newInt(2))));
            assertEquals("b",
                    strValue(Abstract.getItem(ctx, s, ctx.newInt(-1))));
            PyRef three = ctx.newInt(3);
            assertThrows(IndexError.class,
                    () -> Abstract.getItem(ctx, s, three));
        }

        @Test
        @DisplayName("looks up a dict by str key")
        void dictKey() {
            PyRef d = ctx.newDict(Map.of("a", ctx.newInt(1)));
            assertEquals(1,
                    intValue(Abstract.getItem(ctx, d, ctx.newStr("a"))));
            PyRef b = ctx.newStr("b"), one = ctx.newInt(1);
            KeyError e = assertThrows(KeyError.class,
                    () -> Abstract.getItem(ctx, d, b));
            assertEquals("'b'", e.getMessage());
            assertThrows(TypeError.class,
                    () -> Abstract.getItem(ctx, d, one));
        }

        @Test
        @DisplayName("raises TypeError on an int")
        void notSubscriptable() {
            PyRef x = ctx.newInt(1), zero = ctx.newInt(0);
            TypeError e = assertThrows(TypeError.class,
                    () -> Abstract.getItem(ctx, x, zero));
            assertEquals("'int' object is not subscriptable",
                    e.getMessage());
        }

        @Test
        @DisplayName("assigns into a list, releasing what it replaces")
        void listAssign() {
            PyRef old = ctx.newInt(1);
            PyRef list = ctx.newList(old.share(), ctx.newInt(2));
            Abstract.setItem(list, ctx.newInt(0), ctx.newStr("x"));
            assertEquals("[x, 2]", Abstract.str(list));
            assertEquals(1, old.refCount());
        }

        @Test
        @DisplayName("assigns into a dict")
        void dictAssign() {
            PyRef d = ctx.newDict();
            Abstract.setItem(d, ctx.newStr("k"), ctx.newInt(1));
            Abstract.setItem(d, ctx.newStr("k"), ctx.newInt(2));
            assertEquals("{'k': 2}", Abstract.str(d));
        }

        @Test
        @DisplayName("refuses to assign into a tuple")
        void tupleAssign() {
            PyRef t = ctx.newTuple(ctx.newInt(1));
            PyRef zero = ctx.newInt(0), v = ctx.newInt(5);
            TypeError e = assertThrows(TypeError.class,
                    () -> Abstract.setItem(t, zero, v));
            assertEquals("'tuple' object does not support item assignment",
                    e.getMessage());
        }

        @Test
        @DisplayName("raises TypeError indexing a list by itself")
        void listKeyIsList() {
            PyRef list = intList(ctx, 1);
            PyRef v = ctx.newInt(5);
            assertThrows(TypeError.class,
                    () -> Abstract.setItem(list, list, v));
        }
    }

    static Stream<Arguments> truthExamples() {
        Context ctx = new Context();
        return Stream.of( //
                Arguments.of(ctx.getNone(), false), //
                Arguments.of(ctx.newBool(true), true), //
                Arguments.of(ctx.newBool(false), false), //
                Arguments.of(ctx.newInt(0), false), //
                Arguments.of(ctx.newInt(-1), true), //
                Arguments.of(ctx.newStr(""), false), //
                Arguments.of(ctx.newStr("a"), true), //
                Arguments.of(ctx.newList(), false), //
                Arguments.of(intList(ctx, 0), true), //
                Arguments.of(ctx.newTuple(), false), //
                Arguments.of(ctx.newDict(), false), //
                Arguments.of(ctx.newModule("m"), true));
    }

    @ParameterizedTest(name = "{0} is {1}")
    @MethodSource("truthExamples")
    @DisplayName("gives the truth of an object")
    void truth(PyRef obj, boolean expected) {
        assertEquals(expected, Abstract.isTrue(obj));
    }

    @Test
    @DisplayName("gives the length of a sized object")
    void size() {
        assertEquals(3, Abstract.size(ctx.newStr("abc")));
        assertEquals(2, Abstract.size(intList(ctx, 1, 2)));
        assertEquals(0, Abstract.size(ctx.newTuple()));
        PyRef x = ctx.newInt(1);
        TypeError e = assertThrows(TypeError.class, () -> Abstract.size(x));
        assertEquals("object of type 'int' has no len()", e.getMessage());
    }

    @Test
    @DisplayName("names the type of an object")
    void typeName() {
        assertEquals("NoneType", Abstract.typeName(ctx.getNone()));
        assertSame(Kind.Tag.DICT, ctx.newDict().getTag());
    }
}
