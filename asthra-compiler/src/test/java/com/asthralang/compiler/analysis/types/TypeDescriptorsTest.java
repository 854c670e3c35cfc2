package com.asthralang.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型描述符：引用计数、结构相等与显示名
 */
class TypeDescriptorsTest {

    @Nested
    @DisplayName("引用计数")
    class RefCounting {

        @Test
        @DisplayName("原始类型是单例且不计数")
        void primitivesAreSingletons() {
            assertSame(TypeDescriptors.I32, TypeDescriptors.createPrimitive(PrimitiveKind.I32));
            assertSame(TypeDescriptors.I32, TypeDescriptors.primitiveByName("i32"));
            assertFalse(TypeDescriptors.I32.isRefCounted());
            TypeDescriptors.I32.retain();
            TypeDescriptors.I32.release();
            TypeDescriptors.I32.release();
            assertEquals(0, TypeDescriptors.I32.getRefCount());
            assertFalse(TypeDescriptors.I32.isReleased());
        }

        @Test
        @DisplayName("新建复合类型计数为 0，retain/release 成对")
        void retainRelease() {
            SliceType slice = TypeDescriptors.createSlice(TypeDescriptors.U8);
            assertEquals(0, slice.getRefCount());
            slice.retain();
            slice.retain();
            assertEquals(2, slice.getRefCount());
            slice.release();
            assertFalse(slice.isReleased());
            slice.release();
            assertTrue(slice.isReleased());
        }

        @Test
        @DisplayName("释放后再使用抛出 IllegalStateException")
        void useAfterRelease() {
            PointerType ptr = TypeDescriptors.createPointer(TypeDescriptors.I64);
            ptr.retain();
            ptr.release();
            assertThrows(IllegalStateException.class, ptr::retain);
            assertThrows(IllegalStateException.class, ptr::release);
        }

        @Test
        @DisplayName("游离描述符直接 release 为下溢")
        void underflow() {
            OptionType opt = TypeDescriptors.createOption(TypeDescriptors.BOOL);
            assertThrows(IllegalStateException.class, opt::release);
            assertEquals(0, opt.getRefCount());
            assertFalse(opt.isReleased());
        }

        @Test
        @DisplayName("父描述符释放时级联释放子描述符")
        void cascadingRelease() {
            SliceType inner = TypeDescriptors.createSlice(TypeDescriptors.I32);
            ArrayType outer = TypeDescriptors.createArray(inner, 4);
            assertEquals(1, inner.getRefCount());

            outer.retain();
            outer.release();
            assertTrue(outer.isReleased());
            assertTrue(inner.isReleased());
        }

        @Test
        @DisplayName("共享子描述符在最后一个持有者释放前保持有效")
        void sharedChild() {
            StructType point = TypeDescriptors.createStruct("Point", 2);
            point.addField("x", TypeDescriptors.I32, null, true);
            point.retain();

            PointerType p1 = TypeDescriptors.createPointer(point);
            PointerType p2 = TypeDescriptors.createPointer(point, true);
            p1.retain();
            p2.retain();
            assertEquals(3, point.getRefCount());

            p1.release();
            p2.release();
            assertFalse(point.isReleased());
            point.release();
            assertTrue(point.isReleased());
        }

        @Test
        @DisplayName("已释放的结构体不能再添加字段")
        void addFieldAfterRelease() {
            StructType s = TypeDescriptors.createStruct("S", 1);
            s.retain();
            s.release();
            assertThrows(IllegalStateException.class,
                    () -> s.addField("x", TypeDescriptors.I32, null, true));
        }
    }

    @Nested
    @DisplayName("结构相等")
    class Equality {

        @Test
        void compositeEqualityIsStructural() {
            assertEquals(TypeDescriptors.createSlice(TypeDescriptors.I32),
                    TypeDescriptors.createSlice(TypeDescriptors.I32));
            assertNotEquals(TypeDescriptors.createSlice(TypeDescriptors.I32),
                    TypeDescriptors.createSlice(TypeDescriptors.I32, true));
            assertEquals(TypeDescriptors.createArray(TypeDescriptors.U8, 4),
                    TypeDescriptors.createArray(TypeDescriptors.U8, 4));
            assertNotEquals(TypeDescriptors.createArray(TypeDescriptors.U8, 4),
                    TypeDescriptors.createArray(TypeDescriptors.U8, 5));
            assertEquals(TypeDescriptors.createResult(TypeDescriptors.I32, TypeDescriptors.STRING),
                    TypeDescriptors.createResult(TypeDescriptors.I32, TypeDescriptors.STRING));
        }

        @Test
        void hashCodeFollowsEquality() {
            TupleType a = TypeDescriptors.createTuple(Arrays.<TypeDescriptor>asList(TypeDescriptors.I32,
                    TypeDescriptors.BOOL));
            TupleType b = TypeDescriptors.createTuple(Arrays.<TypeDescriptor>asList(TypeDescriptors.I32,
                    TypeDescriptors.BOOL));
            assertEquals(a, b);
            assertEquals(TypeDescriptors.hash(a), TypeDescriptors.hash(b));
        }

        @Test
        void namedTypesCompareByName() {
            assertEquals(TypeDescriptors.createStruct("Point", 0), TypeDescriptors.createStruct("Point", 3));
            assertNotEquals(TypeDescriptors.createStruct("Point", 0), TypeDescriptors.createStruct("Vec", 0));
            assertEquals(TypeDescriptors.createEnum("Color"), TypeDescriptors.createEnum("Color"));
        }

        @Test
        void nullSafeHelpers() {
            assertTrue(TypeDescriptors.equals(null, null));
            assertFalse(TypeDescriptors.equals(TypeDescriptors.I32, null));
            assertEquals(0, TypeDescriptors.hash(null));
            assertEquals("unknown", TypeDescriptors.display(null));
        }
    }

    @Nested
    @DisplayName("显示名与大小")
    class DisplayAndSize {

        @Test
        void displayStrings() {
            assertEquals("[]i32", TypeDescriptors.createSlice(TypeDescriptors.I32).toDisplayString());
            assertEquals("[]mut u8", TypeDescriptors.createSlice(TypeDescriptors.U8, true).toDisplayString());
            assertEquals("[5]i32", TypeDescriptors.createArray(TypeDescriptors.I32, 5).toDisplayString());
            assertEquals("*mut i32", TypeDescriptors.createPointer(TypeDescriptors.I32, true).toDisplayString());
            assertEquals("*const u8", TypeDescriptors.createPointer(TypeDescriptors.U8).toDisplayString());
            assertEquals("Option<string>", TypeDescriptors.createOption(TypeDescriptors.STRING).toDisplayString());
            assertEquals("(i32, bool)", TypeDescriptors.createTuple(Arrays.<TypeDescriptor>asList(
                    TypeDescriptors.I32, TypeDescriptors.BOOL)).toDisplayString());
            assertEquals("fn(i32) -> bool", TypeDescriptors.createFunction(TypeDescriptors.BOOL,
                    Collections.<TypeDescriptor>singletonList(TypeDescriptors.I32)).toDisplayString());
            assertEquals("TaskHandle<i64>", TypeDescriptors.createTaskHandle(TypeDescriptors.I64).toDisplayString());
        }

        @Test
        @DisplayName("元组少于 2 个元素抛出 IllegalArgumentException")
        void tupleArity() {
            assertThrows(IllegalArgumentException.class,
                    () -> TypeDescriptors.createTuple(Collections.<TypeDescriptor>singletonList(TypeDescriptors.I32)));
        }

        @Test
        @DisplayName("结构体大小按字段对齐，packed 不填充")
        void structLayout() {
            StructType aligned = TypeDescriptors.createStruct("A", 2);
            aligned.addField("a", TypeDescriptors.I32, null, true);
            aligned.addField("b", TypeDescriptors.U8, null, true);
            assertEquals(8, aligned.getSize());

            StructType packed = TypeDescriptors.createStruct("P", 2, true, null);
            packed.addField("a", TypeDescriptors.I32, null, true);
            packed.addField("b", TypeDescriptors.U8, null, true);
            assertEquals(5, packed.getSize());
        }

        @Test
        void compositeSizes() {
            assertEquals(20, TypeDescriptors.createArray(TypeDescriptors.I32, 5).getSize());
            assertEquals(16, TypeDescriptors.createSlice(TypeDescriptors.I64).getSize());
            assertEquals(8, TypeDescriptors.createPointer(TypeDescriptors.I8).getSize());
            assertEquals(16, TypeDescriptors.STRING.getSize());
        }

        @Test
        void duplicateFieldRejected() {
            StructType s = TypeDescriptors.createStruct("S", 2);
            assertTrue(TypeDescriptors.addStructField(s, "x", TypeDescriptors.I32, null));
            assertFalse(TypeDescriptors.addStructField(s, "x", TypeDescriptors.I64, null));
            assertEquals(1, s.getFieldCount());
        }

        @Test
        void payloadFreeEnum() {
            EnumType color = TypeDescriptors.createEnum("Color");
            TypeDescriptors.addEnumVariant(color, "Red", null, null);
            TypeDescriptors.addEnumVariant(color, "Green", null, null);
            assertTrue(color.isPayloadFree());
            assertFalse(TypeDescriptors.addEnumVariant(color, "Red", null, null));

            EnumType shape = TypeDescriptors.createEnum("Shape");
            TypeDescriptors.addEnumVariant(shape, "Circle",
                    Collections.<TypeDescriptor>singletonList(TypeDescriptors.F64), null);
            assertFalse(shape.isPayloadFree());
        }
    }
}
