package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;

import java.util.List;

/**
 * 类型描述符工厂与预定义常量。
 *
 * <p>工厂返回的复合描述符处于游离状态（计数 0），由第一个持有者 retain。</p>
 */
public final class TypeDescriptors {

    private TypeDescriptors() {}

    // 原始类型
    public static final PrimitiveType I8 = PrimitiveType.of(PrimitiveKind.I8);
    public static final PrimitiveType I16 = PrimitiveType.of(PrimitiveKind.I16);
    public static final PrimitiveType I32 = PrimitiveType.of(PrimitiveKind.I32);
    public static final PrimitiveType I64 = PrimitiveType.of(PrimitiveKind.I64);
    public static final PrimitiveType I128 = PrimitiveType.of(PrimitiveKind.I128);
    public static final PrimitiveType U8 = PrimitiveType.of(PrimitiveKind.U8);
    public static final PrimitiveType U16 = PrimitiveType.of(PrimitiveKind.U16);
    public static final PrimitiveType U32 = PrimitiveType.of(PrimitiveKind.U32);
    public static final PrimitiveType U64 = PrimitiveType.of(PrimitiveKind.U64);
    public static final PrimitiveType U128 = PrimitiveType.of(PrimitiveKind.U128);
    public static final PrimitiveType ISIZE = PrimitiveType.of(PrimitiveKind.ISIZE);
    public static final PrimitiveType USIZE = PrimitiveType.of(PrimitiveKind.USIZE);
    public static final PrimitiveType F32 = PrimitiveType.of(PrimitiveKind.F32);
    public static final PrimitiveType F64 = PrimitiveType.of(PrimitiveKind.F64);
    public static final PrimitiveType BOOL = PrimitiveType.of(PrimitiveKind.BOOL);
    public static final PrimitiveType CHAR = PrimitiveType.of(PrimitiveKind.CHAR);
    public static final PrimitiveType STRING = PrimitiveType.of(PrimitiveKind.STRING);
    public static final PrimitiveType VOID = PrimitiveType.of(PrimitiveKind.VOID);
    public static final PrimitiveType NEVER = PrimitiveType.of(PrimitiveKind.NEVER);

    public static final UnitType UNIT = UnitType.INSTANCE;

    /** 返回该种类的进程级单例 */
    public static PrimitiveType createPrimitive(PrimitiveKind kind) {
        return PrimitiveType.of(kind);
    }

    /** 根据名称查找原始类型，未知返回 null */
    public static PrimitiveType primitiveByName(String name) {
        PrimitiveKind kind = PrimitiveKind.fromName(name);
        return kind != null ? PrimitiveType.of(kind) : null;
    }

    public static StructType createStruct(String name, int fieldCount) {
        return new StructType(name, fieldCount, false, null);
    }

    public static StructType createStruct(String name, int fieldCount, boolean packed, List<String> typeParams) {
        return new StructType(name, fieldCount, packed, typeParams);
    }

    /** 同名字段已存在返回 false */
    public static boolean addStructField(StructType struct, String name, TypeDescriptor type, AstNode declaration) {
        return struct.addField(name, type, declaration, true);
    }

    public static EnumType createEnum(String name) {
        return new EnumType(name, null);
    }

    public static EnumType createEnum(String name, List<String> typeParams) {
        return new EnumType(name, typeParams);
    }

    /** 同名变体已存在返回 false */
    public static boolean addEnumVariant(EnumType enumType, String name, List<TypeDescriptor> payload,
                                         AstNode declaration) {
        return enumType.addVariant(name, payload, declaration);
    }

    public static SliceType createSlice(TypeDescriptor element) {
        return new SliceType(element, false);
    }

    public static SliceType createSlice(TypeDescriptor element, boolean mutable) {
        return new SliceType(element, mutable);
    }

    public static ArrayType createArray(TypeDescriptor element, long size) {
        return new ArrayType(element, size);
    }

    public static PointerType createPointer(TypeDescriptor pointee) {
        return new PointerType(pointee, false);
    }

    public static PointerType createPointer(TypeDescriptor pointee, boolean mutable) {
        return new PointerType(pointee, mutable);
    }

    /**
     * @throws IllegalArgumentException 元素少于 2 个
     */
    public static TupleType createTuple(List<TypeDescriptor> elements) {
        return new TupleType(elements);
    }

    public static FunctionType createFunction(TypeDescriptor returnType, List<TypeDescriptor> params) {
        return new FunctionType(returnType, params);
    }

    public static OptionType createOption(TypeDescriptor value) {
        return new OptionType(value);
    }

    public static ResultType createResult(TypeDescriptor ok, TypeDescriptor err) {
        return new ResultType(ok, err);
    }

    public static GenericInstanceType createGenericInstance(TypeDescriptor base, List<TypeDescriptor> args) {
        return new GenericInstanceType(base, args);
    }

    public static TaskHandleType createTaskHandle(TypeDescriptor result) {
        return new TaskHandleType(result);
    }

    public static TypeParameterType createTypeParameter(String name) {
        return new TypeParameterType(name);
    }

    public static TypeDescriptor retain(TypeDescriptor type) {
        return type != null ? type.retain() : null;
    }

    public static void release(TypeDescriptor type) {
        if (type != null) type.release();
    }

    /** 结构相等，两者均为 null 时为真 */
    public static boolean equals(TypeDescriptor a, TypeDescriptor b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        return a.equals(b);
    }

    public static int hash(TypeDescriptor type) {
        return type != null ? type.hashCode() : 0;
    }

    /** 显示名，null 显示为 unknown */
    public static String display(TypeDescriptor type) {
        return type != null ? type.toDisplayString() : "unknown";
    }
}
