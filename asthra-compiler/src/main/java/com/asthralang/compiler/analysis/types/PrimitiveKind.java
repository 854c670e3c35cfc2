package com.asthralang.compiler.analysis.types;

import java.util.HashMap;
import java.util.Map;

/**
 * 原始类型种类
 */
public enum PrimitiveKind {
    I8("i8", 1, true, true),
    I16("i16", 2, true, true),
    I32("i32", 4, true, true),
    I64("i64", 8, true, true),
    I128("i128", 16, true, true),
    U8("u8", 1, true, false),
    U16("u16", 2, true, false),
    U32("u32", 4, true, false),
    U64("u64", 8, true, false),
    U128("u128", 16, true, false),
    ISIZE("isize", 8, true, true),
    USIZE("usize", 8, true, false),
    F32("f32", 4, false, true),
    F64("f64", 8, false, true),
    BOOL("bool", 1, false, false),
    CHAR("char", 4, false, false),
    STRING("string", 16, false, false),   // 胖指针：数据指针 + 长度
    VOID("void", 0, false, false),
    NEVER("Never", 0, false, false);

    private static final Map<String, PrimitiveKind> BY_NAME = new HashMap<>();

    static {
        for (PrimitiveKind kind : values()) {
            BY_NAME.put(kind.typeName, kind);
        }
    }

    private final String typeName;
    private final int size;
    private final boolean integer;
    private final boolean signed;

    PrimitiveKind(String typeName, int size, boolean integer, boolean signed) {
        this.typeName = typeName;
        this.size = size;
        this.integer = integer;
        this.signed = signed;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getSize() {
        return size;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    public boolean isNumeric() {
        return integer || isFloat();
    }

    /** 整数与浮点数的有符号性；其余种类返回 false */
    public boolean isSigned() {
        return signed;
    }

    public boolean isUnsignedInteger() {
        return integer && !signed;
    }

    /** 位宽，非数值类型返回 0 */
    public int getBitWidth() {
        return isNumeric() ? size * 8 : 0;
    }

    /** 根据源码名称查找，未知返回 null */
    public static PrimitiveKind fromName(String name) {
        return name == null ? null : BY_NAME.get(name);
    }
}
