package com.asthralang.compiler.analysis.types;

/**
 * 类型描述符类别
 */
public enum TypeCategory {
    PRIMITIVE,
    STRUCT,
    ENUM,
    SLICE,
    ARRAY,
    POINTER,
    FUNCTION,
    TUPLE,
    OPTION,
    RESULT,
    GENERIC_INSTANCE,
    TASK_HANDLE,
    TYPE_PARAMETER,
    UNIT
}
