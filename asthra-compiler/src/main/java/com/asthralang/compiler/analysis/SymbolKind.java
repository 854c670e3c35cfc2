package com.asthralang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // let 绑定
    FUNCTION,           // fn / extern 声明
    TYPE,               // struct / enum 声明
    PARAMETER,          // 函数参数
    FIELD,              // 结构体字段
    METHOD,             // impl 块中的方法
    ENUM_VARIANT,       // 枚举变体
    TYPE_PARAMETER,     // 泛型参数
    CONST               // const 声明
}
