package com.asthralang.compiler.ast;

/**
 * 可见性修饰（pub / priv）
 */
public enum Visibility {
    PUBLIC,
    PRIVATE;

    /** 返回 Asthra 源码中对应的关键字 */
    public String toSourceString() {
        return this == PUBLIC ? "pub" : "priv";
    }
}
