package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 模式基类
 */
public abstract class Pattern extends AstNode {

    protected Pattern(SourceLocation location) {
        super(location);
    }

    /** 是否无条件匹配（通配符或绑定） */
    public boolean isIrrefutable() {
        return false;
    }
}
