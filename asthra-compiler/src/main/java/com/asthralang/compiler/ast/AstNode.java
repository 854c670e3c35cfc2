package com.asthralang.compiler.ast;

import com.asthralang.compiler.ast.decl.Annotation;

import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>节点由解析器构造，语义分析器只读；类型信息通过分析器的旁路表挂接，
 * 不修改节点的语法字段。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点上附着的注解，默认无 */
    public List<Annotation> getAnnotations() {
        return Collections.emptyList();
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
