package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.analysis.types.TypeDescriptor;

/**
 * 类型语法节点基类
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后解析的类型描述符
    protected TypeDescriptor resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public TypeDescriptor getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(TypeDescriptor type) {
        this.resolvedType = type;
    }

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);

    /** 类型语法不参与 AstVisitor 分派 */
    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }

    /** 源码形式，用于诊断信息 */
    public abstract String toSourceString();

    @Override
    public String toString() {
        return toSourceString();
    }
}
