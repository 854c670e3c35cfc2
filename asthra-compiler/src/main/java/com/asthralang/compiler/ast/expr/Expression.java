package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.Annotation;

import java.util.Collections;
import java.util.List;

/**
 * 表达式基类
 *
 * <p>三个标记位由语义分析器填写，其余字段只读。</p>
 */
public abstract class Expression extends AstNode {
    protected List<Annotation> annotations = Collections.emptyList();
    // 语义分析后填充
    private boolean constantExpr;
    private boolean sideEffects;
    private boolean lvalue;

    protected Expression(SourceLocation location) {
        super(location);
    }

    @Override
    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(List<Annotation> annotations) {
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
    }

    public boolean isConstantExpr() {
        return constantExpr;
    }

    public void setConstantExpr(boolean constantExpr) {
        this.constantExpr = constantExpr;
    }

    public boolean hasSideEffects() {
        return sideEffects;
    }

    public void setSideEffects(boolean sideEffects) {
        this.sideEffects = sideEffects;
    }

    public boolean isLvalue() {
        return lvalue;
    }

    public void setLvalue(boolean lvalue) {
        this.lvalue = lvalue;
    }
}
