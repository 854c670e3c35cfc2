package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 下标访问 base[index]。
 *
 * <p>base 可以是定长数组或切片，index 为任意整数类型。
 * 定长数组配常量下标时在分析期做越界检查；作为赋值目标时
 * 可写性取决于 base（可变变量、可变切片）。</p>
 */
public class IndexExpr extends Expression {
    private final Expression base;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression base, Expression index) {
        super(location);
        this.base = base;
        this.index = index;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getIndex() {
        return index;
    }

    /** 任一操作数有副作用则整个下标访问有副作用 */
    public boolean operandsHaveSideEffects() {
        return base.hasSideEffects() || index.hasSideEffects();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
