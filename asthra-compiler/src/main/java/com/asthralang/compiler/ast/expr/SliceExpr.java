package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 切片表达式：target[start:end]，两端均可省略
 */
public class SliceExpr extends Expression {
    private final Expression target;
    private final Expression start;
    private final Expression end;

    public SliceExpr(SourceLocation location, Expression target, Expression start, Expression end) {
        super(location);
        this.target = target;
        this.start = start;
        this.end = end;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSliceExpr(this, context);
    }
}
