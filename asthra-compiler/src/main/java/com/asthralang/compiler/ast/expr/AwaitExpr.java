package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * await handle
 */
public class AwaitExpr extends Expression {
    private final Expression handle;

    public AwaitExpr(SourceLocation location, Expression handle) {
        super(location);
        this.handle = handle;
    }

    public Expression getHandle() {
        return handle;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAwaitExpr(this, context);
    }
}
