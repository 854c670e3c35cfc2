package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * spawn_with_handle h = f(args); 绑定 TaskHandle&lt;T&gt;
 */
public class SpawnWithHandleStmt extends Statement {
    private final String handleName;
    private final Expression call;

    public SpawnWithHandleStmt(SourceLocation location, String handleName, Expression call) {
        super(location);
        this.handleName = handleName;
        this.call = call;
    }

    public String getHandleName() {
        return handleName;
    }

    public Expression getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpawnWithHandleStmt(this, context);
    }
}
