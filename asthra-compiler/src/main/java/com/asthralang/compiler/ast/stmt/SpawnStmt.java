package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * spawn f(args); 丢弃结果的后台任务
 */
public class SpawnStmt extends Statement {
    private final Expression call;

    public SpawnStmt(SourceLocation location, Expression call) {
        super(location);
        this.call = call;
    }

    public Expression getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpawnStmt(this, context);
    }
}
