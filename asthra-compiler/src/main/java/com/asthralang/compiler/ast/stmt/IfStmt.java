package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * if 语句，else 分支可以是 Block 或另一个 IfStmt
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Statement elseBranch;

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
