package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * for x in iterable { ... }
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final Block body;

    public ForStmt(SourceLocation location, String variable, Expression iterable, Block body) {
        super(location);
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
