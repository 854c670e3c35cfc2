package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Literal;

/**
 * 字面量模式
 */
public class LiteralPattern extends Pattern {
    private final Literal literal;

    public LiteralPattern(SourceLocation location, Literal literal) {
        super(location);
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralPattern(this, context);
    }
}
