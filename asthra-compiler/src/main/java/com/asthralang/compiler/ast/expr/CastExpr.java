package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.type.TypeRef;

/**
 * 显式转换：expr as Type
 */
public class CastExpr extends Expression {
    private final Expression expression;
    private final TypeRef targetType;

    public CastExpr(SourceLocation location, Expression expression, TypeRef targetType) {
        super(location);
        this.expression = expression;
        this.targetType = targetType;
    }

    public Expression getExpression() {
        return expression;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
