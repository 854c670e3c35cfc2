package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 字段访问：obj.field、slice.len、tuple.0、alias.func
 */
public class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String fieldName;

    public FieldAccessExpr(SourceLocation location, Expression target, String fieldName) {
        super(location);
        this.target = target;
        this.fieldName = fieldName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
