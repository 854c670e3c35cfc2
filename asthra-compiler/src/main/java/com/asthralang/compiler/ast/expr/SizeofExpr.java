package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.type.TypeRef;

/**
 * sizeof(Type)，结果类型 usize
 */
public class SizeofExpr extends Expression {
    private final TypeRef type;

    public SizeofExpr(SourceLocation location, TypeRef type) {
        super(location);
        this.type = type;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSizeofExpr(this, context);
    }
}
