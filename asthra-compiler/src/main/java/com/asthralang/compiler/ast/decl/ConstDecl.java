package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 常量声明：{@code const MAX: i32 = 100;}
 */
public class ConstDecl extends Declaration {
    private final TypeRef type;
    private final Expression value;

    public ConstDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                     String name, TypeRef type, Expression value) {
        super(location, annotations, visibility, name);
        this.type = type;
        this.value = value;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}
