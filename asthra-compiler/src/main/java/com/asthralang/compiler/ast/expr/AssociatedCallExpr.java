package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 关联函数调用：Type::func(args) / Type&lt;T&gt;::func(args)
 */
public class AssociatedCallExpr extends Expression {
    private final String typeName;
    private final List<TypeRef> typeArgs;
    private final String functionName;
    private final List<Expression> args;

    public AssociatedCallExpr(SourceLocation location, String typeName, List<TypeRef> typeArgs,
                              String functionName, List<Expression> args) {
        super(location);
        this.typeName = typeName;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<TypeRef>emptyList();
        this.functionName = functionName;
        this.args = args != null ? args : Collections.<Expression>emptyList();
    }

    public String getTypeName() {
        return typeName;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssociatedCallExpr(this, context);
    }
}
