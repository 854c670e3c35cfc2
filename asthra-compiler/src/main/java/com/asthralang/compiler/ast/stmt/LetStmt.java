package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.type.TypeRef;

/**
 * 变量绑定：let [mut] name[: Type] [= init];
 */
public class LetStmt extends Statement {
    private final String name;
    private final TypeRef type;         // 可选
    private final Expression initializer; // 可选
    private final boolean mutable;

    public LetStmt(SourceLocation location, String name, TypeRef type,
                   Expression initializer, boolean mutable) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.mutable = mutable;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
