package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * 命名类型：i32、Point、T、Self
 */
public class NamedTypeRef extends TypeRef {
    private final String name;

    public NamedTypeRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }

    @Override
    public String toSourceString() {
        return name;
    }
}
