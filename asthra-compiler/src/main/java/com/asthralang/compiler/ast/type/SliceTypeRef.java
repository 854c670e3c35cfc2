package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * 切片类型：[]T / []mut T
 */
public class SliceTypeRef extends TypeRef {
    private final TypeRef elementType;
    private final boolean mutable;

    public SliceTypeRef(SourceLocation location, TypeRef elementType, boolean mutable) {
        super(location);
        this.elementType = elementType;
        this.mutable = mutable;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }

    @Override
    public String toSourceString() {
        return (mutable ? "[]mut " : "[]") + elementType.toSourceString();
    }
}
