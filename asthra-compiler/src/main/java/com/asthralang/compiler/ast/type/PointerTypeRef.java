package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * 裸指针类型：*const T / *mut T
 */
public class PointerTypeRef extends TypeRef {
    private final TypeRef pointeeType;
    private final boolean mutable;

    public PointerTypeRef(SourceLocation location, TypeRef pointeeType, boolean mutable) {
        super(location);
        this.pointeeType = pointeeType;
        this.mutable = mutable;
    }

    public TypeRef getPointeeType() {
        return pointeeType;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitPointer(this);
    }

    @Override
    public String toSourceString() {
        return (mutable ? "*mut " : "*const ") + pointeeType.toSourceString();
    }
}
