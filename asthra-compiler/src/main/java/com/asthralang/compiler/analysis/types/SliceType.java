package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * 切片类型 []T / []mut T
 */
public final class SliceType extends TypeDescriptor {

    private final TypeDescriptor elementType;
    private final boolean mutable;

    SliceType(TypeDescriptor elementType, boolean mutable) {
        this.elementType = own(elementType);
        this.mutable = mutable;
    }

    public TypeDescriptor getElementType() {
        return elementType;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.SLICE;
    }

    @Override
    public long getSize() {
        return 16;
    }

    @Override
    protected void releaseChildren() {
        elementType.release();
    }

    @Override
    public String toDisplayString() {
        return (mutable ? "[]mut " : "[]") + elementType.toDisplayString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SliceType)) return false;
        SliceType that = (SliceType) o;
        return mutable == that.mutable && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.SLICE, elementType, mutable);
    }
}
