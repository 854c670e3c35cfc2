package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * 裸指针 *const T / *mut T
 */
public final class PointerType extends TypeDescriptor {

    private final TypeDescriptor pointeeType;
    private final boolean mutable;

    PointerType(TypeDescriptor pointeeType, boolean mutable) {
        this.pointeeType = own(pointeeType);
        this.mutable = mutable;
    }

    public TypeDescriptor getPointeeType() {
        return pointeeType;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.POINTER;
    }

    @Override
    public long getSize() {
        return 8;
    }

    @Override
    protected void releaseChildren() {
        pointeeType.release();
    }

    @Override
    public String toDisplayString() {
        return (mutable ? "*mut " : "*const ") + pointeeType.toDisplayString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitPointer(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType)) return false;
        PointerType that = (PointerType) o;
        return mutable == that.mutable && pointeeType.equals(that.pointeeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.POINTER, pointeeType, mutable);
    }
}
