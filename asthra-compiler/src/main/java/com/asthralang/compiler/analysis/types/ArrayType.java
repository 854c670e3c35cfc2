package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * 定长数组 [N]T。长度的合法性由调用方保证。
 */
public final class ArrayType extends TypeDescriptor {

    private final TypeDescriptor elementType;
    private final long length;

    ArrayType(TypeDescriptor elementType, long length) {
        this.elementType = own(elementType);
        this.length = length;
    }

    public TypeDescriptor getElementType() {
        return elementType;
    }

    public long getLength() {
        return length;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.ARRAY;
    }

    @Override
    public long getSize() {
        return elementType.getSize() * length;
    }

    @Override
    protected void releaseChildren() {
        elementType.release();
    }

    @Override
    public String toDisplayString() {
        return "[" + length + "]" + elementType.toDisplayString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return length == that.length && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.ARRAY, elementType, length);
    }
}
