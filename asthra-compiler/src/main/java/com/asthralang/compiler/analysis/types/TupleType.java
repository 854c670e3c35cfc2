package com.asthralang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 元组类型，至少两个元素
 */
public final class TupleType extends TypeDescriptor {

    private final List<TypeDescriptor> elementTypes;

    TupleType(List<TypeDescriptor> elementTypes) {
        if (elementTypes == null || elementTypes.size() < 2) {
            throw new IllegalArgumentException("元组至少需要 2 个元素");
        }
        List<TypeDescriptor> elements = new ArrayList<>(elementTypes.size());
        for (TypeDescriptor t : elementTypes) {
            elements.add(own(t));
        }
        this.elementTypes = Collections.unmodifiableList(elements);
    }

    public List<TypeDescriptor> getElementTypes() {
        return elementTypes;
    }

    public int getArity() {
        return elementTypes.size();
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.TUPLE;
    }

    @Override
    public long getSize() {
        long size = 0;
        for (TypeDescriptor t : elementTypes) {
            size += t.getSize();
        }
        return size;
    }

    @Override
    protected void releaseChildren() {
        for (TypeDescriptor t : elementTypes) {
            t.release();
        }
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elementTypes.get(i).toDisplayString());
        }
        return sb.append(')').toString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupleType)) return false;
        return elementTypes.equals(((TupleType) o).elementTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.TUPLE, elementTypes);
    }
}
