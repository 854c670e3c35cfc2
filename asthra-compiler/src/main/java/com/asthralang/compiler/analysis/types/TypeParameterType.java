package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * 泛型参数占位类型（如 T），不做单态化
 */
public final class TypeParameterType extends TypeDescriptor {

    private final String name;

    TypeParameterType(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.TYPE_PARAMETER;
    }

    @Override
    public long getSize() {
        return 0;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitTypeParameter(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeParameterType)) return false;
        return name.equals(((TypeParameterType) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.TYPE_PARAMETER, name);
    }
}
