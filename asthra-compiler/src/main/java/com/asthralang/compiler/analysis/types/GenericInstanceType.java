package com.asthralang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 泛型实例化 Base&lt;A1, A2&gt;
 */
public final class GenericInstanceType extends TypeDescriptor {

    private final TypeDescriptor baseType;
    private final List<TypeDescriptor> typeArgs;

    GenericInstanceType(TypeDescriptor baseType, List<TypeDescriptor> typeArgs) {
        this.baseType = own(baseType);
        List<TypeDescriptor> args = new ArrayList<>();
        if (typeArgs != null) {
            for (TypeDescriptor a : typeArgs) {
                args.add(own(a));
            }
        }
        this.typeArgs = Collections.unmodifiableList(args);
    }

    public TypeDescriptor getBaseType() {
        return baseType;
    }

    public List<TypeDescriptor> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.GENERIC_INSTANCE;
    }

    @Override
    public long getSize() {
        return baseType.getSize();
    }

    @Override
    protected void releaseChildren() {
        baseType.release();
        for (TypeDescriptor a : typeArgs) {
            a.release();
        }
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder(baseType.toDisplayString()).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toDisplayString());
        }
        return sb.append('>').toString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitGenericInstance(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericInstanceType)) return false;
        GenericInstanceType that = (GenericInstanceType) o;
        return baseType.equals(that.baseType) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.GENERIC_INSTANCE, baseType, typeArgs);
    }
}
