package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * Option&lt;T&gt;
 */
public final class OptionType extends TypeDescriptor {

    private final TypeDescriptor valueType;

    OptionType(TypeDescriptor valueType) {
        this.valueType = own(valueType);
    }

    public TypeDescriptor getValueType() {
        return valueType;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.OPTION;
    }

    @Override
    public long getSize() {
        return valueType.getSize() + 1;
    }

    @Override
    protected void releaseChildren() {
        valueType.release();
    }

    @Override
    public String toDisplayString() {
        return "Option<" + valueType.toDisplayString() + ">";
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitOption(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionType)) return false;
        return valueType.equals(((OptionType) o).valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.OPTION, valueType);
    }
}
