package com.asthralang.compiler.analysis.types;

/**
 * Unit 类型 ()，单例
 */
public final class UnitType extends TypeDescriptor {

    public static final UnitType INSTANCE = new UnitType();

    private UnitType() {
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.UNIT;
    }

    @Override
    public long getSize() {
        return 0;
    }

    @Override
    public boolean isRefCounted() {
        return false;
    }

    @Override
    public String toDisplayString() {
        return "()";
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitUnit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnitType;
    }

    @Override
    public int hashCode() {
        return 0x554e4954;
    }
}
