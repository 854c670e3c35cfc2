package com.asthralang.compiler.analysis.types;

import java.util.EnumMap;
import java.util.Map;

/**
 * 原始类型，每种一个进程级单例
 */
public final class PrimitiveType extends TypeDescriptor {

    private static final Map<PrimitiveKind, PrimitiveType> INSTANCES = new EnumMap<>(PrimitiveKind.class);

    static {
        for (PrimitiveKind kind : PrimitiveKind.values()) {
            INSTANCES.put(kind, new PrimitiveType(kind));
        }
    }

    private final PrimitiveKind kind;

    private PrimitiveType(PrimitiveKind kind) {
        this.kind = kind;
    }

    public static PrimitiveType of(PrimitiveKind kind) {
        return INSTANCES.get(kind);
    }

    public PrimitiveKind getKind() {
        return kind;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.PRIMITIVE;
    }

    @Override
    public long getSize() {
        return kind.getSize();
    }

    @Override
    public boolean isRefCounted() {
        return false;
    }

    @Override
    public String toDisplayString() {
        return kind.getTypeName();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return kind == ((PrimitiveType) o).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
