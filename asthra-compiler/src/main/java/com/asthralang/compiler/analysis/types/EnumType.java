package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 枚举类型，相等性只看名称
 */
public final class EnumType extends TypeDescriptor {

    private static final int TAG_SIZE = 4;

    private final String name;
    private final List<String> typeParams;
    private final Map<String, EnumVariant> variants = new LinkedHashMap<>();

    EnumType(String name, List<String> typeParams) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeParams = typeParams != null
                ? Collections.unmodifiableList(new ArrayList<>(typeParams))
                : Collections.<String>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    /** 同名变体已存在返回 false */
    public boolean addVariant(String variantName, List<TypeDescriptor> payloadTypes, AstNode declaration) {
        checkNotReleased();
        if (variants.containsKey(variantName)) return false;
        List<TypeDescriptor> owned = new ArrayList<>();
        if (payloadTypes != null) {
            for (TypeDescriptor t : payloadTypes) {
                owned.add(own(t));
            }
        }
        variants.put(variantName, new EnumVariant(variantName, variants.size(), owned, declaration));
        return true;
    }

    public EnumVariant getVariant(String variantName) {
        return variants.get(variantName);
    }

    public List<EnumVariant> getVariants() {
        return new ArrayList<>(variants.values());
    }

    public int getVariantCount() {
        return variants.size();
    }

    /** 所有变体都不带载荷，可与整数互转 */
    public boolean isPayloadFree() {
        for (EnumVariant v : variants.values()) {
            if (v.hasPayload()) return false;
        }
        return true;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.ENUM;
    }

    @Override
    public long getSize() {
        long maxPayload = 0;
        for (EnumVariant v : variants.values()) {
            long payload = 0;
            for (TypeDescriptor t : v.getPayloadTypes()) {
                payload += t == this ? 0 : t.getSize();
            }
            maxPayload = Math.max(maxPayload, payload);
        }
        return TAG_SIZE + maxPayload;
    }

    @Override
    protected void releaseChildren() {
        for (EnumVariant v : variants.values()) {
            for (TypeDescriptor t : v.getPayloadTypes()) {
                t.release();
            }
        }
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumType)) return false;
        return name.equals(((EnumType) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.ENUM, name);
    }
}
