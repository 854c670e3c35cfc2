package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 结构体类型。字段按插入顺序保存，按名称查找。
 *
 * <p>声明阶段逐步添加字段与方法；相等性只看名称与 packed 标记。</p>
 */
public final class StructType extends TypeDescriptor {

    private final String name;
    private final boolean packed;
    private final List<String> typeParams;
    private final Map<String, StructField> fields;
    private final Map<String, StructMethod> methods = new LinkedHashMap<>();

    StructType(String name, int fieldCapacity, boolean packed, List<String> typeParams) {
        this.name = Objects.requireNonNull(name, "name");
        this.packed = packed;
        this.typeParams = typeParams != null
                ? Collections.unmodifiableList(new ArrayList<>(typeParams))
                : Collections.<String>emptyList();
        this.fields = new LinkedHashMap<>(Math.max(4, fieldCapacity * 2));
    }

    public String getName() {
        return name;
    }

    public boolean isPacked() {
        return packed;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    /** 同名字段已存在返回 false */
    public boolean addField(String fieldName, TypeDescriptor type, AstNode declaration, boolean isPublic) {
        checkNotReleased();
        if (fields.containsKey(fieldName)) return false;
        fields.put(fieldName, new StructField(fieldName, own(type), declaration, isPublic, fields.size()));
        return true;
    }

    public StructField getField(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public List<StructField> getFields() {
        return new ArrayList<>(fields.values());
    }

    public int getFieldCount() {
        return fields.size();
    }

    /** 同名方法已存在返回 false */
    public boolean addMethod(StructMethod method) {
        checkNotReleased();
        if (methods.containsKey(method.getName())) return false;
        own(method.getSignature());
        methods.put(method.getName(), method);
        return true;
    }

    public StructMethod getMethod(String methodName) {
        return methods.get(methodName);
    }

    public List<StructMethod> getMethods() {
        return new ArrayList<>(methods.values());
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.STRUCT;
    }

    @Override
    public long getSize() {
        long size = 0;
        long maxAlign = 1;
        for (StructField field : fields.values()) {
            long fieldSize = field.getType() == this ? 0 : field.getType().getSize();
            if (!packed) {
                long align = Math.max(1, Math.min(fieldSize, 8));
                maxAlign = Math.max(maxAlign, align);
                size = (size + align - 1) / align * align;
            }
            size += fieldSize;
        }
        if (!packed) {
            size = (size + maxAlign - 1) / maxAlign * maxAlign;
        }
        return size;
    }

    @Override
    protected void releaseChildren() {
        for (StructField field : fields.values()) {
            field.getType().release();
        }
        for (StructMethod method : methods.values()) {
            method.getSignature().release();
        }
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        StructType that = (StructType) o;
        return packed == that.packed && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.STRUCT, name, packed);
    }
}
