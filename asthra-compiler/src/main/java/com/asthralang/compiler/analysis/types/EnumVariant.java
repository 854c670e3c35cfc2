package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;

import java.util.Collections;
import java.util.List;

/**
 * 枚举变体
 */
public final class EnumVariant {
    private final String name;
    private final int index;
    private final List<TypeDescriptor> payloadTypes;
    private final AstNode declaration;

    EnumVariant(String name, int index, List<TypeDescriptor> payloadTypes, AstNode declaration) {
        this.name = name;
        this.index = index;
        this.payloadTypes = Collections.unmodifiableList(payloadTypes);
        this.declaration = declaration;
    }

    public String getName() {
        return name;
    }

    /** 判别值 */
    public int getIndex() {
        return index;
    }

    public List<TypeDescriptor> getPayloadTypes() {
        return payloadTypes;
    }

    public boolean hasPayload() {
        return !payloadTypes.isEmpty();
    }

    public AstNode getDeclaration() {
        return declaration;
    }
}
