package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.type.TypeParameter;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<EnumVariantDecl> variants;

    public EnumDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                    String name, List<TypeParameter> typeParams, List<EnumVariantDecl> variants) {
        super(location, annotations, visibility, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.variants = variants != null ? variants : Collections.<EnumVariantDecl>emptyList();
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<EnumVariantDecl> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /**
     * 枚举变体，可携带载荷类型：{@code Some(T)}
     */
    public static final class EnumVariantDecl extends AstNode {
        private final String name;
        private final List<TypeRef> payloadTypes;

        public EnumVariantDecl(SourceLocation location, String name, List<TypeRef> payloadTypes) {
            super(location);
            this.name = name;
            this.payloadTypes = payloadTypes != null ? payloadTypes : Collections.<TypeRef>emptyList();
        }

        public String getName() {
            return name;
        }

        public List<TypeRef> getPayloadTypes() {
            return payloadTypes;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
