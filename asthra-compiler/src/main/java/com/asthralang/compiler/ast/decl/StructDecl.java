package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.type.TypeParameter;

import java.util.Collections;
import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<StructFieldDecl> fields;
    private final boolean packed;

    public StructDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                      String name, List<TypeParameter> typeParams, List<StructFieldDecl> fields,
                      boolean packed) {
        super(location, annotations, visibility, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.fields = fields != null ? fields : Collections.<StructFieldDecl>emptyList();
        this.packed = packed;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public List<StructFieldDecl> getFields() {
        return fields;
    }

    public boolean isPacked() {
        return packed;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
