package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.stmt.Block;
import com.asthralang.compiler.ast.type.TypeParameter;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 */
public class FunctionDecl extends Declaration {
    private final List<TypeParameter> typeParams;
    private final List<Parameter> params;
    private final TypeRef returnType;            // 可选，默认 void
    private final Block body;

    public FunctionDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                        String name, List<TypeParameter> typeParams, List<Parameter> params,
                        TypeRef returnType, Block body) {
        super(location, annotations, visibility, name);
        this.typeParams = typeParams != null ? typeParams : Collections.<TypeParameter>emptyList();
        this.params = params != null ? params : Collections.<Parameter>emptyList();
        this.returnType = returnType;
        this.body = body;
    }

    public List<TypeParameter> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
