package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数类型：fn(T1, T2) -> R
 */
public class FunctionTypeRef extends TypeRef {
    private final List<TypeRef> paramTypes;
    private final TypeRef returnType;

    public FunctionTypeRef(SourceLocation location, List<TypeRef> paramTypes, TypeRef returnType) {
        super(location);
        this.paramTypes = paramTypes != null ? paramTypes : Collections.<TypeRef>emptyList();
        this.returnType = returnType;
    }

    public List<TypeRef> getParamTypes() {
        return paramTypes;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder("fn(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toSourceString());
        }
        sb.append(')');
        if (returnType != null) {
            sb.append(" -> ").append(returnType.toSourceString());
        }
        return sb.toString();
    }
}
