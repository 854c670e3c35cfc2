package com.asthralang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型 fn(P1, P2) -> R
 */
public final class FunctionType extends TypeDescriptor {

    private final TypeDescriptor returnType;
    private final List<TypeDescriptor> paramTypes;

    FunctionType(TypeDescriptor returnType, List<TypeDescriptor> paramTypes) {
        this.returnType = own(returnType);
        List<TypeDescriptor> params = new ArrayList<>();
        if (paramTypes != null) {
            for (TypeDescriptor p : paramTypes) {
                params.add(own(p));
            }
        }
        this.paramTypes = Collections.unmodifiableList(params);
    }

    public TypeDescriptor getReturnType() {
        return returnType;
    }

    public List<TypeDescriptor> getParamTypes() {
        return paramTypes;
    }

    public int getArity() {
        return paramTypes.size();
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.FUNCTION;
    }

    @Override
    public long getSize() {
        return 8;
    }

    @Override
    protected void releaseChildren() {
        returnType.release();
        for (TypeDescriptor p : paramTypes) {
            p.release();
        }
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("fn(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        return sb.append(") -> ").append(returnType.toDisplayString()).toString();
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return returnType.equals(that.returnType) && paramTypes.equals(that.paramTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.FUNCTION, returnType, paramTypes);
    }
}
