package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 元组类型：(T1, T2, ...)
 */
public class TupleTypeRef extends TypeRef {
    private final List<TypeRef> elementTypes;

    public TupleTypeRef(SourceLocation location, List<TypeRef> elementTypes) {
        super(location);
        this.elementTypes = elementTypes != null ? elementTypes : Collections.<TypeRef>emptyList();
    }

    public List<TypeRef> getElementTypes() {
        return elementTypes;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elementTypes.get(i).toSourceString());
        }
        return sb.append(')').toString();
    }
}
