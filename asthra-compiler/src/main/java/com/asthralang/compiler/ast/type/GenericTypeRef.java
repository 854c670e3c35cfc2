package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 泛型类型：Vec&lt;i32&gt;、TaskHandle&lt;T&gt;
 */
public class GenericTypeRef extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public GenericTypeRef(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<TypeRef>emptyList();
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }

    @Override
    public String toSourceString() {
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toSourceString());
        }
        return sb.append('>').toString();
    }
}
