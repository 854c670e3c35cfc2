package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * Option&lt;T&gt;
 */
public class OptionTypeRef extends TypeRef {
    private final TypeRef valueType;

    public OptionTypeRef(SourceLocation location, TypeRef valueType) {
        super(location);
        this.valueType = valueType;
    }

    public TypeRef getValueType() {
        return valueType;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitOption(this);
    }

    @Override
    public String toSourceString() {
        return "Option<" + valueType.toSourceString() + ">";
    }
}
