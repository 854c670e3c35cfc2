package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * 定长数组类型：[N]T，N 必须是编译期正整数常量
 */
public class ArrayTypeRef extends TypeRef {
    private final TypeRef elementType;
    private final Expression size;

    public ArrayTypeRef(SourceLocation location, TypeRef elementType, Expression size) {
        super(location);
        this.elementType = elementType;
        this.size = size;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public Expression getSize() {
        return size;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String toSourceString() {
        return "[N]" + elementType.toSourceString();
    }
}
