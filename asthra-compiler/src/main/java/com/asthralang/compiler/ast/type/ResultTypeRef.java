package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * Result&lt;T, E&gt;
 */
public class ResultTypeRef extends TypeRef {
    private final TypeRef okType;
    private final TypeRef errType;

    public ResultTypeRef(SourceLocation location, TypeRef okType, TypeRef errType) {
        super(location);
        this.okType = okType;
        this.errType = errType;
    }

    public TypeRef getOkType() {
        return okType;
    }

    public TypeRef getErrType() {
        return errType;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitResult(this);
    }

    @Override
    public String toSourceString() {
        return "Result<" + okType.toSourceString() + ", " + errType.toSourceString() + ">";
    }
}
