package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * Result&lt;T, E&gt;
 */
public final class ResultType extends TypeDescriptor {

    private final TypeDescriptor okType;
    private final TypeDescriptor errType;

    ResultType(TypeDescriptor okType, TypeDescriptor errType) {
        this.okType = own(okType);
        this.errType = own(errType);
    }

    public TypeDescriptor getOkType() {
        return okType;
    }

    public TypeDescriptor getErrType() {
        return errType;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.RESULT;
    }

    @Override
    public long getSize() {
        return Math.max(okType.getSize(), errType.getSize()) + 1;
    }

    @Override
    protected void releaseChildren() {
        okType.release();
        errType.release();
    }

    @Override
    public String toDisplayString() {
        return "Result<" + okType.toDisplayString() + ", " + errType.toDisplayString() + ">";
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitResult(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultType)) return false;
        ResultType that = (ResultType) o;
        return okType.equals(that.okType) && errType.equals(that.errType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.RESULT, okType, errType);
    }
}
