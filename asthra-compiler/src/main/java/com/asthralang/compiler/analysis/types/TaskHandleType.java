package com.asthralang.compiler.analysis.types;

import java.util.Objects;

/**
 * spawn_with_handle 产生的 TaskHandle&lt;T&gt;
 */
public final class TaskHandleType extends TypeDescriptor {

    private final TypeDescriptor resultType;

    TaskHandleType(TypeDescriptor resultType) {
        this.resultType = own(resultType);
    }

    public TypeDescriptor getResultType() {
        return resultType;
    }

    @Override
    public TypeCategory getCategory() {
        return TypeCategory.TASK_HANDLE;
    }

    @Override
    public long getSize() {
        return 8;
    }

    @Override
    protected void releaseChildren() {
        resultType.release();
    }

    @Override
    public String toDisplayString() {
        return "TaskHandle<" + resultType.toDisplayString() + ">";
    }

    @Override
    public <R> R accept(TypeDescriptorVisitor<R> visitor) {
        return visitor.visitTaskHandle(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskHandleType)) return false;
        return resultType.equals(((TaskHandleType) o).resultType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TypeCategory.TASK_HANDLE, resultType);
    }
}
