package com.asthralang.compiler.analysis.types;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 已解析类型的描述符基类。
 *
 * <p>复合描述符带引用计数：新建时计数为 0（游离状态），每个持有者调用
 * {@link #retain()}，计数归零的 {@link #release()} 将描述符标记为已释放并级联释放
 * 其持有的子描述符。原始类型与 unit 为进程级单例，不参与计数。</p>
 *
 * <p>相等性按结构递归比较；结构体、枚举、类型参数按名称比较。</p>
 */
public abstract class TypeDescriptor {

    private final AtomicInteger refCount = new AtomicInteger();
    private volatile boolean released;

    public abstract TypeCategory getCategory();

    /** 字节大小 */
    public abstract long getSize();

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 TypeDescriptorVisitor 进行类型分派 */
    public abstract <R> R accept(TypeDescriptorVisitor<R> visitor);

    /** 单例类型返回 false */
    public boolean isRefCounted() {
        return true;
    }

    public int getRefCount() {
        return refCount.get();
    }

    public boolean isReleased() {
        return released;
    }

    public TypeDescriptor retain() {
        if (!isRefCounted()) return this;
        checkNotReleased();
        refCount.incrementAndGet();
        return this;
    }

    public void release() {
        if (!isRefCounted()) return;
        checkNotReleased();
        int remaining = refCount.decrementAndGet();
        if (remaining < 0) {
            refCount.incrementAndGet();
            throw new IllegalStateException("引用计数下溢: " + toDisplayString());
        }
        if (remaining == 0) {
            released = true;
            releaseChildren();
        }
    }

    /** 计数归零时释放持有的子描述符 */
    protected void releaseChildren() {
    }

    protected final void checkNotReleased() {
        if (released) {
            throw new IllegalStateException("类型描述符已释放: " + toDisplayString());
        }
    }

    /** 子描述符挂接到复合描述符时调用 */
    protected static <T extends TypeDescriptor> T own(T child) {
        if (child == null) throw new NullPointerException("子类型不能为空");
        child.retain();
        return child;
    }

    public boolean isPrimitive() {
        return getCategory() == TypeCategory.PRIMITIVE;
    }

    public boolean isPrimitive(PrimitiveKind kind) {
        return this instanceof PrimitiveType && ((PrimitiveType) this).getKind() == kind;
    }

    public boolean isInteger() {
        return this instanceof PrimitiveType && ((PrimitiveType) this).getKind().isInteger();
    }

    public boolean isFloat() {
        return this instanceof PrimitiveType && ((PrimitiveType) this).getKind().isFloat();
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    public boolean isBool() {
        return isPrimitive(PrimitiveKind.BOOL);
    }

    public boolean isVoid() {
        return isPrimitive(PrimitiveKind.VOID) || getCategory() == TypeCategory.UNIT;
    }

    public boolean isNever() {
        return isPrimitive(PrimitiveKind.NEVER);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
