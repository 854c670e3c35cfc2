package com.asthralang.compiler.analysis;

import java.util.Objects;

/**
 * 编译期常量值
 */
public final class ConstValue {

    public enum Kind {
        INTEGER, FLOAT, BOOLEAN, STRING
    }

    private final Kind kind;
    private final long intValue;
    private final double floatValue;
    private final boolean boolValue;
    private final String stringValue;

    private ConstValue(Kind kind, long intValue, double floatValue, boolean boolValue, String stringValue) {
        this.kind = kind;
        this.intValue = intValue;
        this.floatValue = floatValue;
        this.boolValue = boolValue;
        this.stringValue = stringValue;
    }

    public static ConstValue ofInteger(long value) {
        return new ConstValue(Kind.INTEGER, value, 0, false, null);
    }

    public static ConstValue ofFloat(double value) {
        return new ConstValue(Kind.FLOAT, 0, value, false, null);
    }

    public static ConstValue ofBoolean(boolean value) {
        return new ConstValue(Kind.BOOLEAN, 0, 0, value, null);
    }

    public static ConstValue ofString(String value) {
        return new ConstValue(Kind.STRING, 0, 0, false, Objects.requireNonNull(value));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    public boolean isFloat() {
        return kind == Kind.FLOAT;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public long asLong() {
        if (kind != Kind.INTEGER) throw new IllegalStateException("不是整数常量: " + this);
        return intValue;
    }

    /** 整数提升为浮点 */
    public double asDouble() {
        if (kind == Kind.FLOAT) return floatValue;
        if (kind == Kind.INTEGER) return intValue;
        throw new IllegalStateException("不是数值常量: " + this);
    }

    public boolean asBoolean() {
        if (kind != Kind.BOOLEAN) throw new IllegalStateException("不是布尔常量: " + this);
        return boolValue;
    }

    public String asString() {
        if (kind != Kind.STRING) throw new IllegalStateException("不是字符串常量: " + this);
        return stringValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstValue)) return false;
        ConstValue that = (ConstValue) o;
        if (kind != that.kind) return false;
        switch (kind) {
            case INTEGER: return intValue == that.intValue;
            case FLOAT: return Double.compare(floatValue, that.floatValue) == 0;
            case BOOLEAN: return boolValue == that.boolValue;
            default: return stringValue.equals(that.stringValue);
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case INTEGER: return Objects.hash(kind, intValue);
            case FLOAT: return Objects.hash(kind, floatValue);
            case BOOLEAN: return Objects.hash(kind, boolValue);
            default: return Objects.hash(kind, stringValue);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case INTEGER: return Long.toString(intValue);
            case FLOAT: return Double.toString(floatValue);
            case BOOLEAN: return Boolean.toString(boolValue);
            default: return "\"" + stringValue + "\"";
        }
    }
}
