package com.asthralang.compiler.analysis.types;

import java.util.List;

/**
 * 类型兼容性判断：隐式赋值、二元运算提升与显式转换。
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /** 显式转换的判定结果 */
    public enum CastValidity {
        ALLOWED,
        REQUIRES_UNSAFE,
        FORBIDDEN
    }

    /**
     * 判断 source 类型是否可以隐式赋值给 target 类型。
     */
    public static boolean isAssignable(TypeDescriptor target, TypeDescriptor source) {
        if (target == null || source == null) return true;
        if (target.equals(source)) return true;

        // Never 是所有类型的子类型
        if (source.isNever()) return true;

        // 泛型参数不做单态化，接受任何类型
        if (target.getCategory() == TypeCategory.TYPE_PARAMETER
                || source.getCategory() == TypeCategory.TYPE_PARAMETER) {
            return true;
        }

        if (target.isVoid() && source.isVoid()) return true;

        if (target instanceof PrimitiveType && source instanceof PrimitiveType) {
            return isNumericWidening(((PrimitiveType) target).getKind(), ((PrimitiveType) source).getKind());
        }

        switch (target.getCategory()) {
            case SLICE: {
                SliceType t = (SliceType) target;
                if (source instanceof SliceType) {
                    SliceType s = (SliceType) source;
                    // []mut T 可作为 []T 使用
                    return !t.isMutable() && s.isMutable() && t.getElementType().equals(s.getElementType());
                }
                if (source instanceof ArrayType) {
                    return !t.isMutable() && t.getElementType().equals(((ArrayType) source).getElementType());
                }
                return false;
            }
            case POINTER: {
                if (!(source instanceof PointerType)) return false;
                PointerType t = (PointerType) target;
                PointerType s = (PointerType) source;
                if (t.isMutable() && !s.isMutable()) return false;
                return t.getPointeeType().equals(s.getPointeeType())
                        || t.getPointeeType().isVoid();
            }
            case OPTION:
                return source instanceof OptionType
                        && isAssignable(((OptionType) target).getValueType(), ((OptionType) source).getValueType());
            case RESULT:
                if (!(source instanceof ResultType)) return false;
                return isAssignable(((ResultType) target).getOkType(), ((ResultType) source).getOkType())
                        && isAssignable(((ResultType) target).getErrType(), ((ResultType) source).getErrType());
            case TASK_HANDLE:
                return source instanceof TaskHandleType
                        && isAssignable(((TaskHandleType) target).getResultType(),
                        ((TaskHandleType) source).getResultType());
            case GENERIC_INSTANCE:
                if (!(source instanceof GenericInstanceType)) return false;
                return isGenericAssignable((GenericInstanceType) target, (GenericInstanceType) source);
            case TUPLE:
                if (!(source instanceof TupleType)) return false;
                return areAllAssignable(((TupleType) target).getElementTypes(), ((TupleType) source).getElementTypes());
            default:
                return false;
        }
    }

    private static boolean isGenericAssignable(GenericInstanceType target, GenericInstanceType source) {
        if (!target.getBaseType().equals(source.getBaseType())) return false;
        return areAllAssignable(target.getTypeArgs(), source.getTypeArgs());
    }

    private static boolean areAllAssignable(List<TypeDescriptor> targets, List<TypeDescriptor> sources) {
        if (targets.size() != sources.size()) return false;
        for (int i = 0; i < targets.size(); i++) {
            if (!isAssignable(targets.get(i), sources.get(i))) return false;
        }
        return true;
    }

    /**
     * 数值拓宽：同符号整数由窄到宽，f32 到 f64
     */
    public static boolean isNumericWidening(PrimitiveKind target, PrimitiveKind source) {
        if (target == source) return true;
        if (target.isInteger() && source.isInteger()) {
            return target.isSigned() == source.isSigned() && target.getBitWidth() >= source.getBitWidth();
        }
        return target == PrimitiveKind.F64 && source == PrimitiveKind.F32;
    }

    public static boolean isIntegerType(TypeDescriptor type) {
        return type != null && type.isInteger();
    }

    public static boolean isFloatType(TypeDescriptor type) {
        return type != null && type.isFloat();
    }

    public static boolean isNumericType(TypeDescriptor type) {
        return type != null && type.isNumeric();
    }

    public static boolean isSignedNumeric(TypeDescriptor type) {
        return type instanceof PrimitiveType && ((PrimitiveType) type).getKind().isSigned()
                && ((PrimitiveType) type).getKind().isNumeric();
    }

    /** 两个整数类型的符号性是否不同 */
    public static boolean hasMixedSignedness(TypeDescriptor a, TypeDescriptor b) {
        return isIntegerType(a) && isIntegerType(b) && isSignedNumeric(a) != isSignedNumeric(b);
    }

    /**
     * 二元算术运算的提升结果：较宽的操作数类型胜出，整数与浮点混合取浮点。
     * 无法提升（非数值或符号不同）返回 null。
     */
    public static TypeDescriptor promote(TypeDescriptor a, TypeDescriptor b) {
        if (a == null || b == null) return null;
        if (!a.isNumeric() || !b.isNumeric()) return null;
        if (a.equals(b)) return a;
        PrimitiveKind ka = ((PrimitiveType) a).getKind();
        PrimitiveKind kb = ((PrimitiveType) b).getKind();
        if (ka.isFloat() || kb.isFloat()) {
            if (ka.isFloat() && kb.isFloat()) {
                return ka.getBitWidth() >= kb.getBitWidth() ? a : b;
            }
            return ka.isFloat() ? a : b;
        }
        if (ka.isSigned() != kb.isSigned()) return null;
        return ka.getBitWidth() >= kb.getBitWidth() ? a : b;
    }

    /**
     * 显式转换 source as target 的合法性
     */
    public static CastValidity classifyCast(TypeDescriptor source, TypeDescriptor target) {
        if (source == null || target == null) return CastValidity.FORBIDDEN;
        if (source.equals(target)) return CastValidity.ALLOWED;

        if (source.isNumeric() && target.isNumeric()) return CastValidity.ALLOWED;

        // char <-> 整数
        if (source.isPrimitive(PrimitiveKind.CHAR) && target.isInteger()) return CastValidity.ALLOWED;
        if (source.isInteger() && target.isPrimitive(PrimitiveKind.CHAR)) return CastValidity.ALLOWED;

        // bool -> 整数
        if (source.isBool() && target.isInteger()) return CastValidity.ALLOWED;

        // 枚举 <-> 整数
        if (source instanceof EnumType && target.isInteger()) {
            return ((EnumType) source).isPayloadFree() ? CastValidity.ALLOWED : CastValidity.FORBIDDEN;
        }
        if (source.isInteger() && target instanceof EnumType) {
            return ((EnumType) target).isPayloadFree() ? CastValidity.ALLOWED : CastValidity.FORBIDDEN;
        }

        // 指针重解释
        if (source instanceof PointerType && target instanceof PointerType) return CastValidity.REQUIRES_UNSAFE;
        if (source instanceof PointerType && isPointerSizedInteger(target)) return CastValidity.REQUIRES_UNSAFE;
        if (isPointerSizedInteger(source) && target instanceof PointerType) return CastValidity.REQUIRES_UNSAFE;

        return CastValidity.FORBIDDEN;
    }

    private static boolean isPointerSizedInteger(TypeDescriptor type) {
        return type.isPrimitive(PrimitiveKind.USIZE) || type.isPrimitive(PrimitiveKind.ISIZE);
    }
}
