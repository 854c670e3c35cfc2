package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.PointerType;
import com.asthralang.compiler.analysis.types.PrimitiveKind;
import com.asthralang.compiler.analysis.types.PrimitiveType;
import com.asthralang.compiler.analysis.types.SliceType;
import com.asthralang.compiler.analysis.types.StructField;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TypeCategory;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.Parameter;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * FFI 边界类型检查。
 *
 * <p>可跨越边界的类型：除 string 与 Never 外的原始类型、指针、
 * 字段全部可跨越的结构体、无负载枚举。切片需拆成指针加长度传递。</p>
 */
final class FfiValidator {

    private final SemanticAnalyzer analyzer;

    FfiValidator(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    boolean isFfiSafe(TypeDescriptor type) {
        return isFfiSafe(type, Collections.newSetFromMap(new IdentityHashMap<TypeDescriptor, Boolean>()));
    }

    private boolean isFfiSafe(TypeDescriptor type, Set<TypeDescriptor> visiting) {
        if (type == null) return false;
        if (type instanceof PrimitiveType) {
            PrimitiveKind kind = ((PrimitiveType) type).getKind();
            return kind != PrimitiveKind.STRING && kind != PrimitiveKind.NEVER && kind != PrimitiveKind.VOID;
        }
        if (type instanceof PointerType) return true;
        if (type instanceof EnumType) return ((EnumType) type).isPayloadFree();
        if (type instanceof StructType) {
            StructType struct = (StructType) type;
            if (struct.isGeneric()) return false;
            // 自引用只可能经由指针，已在上面放行
            if (!visiting.add(struct)) return true;
            for (StructField field : struct.getFields()) {
                if (!isFfiSafe(field.getType(), visiting)) return false;
            }
            return true;
        }
        return false;
    }

    boolean checkParameter(String externName, Parameter param, TypeDescriptor type) {
        if (type == null) return false;
        if (type.isVoid()) {
            analyzer.reportError(ErrorKind.FFI_INCOMPATIBLE_TYPE, param.getLocation(),
                    "外部函数 %s 的参数 '%s' 不能是 void", externName, param.getName());
            return false;
        }
        return check(type, param.getLocation(), "外部函数 " + externName + " 的参数 '" + param.getName() + "'");
    }

    boolean checkReturn(String externName, TypeDescriptor type, SourceLocation location) {
        if (type == null) return false;
        if (type.isVoid()) return true;
        return check(type, location, "外部函数 " + externName + " 的返回值");
    }

    private boolean check(TypeDescriptor type, SourceLocation location, String what) {
        if (isFfiSafe(type)) return true;

        if (type instanceof SliceType) {
            TypeDescriptor element = ((SliceType) type).getElementType();
            analyzer.reportErrorWithSuggestion(ErrorKind.FFI_INCOMPATIBLE_TYPE, location,
                    "改为传递两个参数: ptr: *const " + element.toDisplayString() + ", len: usize",
                    "%s 不能使用切片类型 %s", what, type.toDisplayString());
        } else if (type.isPrimitive(PrimitiveKind.STRING)) {
            analyzer.reportErrorWithSuggestion(ErrorKind.FFI_INCOMPATIBLE_TYPE, location,
                    "使用 *const u8",
                    "%s 不能使用 string", what);
        } else if (isGeneric(type)) {
            analyzer.reportError(ErrorKind.FFI_INCOMPATIBLE_TYPE, location,
                    "%s 不能使用泛型类型 %s", what, type.toDisplayString());
        } else {
            analyzer.reportError(ErrorKind.FFI_INCOMPATIBLE_TYPE, location,
                    "类型 %s 不能跨越 FFI 边界 (%s)", type.toDisplayString(), what);
        }
        return false;
    }

    private static boolean isGeneric(TypeDescriptor type) {
        TypeCategory c = type.getCategory();
        if (c == TypeCategory.GENERIC_INSTANCE || c == TypeCategory.TYPE_PARAMETER) return true;
        return type instanceof StructType && ((StructType) type).isGeneric();
    }
}
