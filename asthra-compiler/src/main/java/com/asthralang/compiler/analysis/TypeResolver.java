package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TypeCategory;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.type.ArrayTypeRef;
import com.asthralang.compiler.ast.type.FunctionTypeRef;
import com.asthralang.compiler.ast.type.GenericTypeRef;
import com.asthralang.compiler.ast.type.NamedTypeRef;
import com.asthralang.compiler.ast.type.OptionTypeRef;
import com.asthralang.compiler.ast.type.PointerTypeRef;
import com.asthralang.compiler.ast.type.ResultTypeRef;
import com.asthralang.compiler.ast.type.SliceTypeRef;
import com.asthralang.compiler.ast.type.TupleTypeRef;
import com.asthralang.compiler.ast.type.TypeRef;
import com.asthralang.compiler.ast.type.TypeRefVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 将类型语法节点解析为 {@link TypeDescriptor}，并挂接到节点上。
 * 解析失败时报告诊断并返回 null。
 */
final class TypeResolver implements TypeRefVisitor<TypeDescriptor> {

    static final String SELF_TYPE = "Self";

    private final SemanticAnalyzer analyzer;

    TypeResolver(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    TypeDescriptor analyzeTypeNode(TypeRef ref) {
        if (ref == null) return null;
        TypeDescriptor resolved = ref.accept(this);
        if (resolved != null) {
            analyzer.attachTypeRef(ref, resolved);
        }
        return resolved;
    }

    /** 任一元素解析失败返回 null，但所有元素都会被解析以暴露全部错误 */
    private List<TypeDescriptor> resolveAll(List<TypeRef> refs) {
        List<TypeDescriptor> result = new ArrayList<TypeDescriptor>(refs.size());
        boolean failed = false;
        for (TypeRef ref : refs) {
            TypeDescriptor t = analyzeTypeNode(ref);
            if (t == null) failed = true;
            result.add(t);
        }
        return failed ? null : result;
    }

    @Override
    public TypeDescriptor visitNamed(NamedTypeRef type) {
        String name = type.getName();
        if (SELF_TYPE.equals(name)) {
            StructType impl = analyzer.getCurrentImpl();
            if (impl == null) {
                analyzer.reportError(ErrorKind.INVALID_TYPE, type.getLocation(), "Self 只能在 impl 块中使用");
            }
            return impl;
        }

        TypeDescriptor builtin = analyzer.getBuiltinType(name);
        if (builtin != null) return builtin;

        if (BuiltinGenerics.arityOf(name) > 0) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, type.getLocation(),
                    "泛型类型 %s 需要 %d 个类型实参", name, BuiltinGenerics.arityOf(name));
            return null;
        }

        TypeDescriptor declared = resolveDeclaredType(name, type);
        if (declared == null) return null;
        int expected = typeParamCount(declared);
        if (expected > 0) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, type.getLocation(),
                    "泛型类型 %s 需要 %d 个类型实参", name, expected);
            return null;
        }
        return declared;
    }

    @Override
    public TypeDescriptor visitGeneric(GenericTypeRef type) {
        String name = type.getName();
        List<TypeDescriptor> args = resolveAll(type.getTypeArgs());

        int builtinArity = BuiltinGenerics.arityOf(name);
        if (builtinArity > 0) {
            if (type.getTypeArgs().size() != builtinArity) {
                analyzer.reportError(ErrorKind.ARITY_MISMATCH, type.getLocation(),
                        "类型 %s 需要 %d 个类型实参，实际 %d", name, builtinArity, type.getTypeArgs().size());
                return null;
            }
            if (args == null) return null;
            return BuiltinGenerics.create(name, args);
        }

        TypeDescriptor base = resolveDeclaredType(name, type);
        if (base == null) return null;
        int expected = typeParamCount(base);
        if (expected != type.getTypeArgs().size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, type.getLocation(),
                    "类型 %s 需要 %d 个类型实参，实际 %d", name, expected, type.getTypeArgs().size());
            return null;
        }
        if (args == null) return null;
        return analyzer.getGenericCache().getOrCreate(base, args);
    }

    @Override
    public TypeDescriptor visitSlice(SliceTypeRef type) {
        TypeDescriptor element = analyzeTypeNode(type.getElementType());
        if (element == null) return null;
        if (element.isVoid() || element.isNever()) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, type.getLocation(),
                    "切片元素类型不能是 %s", element.toDisplayString());
            return null;
        }
        return TypeDescriptors.createSlice(element, type.isMutable());
    }

    @Override
    public TypeDescriptor visitArray(ArrayTypeRef type) {
        TypeDescriptor element = analyzeTypeNode(type.getElementType());
        ConstValue size;
        try {
            size = analyzer.constEvaluator().evaluate(type.getSize());
        } catch (ConstEvaluationException e) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, e.getLocation(),
                    "数组长度必须是编译期常量: %s", e.getMessage());
            return null;
        }
        if (!size.isInteger()) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, type.getSize().getLocation(),
                    "数组长度必须是整数，实际 %s", size);
            return null;
        }
        if (size.asLong() <= 0) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, type.getSize().getLocation(),
                    "数组长度必须为正整数，实际 %d", size.asLong());
            return null;
        }
        if (element == null) return null;
        return TypeDescriptors.createArray(element, size.asLong());
    }

    @Override
    public TypeDescriptor visitPointer(PointerTypeRef type) {
        TypeDescriptor pointee = analyzeTypeNode(type.getPointeeType());
        if (pointee == null) return null;
        return TypeDescriptors.createPointer(pointee, type.isMutable());
    }

    @Override
    public TypeDescriptor visitTuple(TupleTypeRef type) {
        if (type.getElementTypes().size() < 2) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, type.getLocation(),
                    "元组类型至少需要 2 个元素，实际 %d", type.getElementTypes().size());
            return null;
        }
        List<TypeDescriptor> elements = resolveAll(type.getElementTypes());
        return elements != null ? TypeDescriptors.createTuple(elements) : null;
    }

    @Override
    public TypeDescriptor visitFunction(FunctionTypeRef type) {
        List<TypeDescriptor> params = resolveAll(type.getParamTypes());
        TypeDescriptor ret = type.getReturnType() != null
                ? analyzeTypeNode(type.getReturnType())
                : TypeDescriptors.VOID;
        if (params == null || ret == null) return null;
        return TypeDescriptors.createFunction(ret, params);
    }

    @Override
    public TypeDescriptor visitOption(OptionTypeRef type) {
        TypeDescriptor value = analyzeTypeNode(type.getValueType());
        return value != null ? TypeDescriptors.createOption(value) : null;
    }

    @Override
    public TypeDescriptor visitResult(ResultTypeRef type) {
        TypeDescriptor ok = analyzeTypeNode(type.getOkType());
        TypeDescriptor err = analyzeTypeNode(type.getErrType());
        if (ok == null || err == null) return null;
        return TypeDescriptors.createResult(ok, err);
    }

    // ============ 辅助 ============

    private TypeDescriptor resolveDeclaredType(String name, TypeRef ref) {
        Symbol symbol = analyzer.resolve(name);
        if (symbol == null) {
            analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, ref.getLocation(), "未知类型 '%s'", name);
            return null;
        }
        if (symbol.getKind() != SymbolKind.TYPE && symbol.getKind() != SymbolKind.TYPE_PARAMETER) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, ref.getLocation(), "'%s' 不是类型", name);
            return null;
        }
        symbol.markUsed();
        return symbol.getType();
    }

    static int typeParamCount(TypeDescriptor type) {
        if (type instanceof StructType) return ((StructType) type).getTypeParams().size();
        if (type instanceof EnumType) return ((EnumType) type).getTypeParams().size();
        return 0;
    }

    static List<String> typeParamsOf(TypeDescriptor type) {
        if (type instanceof StructType) return ((StructType) type).getTypeParams();
        if (type instanceof EnumType) return ((EnumType) type).getTypeParams();
        return Collections.emptyList();
    }

    static boolean isTypeParameter(TypeDescriptor type) {
        return type != null && type.getCategory() == TypeCategory.TYPE_PARAMETER;
    }

    /**
     * 内置泛型：Option、Result、TaskHandle
     */
    static final class BuiltinGenerics {
        static final String OPTION = "Option";
        static final String RESULT = "Result";
        static final String TASK_HANDLE = "TaskHandle";

        private BuiltinGenerics() {
        }

        static int arityOf(String name) {
            if (OPTION.equals(name) || TASK_HANDLE.equals(name)) return 1;
            if (RESULT.equals(name)) return 2;
            return 0;
        }

        static TypeDescriptor create(String name, List<TypeDescriptor> args) {
            if (OPTION.equals(name)) return TypeDescriptors.createOption(args.get(0));
            if (RESULT.equals(name)) return TypeDescriptors.createResult(args.get(0), args.get(1));
            return TypeDescriptors.createTaskHandle(args.get(0));
        }
    }
}
