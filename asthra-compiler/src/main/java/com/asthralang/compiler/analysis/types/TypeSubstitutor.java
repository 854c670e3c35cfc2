package com.asthralang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把类型中的泛型参数替换为实参。未发生替换时返回原实例。
 */
public final class TypeSubstitutor implements TypeDescriptorVisitor<TypeDescriptor> {

    private final Map<String, TypeDescriptor> bindings;

    public TypeSubstitutor(Map<String, TypeDescriptor> bindings) {
        this.bindings = bindings;
    }

    public TypeDescriptor substitute(TypeDescriptor type) {
        if (type == null || bindings.isEmpty()) return type;
        return type.accept(this);
    }

    /**
     * 以 param 为模式匹配 arg，把其中出现的类型参数记入 bindings。
     * 已绑定的参数与新实参冲突时返回 false。
     */
    public static boolean bind(TypeDescriptor param, TypeDescriptor arg, Map<String, TypeDescriptor> bindings) {
        if (param == null || arg == null) return true;
        if (param instanceof TypeParameterType) {
            String name = ((TypeParameterType) param).getName();
            TypeDescriptor bound = bindings.get(name);
            if (bound == null) {
                bindings.put(name, arg);
                return true;
            }
            return TypeCompatibility.isAssignable(bound, arg);
        }
        if (param instanceof SliceType && arg instanceof SliceType) {
            return bind(((SliceType) param).getElementType(), ((SliceType) arg).getElementType(), bindings);
        }
        if (param instanceof SliceType && arg instanceof ArrayType) {
            return bind(((SliceType) param).getElementType(), ((ArrayType) arg).getElementType(), bindings);
        }
        if (param instanceof ArrayType && arg instanceof ArrayType) {
            return bind(((ArrayType) param).getElementType(), ((ArrayType) arg).getElementType(), bindings);
        }
        if (param instanceof PointerType && arg instanceof PointerType) {
            return bind(((PointerType) param).getPointeeType(), ((PointerType) arg).getPointeeType(), bindings);
        }
        if (param instanceof OptionType && arg instanceof OptionType) {
            return bind(((OptionType) param).getValueType(), ((OptionType) arg).getValueType(), bindings);
        }
        if (param instanceof ResultType && arg instanceof ResultType) {
            return bind(((ResultType) param).getOkType(), ((ResultType) arg).getOkType(), bindings)
                    && bind(((ResultType) param).getErrType(), ((ResultType) arg).getErrType(), bindings);
        }
        if (param instanceof TaskHandleType && arg instanceof TaskHandleType) {
            return bind(((TaskHandleType) param).getResultType(), ((TaskHandleType) arg).getResultType(), bindings);
        }
        if (param instanceof TupleType && arg instanceof TupleType) {
            return bindAll(((TupleType) param).getElementTypes(), ((TupleType) arg).getElementTypes(), bindings);
        }
        if (param instanceof GenericInstanceType && arg instanceof GenericInstanceType) {
            return bindAll(((GenericInstanceType) param).getTypeArgs(),
                    ((GenericInstanceType) arg).getTypeArgs(), bindings);
        }
        return true;
    }

    private static boolean bindAll(List<TypeDescriptor> params, List<TypeDescriptor> args,
                                   Map<String, TypeDescriptor> bindings) {
        if (params.size() != args.size()) return true;
        boolean ok = true;
        for (int i = 0; i < params.size(); i++) {
            ok &= bind(params.get(i), args.get(i), bindings);
        }
        return ok;
    }

    private List<TypeDescriptor> substituteAll(List<TypeDescriptor> types, boolean[] changed) {
        List<TypeDescriptor> result = new ArrayList<>(types.size());
        for (TypeDescriptor t : types) {
            TypeDescriptor s = t.accept(this);
            if (s != t) changed[0] = true;
            result.add(s);
        }
        return result;
    }

    @Override
    public TypeDescriptor visitPrimitive(PrimitiveType type) {
        return type;
    }

    @Override
    public TypeDescriptor visitStruct(StructType type) {
        return type;
    }

    @Override
    public TypeDescriptor visitEnum(EnumType type) {
        return type;
    }

    @Override
    public TypeDescriptor visitSlice(SliceType type) {
        TypeDescriptor e = type.getElementType().accept(this);
        return e == type.getElementType() ? type : TypeDescriptors.createSlice(e, type.isMutable());
    }

    @Override
    public TypeDescriptor visitArray(ArrayType type) {
        TypeDescriptor e = type.getElementType().accept(this);
        return e == type.getElementType() ? type : TypeDescriptors.createArray(e, type.getLength());
    }

    @Override
    public TypeDescriptor visitPointer(PointerType type) {
        TypeDescriptor p = type.getPointeeType().accept(this);
        return p == type.getPointeeType() ? type : TypeDescriptors.createPointer(p, type.isMutable());
    }

    @Override
    public TypeDescriptor visitFunction(FunctionType type) {
        boolean[] changed = new boolean[1];
        TypeDescriptor r = type.getReturnType().accept(this);
        List<TypeDescriptor> params = substituteAll(type.getParamTypes(), changed);
        if (r == type.getReturnType() && !changed[0]) return type;
        return TypeDescriptors.createFunction(r, params);
    }

    @Override
    public TypeDescriptor visitTuple(TupleType type) {
        boolean[] changed = new boolean[1];
        List<TypeDescriptor> elements = substituteAll(type.getElementTypes(), changed);
        return changed[0] ? TypeDescriptors.createTuple(elements) : type;
    }

    @Override
    public TypeDescriptor visitOption(OptionType type) {
        TypeDescriptor v = type.getValueType().accept(this);
        return v == type.getValueType() ? type : TypeDescriptors.createOption(v);
    }

    @Override
    public TypeDescriptor visitResult(ResultType type) {
        TypeDescriptor ok = type.getOkType().accept(this);
        TypeDescriptor err = type.getErrType().accept(this);
        if (ok == type.getOkType() && err == type.getErrType()) return type;
        return TypeDescriptors.createResult(ok, err);
    }

    @Override
    public TypeDescriptor visitGenericInstance(GenericInstanceType type) {
        boolean[] changed = new boolean[1];
        List<TypeDescriptor> args = substituteAll(type.getTypeArgs(), changed);
        return changed[0] ? TypeDescriptors.createGenericInstance(type.getBaseType(), args) : type;
    }

    @Override
    public TypeDescriptor visitTaskHandle(TaskHandleType type) {
        TypeDescriptor r = type.getResultType().accept(this);
        return r == type.getResultType() ? type : TypeDescriptors.createTaskHandle(r);
    }

    @Override
    public TypeDescriptor visitTypeParameter(TypeParameterType type) {
        TypeDescriptor bound = bindings.get(type.getName());
        return bound != null ? bound : type;
    }

    @Override
    public TypeDescriptor visitUnit(UnitType type) {
        return type;
    }
}
