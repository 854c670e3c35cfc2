package com.asthralang.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitNamed(NamedTypeRef type);
    R visitGeneric(GenericTypeRef type);
    R visitSlice(SliceTypeRef type);
    R visitArray(ArrayTypeRef type);
    R visitPointer(PointerTypeRef type);
    R visitTuple(TupleTypeRef type);
    R visitFunction(FunctionTypeRef type);
    R visitOption(OptionTypeRef type);
    R visitResult(ResultTypeRef type);
}
