package com.asthralang.compiler.analysis.types;

/**
 * TypeDescriptor 访问者，用于替代 instanceof 分派
 */
public interface TypeDescriptorVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitStruct(StructType type);
    R visitEnum(EnumType type);
    R visitSlice(SliceType type);
    R visitArray(ArrayType type);
    R visitPointer(PointerType type);
    R visitFunction(FunctionType type);
    R visitTuple(TupleType type);
    R visitOption(OptionType type);
    R visitResult(ResultType type);
    R visitGenericInstance(GenericInstanceType type);
    R visitTaskHandle(TaskHandleType type);
    R visitTypeParameter(TypeParameterType type);
    R visitUnit(UnitType type);
}
