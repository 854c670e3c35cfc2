package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.decl.FunctionDecl;

/**
 * 正在分析的函数体上下文：返回类型检查与并发分级依赖它
 */
final class FunctionContext {
    private final FunctionDecl declaration;
    private final TypeDescriptor returnType;
    private final boolean nonDeterministic;
    private final StructType receiver;   // 方法所属结构体，普通函数为 null

    FunctionContext(FunctionDecl declaration, TypeDescriptor returnType,
                    boolean nonDeterministic, StructType receiver) {
        this.declaration = declaration;
        this.returnType = returnType;
        this.nonDeterministic = nonDeterministic;
        this.receiver = receiver;
    }

    FunctionDecl getDeclaration() { return declaration; }
    TypeDescriptor getReturnType() { return returnType; }
    boolean isNonDeterministic() { return nonDeterministic; }
    StructType getReceiver() { return receiver; }

    String getName() {
        return declaration != null ? declaration.getName() : "<anonymous>";
    }
}
