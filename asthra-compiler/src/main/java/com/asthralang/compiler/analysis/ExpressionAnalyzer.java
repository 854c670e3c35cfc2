package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.AnnotationAnalyzer.AnnotationContext;
import com.asthralang.compiler.analysis.TypeResolver.BuiltinGenerics;
import com.asthralang.compiler.analysis.types.ArrayType;
import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.EnumVariant;
import com.asthralang.compiler.analysis.types.FunctionType;
import com.asthralang.compiler.analysis.types.GenericInstanceType;
import com.asthralang.compiler.analysis.types.OptionType;
import com.asthralang.compiler.analysis.types.PointerType;
import com.asthralang.compiler.analysis.types.PrimitiveKind;
import com.asthralang.compiler.analysis.types.PrimitiveType;
import com.asthralang.compiler.analysis.types.ResultType;
import com.asthralang.compiler.analysis.types.SliceType;
import com.asthralang.compiler.analysis.types.StructField;
import com.asthralang.compiler.analysis.types.StructMethod;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TaskHandleType;
import com.asthralang.compiler.analysis.types.TupleType;
import com.asthralang.compiler.analysis.types.TypeCompatibility;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.analysis.types.TypeSubstitutor;
import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.ConstDecl;
import com.asthralang.compiler.ast.expr.ArrayLiteral;
import com.asthralang.compiler.ast.expr.AssignExpr;
import com.asthralang.compiler.ast.expr.AssociatedCallExpr;
import com.asthralang.compiler.ast.expr.AwaitExpr;
import com.asthralang.compiler.ast.expr.BinaryExpr;
import com.asthralang.compiler.ast.expr.CallExpr;
import com.asthralang.compiler.ast.expr.CastExpr;
import com.asthralang.compiler.ast.expr.EnumVariantExpr;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.FieldAccessExpr;
import com.asthralang.compiler.ast.expr.Identifier;
import com.asthralang.compiler.ast.expr.IndexExpr;
import com.asthralang.compiler.ast.expr.Literal;
import com.asthralang.compiler.ast.expr.MatchExpr;
import com.asthralang.compiler.ast.expr.RepeatedArrayLiteral;
import com.asthralang.compiler.ast.expr.SizeofExpr;
import com.asthralang.compiler.ast.expr.SliceExpr;
import com.asthralang.compiler.ast.expr.StructLiteral;
import com.asthralang.compiler.ast.expr.TupleLiteral;
import com.asthralang.compiler.ast.expr.UnaryExpr;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式分析：类型检查、类型推断与表达式标记。
 *
 * <p>访问者上下文是期望类型（可为 null），字面量据此确定具体类型。
 * 访问方法返回 null 表示未支持的节点种类。成功分析的表达式总有类型挂接在分析器上。</p>
 */
final class ExpressionAnalyzer implements AstVisitor<Boolean, TypeDescriptor> {

    private final SemanticAnalyzer analyzer;

    ExpressionAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    boolean analyze(Expression expr, TypeDescriptor expected) {
        if (expr == null) {
            analyzer.reportError(ErrorKind.INTERNAL, SourceLocation.UNKNOWN, "表达式节点为空");
            return false;
        }
        analyzer.countNode(expr);
        if (!analyzer.annotations().validate(expr.getAnnotations(), AnnotationContext.EXPRESSION)) {
            return false;
        }
        Boolean ok = expr.accept(this, expected);
        if (ok == null) {
            analyzer.reportError(ErrorKind.UNSUPPORTED_EXPRESSION, expr.getLocation(),
                    "不支持的表达式: %s", expr.getClass().getSimpleName());
            return false;
        }
        if (ok && analyzer.getExpressionType(expr) == null) {
            analyzer.reportError(ErrorKind.INTERNAL, expr.getLocation(),
                    "表达式 %s 分析成功但没有类型", expr.getClass().getSimpleName());
            return false;
        }
        return ok;
    }

    /** 逐个分析，不因前一个失败而跳过后续 */
    private boolean analyzeAll(List<Expression> exprs) {
        boolean ok = true;
        for (Expression e : exprs) {
            if (!analyze(e, null)) ok = false;
        }
        return ok;
    }

    private TypeDescriptor typeOf(Expression expr) {
        return analyzer.getExpressionType(expr);
    }

    private boolean typed(Expression expr, TypeDescriptor type) {
        analyzer.setExpressionType(expr, type);
        return true;
    }

    /**
     * 检查 source 可以赋给 target，否则在 location 报告 TYPE_MISMATCH
     */
    boolean expectAssignable(TypeDescriptor target, TypeDescriptor source, SourceLocation location) {
        if (TypeCompatibility.isAssignable(target, source)) return true;
        if (TypeCompatibility.hasMixedSignedness(target, source)) {
            analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_MISMATCH, location,
                    "使用 as " + target.toDisplayString() + " 显式转换",
                    "类型不匹配: 期望 %s, 实际 %s", target.toDisplayString(), source.toDisplayString());
        } else {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, location,
                    "类型不匹配: 期望 %s, 实际 %s", target.toDisplayString(), source.toDisplayString());
        }
        return false;
    }

    // ============ 字面量与标识符 ============

    @Override
    public Boolean visitLiteral(Literal node, TypeDescriptor expected) {
        node.setConstantExpr(true);
        switch (node.getKind()) {
            case INT:
                return typeIntegerLiteral(node, ((Number) node.getValue()).longValue(), expected);
            case FLOAT:
                return typed(node, expected != null && expected.isFloat() ? expected : TypeDescriptors.F64);
            case STRING:
                return typed(node, TypeDescriptors.STRING);
            case BOOL:
                return typed(node, TypeDescriptors.BOOL);
            case CHAR:
                return typeCharLiteral(node, expected);
            case UNIT:
                return typed(node, TypeDescriptors.UNIT);
            default:
                return null;
        }
    }

    private boolean typeIntegerLiteral(Literal node, long value, TypeDescriptor expected) {
        if (expected != null && expected.isNumeric()) {
            if (expected.isInteger() && !fitsIn(value, ((PrimitiveType) expected).getKind())) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                        "整数字面量 %d 超出 %s 的取值范围", value, expected.toDisplayString());
                return false;
            }
            return typed(node, expected);
        }
        boolean fitsI32 = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
        return typed(node, fitsI32 ? TypeDescriptors.I32 : TypeDescriptors.I64);
    }

    private boolean typeCharLiteral(Literal node, TypeDescriptor expected) {
        int codePoint = ((Number) node.getValue()).intValue();
        if (!isUnicodeScalar(codePoint)) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                    "非法的字符字面量: U+%04X 不是 Unicode 标量值", codePoint);
            return false;
        }
        AnalyzerConfig config = analyzer.getConfig();
        if (expected == null && config.isStrictMode() && !config.isTestMode()) {
            analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                    "添加类型注解，如 let c: char = ...",
                    "字符字面量需要显式的类型上下文");
            return false;
        }
        return typed(node, TypeDescriptors.CHAR);
    }

    static boolean isUnicodeScalar(int codePoint) {
        return codePoint >= 0 && codePoint <= Character.MAX_CODE_POINT
                && (codePoint < Character.MIN_SURROGATE || codePoint > Character.MAX_SURROGATE);
    }

    static boolean fitsIn(long value, PrimitiveKind kind) {
        int bits = kind.getBitWidth();
        if (bits >= 64) {
            return kind.isSigned() || value >= 0;
        }
        if (kind.isSigned()) {
            long max = (1L << (bits - 1)) - 1;
            return value >= -max - 1 && value <= max;
        }
        return value >= 0 && value <= (1L << bits) - 1;
    }

    @Override
    public Boolean visitIdentifier(Identifier node, TypeDescriptor expected) {
        String name = node.getName();
        Symbol symbol = analyzer.resolve(name);
        if (symbol == null) {
            if (analyzer.predeclared().isPredeclared(name)) {
                analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                        "预声明函数 '%s' 只能直接调用", name);
            } else if (analyzer.getAliasTable().hasAlias(name)) {
                analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                        "'%s' 是模块别名，不能作为值使用", name);
            } else {
                analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, node.getLocation(),
                        "未声明的标识符 '%s'", name);
            }
            return false;
        }
        symbol.markUsed();
        if (symbol.getKind() == SymbolKind.TYPE || symbol.getKind() == SymbolKind.TYPE_PARAMETER) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                    "'%s' 是类型，不能作为值使用", name);
            return false;
        }
        TypeDescriptor type = symbol.getType();
        if (type == null && symbol.getKind() == SymbolKind.CONST && symbol.getDeclaration() instanceof ConstDecl) {
            // 无类型注解的常量被前向引用
            type = analyzer.declarations().resolveConstType(symbol, node.getLocation());
        }
        // 声明本身已失败并报告过
        if (type == null) return false;
        if (symbol.getKind() == SymbolKind.VARIABLE && !symbol.isInitialized()) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                    "变量 '%s' 在初始化前使用", name);
            return false;
        }
        node.setLvalue(symbol.getKind() == SymbolKind.VARIABLE || symbol.getKind() == SymbolKind.PARAMETER);
        node.setConstantExpr(symbol.getKind() == SymbolKind.CONST);
        return typed(node, type);
    }

    // ============ 运算符 ============

    @Override
    public Boolean visitBinaryExpr(BinaryExpr node, TypeDescriptor expected) {
        BinaryExpr.BinaryOp op = node.getOperator();
        Expression left = node.getLeft();
        Expression right = node.getRight();

        if (op.isLogical()) {
            boolean leftOk = analyze(left, TypeDescriptors.BOOL);
            boolean rightOk = analyze(right, TypeDescriptors.BOOL);
            if (!leftOk || !rightOk) return false;
            markFlags(node, left, right);
            if (!typeOf(left).isBool() || !typeOf(right).isBool()) {
                return operandMismatch(node, typeOf(left), typeOf(right));
            }
            return typed(node, TypeDescriptors.BOOL);
        }

        boolean numericContext = op.isArithmetic() || op.isBitwise() || op.isShift();
        TypeDescriptor leftHint = numericContext && expected != null && expected.isNumeric() ? expected : null;
        boolean leftOk = analyze(left, leftHint);
        TypeDescriptor lt = leftOk ? typeOf(left) : null;
        boolean rightOk = analyze(right, op.isShift() ? null : lt);
        if (!leftOk || !rightOk) return false;
        TypeDescriptor rt = typeOf(right);

        // 无上下文的数值字面量采用另一侧的类型
        if (leftHint == null && !op.isShift() && isDefaultTypedLiteral(left) && rt.isNumeric()) {
            lt = adoptLiteralType((Literal) left, lt, rt);
            if (lt == null) return false;
        }
        markFlags(node, left, right);

        if (op.isArithmetic()) {
            if (op == BinaryExpr.BinaryOp.ADD && lt.isPrimitive(PrimitiveKind.STRING)
                    && rt.isPrimitive(PrimitiveKind.STRING)) {
                return typed(node, TypeDescriptors.STRING);
            }
            if (!lt.isNumeric() || !rt.isNumeric()) return operandMismatch(node, lt, rt);
            TypeDescriptor result = promoteChecked(node, lt, rt);
            return result != null && typed(node, result);
        }
        if (op.isBitwise()) {
            if (!lt.isInteger() || !rt.isInteger()) return operandMismatch(node, lt, rt);
            TypeDescriptor result = promoteChecked(node, lt, rt);
            return result != null && typed(node, result);
        }
        if (op.isShift()) {
            if (!lt.isInteger() || !rt.isInteger()) return operandMismatch(node, lt, rt);
            return typed(node, lt);
        }
        // 比较
        if (lt.isNumeric() && rt.isNumeric()) {
            return promoteChecked(node, lt, rt) != null && typed(node, TypeDescriptors.BOOL);
        }
        if (op.isEquality()) {
            if (TypeCompatibility.isAssignable(lt, rt) || TypeCompatibility.isAssignable(rt, lt)) {
                return typed(node, TypeDescriptors.BOOL);
            }
            return operandMismatch(node, lt, rt);
        }
        boolean ordered = (lt.isPrimitive(PrimitiveKind.CHAR) || lt.isPrimitive(PrimitiveKind.STRING)) && lt.equals(rt);
        if (!ordered) return operandMismatch(node, lt, rt);
        return typed(node, TypeDescriptors.BOOL);
    }

    private static void markFlags(Expression node, Expression left, Expression right) {
        node.setConstantExpr(left.isConstantExpr() && right.isConstantExpr());
        node.setSideEffects(left.hasSideEffects() || right.hasSideEffects());
    }

    private boolean isDefaultTypedLiteral(Expression expr) {
        if (!(expr instanceof Literal)) return false;
        Literal lit = (Literal) expr;
        return lit.getKind() == Literal.LiteralKind.INT || lit.getKind() == Literal.LiteralKind.FLOAT;
    }

    /** 返回字面量的新类型；范围不符时报告并返回 null */
    private TypeDescriptor adoptLiteralType(Literal literal, TypeDescriptor current, TypeDescriptor target) {
        if (literal.getKind() == Literal.LiteralKind.FLOAT && !target.isFloat()) return current;
        if (literal.getKind() == Literal.LiteralKind.INT && target.isInteger()) {
            long value = ((Number) literal.getValue()).longValue();
            if (!fitsIn(value, ((PrimitiveType) target).getKind())) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, literal.getLocation(),
                        "整数字面量 %d 超出 %s 的取值范围", value, target.toDisplayString());
                return null;
            }
        }
        analyzer.setExpressionType(literal, target);
        return target;
    }

    private TypeDescriptor promoteChecked(BinaryExpr node, TypeDescriptor lt, TypeDescriptor rt) {
        TypeDescriptor promoted = TypeCompatibility.promote(lt, rt);
        if (promoted != null) return promoted;
        String op = node.getOperator().toSourceString();
        if (analyzer.getConfig().isStrictMode()) {
            analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                    "使用 as 显式转换其中一个操作数",
                    "运算符 '%s' 的操作数符号不一致: %s 与 %s", op, lt.toDisplayString(), rt.toDisplayString());
            return null;
        }
        analyzer.reportWarning(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                "运算符 '%s' 的操作数符号不一致: %s 与 %s", op, lt.toDisplayString(), rt.toDisplayString());
        return lt.getSize() >= rt.getSize() ? lt : rt;
    }

    private boolean operandMismatch(BinaryExpr node, TypeDescriptor lt, TypeDescriptor rt) {
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                "运算符 '%s' 不能用于 %s 和 %s", node.getOperator().toSourceString(),
                lt.toDisplayString(), rt.toDisplayString());
        return false;
    }

    @Override
    public Boolean visitUnaryExpr(UnaryExpr node, TypeDescriptor expected) {
        UnaryExpr.UnaryOp op = node.getOperator();
        Expression operand = node.getOperand();

        if (op == UnaryExpr.UnaryOp.NEG && operand instanceof Literal
                && ((Literal) operand).getKind() == Literal.LiteralKind.INT) {
            return negateIntegerLiteral(node, (Literal) operand, expected);
        }

        TypeDescriptor hint = null;
        if (op == UnaryExpr.UnaryOp.NOT) {
            hint = TypeDescriptors.BOOL;
        } else if ((op == UnaryExpr.UnaryOp.NEG || op == UnaryExpr.UnaryOp.BIT_NOT)
                && expected != null && expected.isNumeric()) {
            hint = expected;
        } else if ((op == UnaryExpr.UnaryOp.ADDRESS_OF || op == UnaryExpr.UnaryOp.ADDRESS_OF_MUT)
                && expected instanceof PointerType) {
            hint = ((PointerType) expected).getPointeeType();
        }
        if (!analyze(operand, hint)) return false;
        TypeDescriptor t = typeOf(operand);
        node.setSideEffects(operand.hasSideEffects());

        switch (op) {
            case NEG:
                if (!t.isNumeric()) return unaryMismatch(node, t);
                if (t.isInteger() && ((PrimitiveType) t).getKind().isUnsignedInteger()) {
                    analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                            "不能对无符号类型 %s 取负", t.toDisplayString());
                    return false;
                }
                node.setConstantExpr(operand.isConstantExpr());
                return typed(node, t);
            case NOT:
                if (!t.isBool()) return unaryMismatch(node, t);
                node.setConstantExpr(operand.isConstantExpr());
                return typed(node, TypeDescriptors.BOOL);
            case BIT_NOT:
                if (!t.isInteger()) return unaryMismatch(node, t);
                node.setConstantExpr(operand.isConstantExpr());
                return typed(node, t);
            case DEREF:
                if (!(t instanceof PointerType)) {
                    analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                            "只能解引用指针，实际 %s", t.toDisplayString());
                    return false;
                }
                if (!analyzer.isInUnsafeContext()) {
                    analyzer.reportErrorWithSuggestion(ErrorKind.UNSAFE_REQUIRED, node.getLocation(),
                            "将解引用放入 unsafe { ... } 块", "解引用裸指针需要 unsafe 块");
                    return false;
                }
                TypeDescriptor pointee = ((PointerType) t).getPointeeType();
                if (pointee.isVoid()) {
                    analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(), "不能解引用 %s", t.toDisplayString());
                    return false;
                }
                node.setLvalue(true);
                return typed(node, pointee);
            case ADDRESS_OF:
            case ADDRESS_OF_MUT:
                if (!operand.isLvalue()) {
                    analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(), "只能对左值取地址");
                    return false;
                }
                boolean mutable = op == UnaryExpr.UnaryOp.ADDRESS_OF_MUT;
                if (mutable && !checkMutablePlace(operand)) return false;
                return typed(node, TypeDescriptors.createPointer(t, mutable));
            default:
                return null;
        }
    }

    private boolean negateIntegerLiteral(UnaryExpr node, Literal literal, TypeDescriptor expected) {
        analyzer.countNode(literal);
        long value = -((Number) literal.getValue()).longValue();
        TypeDescriptor type;
        if (expected != null && expected.isInteger()) {
            PrimitiveKind kind = ((PrimitiveType) expected).getKind();
            if (kind.isUnsignedInteger()) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                        "不能对无符号类型 %s 取负", expected.toDisplayString());
                return false;
            }
            if (!fitsIn(value, kind)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                        "整数字面量 %d 超出 %s 的取值范围", value, expected.toDisplayString());
                return false;
            }
            type = expected;
        } else if (expected != null && expected.isFloat()) {
            type = expected;
        } else {
            type = fitsIn(value, PrimitiveKind.I32) ? TypeDescriptors.I32 : TypeDescriptors.I64;
        }
        literal.setConstantExpr(true);
        node.setConstantExpr(true);
        analyzer.setExpressionType(literal, type);
        return typed(node, type);
    }

    private boolean unaryMismatch(UnaryExpr node, TypeDescriptor t) {
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                "运算符 '%s' 不能用于 %s", node.getOperator().toSourceString(), t.toDisplayString());
        return false;
    }

    // ============ 调用 ============

    @Override
    public Boolean visitCallExpr(CallExpr node, TypeDescriptor expected) {
        node.setSideEffects(true);
        Expression callee = node.getCallee();

        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            if (analyzer.getCurrentScope().resolve(name) == null && analyzer.predeclared().isPredeclared(name)) {
                analyzer.countNode(callee);
                return analyzer.predeclared().analyzeCall(node, name);
            }
        }
        if (callee instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) callee;
            String alias = moduleAliasOf(access.getTarget());
            if (alias != null) {
                return analyzeModuleCall(node, alias, access, expected);
            }
            return analyzeMethodCall(node, access, expected);
        }

        if (!analyze(callee, null)) {
            analyzeAll(node.getArgs());
            return false;
        }
        TypeDescriptor calleeType = typeOf(callee);
        if (!(calleeType instanceof FunctionType)) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, callee.getLocation(),
                    "'%s' 不可调用，类型为 %s", calleeName(callee), calleeType.toDisplayString());
            analyzeAll(node.getArgs());
            return false;
        }
        if (callee instanceof Identifier) {
            warnIfDeprecated(analyzer.getCurrentScope().resolve(((Identifier) callee).getName()), node.getLocation());
        }
        return checkCallArgs(node, calleeName(callee), (FunctionType) calleeType, node.getArgs(), expected);
    }

    @Override
    public Boolean visitAssociatedCallExpr(AssociatedCallExpr node, TypeDescriptor expected) {
        node.setSideEffects(true);
        TypeDescriptor owner = resolveTypeName(node.getTypeName(), node.getTypeArgs(), node.getLocation());
        if (owner == null) {
            analyzeAll(node.getArgs());
            return false;
        }
        return analyzeAssociated(node, owner, node.getTypeName(), node.getFunctionName(), node.getArgs(), expected);
    }

    /**
     * 参数个数与类型检查；泛型参数由实参推断并代入返回类型
     */
    private boolean checkCallArgs(Expression call, String name, FunctionType signature,
                                  List<Expression> args, TypeDescriptor expected) {
        List<TypeDescriptor> params = signature.getParamTypes();
        boolean ok = true;
        if (args.size() != params.size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, call.getLocation(),
                    "函数 '%s' 需要 %d 个参数，实际 %d", name, params.size(), args.size());
            ok = false;
        }
        Map<String, TypeDescriptor> bindings = new HashMap<String, TypeDescriptor>();
        for (int i = 0; i < args.size(); i++) {
            Expression arg = args.get(i);
            TypeDescriptor param = i < params.size() ? params.get(i) : null;
            if (!analyze(arg, param)) {
                ok = false;
                continue;
            }
            if (param == null) continue;
            TypeDescriptor argType = typeOf(arg);
            if (!TypeSubstitutor.bind(param, argType, bindings)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, arg.getLocation(),
                        "第 %d 个参数的类型 %s 与已推断的泛型实参冲突", i + 1, argType.toDisplayString());
                ok = false;
            } else if (!expectAssignable(param, argType, arg.getLocation())) {
                ok = false;
            }
        }
        if (!ok) return false;

        TypeDescriptor result = signature.getReturnType();
        if (!bindings.isEmpty()) {
            result = new TypeSubstitutor(bindings).substitute(result);
        }
        if (TypeResolver.isTypeParameter(result) && expected != null) {
            result = expected;
        }
        return typed(call, result);
    }

    private boolean analyzeModuleCall(CallExpr node, String alias, FieldAccessExpr access, TypeDescriptor expected) {
        analyzer.countNode(access);
        boolean ok = analyzer.concurrency().checkModuleAccess(alias, access.getFieldName(), access.getLocation());
        if (!analyzeAll(node.getArgs())) ok = false;
        if (!ok) return false;
        // 外部模块的签名在本编译单元不可见，结果类型取自上下文
        return typed(node, expected != null ? expected : TypeDescriptors.VOID);
    }

    private boolean analyzeMethodCall(CallExpr node, FieldAccessExpr access, TypeDescriptor expected) {
        analyzer.countNode(access);
        Expression target = access.getTarget();
        String methodName = access.getFieldName();

        if (target instanceof Identifier) {
            String typeName = ((Identifier) target).getName();
            Symbol symbol = analyzer.getCurrentScope().resolve(typeName);
            if (symbol == null && BuiltinGenerics.arityOf(typeName) > 0) {
                return constructBuiltinVariant(node, typeName, methodName, node.getArgs(), expected);
            }
            if (symbol != null && symbol.getKind() == SymbolKind.TYPE) {
                symbol.markUsed();
                if (symbol.getType() instanceof EnumType) {
                    return constructVariant(node, (EnumType) symbol.getType(), methodName, node.getArgs(), expected);
                }
                return analyzeAssociated(node, symbol.getType(), typeName, methodName, node.getArgs(), expected);
            }
        }

        if (!analyze(target, null)) {
            analyzeAll(node.getArgs());
            return false;
        }
        TypeDescriptor receiver = typeOf(target);
        if (receiver instanceof PointerType) {
            receiver = ((PointerType) receiver).getPointeeType();
        }
        StructType struct = structOf(receiver);
        if (struct == null) {
            analyzer.reportError(ErrorKind.UNKNOWN_FIELD, access.getLocation(),
                    "类型 %s 没有方法 '%s'", receiver.toDisplayString(), methodName);
            analyzeAll(node.getArgs());
            return false;
        }
        Map<String, TypeDescriptor> bindings = bindingsOf(receiver);

        StructMethod method = struct.getMethod(methodName);
        if (method == null) {
            StructField field = struct.getField(methodName);
            if (field != null && field.getType() instanceof FunctionType) {
                if (!checkFieldVisible(struct, field, access.getLocation())) return false;
                FunctionType fieldSig = (FunctionType) substitute(bindings, field.getType());
                analyzer.setExpressionType(access, fieldSig);
                return checkCallArgs(node, methodName, fieldSig, node.getArgs(), expected);
            }
            analyzer.reportError(ErrorKind.UNKNOWN_FIELD, access.getLocation(),
                    "结构体 %s 没有方法 '%s'", struct.getName(), methodName);
            analyzeAll(node.getArgs());
            return false;
        }
        if (!method.isInstanceMethod()) {
            analyzer.reportErrorWithSuggestion(ErrorKind.INVALID_EXPRESSION, access.getLocation(),
                    struct.getName() + "::" + methodName + "(...)",
                    "'%s' 是关联函数，需要通过类型调用", methodName);
            analyzeAll(node.getArgs());
            return false;
        }
        if (!checkMethodVisible(struct, method, access.getLocation())) {
            analyzeAll(node.getArgs());
            return false;
        }
        warnIfDeprecated(method.getDeclaration(), methodName, node.getLocation());
        FunctionType signature = (FunctionType) substitute(bindings, method.getSignature());
        analyzer.setExpressionType(access, signature);
        return checkCallArgs(node, struct.getName() + "." + methodName, signature, node.getArgs(), expected);
    }

    private boolean analyzeAssociated(Expression call, TypeDescriptor owner, String typeName, String functionName,
                                      List<Expression> args, TypeDescriptor expected) {
        StructType struct = structOf(owner);
        if (struct == null) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, call.getLocation(),
                    "类型 %s 没有关联函数 '%s'", typeName, functionName);
            analyzeAll(args);
            return false;
        }
        StructMethod method = struct.getMethod(functionName);
        if (method == null) {
            analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, call.getLocation(),
                    "结构体 %s 没有关联函数 '%s'", struct.getName(), functionName);
            analyzeAll(args);
            return false;
        }
        if (method.isInstanceMethod()) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, call.getLocation(),
                    "'%s' 是实例方法，需要通过值调用", functionName);
            analyzeAll(args);
            return false;
        }
        if (!checkMethodVisible(struct, method, call.getLocation())) {
            analyzeAll(args);
            return false;
        }
        warnIfDeprecated(method.getDeclaration(), functionName, call.getLocation());
        FunctionType signature = (FunctionType) substitute(bindingsOf(owner), method.getSignature());
        return checkCallArgs(call, struct.getName() + "::" + functionName, signature, args, expected);
    }

    private void warnIfDeprecated(Symbol symbol, SourceLocation location) {
        if (symbol != null && symbol.hasAnnotation("deprecated")) {
            analyzer.reportWarning(ErrorKind.INVALID_ANNOTATION, location, "'%s' 已弃用", symbol.getName());
        }
    }

    private void warnIfDeprecated(AstNode declaration, String name, SourceLocation location) {
        if (declaration != null && AnnotationAnalyzer.contains(declaration.getAnnotations(), "deprecated")) {
            analyzer.reportWarning(ErrorKind.INVALID_ANNOTATION, location, "'%s' 已弃用", name);
        }
    }

    private static String calleeName(Expression callee) {
        if (callee instanceof Identifier) return ((Identifier) callee).getName();
        if (callee instanceof FieldAccessExpr) return ((FieldAccessExpr) callee).getFieldName();
        return "<表达式>";
    }

    // ============ 成员访问 ============

    @Override
    public Boolean visitFieldAccessExpr(FieldAccessExpr node, TypeDescriptor expected) {
        Expression target = node.getTarget();
        String fieldName = node.getFieldName();

        String alias = moduleAliasOf(target);
        if (alias != null) {
            if (!analyzer.concurrency().checkModuleAccess(alias, fieldName, node.getLocation())) return false;
            if (expected == null) {
                analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                        "添加类型注解", "无法推断外部模块成员 %s.%s 的类型", alias, fieldName);
                return false;
            }
            return typed(node, expected);
        }
        if (target instanceof Identifier) {
            String typeName = ((Identifier) target).getName();
            Symbol symbol = analyzer.getCurrentScope().resolve(typeName);
            if (symbol == null && BuiltinGenerics.arityOf(typeName) > 0) {
                return constructBuiltinVariant(node, typeName, fieldName, Collections.<Expression>emptyList(), expected);
            }
            if (symbol != null && symbol.getKind() == SymbolKind.TYPE && symbol.getType() instanceof EnumType) {
                symbol.markUsed();
                return constructVariant(node, (EnumType) symbol.getType(), fieldName,
                        Collections.<Expression>emptyList(), expected);
            }
        }

        if (!analyze(target, null)) return false;
        TypeDescriptor t = typeOf(target);
        boolean viaPointer = false;
        if (t instanceof PointerType) {
            t = ((PointerType) t).getPointeeType();
            viaPointer = true;
        }
        node.setSideEffects(target.hasSideEffects());

        StructType struct = structOf(t);
        if (struct != null) {
            StructField field = struct.getField(fieldName);
            if (field == null) {
                analyzer.reportError(ErrorKind.UNKNOWN_FIELD, node.getLocation(),
                        "结构体 %s 没有字段 '%s'", struct.getName(), fieldName);
                return false;
            }
            if (!checkFieldVisible(struct, field, node.getLocation())) return false;
            node.setLvalue(viaPointer || target.isLvalue());
            return typed(node, substitute(bindingsOf(t), field.getType()));
        }
        if ("len".equals(fieldName)
                && (t instanceof SliceType || t instanceof ArrayType || t.isPrimitive(PrimitiveKind.STRING))) {
            node.setConstantExpr(t instanceof ArrayType);
            return typed(node, TypeDescriptors.USIZE);
        }
        if (t instanceof TupleType) {
            List<TypeDescriptor> elements = ((TupleType) t).getElementTypes();
            int index = parseTupleIndex(fieldName);
            if (index >= 0 && index < elements.size()) {
                node.setLvalue(target.isLvalue());
                return typed(node, elements.get(index));
            }
            analyzer.reportError(ErrorKind.UNKNOWN_FIELD, node.getLocation(),
                    "元组 %s 没有字段 '%s'", t.toDisplayString(), fieldName);
            return false;
        }
        analyzer.reportError(ErrorKind.UNKNOWN_FIELD, node.getLocation(),
                "类型 %s 没有字段 '%s'", t.toDisplayString(), fieldName);
        return false;
    }

    private static int parseTupleIndex(String name) {
        if (name.isEmpty() || name.length() > 9) return -1;
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) return -1;
        }
        return Integer.parseInt(name);
    }

    private boolean insideImplOf(StructType struct) {
        StructType impl = analyzer.getCurrentImpl();
        return impl != null && impl.equals(struct);
    }

    private boolean checkFieldVisible(StructType struct, StructField field, SourceLocation location) {
        if (field.isPublic() || insideImplOf(struct)) return true;
        analyzer.reportError(ErrorKind.VISIBILITY_VIOLATION, location,
                "字段 '%s' 是结构体 %s 的私有字段", field.getName(), struct.getName());
        return false;
    }

    private boolean checkMethodVisible(StructType struct, StructMethod method, SourceLocation location) {
        if (method.isPublic() || insideImplOf(struct)) return true;
        analyzer.reportError(ErrorKind.VISIBILITY_VIOLATION, location,
                "方法 '%s' 是结构体 %s 的私有方法", method.getName(), struct.getName());
        return false;
    }

    /** 标识符未绑定到符号且是已注册的模块别名时返回别名 */
    private String moduleAliasOf(Expression target) {
        if (!(target instanceof Identifier)) return null;
        String name = ((Identifier) target).getName();
        if (analyzer.getCurrentScope().resolve(name) != null) return null;
        return analyzer.getAliasTable().hasAlias(name) ? name : null;
    }

    @Override
    public Boolean visitIndexExpr(IndexExpr node, TypeDescriptor expected) {
        boolean targetOk = analyze(node.getBase(), null);
        boolean indexOk = analyze(node.getIndex(), null);
        if (!targetOk || !indexOk) return false;
        TypeDescriptor t = typeOf(node.getBase());
        TypeDescriptor indexType = typeOf(node.getIndex());
        node.setSideEffects(node.operandsHaveSideEffects());

        TypeDescriptor element = elementTypeOf(t);
        if (element == null) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getBase().getLocation(),
                    "只能对数组或切片进行索引，实际 %s", t.toDisplayString());
            return false;
        }
        if (!indexType.isInteger()) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getIndex().getLocation(),
                    "下标必须是整数，实际 %s", indexType.toDisplayString());
            return false;
        }
        if (t instanceof ArrayType && node.getIndex().isConstantExpr()) {
            ConstValue index = analyzer.constEvaluator().tryEvaluate(node.getIndex());
            long length = ((ArrayType) t).getLength();
            if (index != null && index.isInteger() && (index.asLong() < 0 || index.asLong() >= length)) {
                analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getIndex().getLocation(),
                        "数组下标 %d 越界，长度为 %d", index.asLong(), length);
                return false;
            }
        }
        node.setLvalue(true);
        return typed(node, element);
    }

    @Override
    public Boolean visitSliceExpr(SliceExpr node, TypeDescriptor expected) {
        boolean ok = analyze(node.getTarget(), null);
        ok &= checkSliceBound(node.getStart());
        ok &= checkSliceBound(node.getEnd());
        if (!ok) return false;
        TypeDescriptor t = typeOf(node.getTarget());
        TypeDescriptor element = elementTypeOf(t);
        if (element == null) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getTarget().getLocation(),
                    "只能对数组或切片进行切片，实际 %s", t.toDisplayString());
            return false;
        }
        boolean mutable = t instanceof SliceType && ((SliceType) t).isMutable();
        return typed(node, TypeDescriptors.createSlice(element, mutable));
    }

    private boolean checkSliceBound(Expression bound) {
        if (bound == null) return true;
        if (!analyze(bound, TypeDescriptors.USIZE)) return false;
        TypeDescriptor t = typeOf(bound);
        if (t.isInteger()) return true;
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, bound.getLocation(),
                "切片边界必须是整数，实际 %s", t.toDisplayString());
        return false;
    }

    // ============ 赋值 ============

    @Override
    public Boolean visitAssignExpr(AssignExpr node, TypeDescriptor expected) {
        node.setSideEffects(true);
        Expression target = node.getTarget();
        Expression value = node.getValue();

        Symbol deferred = null;
        boolean targetOk;
        if (target instanceof Identifier) {
            deferred = analyzeAssignedIdentifier((Identifier) target);
            targetOk = deferred != null;
        } else if (target instanceof FieldAccessExpr || target instanceof IndexExpr || isDeref(target)) {
            targetOk = analyze(target, null) && checkMutablePlace(target);
        } else {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, target.getLocation(), "赋值目标不是左值");
            targetOk = false;
        }
        TypeDescriptor targetType = targetOk ? typeOf(target) : null;
        boolean valueOk = analyze(value, targetType);
        if (!targetOk || !valueOk) return false;
        if (!expectAssignable(targetType, typeOf(value), value.getLocation())) return false;
        if (deferred != null && !deferred.isInitialized()) {
            deferred.setInitialized(true);
        }
        return typed(node, TypeDescriptors.VOID);
    }

    /** 返回被赋值的符号；不可赋值时报告并返回 null */
    private Symbol analyzeAssignedIdentifier(Identifier target) {
        analyzer.countNode(target);
        String name = target.getName();
        Symbol symbol = analyzer.resolve(name);
        if (symbol == null) {
            analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, target.getLocation(), "未声明的标识符 '%s'", name);
            return null;
        }
        SymbolKind kind = symbol.getKind();
        if (kind != SymbolKind.VARIABLE && kind != SymbolKind.PARAMETER) {
            analyzer.reportError(ErrorKind.IMMUTABILITY_VIOLATION, target.getLocation(),
                    "不能给%s '%s' 赋值", describeKind(kind), name);
            return null;
        }
        // let x: T; 之后的首次赋值视为初始化
        boolean deferredInit = kind == SymbolKind.VARIABLE && !symbol.isInitialized();
        if (!symbol.isMutable() && !deferredInit) {
            analyzer.reportErrorWithSuggestion(ErrorKind.IMMUTABILITY_VIOLATION, target.getLocation(),
                    "使用 let mut " + name + " 声明", "不能给不可变变量 '%s' 赋值", name);
            return null;
        }
        if (symbol.getType() == null) return null;
        target.setLvalue(true);
        analyzer.setExpressionType(target, symbol.getType());
        return symbol;
    }

    private static String describeKind(SymbolKind kind) {
        switch (kind) {
            case CONST: return "常量";
            case FUNCTION: return "函数";
            case METHOD: return "方法";
            case TYPE:
            case TYPE_PARAMETER: return "类型";
            case ENUM_VARIANT: return "枚举变体";
            default: return "符号";
        }
    }

    private static boolean isDeref(Expression expr) {
        return expr instanceof UnaryExpr && ((UnaryExpr) expr).getOperator() == UnaryExpr.UnaryOp.DEREF;
    }

    /**
     * 检查表达式是可修改的位置：沿字段与下标访问找到根变量，
     * 经过指针或切片时以其可变性为准
     */
    boolean checkMutablePlace(Expression place) {
        if (place instanceof Identifier) {
            String name = ((Identifier) place).getName();
            Symbol symbol = analyzer.getCurrentScope().resolve(name);
            if (symbol == null) return false;
            if (symbol.isMutable()) return true;
            analyzer.reportErrorWithSuggestion(ErrorKind.IMMUTABILITY_VIOLATION, place.getLocation(),
                    "使用 let mut " + name + " 声明", "不能修改不可变变量 '%s'", name);
            return false;
        }
        if (place instanceof FieldAccessExpr) {
            Expression target = ((FieldAccessExpr) place).getTarget();
            TypeDescriptor t = typeOf(target);
            if (t instanceof PointerType) return requireMutablePointer((PointerType) t, place);
            return checkMutablePlace(target);
        }
        if (place instanceof IndexExpr) {
            Expression target = ((IndexExpr) place).getBase();
            TypeDescriptor t = typeOf(target);
            if (t instanceof SliceType) {
                if (((SliceType) t).isMutable()) return true;
                analyzer.reportError(ErrorKind.IMMUTABILITY_VIOLATION, place.getLocation(),
                        "不能通过不可变切片 %s 修改元素", t.toDisplayString());
                return false;
            }
            return checkMutablePlace(target);
        }
        if (isDeref(place)) {
            TypeDescriptor t = typeOf(((UnaryExpr) place).getOperand());
            if (t instanceof PointerType) return requireMutablePointer((PointerType) t, place);
        }
        analyzer.reportError(ErrorKind.INVALID_EXPRESSION, place.getLocation(), "赋值目标不是可修改的位置");
        return false;
    }

    private boolean requireMutablePointer(PointerType pointer, Expression place) {
        if (pointer.isMutable()) return true;
        analyzer.reportError(ErrorKind.IMMUTABILITY_VIOLATION, place.getLocation(),
                "不能通过不可变指针 %s 修改", pointer.toDisplayString());
        return false;
    }

    // ============ 复合字面量 ============

    @Override
    public Boolean visitArrayLiteral(ArrayLiteral node, TypeDescriptor expected) {
        List<Expression> elements = node.getElements();
        TypeDescriptor elementHint = elementTypeOf(expected);
        if (elements.isEmpty()) {
            if (elementHint == null) {
                analyzer.reportError(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(), "无法推断空数组字面量的元素类型");
                return false;
            }
            if (!checkArrayLength(node, expected, 0)) return false;
            node.setConstantExpr(true);
            return typed(node, expected);
        }
        if (!checkArrayLength(node, expected, elements.size())) return false;

        // 第一个元素的类型决定其余元素的期望类型
        TypeDescriptor elementType = null;
        boolean ok = true;
        boolean allConst = true;
        boolean sideEffects = false;
        for (Expression element : elements) {
            if (!analyze(element, elementType != null ? elementType : elementHint)) {
                ok = false;
                continue;
            }
            TypeDescriptor t = typeOf(element);
            allConst &= element.isConstantExpr();
            sideEffects |= element.hasSideEffects();
            if (elementType == null) {
                elementType = t;
            } else if (!TypeCompatibility.isAssignable(elementType, t)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, element.getLocation(),
                        "数组元素类型不一致: 期望 %s, 实际 %s", elementType.toDisplayString(), t.toDisplayString());
                ok = false;
            }
        }
        if (!ok) return false;
        node.setConstantExpr(allConst);
        node.setSideEffects(sideEffects);
        return typed(node, TypeDescriptors.createArray(elementType, elements.size()));
    }

    /** 期望类型为定长数组时，字面量的元素个数必须与其长度一致 */
    private boolean checkArrayLength(ArrayLiteral node, TypeDescriptor expected, int count) {
        if (!(expected instanceof ArrayType)) return true;
        long length = ((ArrayType) expected).getLength();
        if (length == count) return true;
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                "数组长度不匹配: %s 需要 %d 个元素，实际 %d", expected.toDisplayString(), length, count);
        return false;
    }

    @Override
    public Boolean visitRepeatedArrayLiteral(RepeatedArrayLiteral node, TypeDescriptor expected) {
        Expression value = node.getValue();
        Expression count = node.getCount();
        boolean valueOk = analyze(value, elementTypeOf(expected));
        boolean countOk = analyze(count, null);
        if (!valueOk || !countOk) return false;

        TypeDescriptor countType = typeOf(count);
        if (!countType.isInteger()) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, count.getLocation(),
                    "重复数组的长度必须是整数，实际 %s", countType.toDisplayString());
            return false;
        }
        ConstValue length;
        try {
            length = analyzer.constEvaluator().evaluate(count);
        } catch (ConstEvaluationException e) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, count.getLocation(),
                    "重复数组的长度必须是编译期常量: %s", e.getMessage());
            return false;
        }
        if (length.asLong() <= 0) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, count.getLocation(),
                    "重复数组的长度必须为正整数，实际 %d", length.asLong());
            return false;
        }
        node.setConstantExpr(value.isConstantExpr());
        node.setSideEffects(value.hasSideEffects());
        return typed(node, TypeDescriptors.createArray(typeOf(value), length.asLong()));
    }

    @Override
    public Boolean visitTupleLiteral(TupleLiteral node, TypeDescriptor expected) {
        List<Expression> elements = node.getElements();
        if (elements.size() < 2) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                    "元组字面量至少需要 2 个元素，实际 %d", elements.size());
            return false;
        }
        List<TypeDescriptor> hints = null;
        if (expected instanceof TupleType && ((TupleType) expected).getArity() == elements.size()) {
            hints = ((TupleType) expected).getElementTypes();
        }
        List<TypeDescriptor> types = new ArrayList<TypeDescriptor>(elements.size());
        boolean ok = true;
        boolean allConst = true;
        for (int i = 0; i < elements.size(); i++) {
            Expression element = elements.get(i);
            if (!analyze(element, hints != null ? hints.get(i) : null)) {
                ok = false;
                continue;
            }
            allConst &= element.isConstantExpr();
            types.add(typeOf(element));
        }
        if (!ok) return false;
        node.setConstantExpr(allConst);
        return typed(node, TypeDescriptors.createTuple(types));
    }

    @Override
    public Boolean visitStructLiteral(StructLiteral node, TypeDescriptor expected) {
        TypeDescriptor owner = resolveTypeName(node.getStructName(), node.getTypeArgs(), node.getLocation());
        StructType struct = owner != null ? structOf(owner) : null;
        if (owner != null && struct == null) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, node.getLocation(), "'%s' 不是结构体类型", node.getStructName());
        }
        if (struct == null) {
            for (StructLiteral.FieldInit init : node.getFields()) {
                analyze(init.getValue(), null);
            }
            return false;
        }

        Map<String, TypeDescriptor> bindings = bindingsOf(owner);
        boolean inferring = struct.isGeneric() && !(owner instanceof GenericInstanceType);
        if (inferring && isInstanceOf(expected, struct)) {
            owner = expected;
            bindings = bindingsOf(expected);
            inferring = false;
        }

        boolean ok = true;
        Set<String> seen = new HashSet<String>();
        for (StructLiteral.FieldInit init : node.getFields()) {
            Expression value = init.getValue();
            if (!seen.add(init.getName())) {
                analyzer.reportError(ErrorKind.INVALID_EXPRESSION, init.getLocation(),
                        "字段 '%s' 重复初始化", init.getName());
                analyze(value, null);
                ok = false;
                continue;
            }
            StructField field = struct.getField(init.getName());
            if (field == null) {
                analyzer.reportError(ErrorKind.UNKNOWN_FIELD, init.getLocation(),
                        "结构体 %s 没有字段 '%s'", struct.getName(), init.getName());
                analyze(value, null);
                ok = false;
                continue;
            }
            if (!checkFieldVisible(struct, field, init.getLocation())) ok = false;

            TypeDescriptor fieldType = substitute(bindings, field.getType());
            if (!analyze(value, fieldType)) {
                ok = false;
                continue;
            }
            TypeDescriptor valueType = typeOf(value);
            if (inferring && !TypeSubstitutor.bind(field.getType(), valueType, bindings)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, value.getLocation(),
                        "字段 '%s' 的类型 %s 与已推断的泛型实参冲突", init.getName(), valueType.toDisplayString());
                ok = false;
            } else if (!expectAssignable(fieldType, valueType, value.getLocation())) {
                ok = false;
            }
            if (value.hasSideEffects()) node.setSideEffects(true);
        }
        for (StructField field : struct.getFields()) {
            if (!seen.contains(field.getName())) {
                analyzer.reportError(ErrorKind.MISSING_FIELD, node.getLocation(),
                        "结构体 %s 缺少字段 '%s'", struct.getName(), field.getName());
                ok = false;
            }
        }
        if (!ok) return false;

        if (inferring) {
            owner = instantiate(node, struct, struct.getTypeParams(), bindings);
            if (owner == null) return false;
        }
        return typed(node, owner);
    }

    @Override
    public Boolean visitEnumVariantExpr(EnumVariantExpr node, TypeDescriptor expected) {
        String enumName = node.getEnumName();
        Symbol symbol = analyzer.resolve(enumName);
        if (symbol == null && BuiltinGenerics.arityOf(enumName) > 0) {
            return constructBuiltinVariant(node, enumName, node.getVariantName(), node.getPayload(), expected);
        }
        if (symbol == null) {
            analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, node.getLocation(), "未知枚举 '%s'", enumName);
            analyzeAll(node.getPayload());
            return false;
        }
        if (symbol.getKind() != SymbolKind.TYPE || !(symbol.getType() instanceof EnumType)) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, node.getLocation(), "'%s' 不是枚举类型", enumName);
            analyzeAll(node.getPayload());
            return false;
        }
        symbol.markUsed();
        return constructVariant(node, (EnumType) symbol.getType(), node.getVariantName(), node.getPayload(), expected);
    }

    private boolean constructVariant(Expression node, EnumType enumType, String variantName,
                                     List<Expression> payload, TypeDescriptor expected) {
        EnumVariant variant = enumType.getVariant(variantName);
        if (variant == null) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                    "枚举 %s 没有变体 '%s'", enumType.getName(), variantName);
            analyzeAll(payload);
            return false;
        }
        boolean generic = !enumType.getTypeParams().isEmpty();
        Map<String, TypeDescriptor> bindings = new HashMap<String, TypeDescriptor>();
        if (generic && isInstanceOf(expected, enumType)) {
            bindings.putAll(bindingsOf(expected));
        }

        List<TypeDescriptor> payloadTypes = variant.getPayloadTypes();
        boolean ok = true;
        if (payload.size() != payloadTypes.size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, node.getLocation(),
                    "变体 %s.%s 需要 %d 个负载值，实际 %d", enumType.getName(), variantName,
                    payloadTypes.size(), payload.size());
            ok = false;
        }
        for (int i = 0; i < payload.size(); i++) {
            Expression value = payload.get(i);
            TypeDescriptor declared = i < payloadTypes.size() ? payloadTypes.get(i) : null;
            TypeDescriptor hint = declared != null ? substitute(bindings, declared) : null;
            if (!analyze(value, hint)) {
                ok = false;
                continue;
            }
            if (declared == null) continue;
            TypeDescriptor valueType = typeOf(value);
            if (generic && !TypeSubstitutor.bind(declared, valueType, bindings)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, value.getLocation(),
                        "负载类型 %s 与已推断的泛型实参冲突", valueType.toDisplayString());
                ok = false;
            } else if (!expectAssignable(hint, valueType, value.getLocation())) {
                ok = false;
            }
        }
        if (!ok) return false;

        TypeDescriptor result = enumType;
        if (generic) {
            result = instantiate(node, enumType, enumType.getTypeParams(), bindings);
            if (result == null) return false;
        }
        node.setConstantExpr(payload.isEmpty());
        return typed(node, result);
    }

    private boolean constructBuiltinVariant(Expression node, String enumName, String variantName,
                                            List<Expression> payload, TypeDescriptor expected) {
        if (BuiltinGenerics.OPTION.equals(enumName)) {
            if ("Some".equals(variantName)) {
                if (!checkPayloadArity(node, enumName, variantName, payload, 1)) return false;
                TypeDescriptor hint = expected instanceof OptionType ? ((OptionType) expected).getValueType() : null;
                if (!analyze(payload.get(0), hint)) return false;
                TypeDescriptor valueType = typeOf(payload.get(0));
                if (hint != null && !expectAssignable(hint, valueType, payload.get(0).getLocation())) return false;
                return typed(node, hint != null ? expected : TypeDescriptors.createOption(valueType));
            }
            if ("None".equals(variantName)) {
                if (!checkPayloadArity(node, enumName, variantName, payload, 0)) return false;
                if (!(expected instanceof OptionType)) {
                    analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                            "添加类型注解，如 let x: Option<i32> = Option.None", "无法推断 Option.None 的类型");
                    return false;
                }
                node.setConstantExpr(true);
                return typed(node, expected);
            }
        } else if (BuiltinGenerics.RESULT.equals(enumName)
                && ("Ok".equals(variantName) || "Err".equals(variantName))) {
            if (!checkPayloadArity(node, enumName, variantName, payload, 1)) return false;
            if (!(expected instanceof ResultType)) {
                analyzeAll(payload);
                analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                        "添加类型注解，如 Result<i32, string>", "无法推断 Result.%s 的完整类型", variantName);
                return false;
            }
            ResultType result = (ResultType) expected;
            TypeDescriptor hint = "Ok".equals(variantName) ? result.getOkType() : result.getErrType();
            if (!analyze(payload.get(0), hint)) return false;
            if (!expectAssignable(hint, typeOf(payload.get(0)), payload.get(0).getLocation())) return false;
            return typed(node, expected);
        }
        analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                "%s 没有变体 '%s'", enumName, variantName);
        analyzeAll(payload);
        return false;
    }

    private boolean checkPayloadArity(Expression node, String enumName, String variantName,
                                      List<Expression> payload, int expectedCount) {
        if (payload.size() == expectedCount) return true;
        analyzer.reportError(ErrorKind.ARITY_MISMATCH, node.getLocation(),
                "变体 %s.%s 需要 %d 个负载值，实际 %d", enumName, variantName, expectedCount, payload.size());
        analyzeAll(payload);
        return false;
    }

    // ============ 其他表达式 ============

    @Override
    public Boolean visitCastExpr(CastExpr node, TypeDescriptor expected) {
        Expression source = node.getExpression();
        // 字符字面量在转换中以 char 为上下文
        TypeDescriptor hint = source instanceof Literal && ((Literal) source).getKind() == Literal.LiteralKind.CHAR
                ? TypeDescriptors.CHAR : null;
        boolean sourceOk = analyze(source, hint);
        TypeDescriptor target = analyzer.typeResolver().analyzeTypeNode(node.getTargetType());
        if (!sourceOk || target == null) return false;

        TypeDescriptor sourceType = typeOf(source);
        switch (TypeCompatibility.classifyCast(sourceType, target)) {
            case REQUIRES_UNSAFE:
                if (!analyzer.isInUnsafeContext()) {
                    analyzer.reportErrorWithSuggestion(ErrorKind.UNSAFE_REQUIRED, node.getLocation(),
                            "将转换放入 unsafe { ... } 块", "%s 到 %s 的转换需要 unsafe 块",
                            sourceType.toDisplayString(), target.toDisplayString());
                    return false;
                }
                break;
            case FORBIDDEN:
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                        "不能将 %s 转换为 %s", sourceType.toDisplayString(), target.toDisplayString());
                return false;
            default:
                break;
        }
        node.setConstantExpr(source.isConstantExpr() && target.isPrimitive());
        node.setSideEffects(source.hasSideEffects());
        return typed(node, target);
    }

    @Override
    public Boolean visitMatchExpr(MatchExpr node, TypeDescriptor expected) {
        List<TypeDescriptor> armTypes = new ArrayList<TypeDescriptor>();
        if (!analyzer.statements().analyzeMatch(node.getScrutinee(), node.getArms(), expected, armTypes)) {
            return false;
        }
        // Never 分支不参与结果类型
        TypeDescriptor result = null;
        boolean ok = true;
        for (int i = 0; i < armTypes.size(); i++) {
            TypeDescriptor t = armTypes.get(i);
            if (t.isNever()) continue;
            if (result == null) {
                result = t;
            } else if (!TypeCompatibility.isAssignable(result, t)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getArms().get(i).getBody().getLocation(),
                        "match 分支类型不一致: 期望 %s, 实际 %s", result.toDisplayString(), t.toDisplayString());
                ok = false;
            }
        }
        if (!ok) return false;
        if (result == null) {
            result = armTypes.isEmpty() ? TypeDescriptors.VOID : TypeDescriptors.NEVER;
        }
        node.setSideEffects(true);
        return typed(node, result);
    }

    @Override
    public Boolean visitAwaitExpr(AwaitExpr node, TypeDescriptor expected) {
        analyzer.concurrency().checkTier1("await", node.getLocation());
        node.setSideEffects(true);
        Expression handle = node.getHandle();
        if (!(handle instanceof Identifier)) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, handle.getLocation(), "await 的操作数必须是任务句柄变量");
            return false;
        }
        if (!analyze(handle, null)) return false;
        TypeDescriptor t = typeOf(handle);
        if (!(t instanceof TaskHandleType)) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, handle.getLocation(),
                    "await 需要 TaskHandle 类型，实际 %s", t.toDisplayString());
            return false;
        }
        return typed(node, ((TaskHandleType) t).getResultType());
    }

    @Override
    public Boolean visitSizeofExpr(SizeofExpr node, TypeDescriptor expected) {
        TypeDescriptor t = analyzer.typeResolver().analyzeTypeNode(node.getType());
        if (t == null) return false;
        node.setConstantExpr(true);
        return typed(node, TypeDescriptors.USIZE);
    }

    // ============ 泛型与类型辅助 ============

    /**
     * 解析表达式中出现的类型名（结构体字面量、关联调用），可带类型实参
     */
    private TypeDescriptor resolveTypeName(String name, List<TypeRef> typeArgs, SourceLocation location) {
        TypeDescriptor base;
        if (TypeResolver.SELF_TYPE.equals(name)) {
            base = analyzer.getCurrentImpl();
            if (base == null) {
                analyzer.reportError(ErrorKind.INVALID_TYPE, location, "Self 只能在 impl 块中使用");
                return null;
            }
        } else {
            Symbol symbol = analyzer.resolve(name);
            if (symbol == null) {
                analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, location, "未知类型 '%s'", name);
                return null;
            }
            if (symbol.getKind() != SymbolKind.TYPE || symbol.getType() == null) {
                analyzer.reportError(ErrorKind.INVALID_TYPE, location, "'%s' 不是类型", name);
                return null;
            }
            symbol.markUsed();
            base = symbol.getType();
        }
        if (typeArgs == null || typeArgs.isEmpty()) return base;

        int expectedCount = TypeResolver.typeParamCount(base);
        if (expectedCount != typeArgs.size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, location,
                    "类型 %s 需要 %d 个类型实参，实际 %d", name, expectedCount, typeArgs.size());
            return null;
        }
        List<TypeDescriptor> args = new ArrayList<TypeDescriptor>(typeArgs.size());
        for (TypeRef ref : typeArgs) {
            TypeDescriptor t = analyzer.typeResolver().analyzeTypeNode(ref);
            if (t == null) return null;
            args.add(t);
        }
        return analyzer.getGenericCache().getOrCreate(base, args);
    }

    private TypeDescriptor instantiate(Expression node, TypeDescriptor base, List<String> typeParams,
                                       Map<String, TypeDescriptor> bindings) {
        List<TypeDescriptor> args = new ArrayList<TypeDescriptor>(typeParams.size());
        for (String param : typeParams) {
            TypeDescriptor bound = bindings.get(param);
            if (bound == null) {
                analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                        "显式写出类型实参", "无法推断 %s 的类型参数 %s", base.toDisplayString(), param);
                return null;
            }
            args.add(bound);
        }
        return analyzer.getGenericCache().getOrCreate(base, args);
    }

    static StructType structOf(TypeDescriptor type) {
        if (type instanceof StructType) return (StructType) type;
        if (type instanceof GenericInstanceType && ((GenericInstanceType) type).getBaseType() instanceof StructType) {
            return (StructType) ((GenericInstanceType) type).getBaseType();
        }
        return null;
    }

    static EnumType enumOf(TypeDescriptor type) {
        if (type instanceof EnumType) return (EnumType) type;
        if (type instanceof GenericInstanceType && ((GenericInstanceType) type).getBaseType() instanceof EnumType) {
            return (EnumType) ((GenericInstanceType) type).getBaseType();
        }
        return null;
    }

    /** 泛型实例的 类型参数名 → 实参 映射，非实例返回空映射 */
    static Map<String, TypeDescriptor> bindingsOf(TypeDescriptor type) {
        Map<String, TypeDescriptor> bindings = new HashMap<String, TypeDescriptor>();
        if (!(type instanceof GenericInstanceType)) return bindings;
        GenericInstanceType instance = (GenericInstanceType) type;
        List<String> params = TypeResolver.typeParamsOf(instance.getBaseType());
        List<TypeDescriptor> args = instance.getTypeArgs();
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            bindings.put(params.get(i), args.get(i));
        }
        return bindings;
    }

    static TypeDescriptor substitute(Map<String, TypeDescriptor> bindings, TypeDescriptor type) {
        return bindings.isEmpty() ? type : new TypeSubstitutor(bindings).substitute(type);
    }

    private static boolean isInstanceOf(TypeDescriptor type, TypeDescriptor base) {
        return type instanceof GenericInstanceType && ((GenericInstanceType) type).getBaseType().equals(base);
    }

    static TypeDescriptor elementTypeOf(TypeDescriptor type) {
        if (type instanceof ArrayType) return ((ArrayType) type).getElementType();
        if (type instanceof SliceType) return ((SliceType) type).getElementType();
        return null;
    }
}
