package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.PrimitiveKind;
import com.asthralang.compiler.analysis.types.PrimitiveType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.decl.ConstDecl;
import com.asthralang.compiler.ast.expr.BinaryExpr;
import com.asthralang.compiler.ast.expr.CastExpr;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.Identifier;
import com.asthralang.compiler.ast.expr.Literal;
import com.asthralang.compiler.ast.expr.SizeofExpr;
import com.asthralang.compiler.ast.expr.UnaryExpr;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 编译期常量求值
 *
 * <p>整数运算按 64 位补码回绕（与 Java long 一致），移位量取低 6 位。
 * 求值不修改 AST，唯一的副作用是把 const 声明的值缓存到其符号上。</p>
 */
final class ConstEvaluator {

    private final SemanticAnalyzer analyzer;
    // 正在求值的 const 声明，用于检测循环引用
    private final Set<ConstDecl> evaluating = Collections.newSetFromMap(new IdentityHashMap<ConstDecl, Boolean>());
    private final Folder folder = new Folder();

    ConstEvaluator(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * @throws ConstEvaluationException 不是编译期常量
     */
    ConstValue evaluate(Expression expr) {
        if (expr == null) {
            throw new ConstEvaluationException(ErrorKind.INTERNAL, null, "常量表达式为空");
        }
        ConstValue value = expr.accept(folder, null);
        if (value == null) {
            throw new ConstEvaluationException(ErrorKind.INVALID_EXPRESSION, expr,
                    "表达式不是编译期常量: " + expr.getClass().getSimpleName());
        }
        return value;
    }

    /** 失败返回 null，不报告诊断 */
    ConstValue tryEvaluate(Expression expr) {
        try {
            return evaluate(expr);
        } catch (ConstEvaluationException e) {
            return null;
        }
    }

    private static ConstEvaluationException notConst(AstNode node, String message) {
        return new ConstEvaluationException(ErrorKind.INVALID_EXPRESSION, node, message);
    }

    private ConstValue evaluateSymbol(Identifier node, Symbol symbol) {
        if (symbol.getConstValue() != null) {
            return symbol.getConstValue();
        }
        if (!(symbol.getDeclaration() instanceof ConstDecl)) {
            throw notConst(node, "常量 '" + node.getName() + "' 的值不可用");
        }
        ConstDecl decl = (ConstDecl) symbol.getDeclaration();
        if (!evaluating.add(decl)) {
            throw notConst(node, "常量 '" + node.getName() + "' 存在循环引用");
        }
        try {
            ConstValue value = evaluate(decl.getValue());
            checkRange(value, symbol.getType(), decl.getValue());
            symbol.setConstValue(value);
            return value;
        } finally {
            evaluating.remove(decl);
        }
    }

    /**
     * 整数常量的值必须落在其类型的取值范围内，超出时不回绕
     *
     * @throws ConstEvaluationException TYPE_MISMATCH
     */
    static void checkRange(ConstValue value, TypeDescriptor type, AstNode at) {
        if (value == null || !value.isInteger() || !(type instanceof PrimitiveType)) return;
        PrimitiveKind kind = ((PrimitiveType) type).getKind();
        if (kind.isInteger() && !ExpressionAnalyzer.fitsIn(value.asLong(), kind)) {
            throw new ConstEvaluationException(ErrorKind.TYPE_MISMATCH, at,
                    "值 " + value.asLong() + " 超出 " + kind.getTypeName() + " 的取值范围");
        }
    }

    /**
     * 按目标整数位宽截断并做符号/零扩展
     */
    static long wrapToWidth(long value, PrimitiveKind kind) {
        int bits = kind.getBitWidth();
        if (bits >= 64 || bits <= 0) return value;
        long mask = (1L << bits) - 1;
        long truncated = value & mask;
        if (kind.isSigned() && (truncated & (1L << (bits - 1))) != 0) {
            truncated |= ~mask;
        }
        return truncated;
    }

    private final class Folder implements AstVisitor<ConstValue, Void> {

        @Override
        public ConstValue visitLiteral(Literal node, Void ctx) {
            Object v = node.getValue();
            switch (node.getKind()) {
                case INT:
                    return ConstValue.ofInteger(((Number) v).longValue());
                case FLOAT:
                    return ConstValue.ofFloat(((Number) v).doubleValue());
                case BOOL:
                    return ConstValue.ofBoolean((Boolean) v);
                case STRING:
                    return ConstValue.ofString((String) v);
                case CHAR:
                    return ConstValue.ofInteger(((Number) v).longValue());
                default:
                    throw notConst(node, "unit 字面量不是常量");
            }
        }

        @Override
        public ConstValue visitIdentifier(Identifier node, Void ctx) {
            Symbol symbol = analyzer.getCurrentScope().resolve(node.getName());
            if (symbol == null) {
                throw new ConstEvaluationException(ErrorKind.UNDECLARED_IDENTIFIER, node,
                        "未声明的标识符 '" + node.getName() + "'");
            }
            if (symbol.getKind() != SymbolKind.CONST) {
                throw notConst(node, "'" + node.getName() + "' 不是常量");
            }
            symbol.markUsed();
            return evaluateSymbol(node, symbol);
        }

        @Override
        public ConstValue visitUnaryExpr(UnaryExpr node, Void ctx) {
            ConstValue operand = evaluate(node.getOperand());
            switch (node.getOperator()) {
                case NEG:
                    if (operand.isInteger()) return ConstValue.ofInteger(-operand.asLong());
                    if (operand.isFloat()) return ConstValue.ofFloat(-operand.asDouble());
                    break;
                case NOT:
                    if (operand.isBoolean()) return ConstValue.ofBoolean(!operand.asBoolean());
                    break;
                case BIT_NOT:
                    if (operand.isInteger()) return ConstValue.ofInteger(~operand.asLong());
                    break;
                default:
                    throw notConst(node, "运算符 '" + node.getOperator().toSourceString() + "' 不能在常量中使用");
            }
            throw new ConstEvaluationException(ErrorKind.TYPE_MISMATCH, node,
                    "运算符 '" + node.getOperator().toSourceString() + "' 不能用于 " + operand.getKind());
        }

        @Override
        public ConstValue visitBinaryExpr(BinaryExpr node, Void ctx) {
            ConstValue left = evaluate(node.getLeft());
            ConstValue right = evaluate(node.getRight());
            BinaryExpr.BinaryOp op = node.getOperator();

            if (op.isLogical()) {
                if (!left.isBoolean() || !right.isBoolean()) throw mismatch(node, left, right);
                return ConstValue.ofBoolean(op == BinaryExpr.BinaryOp.AND
                        ? left.asBoolean() && right.asBoolean()
                        : left.asBoolean() || right.asBoolean());
            }
            if (left.isString() || right.isString()) {
                return foldString(node, op, left, right);
            }
            if (left.isBoolean() || right.isBoolean()) {
                if (op.isEquality() && left.isBoolean() && right.isBoolean()) {
                    boolean eq = left.asBoolean() == right.asBoolean();
                    return ConstValue.ofBoolean(op == BinaryExpr.BinaryOp.EQ ? eq : !eq);
                }
                throw mismatch(node, left, right);
            }
            if (left.isInteger() && right.isInteger()) {
                return foldInteger(node, op, left.asLong(), right.asLong());
            }
            return foldFloat(node, op, left.asDouble(), right.asDouble());
        }

        private ConstValue foldInteger(BinaryExpr node, BinaryExpr.BinaryOp op, long a, long b) {
            switch (op) {
                case ADD: return ConstValue.ofInteger(a + b);
                case SUB: return ConstValue.ofInteger(a - b);
                case MUL: return ConstValue.ofInteger(a * b);
                case DIV:
                    if (b == 0) throw notConst(node, "常量表达式中除以零");
                    return ConstValue.ofInteger(a / b);
                case MOD:
                    if (b == 0) throw notConst(node, "常量表达式中对零取模");
                    return ConstValue.ofInteger(a % b);
                case BIT_AND: return ConstValue.ofInteger(a & b);
                case BIT_OR: return ConstValue.ofInteger(a | b);
                case BIT_XOR: return ConstValue.ofInteger(a ^ b);
                case SHL: return ConstValue.ofInteger(a << (b & 63));
                case SHR: return ConstValue.ofInteger(a >> (b & 63));
                case EQ: return ConstValue.ofBoolean(a == b);
                case NE: return ConstValue.ofBoolean(a != b);
                case LT: return ConstValue.ofBoolean(a < b);
                case GT: return ConstValue.ofBoolean(a > b);
                case LE: return ConstValue.ofBoolean(a <= b);
                case GE: return ConstValue.ofBoolean(a >= b);
                default:
                    throw notConst(node, "运算符 '" + op.toSourceString() + "' 不能用于整数常量");
            }
        }

        private ConstValue foldFloat(BinaryExpr node, BinaryExpr.BinaryOp op, double a, double b) {
            switch (op) {
                case ADD: return ConstValue.ofFloat(a + b);
                case SUB: return ConstValue.ofFloat(a - b);
                case MUL: return ConstValue.ofFloat(a * b);
                case DIV: return ConstValue.ofFloat(a / b);
                case MOD: return ConstValue.ofFloat(a % b);
                case EQ: return ConstValue.ofBoolean(a == b);
                case NE: return ConstValue.ofBoolean(a != b);
                case LT: return ConstValue.ofBoolean(a < b);
                case GT: return ConstValue.ofBoolean(a > b);
                case LE: return ConstValue.ofBoolean(a <= b);
                case GE: return ConstValue.ofBoolean(a >= b);
                default:
                    throw new ConstEvaluationException(ErrorKind.TYPE_MISMATCH, node,
                            "运算符 '" + op.toSourceString() + "' 不能用于浮点常量");
            }
        }

        private ConstValue foldString(BinaryExpr node, BinaryExpr.BinaryOp op, ConstValue left, ConstValue right) {
            if (!left.isString() || !right.isString()) throw mismatch(node, left, right);
            switch (op) {
                case ADD: return ConstValue.ofString(left.asString() + right.asString());
                case EQ: return ConstValue.ofBoolean(left.asString().equals(right.asString()));
                case NE: return ConstValue.ofBoolean(!left.asString().equals(right.asString()));
                default:
                    throw new ConstEvaluationException(ErrorKind.TYPE_MISMATCH, node,
                            "运算符 '" + op.toSourceString() + "' 不能用于字符串常量");
            }
        }

        private ConstEvaluationException mismatch(BinaryExpr node, ConstValue left, ConstValue right) {
            return new ConstEvaluationException(ErrorKind.TYPE_MISMATCH, node,
                    "运算符 '" + node.getOperator().toSourceString() + "' 的操作数类型不兼容: "
                            + left.getKind() + ", " + right.getKind());
        }

        @Override
        public ConstValue visitCastExpr(CastExpr node, Void ctx) {
            ConstValue value = evaluate(node.getExpression());
            TypeDescriptor target = analyzer.typeResolver().analyzeTypeNode(node.getTargetType());
            if (!(target instanceof PrimitiveType)) {
                throw notConst(node, "常量只能转换为原始类型");
            }
            PrimitiveKind kind = ((PrimitiveType) target).getKind();
            if (kind.isInteger() || kind == PrimitiveKind.CHAR) {
                long raw;
                if (value.isBoolean()) {
                    raw = value.asBoolean() ? 1 : 0;
                } else if (value.isNumeric()) {
                    raw = value.isInteger() ? value.asLong() : (long) value.asDouble();
                } else {
                    throw notConst(node, "字符串常量不能转换为 " + kind.getTypeName());
                }
                return ConstValue.ofInteger(kind.isInteger() ? wrapToWidth(raw, kind) : raw);
            }
            if (kind.isFloat()) {
                if (!value.isNumeric()) throw notConst(node, "只有数值常量可以转换为 " + kind.getTypeName());
                double d = value.asDouble();
                return ConstValue.ofFloat(kind == PrimitiveKind.F32 ? (double) (float) d : d);
            }
            if (kind == PrimitiveKind.BOOL && value.isBoolean()) return value;
            if (kind == PrimitiveKind.STRING && value.isString()) return value;
            throw notConst(node, "不支持的常量转换: " + value.getKind() + " as " + kind.getTypeName());
        }

        @Override
        public ConstValue visitSizeofExpr(SizeofExpr node, Void ctx) {
            TypeDescriptor type = analyzer.typeResolver().analyzeTypeNode(node.getType());
            if (type == null) {
                throw new ConstEvaluationException(ErrorKind.INVALID_TYPE, node, "sizeof 的类型无法解析");
            }
            return ConstValue.ofInteger(type.getSize());
        }
    }
}
