package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.ArrayType;
import com.asthralang.compiler.analysis.types.PrimitiveKind;
import com.asthralang.compiler.analysis.types.SliceType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.expr.CallExpr;
import com.asthralang.compiler.ast.expr.Expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 预声明函数：len、range、log、panic、args。
 *
 * <p>不进入全局作用域，仅在名称无法解析时查询，用户声明的同名函数优先。
 * 每个函数有独立的参数校验。</p>
 */
final class PredeclaredFunctions {

    private static final Set<String> NAMES = Collections.unmodifiableSet(
            new LinkedHashSet<String>(Arrays.asList("len", "range", "log", "panic", "args")));

    private final SemanticAnalyzer analyzer;

    PredeclaredFunctions(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    static Set<String> names() {
        return NAMES;
    }

    boolean isPredeclared(String name) {
        return NAMES.contains(name);
    }

    /**
     * 校验调用并挂接结果类型
     */
    boolean analyzeCall(CallExpr call, String name) {
        List<Expression> args = call.getArgs();
        if ("len".equals(name)) return analyzeLen(call, args);
        if ("range".equals(name)) return analyzeRange(call, args);
        if ("log".equals(name)) return analyzeStringSink(call, args, name, TypeDescriptors.VOID);
        if ("panic".equals(name)) return analyzeStringSink(call, args, name, TypeDescriptors.NEVER);
        if ("args".equals(name)) {
            if (!checkArity(call, name, 0, 0)) return false;
            analyzer.setExpressionType(call, TypeDescriptors.createSlice(TypeDescriptors.STRING));
            return true;
        }
        analyzer.reportError(ErrorKind.INTERNAL, call.getLocation(), "未知的预声明函数 '%s'", name);
        return false;
    }

    private boolean analyzeLen(CallExpr call, List<Expression> args) {
        if (!checkArity(call, "len", 1, 1)) return false;
        Expression arg = args.get(0);
        if (!analyzer.expressions().analyze(arg, null)) return false;
        TypeDescriptor t = analyzer.getExpressionType(arg);
        if (!(t instanceof SliceType) && !(t instanceof ArrayType) && !t.isPrimitive(PrimitiveKind.STRING)) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, arg.getLocation(),
                    "len 需要切片、数组或字符串参数，实际 %s", TypeDescriptors.display(t));
            return false;
        }
        analyzer.setExpressionType(call, TypeDescriptors.USIZE);
        return true;
    }

    private boolean analyzeRange(CallExpr call, List<Expression> args) {
        if (!checkArity(call, "range", 1, 2)) return false;
        boolean ok = true;
        for (Expression arg : args) {
            if (!analyzer.expressions().analyze(arg, TypeDescriptors.I32)) {
                ok = false;
                continue;
            }
            // 签名为 range(end: i32) / range(start: i32, end: i32)，更宽的边界不做隐式截断
            TypeDescriptor t = analyzer.getExpressionType(arg);
            if (!analyzer.expressions().expectAssignable(TypeDescriptors.I32, t, arg.getLocation())) {
                ok = false;
            }
        }
        if (!ok) return false;
        analyzer.setExpressionType(call, TypeDescriptors.createSlice(TypeDescriptors.I32));
        return true;
    }

    private boolean analyzeStringSink(CallExpr call, List<Expression> args, String name, TypeDescriptor result) {
        if (!checkArity(call, name, 1, 1)) return false;
        Expression arg = args.get(0);
        if (!analyzer.expressions().analyze(arg, TypeDescriptors.STRING)) return false;
        TypeDescriptor t = analyzer.getExpressionType(arg);
        if (!TypeDescriptors.STRING.equals(t)) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, arg.getLocation(),
                    "%s 需要 string 参数，实际 %s", name, TypeDescriptors.display(t));
            return false;
        }
        analyzer.setExpressionType(call, result);
        return true;
    }

    private boolean checkArity(CallExpr call, String name, int min, int max) {
        int n = call.getArgs().size();
        if (n >= min && n <= max) return true;
        String expected = min == max ? String.valueOf(min) : min + "~" + max;
        analyzer.reportError(ErrorKind.ARITY_MISMATCH, call.getLocation(),
                "%s 需要 %s 个参数，实际 %d", name, expected, n);
        return false;
    }
}
