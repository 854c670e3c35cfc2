package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.AnnotationAnalyzer.AnnotationContext;
import com.asthralang.compiler.analysis.SemanticAnalyzer.ContextGuard;
import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.EnumVariant;
import com.asthralang.compiler.analysis.types.OptionType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.expr.CallExpr;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.pattern.EnumPattern;
import com.asthralang.compiler.ast.pattern.Pattern;
import com.asthralang.compiler.ast.stmt.Block;
import com.asthralang.compiler.ast.stmt.BreakStmt;
import com.asthralang.compiler.ast.stmt.ContinueStmt;
import com.asthralang.compiler.ast.stmt.ExpressionStmt;
import com.asthralang.compiler.ast.stmt.ForStmt;
import com.asthralang.compiler.ast.stmt.IfLetStmt;
import com.asthralang.compiler.ast.stmt.IfStmt;
import com.asthralang.compiler.ast.stmt.LetStmt;
import com.asthralang.compiler.ast.stmt.MatchArm;
import com.asthralang.compiler.ast.stmt.MatchStmt;
import com.asthralang.compiler.ast.stmt.ReturnStmt;
import com.asthralang.compiler.ast.stmt.SpawnStmt;
import com.asthralang.compiler.ast.stmt.SpawnWithHandleStmt;
import com.asthralang.compiler.ast.stmt.Statement;
import com.asthralang.compiler.ast.stmt.UnsafeBlock;
import com.asthralang.compiler.ast.stmt.WhileStmt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 语句分析：作用域、控制流上下文与并发语句
 */
final class StatementAnalyzer implements AstVisitor<Boolean, Void> {

    private final SemanticAnalyzer analyzer;

    StatementAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    boolean analyze(Statement stmt) {
        if (stmt == null) {
            analyzer.reportError(ErrorKind.INTERNAL, SourceLocation.UNKNOWN, "语句节点为空");
            return false;
        }
        analyzer.countNode(stmt);
        if (!analyzer.annotations().validate(stmt.getAnnotations(), AnnotationContext.STATEMENT)) {
            return false;
        }
        Boolean ok = stmt.accept(this, null);
        if (ok == null) {
            analyzer.reportError(ErrorKind.UNSUPPORTED_STATEMENT, stmt.getLocation(),
                    "不支持的语句: %s", stmt.getClass().getSimpleName());
            return false;
        }
        return ok;
    }

    /**
     * 在当前作用域中逐条分析，函数体与已开启作用域的分支使用。
     * 发散语句之后的语句仍会分析，并对第一条给出不可达警告。
     */
    boolean analyzeBlockInCurrentScope(Block block) {
        boolean ok = true;
        boolean diverged = false;
        boolean warned = false;
        for (Statement stmt : block.getStatements()) {
            if (diverged && !warned) {
                analyzer.reportWarning(ErrorKind.INVALID_CONTROL_FLOW, stmt.getLocation(), "不可达的代码");
                warned = true;
            }
            if (!analyze(stmt)) ok = false;
            if (analyzer.controlFlow().isTerminator(stmt)) diverged = true;
        }
        return ok;
    }

    private boolean analyzeScopedBlock(Block block) {
        analyzer.countNode(block);
        try (ContextGuard scope = analyzer.enterScope()) {
            return analyzeBlockInCurrentScope(block);
        }
    }

    @Override
    public Boolean visitBlock(Block node, Void ctx) {
        try (ContextGuard scope = analyzer.enterScope()) {
            return analyzeBlockInCurrentScope(node);
        }
    }

    @Override
    public Boolean visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return analyzer.expressions().analyze(node.getExpression(), null);
    }

    @Override
    public Boolean visitLetStmt(LetStmt node, Void ctx) {
        String name = node.getName();
        boolean ok = true;

        TypeDescriptor declared = null;
        if (node.getType() != null) {
            declared = analyzer.typeResolver().analyzeTypeNode(node.getType());
            if (declared == null) ok = false;
        }

        TypeDescriptor type = declared;
        Expression init = node.getInitializer();
        if (init != null) {
            if (!analyzer.expressions().analyze(init, declared)) {
                ok = false;
            } else {
                TypeDescriptor initType = analyzer.getExpressionType(init);
                if (declared != null) {
                    if (!analyzer.expressions().expectAssignable(declared, initType, init.getLocation())) ok = false;
                } else if (initType.isVoid()) {
                    analyzer.reportError(ErrorKind.TYPE_INFERENCE_FAILED, init.getLocation(),
                            "不能用 void 表达式初始化变量 '%s'", name);
                    ok = false;
                } else if (ok) {
                    type = initType;
                }
            }
        } else if (node.getType() == null && isStrict()) {
            analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_INFERENCE_FAILED, node.getLocation(),
                    "添加类型注解，如 let " + name + ": i32;",
                    "变量 '%s' 既没有类型注解也没有初始化表达式", name);
            ok = false;
        }

        analyzer.checkSymbolShadowing(name, node.getLocation(), false);
        // 失败时也登记符号，避免后续使用处产生连锁的未声明错误
        Symbol symbol = new Symbol(name, SymbolKind.VARIABLE, ok ? type : null, node, Visibility.PRIVATE);
        symbol.setMutable(node.isMutable());
        symbol.setInitialized(init != null);
        if (!analyzer.declareSymbol(symbol, node.getLocation())) ok = false;
        return ok;
    }

    private boolean isStrict() {
        AnalyzerConfig config = analyzer.getConfig();
        return config.isStrictMode() && !config.isTestMode();
    }

    @Override
    public Boolean visitReturnStmt(ReturnStmt node, Void ctx) {
        FunctionContext function = analyzer.getCurrentFunction();
        Expression value = node.getValue();
        if (function == null) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(), "return 只能出现在函数体内");
            if (value != null) analyzer.expressions().analyze(value, null);
            return false;
        }
        TypeDescriptor expected = function.getReturnType();
        if (expected == null) {
            // 返回类型解析失败，已报告
            return value == null || analyzer.expressions().analyze(value, null);
        }
        if (expected.isNever()) {
            analyzer.reportError(ErrorKind.INVALID_CONTROL_FLOW, node.getLocation(),
                    "返回 Never 的函数 '%s' 不能 return", function.getName());
            if (value != null) analyzer.expressions().analyze(value, null);
            return false;
        }
        if (value == null) {
            if (expected.isVoid()) return true;
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                    "函数 '%s' 需要返回 %s", function.getName(), expected.toDisplayString());
            return false;
        }
        if (!analyzer.expressions().analyze(value, expected)) return false;
        TypeDescriptor actual = analyzer.getExpressionType(value);
        if (expected.isVoid() && !actual.isVoid() && !actual.isNever()) {
            analyzer.reportError(ErrorKind.TYPE_MISMATCH, value.getLocation(),
                    "void 函数 '%s' 不能返回值", function.getName());
            return false;
        }
        return analyzer.expressions().expectAssignable(expected, actual, value.getLocation());
    }

    @Override
    public Boolean visitIfStmt(IfStmt node, Void ctx) {
        boolean ok = checkCondition(node.getCondition(), "if");
        if (!analyzeScopedBlock(node.getThenBlock())) ok = false;
        if (node.hasElse() && !analyze(node.getElseBranch())) ok = false;
        return ok;
    }

    @Override
    public Boolean visitIfLetStmt(IfLetStmt node, Void ctx) {
        boolean ok = analyzer.expressions().analyze(node.getValue(), null);
        TypeDescriptor scrutinee = ok ? analyzer.getExpressionType(node.getValue()) : null;
        try (ContextGuard scope = analyzer.enterScope()) {
            if (scrutinee == null || !analyzer.patterns().check(node.getPattern(), scrutinee)) {
                ok = false;
                analyzer.patterns().bindUnresolved(node.getPattern());
            }
            if (!analyzeScopedBlock(node.getThenBlock())) ok = false;
        }
        if (node.getElseBlock() != null && !analyzeScopedBlock(node.getElseBlock())) ok = false;
        return ok;
    }

    @Override
    public Boolean visitWhileStmt(WhileStmt node, Void ctx) {
        boolean ok = checkCondition(node.getCondition(), "while");
        try (ContextGuard loop = analyzer.enterLoop()) {
            if (!analyzeScopedBlock(node.getBody())) ok = false;
        }
        return ok;
    }

    private boolean checkCondition(Expression condition, String keyword) {
        if (!analyzer.expressions().analyze(condition, TypeDescriptors.BOOL)) return false;
        TypeDescriptor t = analyzer.getExpressionType(condition);
        if (t.isBool()) return true;
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, condition.getLocation(),
                "%s 条件必须是 bool，实际 %s", keyword, t.toDisplayString());
        return false;
    }

    @Override
    public Boolean visitForStmt(ForStmt node, Void ctx) {
        boolean ok = analyzer.expressions().analyze(node.getIterable(), null);
        TypeDescriptor element = null;
        if (ok) {
            TypeDescriptor iterable = analyzer.getExpressionType(node.getIterable());
            element = ExpressionAnalyzer.elementTypeOf(iterable);
            if (element == null) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getIterable().getLocation(),
                        "for 只能遍历数组或切片，实际 %s", iterable.toDisplayString());
                ok = false;
            }
        }
        try (ContextGuard scope = analyzer.enterScope();
             ContextGuard loop = analyzer.enterLoop()) {
            Symbol variable = new Symbol(node.getVariable(), SymbolKind.VARIABLE, element, node, Visibility.PRIVATE);
            variable.setInitialized(true);
            if (!analyzer.declareSymbol(variable, node.getLocation())) ok = false;
            if (!analyzeScopedBlock(node.getBody())) ok = false;
        }
        return ok;
    }

    @Override
    public Boolean visitBreakStmt(BreakStmt node, Void ctx) {
        return checkInLoop(node, "break");
    }

    @Override
    public Boolean visitContinueStmt(ContinueStmt node, Void ctx) {
        return checkInLoop(node, "continue");
    }

    private boolean checkInLoop(Statement node, String keyword) {
        if (analyzer.getLoopDepth() > 0) return true;
        analyzer.reportError(ErrorKind.INVALID_CONTROL_FLOW, node.getLocation(), "%s 只能出现在循环内", keyword);
        return false;
    }

    @Override
    public Boolean visitMatchStmt(MatchStmt node, Void ctx) {
        return analyzeMatch(node.getScrutinee(), node.getArms(), null, null);
    }

    /**
     * 分析 match 的被匹配值与全部分支。armTypes 非空时收集各分支结果类型：
     * 表达式体取表达式类型，块体为 void，发散的块体为 Never。
     */
    boolean analyzeMatch(Expression scrutinee, List<MatchArm> arms, TypeDescriptor expected,
                         List<TypeDescriptor> armTypes) {
        if (!analyzer.expressions().analyze(scrutinee, null)) {
            return false;
        }
        TypeDescriptor scrutineeType = analyzer.getExpressionType(scrutinee);
        boolean ok = true;
        for (MatchArm arm : arms) {
            analyzer.countNode(arm);
            try (ContextGuard scope = analyzer.enterScope()) {
                if (!analyzer.patterns().check(arm.getPattern(), scrutineeType)) {
                    ok = false;
                    analyzer.patterns().bindUnresolved(arm.getPattern());
                }
                if (arm.getGuard() != null && !checkCondition(arm.getGuard(), "match 守卫")) ok = false;
                if (!analyzeArmBody(arm.getBody(), expected, armTypes)) ok = false;
            }
        }
        if (ok) warnIfNotExhaustive(scrutineeType, arms, scrutinee.getLocation());
        return ok;
    }

    private boolean analyzeArmBody(Statement body, TypeDescriptor expected, List<TypeDescriptor> armTypes) {
        if (armTypes == null) return analyze(body);
        if (body instanceof ExpressionStmt) {
            analyzer.countNode(body);
            Expression expr = ((ExpressionStmt) body).getExpression();
            if (!analyzer.expressions().analyze(expr, expected)) return false;
            armTypes.add(analyzer.getExpressionType(expr));
            return true;
        }
        if (body instanceof Block) {
            if (!analyze(body)) return false;
            armTypes.add(analyzer.controlFlow().blockReturnsNever((Block) body)
                    ? TypeDescriptors.NEVER : TypeDescriptors.VOID);
            return true;
        }
        analyzer.reportError(ErrorKind.UNSUPPORTED_STATEMENT, body.getLocation(),
                "match 分支体只能是表达式或块");
        return false;
    }

    /** 枚举与 Option 的 match 未覆盖全部变体且没有兜底分支时警告 */
    private void warnIfNotExhaustive(TypeDescriptor scrutinee, List<MatchArm> arms, SourceLocation location) {
        List<String> variants = new ArrayList<String>();
        EnumType enumType = ExpressionAnalyzer.enumOf(scrutinee);
        if (enumType != null) {
            for (EnumVariant v : enumType.getVariants()) {
                variants.add(v.getName());
            }
        } else if (scrutinee instanceof OptionType) {
            variants.add("Some");
            variants.add("None");
        } else {
            return;
        }
        Set<String> covered = new HashSet<String>();
        for (MatchArm arm : arms) {
            Pattern pattern = arm.getPattern();
            if (arm.getGuard() != null) continue;
            if (PatternAnalyzer.isCatchAll(pattern)) return;
            if (pattern instanceof EnumPattern) covered.add(((EnumPattern) pattern).getVariantName());
        }
        List<String> missing = new ArrayList<String>();
        for (String v : variants) {
            if (!covered.contains(v)) missing.add(v);
        }
        if (!missing.isEmpty()) {
            analyzer.reportWarning(ErrorKind.INVALID_CONTROL_FLOW, location,
                    "match 未覆盖 %s 的变体: %s", scrutinee.toDisplayString(), String.join(", ", missing));
        }
    }

    @Override
    public Boolean visitSpawnStmt(SpawnStmt node, Void ctx) {
        analyzer.concurrency().checkTier1("spawn", node.getLocation());
        Expression call = node.getCall();
        if (!checkSpawnCall(call)) return false;
        TypeDescriptor result = analyzer.getExpressionType(call);
        if (!result.isVoid()) {
            analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_MISMATCH, call.getLocation(),
                    "使用 spawn_with_handle 获取结果",
                    "spawn 的函数必须返回 void，实际 %s", result.toDisplayString());
            return false;
        }
        return true;
    }

    @Override
    public Boolean visitSpawnWithHandleStmt(SpawnWithHandleStmt node, Void ctx) {
        analyzer.concurrency().checkTier1("spawn_with_handle", node.getLocation());
        Expression call = node.getCall();
        boolean ok = checkSpawnCall(call);
        TypeDescriptor handle = null;
        if (ok) {
            TypeDescriptor result = analyzer.getExpressionType(call);
            handle = TypeDescriptors.createTaskHandle(result);
        }
        Symbol symbol = new Symbol(node.getHandleName(), SymbolKind.VARIABLE, handle, node, Visibility.PRIVATE);
        symbol.setInitialized(true);
        if (!analyzer.declareSymbol(symbol, node.getLocation())) ok = false;
        return ok;
    }

    private boolean checkSpawnCall(Expression call) {
        if (!(call instanceof CallExpr)) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, call.getLocation(), "spawn 的操作数必须是函数调用");
            return false;
        }
        return analyzer.expressions().analyze(call, null);
    }

    @Override
    public Boolean visitUnsafeBlock(UnsafeBlock node, Void ctx) {
        if (!analyzer.getConfig().isAllowUnsafe()) {
            analyzer.reportError(ErrorKind.UNSAFE_REQUIRED, node.getLocation(), "当前配置禁止 unsafe 块");
            return false;
        }
        try (ContextGuard unsafe = analyzer.enterUnsafe()) {
            return analyzeScopedBlock(node.getBlock());
        }
    }
}
