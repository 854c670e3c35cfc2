package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.GenericInstanceCache;
import com.asthralang.compiler.analysis.types.PrimitiveKind;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.Declaration;
import com.asthralang.compiler.ast.decl.Program;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.stmt.Statement;
import com.asthralang.compiler.ast.type.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 语义分析器：一个编译单元一个实例，深度优先单线程遍历 AST。
 *
 * <p>持有全局作用域、当前作用域、内置类型表、诊断收集器与统计信息，
 * 具体检查委托给各子分析器：</p>
 * <ul>
 *   <li>{@link DeclarationAnalyzer} 顶层声明与程序入口</li>
 *   <li>{@link StatementAnalyzer} 语句</li>
 *   <li>{@link ExpressionAnalyzer} 表达式与类型推断</li>
 *   <li>{@link PatternAnalyzer} match / if-let 模式</li>
 *   <li>{@link TypeResolver} 类型语法到类型描述符</li>
 *   <li>{@link ConstEvaluator} 编译期常量求值</li>
 * </ul>
 *
 * <p>表达式类型以节点身份为键挂在旁路表上，分析器对挂接的每个类型持有一个引用，
 * {@link #reset()} 与 {@link #close()} 时归还。</p>
 */
public final class SemanticAnalyzer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final int GLOBAL_SCOPE_BUCKETS = 64;
    private static final int LOCAL_SCOPE_BUCKETS = 16;

    private final AnalyzerConfig config;
    private final ModuleAliasTable aliasTable;
    private final Map<String, TypeDescriptor> builtinTypes;
    private final GenericInstanceCache genericCache;
    private final AnalysisStatistics statistics = new AnalysisStatistics();
    private final AtomicInteger nextScopeId = new AtomicInteger();

    private DiagnosticCollector diagnostics;
    private SymbolTable globalScope;
    private SymbolTable currentScope;
    private final Map<Expression, TypeDescriptor> expressionTypes = new IdentityHashMap<>();
    private final List<TypeDescriptor> typeRefTypes = new ArrayList<>();

    // 遍历上下文
    private FunctionContext currentFunction;
    private StructType currentImpl;
    private int loopDepth;
    private boolean unsafeContext;
    private String packageName;
    private boolean closed;

    // 委托
    private final TypeResolver typeResolver;
    private final ConstEvaluator constEvaluator;
    private final ExpressionAnalyzer expressionAnalyzer;
    private final StatementAnalyzer statementAnalyzer;
    private final PatternAnalyzer patternAnalyzer;
    private final DeclarationAnalyzer declarationAnalyzer;
    private final AnnotationAnalyzer annotationAnalyzer;
    private final FfiValidator ffiValidator;
    private final ConcurrencyTierChecker concurrencyChecker;
    private final ControlFlowAnalyzer controlFlow;
    private final PredeclaredFunctions predeclaredFunctions;

    public SemanticAnalyzer() {
        this(new AnalyzerConfig());
    }

    public SemanticAnalyzer(AnalyzerConfig config) {
        this(config, new ModuleAliasTable());
    }

    /**
     * @param sharedAliases 与其他分析器显式共享的模块别名表
     */
    public SemanticAnalyzer(AnalyzerConfig config, ModuleAliasTable sharedAliases) {
        this.config = Objects.requireNonNull(config, "config");
        this.aliasTable = Objects.requireNonNull(sharedAliases, "sharedAliases");
        this.builtinTypes = createBuiltinTypes();
        this.genericCache = new GenericInstanceCache(config.getGenericCacheSize());

        this.typeResolver = new TypeResolver(this);
        this.constEvaluator = new ConstEvaluator(this);
        this.expressionAnalyzer = new ExpressionAnalyzer(this);
        this.statementAnalyzer = new StatementAnalyzer(this);
        this.patternAnalyzer = new PatternAnalyzer(this);
        this.declarationAnalyzer = new DeclarationAnalyzer(this);
        this.annotationAnalyzer = new AnnotationAnalyzer(this);
        this.ffiValidator = new FfiValidator(this);
        this.concurrencyChecker = new ConcurrencyTierChecker(this);
        this.controlFlow = new ControlFlowAnalyzer(this);
        this.predeclaredFunctions = new PredeclaredFunctions(this);

        initState();
    }

    private static Map<String, TypeDescriptor> createBuiltinTypes() {
        Map<String, TypeDescriptor> types = new LinkedHashMap<>();
        for (PrimitiveKind kind : PrimitiveKind.values()) {
            types.put(kind.getTypeName(), TypeDescriptors.createPrimitive(kind));
        }
        types.put("()", TypeDescriptors.UNIT);
        return Collections.unmodifiableMap(types);
    }

    private void initState() {
        this.diagnostics = new DiagnosticCollector(config.getMaxErrors(), config.isEnableWarnings(), statistics);
        this.globalScope = new SymbolTable(GLOBAL_SCOPE_BUCKETS, null, nextScopeId.getAndIncrement());
        this.currentScope = globalScope;
        this.currentFunction = null;
        this.currentImpl = null;
        this.loopDepth = 0;
        this.unsafeContext = false;
        this.packageName = null;
        declarationAnalyzer.reset();
        concurrencyChecker.reset();
    }

    // ============ 入口 ============

    /** 分析整个编译单元并返回结果视图 */
    public AnalysisResult analyze(Program program) {
        boolean success = analyzeProgram(program);
        return buildResult(success);
    }

    /**
     * 先分析全部导入，再按源码顺序分析声明。
     * 单个声明失败不影响其后声明的分析；返回值为错误计数是否为零。
     */
    public boolean analyzeProgram(Program program) {
        checkOpen();
        Objects.requireNonNull(program, "program");
        log.debug("开始语义分析: {}", program.getLocation().getFile());
        declarationAnalyzer.analyzeProgram(program);
        boolean success = diagnostics.getErrorCount() == 0;
        if (log.isDebugEnabled()) {
            log.debug("语义分析完成: success={}, {}", success, statistics);
        }
        return success;
    }

    public boolean analyzeDeclaration(Declaration decl) {
        checkOpen();
        return declarationAnalyzer.analyze(decl);
    }

    public boolean analyzeStatement(Statement stmt) {
        checkOpen();
        return statementAnalyzer.analyze(stmt);
    }

    public boolean analyzeExpression(Expression expr) {
        return analyzeExpression(expr, null);
    }

    /**
     * @param expected 上下文期望类型，可为 null
     */
    public boolean analyzeExpression(Expression expr, TypeDescriptor expected) {
        checkOpen();
        return expressionAnalyzer.analyze(expr, expected);
    }

    /** 类型语法到类型描述符，失败时已报告诊断并返回 null */
    public TypeDescriptor analyzeTypeNode(TypeRef typeRef) {
        checkOpen();
        return typeResolver.analyzeTypeNode(typeRef);
    }

    /**
     * @throws ConstEvaluationException 表达式不是编译期常量
     */
    public ConstValue evaluateConst(Expression expr) {
        checkOpen();
        return constEvaluator.evaluate(expr);
    }

    public AnalysisResult buildResult(boolean success) {
        return new AnalysisResult(success, globalScope, diagnostics.getDiagnostics(),
                diagnostics.getErrorCount(), statistics.snapshot(), expressionTypes);
    }

    // ============ 符号解析 ============

    /** 从当前作用域向外查找，内层优先 */
    public Symbol resolve(String name) {
        Symbol s = currentScope.resolve(name);
        if (s != null) statistics.incrementSymbolsResolved();
        return s;
    }

    /** 内置类型表查找 */
    public TypeDescriptor getBuiltinType(String name) {
        return builtinTypes.get(name);
    }

    /**
     * 返回被 name 遮蔽的外层符号；没有遮蔽返回 null。
     * 遮蔽本身合法，默认不报告。
     */
    public Symbol checkSymbolShadowing(String name) {
        SymbolTable parent = currentScope.getParent();
        return parent != null ? parent.resolve(name) : null;
    }

    /**
     * 同 {@link #checkSymbolShadowing(String)}，并在 warning 开启且 warn 为真时发出警告
     */
    public Symbol checkSymbolShadowing(String name, SourceLocation location, boolean warn) {
        Symbol shadowed = checkSymbolShadowing(name);
        if (shadowed != null && warn && config.isEnableWarnings()) {
            diagnostics.reportWarning(ErrorKind.REDECLARATION, location,
                    "'%s' 遮蔽了外层作用域中的同名符号", name);
        }
        return shadowed;
    }

    /**
     * 在当前作用域注册符号，同一作用域重名时报告 REDECLARATION
     */
    boolean declareSymbol(Symbol symbol, SourceLocation location) {
        if (!currentScope.insert(symbol.getName(), symbol)) {
            symbol.releaseType();
            diagnostics.reportError(ErrorKind.REDECLARATION, location,
                    "重复声明 '%s'", symbol.getName());
            return false;
        }
        return true;
    }

    // ============ 作用域与上下文 ============

    /**
     * 进入子作用域，离开时由返回的守卫恢复
     */
    public ContextGuard enterScope() {
        final SymbolTable parent = currentScope;
        final SymbolTable child = parent.createChild(nextScopeId.getAndIncrement());
        currentScope = child;
        long depth = statistics.enterScope();
        if (log.isDebugEnabled() && depth == statistics.getMaxScopeDepth()) {
            log.debug("作用域深度: {}", depth);
        }
        return new ContextGuard(() -> {
            child.destroy();
            currentScope = parent;
            statistics.exitScope();
        });
    }

    /** 进入 unsafe 上下文，嵌套幂等 */
    public ContextGuard enterUnsafe() {
        final boolean previous = unsafeContext;
        unsafeContext = true;
        return new ContextGuard(() -> unsafeContext = previous);
    }

    ContextGuard enterLoop() {
        loopDepth++;
        return new ContextGuard(() -> loopDepth--);
    }

    ContextGuard enterFunction(FunctionContext context) {
        final FunctionContext previous = currentFunction;
        final int previousLoopDepth = loopDepth;
        currentFunction = context;
        loopDepth = 0;
        return new ContextGuard(() -> {
            currentFunction = previous;
            loopDepth = previousLoopDepth;
        });
    }

    /** 临时回到全局作用域与顶层上下文，用于按需分析顶层常量 */
    ContextGuard enterGlobalScope() {
        final SymbolTable previousScope = currentScope;
        final FunctionContext previousFunction = currentFunction;
        final StructType previousImpl = currentImpl;
        currentScope = globalScope;
        currentFunction = null;
        currentImpl = null;
        return new ContextGuard(() -> {
            currentScope = previousScope;
            currentFunction = previousFunction;
            currentImpl = previousImpl;
        });
    }

    ContextGuard enterImpl(StructType target) {
        final StructType previous = currentImpl;
        currentImpl = target;
        return new ContextGuard(() -> currentImpl = previous);
    }

    public boolean isInUnsafeContext() {
        return unsafeContext;
    }

    public int getLoopDepth() {
        return loopDepth;
    }

    FunctionContext getCurrentFunction() {
        return currentFunction;
    }

    StructType getCurrentImpl() {
        return currentImpl;
    }

    public SymbolTable getCurrentScope() {
        return currentScope;
    }

    public SymbolTable getGlobalScope() {
        return globalScope;
    }

    public String getPackageName() {
        return packageName;
    }

    void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    // ============ 类型挂接 ============

    /** 挂接表达式类型，分析器持有新类型并归还旧类型 */
    public void setExpressionType(Expression expr, TypeDescriptor type) {
        if (expr == null || type == null) return;
        type.retain();
        TypeDescriptor old = expressionTypes.put(expr, type);
        if (old != null) old.release();
        statistics.incrementTypesChecked();
    }

    public TypeDescriptor getExpressionType(Expression expr) {
        return expr != null ? expressionTypes.get(expr) : null;
    }

    void attachTypeRef(TypeRef typeRef, TypeDescriptor type) {
        if (typeRef.getResolvedType() == type) return;
        type.retain();
        typeRefTypes.add(type);
        typeRef.setResolvedType(type);
    }

    // ============ 诊断 ============

    public SemanticDiagnostic reportError(ErrorKind kind, SourceLocation location, String message, Object... args) {
        return diagnostics.reportError(kind, location, message, args);
    }

    public SemanticDiagnostic reportErrorWithSuggestion(ErrorKind kind, SourceLocation location, String suggestion,
                                                        String message, Object... args) {
        return diagnostics.reportErrorWithSuggestion(kind, location, suggestion, message, args);
    }

    public SemanticDiagnostic reportWarning(ErrorKind kind, SourceLocation location, String message, Object... args) {
        return diagnostics.reportWarning(kind, location, message, args);
    }

    /** 标记节点已分析 */
    void countNode(AstNode node) {
        statistics.incrementNodesAnalyzed();
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }

    public int getErrorCount() {
        return diagnostics.getErrorCount();
    }

    public AnalysisStatistics getStatistics() {
        return statistics;
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    public ModuleAliasTable getAliasTable() {
        return aliasTable;
    }

    public GenericInstanceCache getGenericCache() {
        return genericCache;
    }

    // ============ 委托访问 ============

    TypeResolver typeResolver() { return typeResolver; }
    ConstEvaluator constEvaluator() { return constEvaluator; }
    ExpressionAnalyzer expressions() { return expressionAnalyzer; }
    StatementAnalyzer statements() { return statementAnalyzer; }
    PatternAnalyzer patterns() { return patternAnalyzer; }
    DeclarationAnalyzer declarations() { return declarationAnalyzer; }
    AnnotationAnalyzer annotations() { return annotationAnalyzer; }
    FfiValidator ffi() { return ffiValidator; }
    ConcurrencyTierChecker concurrency() { return concurrencyChecker; }
    ControlFlowAnalyzer controlFlow() { return controlFlow; }
    PredeclaredFunctions predeclared() { return predeclaredFunctions; }

    // ============ 生命周期 ============

    /**
     * 清空错误、统计与作用域，保留内置类型，用于同一实例的独立重新分析
     */
    public void reset() {
        checkOpen();
        releaseOwnedTypes();
        statistics.reset();
        initState();
    }

    /** 归还分析器持有的全部类型引用 */
    @Override
    public void close() {
        if (closed) return;
        releaseOwnedTypes();
        closed = true;
    }

    private void releaseOwnedTypes() {
        for (TypeDescriptor t : expressionTypes.values()) {
            t.release();
        }
        expressionTypes.clear();
        for (TypeDescriptor t : typeRefTypes) {
            t.release();
        }
        typeRefTypes.clear();
        while (currentScope != globalScope && currentScope != null) {
            SymbolTable inner = currentScope;
            currentScope = inner.getParent();
            inner.destroy();
        }
        globalScope.destroy();
        genericCache.clear();
    }

    private void checkOpen() {
        if (closed) throw new IllegalStateException("分析器已关闭");
    }

    /**
     * 作用域与上下文守卫，配合 try-with-resources 保证提前返回时也能恢复
     */
    public static final class ContextGuard implements AutoCloseable {
        private final Runnable restore;
        private boolean closed;

        ContextGuard(Runnable restore) {
            this.restore = restore;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            restore.run();
        }
    }
}
