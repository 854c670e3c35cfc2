package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.AnnotationAnalyzer.AnnotationContext;
import com.asthralang.compiler.analysis.SemanticAnalyzer.ContextGuard;
import com.asthralang.compiler.analysis.types.ArrayType;
import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.FunctionType;
import com.asthralang.compiler.analysis.types.PointerType;
import com.asthralang.compiler.analysis.types.StructMethod;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TupleType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.decl.ConstDecl;
import com.asthralang.compiler.ast.decl.Declaration;
import com.asthralang.compiler.ast.decl.EnumDecl;
import com.asthralang.compiler.ast.decl.ExternDecl;
import com.asthralang.compiler.ast.decl.FunctionDecl;
import com.asthralang.compiler.ast.decl.ImplBlock;
import com.asthralang.compiler.ast.decl.ImportDecl;
import com.asthralang.compiler.ast.decl.MethodDecl;
import com.asthralang.compiler.ast.decl.Parameter;
import com.asthralang.compiler.ast.decl.Program;
import com.asthralang.compiler.ast.decl.StructDecl;
import com.asthralang.compiler.ast.decl.StructFieldDecl;
import com.asthralang.compiler.ast.type.TypeParameter;
import com.asthralang.compiler.ast.type.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 顶层声明分析。
 *
 * <p>按三个阶段处理，使函数体可以引用其后声明的类型与函数：</p>
 * <ol>
 *   <li>登记结构体与枚举的类型名</li>
 *   <li>解析字段、变体与签名，登记函数、外部函数与常量</li>
 *   <li>分析函数体与常量初始化表达式</li>
 * </ol>
 * <p>每个阶段内按源码顺序进行；每个声明的每个阶段只执行一次。</p>
 */
final class DeclarationAnalyzer implements AstVisitor<Boolean, DeclarationAnalyzer.Phase> {

    private static final Logger log = LoggerFactory.getLogger(DeclarationAnalyzer.class);

    enum Phase {
        REGISTER_TYPES,
        SIGNATURES,
        BODIES
    }

    private final SemanticAnalyzer analyzer;

    private final Map<Declaration, Phase> completed = new IdentityHashMap<>();
    private final Map<Declaration, Boolean> outcomes = new IdentityHashMap<>();
    private final Map<Declaration, TypeDescriptor> declaredTypes = new IdentityHashMap<>();
    private final Map<FunctionDecl, FunctionType> signatures = new IdentityHashMap<>();
    private final Set<String> importedAliases = new HashSet<>();
    // 正在分析初始化表达式的常量
    private final Set<ConstDecl> resolvingConsts = Collections.newSetFromMap(new IdentityHashMap<ConstDecl, Boolean>());

    DeclarationAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    void reset() {
        completed.clear();
        outcomes.clear();
        declaredTypes.clear();
        signatures.clear();
        importedAliases.clear();
        resolvingConsts.clear();
    }

    // ============ 入口 ============

    boolean analyzeProgram(Program program) {
        analyzer.countNode(program);
        if (program.getPackageDecl() != null) {
            analyzer.countNode(program.getPackageDecl());
            analyzer.setPackageName(program.getPackageDecl().getName());
        }
        boolean ok = true;
        for (ImportDecl imp : program.getImports()) {
            if (!analyzeImport(imp)) ok = false;
        }
        List<Declaration> declarations = program.getDeclarations();
        for (Phase phase : Phase.values()) {
            log.trace("声明阶段 {}，共 {} 个声明", phase, declarations.size());
            for (Declaration decl : declarations) {
                if (!runPhase(decl, phase)) ok = false;
            }
        }
        return ok;
    }

    /** 对单个声明依次执行尚未完成的阶段 */
    boolean analyze(Declaration decl) {
        if (decl == null) {
            analyzer.reportError(ErrorKind.INTERNAL, SourceLocation.UNKNOWN, "声明节点为空");
            return false;
        }
        boolean ok = true;
        for (Phase phase : Phase.values()) {
            if (!runPhase(decl, phase)) ok = false;
        }
        return ok;
    }

    private boolean runPhase(Declaration decl, Phase phase) {
        Phase done = completed.get(decl);
        if (done != null && done.compareTo(phase) >= 0) {
            return outcome(decl);
        }
        if (phase.ordinal() > 0 && (done == null || done.ordinal() < phase.ordinal() - 1)) {
            // 单独分析某个声明时补齐前面的阶段
            runPhase(decl, Phase.values()[phase.ordinal() - 1]);
            if (completed.get(decl).compareTo(phase) >= 0) return outcome(decl);
        }
        if (phase == Phase.REGISTER_TYPES) {
            analyzer.countNode(decl);
        }
        completed.put(decl, phase);

        Boolean ok = decl.accept(this, phase);
        if (ok == null) {
            analyzer.reportError(ErrorKind.UNSUPPORTED_DECLARATION, decl.getLocation(),
                    "不支持的声明: %s", decl.getClass().getSimpleName());
            skipRemaining(decl);
            return false;
        }
        if (!ok) outcomes.put(decl, Boolean.FALSE);
        return ok;
    }

    private boolean outcome(Declaration decl) {
        return !Boolean.FALSE.equals(outcomes.get(decl));
    }

    /** 该声明后续阶段不再执行 */
    private void skipRemaining(Declaration decl) {
        completed.put(decl, Phase.BODIES);
        outcomes.put(decl, Boolean.FALSE);
    }

    /**
     * 注解预检，失败时该声明不再继续分析
     */
    private boolean validateAnnotations(Declaration decl, AnnotationContext context) {
        if (analyzer.annotations().validate(decl.getAnnotations(), context)) return true;
        skipRemaining(decl);
        return false;
    }

    // ============ import ============

    private boolean analyzeImport(ImportDecl imp) {
        analyzer.countNode(imp);
        String alias = imp.getEffectiveName();
        String path = imp.getPath();
        if (!importedAliases.add(alias)) {
            analyzer.reportError(ErrorKind.REDECLARATION, imp.getLocation(), "重复导入别名 '%s'", alias);
            return false;
        }
        ModuleAliasTable aliases = analyzer.getAliasTable();
        if (aliases.registerAlias(alias, path)) {
            log.debug("导入模块 {} as {}", path, alias);
            return true;
        }
        String existing = aliases.resolveAlias(alias);
        // 共享别名表中已有相同映射
        if (path.equals(existing)) return true;
        analyzer.reportError(ErrorKind.REDECLARATION, imp.getLocation(),
                "别名 '%s' 已指向模块 %s", alias, existing);
        return false;
    }

    // ============ struct ============

    @Override
    public Boolean visitStructDecl(StructDecl node, Phase phase) {
        switch (phase) {
            case REGISTER_TYPES: {
                StructType struct = TypeDescriptors.createStruct(node.getName(), node.getFields().size(),
                        node.isPacked(), typeParamNames(node.getTypeParams()));
                return registerType(node, struct);
            }
            case SIGNATURES:
                if (!validateAnnotations(node, AnnotationContext.STRUCT)) return false;
                return analyzeStructFields(node, (StructType) declaredTypes.get(node));
            default:
                return true;
        }
    }

    private boolean registerType(Declaration node, TypeDescriptor type) {
        Symbol symbol = new Symbol(node.getName(), SymbolKind.TYPE, type, node, node.getVisibility());
        symbol.setPredeclared(true);
        symbol.setExported(node.getVisibility() == Visibility.PUBLIC);
        symbol.setAnnotations(node.getAnnotations());
        if (!analyzer.declareSymbol(symbol, node.getLocation())) {
            skipRemaining(node);
            return false;
        }
        declaredTypes.put(node, type);
        return true;
    }

    private boolean analyzeStructFields(StructDecl node, StructType struct) {
        boolean ok = true;
        try (ContextGuard scope = analyzer.enterScope()) {
            bindTypeParameters(struct.getTypeParams(), node);
            for (StructFieldDecl field : node.getFields()) {
                analyzer.countNode(field);
                if (!analyzer.annotations().validate(field.getAnnotations(), AnnotationContext.STRUCT_FIELD)) {
                    ok = false;
                    continue;
                }
                if (struct.hasField(field.getName())) {
                    analyzer.reportError(ErrorKind.REDECLARATION, field.getLocation(),
                            "结构体 %s 的字段 '%s' 重复", struct.getName(), field.getName());
                    ok = false;
                    continue;
                }
                TypeDescriptor type = analyzer.typeResolver().analyzeTypeNode(field.getType());
                if (type == null) {
                    ok = false;
                    continue;
                }
                if (containsByValue(type, struct)) {
                    analyzer.reportErrorWithSuggestion(ErrorKind.INVALID_TYPE, field.getLocation(),
                            "改用指针 *" + struct.getName(),
                            "结构体 %s 不能直接包含自身 (字段 '%s')", struct.getName(), field.getName());
                    ok = false;
                    continue;
                }
                struct.addField(field.getName(), type, field, field.getVisibility() == Visibility.PUBLIC);
            }
        }
        return ok;
    }

    private static boolean containsByValue(TypeDescriptor type, StructType struct) {
        if (type == struct) return true;
        if (type instanceof ArrayType) return containsByValue(((ArrayType) type).getElementType(), struct);
        if (type instanceof TupleType) {
            for (TypeDescriptor element : ((TupleType) type).getElementTypes()) {
                if (containsByValue(element, struct)) return true;
            }
        }
        return false;
    }

    // ============ enum ============

    @Override
    public Boolean visitEnumDecl(EnumDecl node, Phase phase) {
        switch (phase) {
            case REGISTER_TYPES:
                return registerType(node, TypeDescriptors.createEnum(node.getName(),
                        typeParamNames(node.getTypeParams())));
            case SIGNATURES:
                if (!validateAnnotations(node, AnnotationContext.ENUM)) return false;
                return analyzeEnumVariants(node, (EnumType) declaredTypes.get(node));
            default:
                return true;
        }
    }

    private boolean analyzeEnumVariants(EnumDecl node, EnumType enumType) {
        boolean ok = true;
        try (ContextGuard scope = analyzer.enterScope()) {
            bindTypeParameters(enumType.getTypeParams(), node);
            for (EnumDecl.EnumVariantDecl variant : node.getVariants()) {
                analyzer.countNode(variant);
                List<TypeDescriptor> payload = new ArrayList<>();
                boolean resolved = true;
                for (TypeRef ref : variant.getPayloadTypes()) {
                    TypeDescriptor t = analyzer.typeResolver().analyzeTypeNode(ref);
                    if (t == null) {
                        resolved = false;
                    } else {
                        payload.add(t);
                    }
                }
                if (!resolved) {
                    ok = false;
                    continue;
                }
                if (!enumType.addVariant(variant.getName(), payload, variant)) {
                    analyzer.reportError(ErrorKind.REDECLARATION, variant.getLocation(),
                            "枚举 %s 的变体 '%s' 重复", enumType.getName(), variant.getName());
                    ok = false;
                }
            }
        }
        return ok;
    }

    // ============ fn ============

    @Override
    public Boolean visitFunctionDecl(FunctionDecl node, Phase phase) {
        switch (phase) {
            case SIGNATURES:
                return declareFunction(node);
            case BODIES: {
                FunctionType signature = signatures.get(node);
                return signature != null && analyzeBody(node, signature, null);
            }
            default:
                return true;
        }
    }

    private boolean declareFunction(FunctionDecl node) {
        if (!validateAnnotations(node, AnnotationContext.FUNCTION)) return false;
        FunctionType signature;
        try (ContextGuard scope = analyzer.enterScope()) {
            bindTypeParameters(typeParamNames(node.getTypeParams()), node);
            signature = resolveSignature(node, AnnotationContext.PARAMETER);
        }
        if (signature == null) {
            skipRemaining(node);
            return false;
        }
        boolean ok = true;
        if ("main".equals(node.getName())) {
            TypeDescriptor ret = signature.getReturnType();
            if (!ret.isVoid() && !ret.equals(TypeDescriptors.I32)) {
                analyzer.reportError(ErrorKind.TYPE_MISMATCH, returnLocation(node),
                        "main 函数必须返回 void 或 i32，实际 %s", ret.toDisplayString());
                ok = false;
            }
        }
        Symbol symbol = new Symbol(node.getName(), SymbolKind.FUNCTION, signature, node, node.getVisibility());
        symbol.setPredeclared(true);
        symbol.setInitialized(true);
        symbol.setExported(node.getVisibility() == Visibility.PUBLIC);
        symbol.setAnnotations(node.getAnnotations());
        if (!analyzer.declareSymbol(symbol, node.getLocation())) {
            skipRemaining(node);
            return false;
        }
        signatures.put(node, signature);
        return ok;
    }

    private static SourceLocation returnLocation(FunctionDecl node) {
        return node.getReturnType() != null ? node.getReturnType().getLocation() : node.getLocation();
    }

    /**
     * 解析参数与返回类型，重复参数名报告 REDECLARATION。任一失败返回 null。
     */
    private FunctionType resolveSignature(FunctionDecl node, AnnotationContext paramContext) {
        boolean ok = true;
        Set<String> names = new HashSet<>();
        List<TypeDescriptor> params = new ArrayList<>();
        for (Parameter param : node.getParams()) {
            analyzer.countNode(param);
            if (!names.add(param.getName())) {
                analyzer.reportError(ErrorKind.REDECLARATION, param.getLocation(),
                        "函数 '%s' 的参数 '%s' 重复", node.getName(), param.getName());
                ok = false;
            }
            if (!analyzer.annotations().validate(param.getAnnotations(), paramContext)) ok = false;
            TypeDescriptor t = analyzer.typeResolver().analyzeTypeNode(param.getType());
            if (t == null) {
                ok = false;
            } else if (t.isVoid()) {
                analyzer.reportError(ErrorKind.INVALID_TYPE, param.getLocation(),
                        "参数 '%s' 的类型不能是 void", param.getName());
                ok = false;
            } else {
                params.add(t);
            }
        }
        TypeDescriptor ret = node.getReturnType() != null
                ? analyzer.typeResolver().analyzeTypeNode(node.getReturnType())
                : TypeDescriptors.VOID;
        if (ret == null || !ok) return null;
        return TypeDescriptors.createFunction(ret, params);
    }

    /**
     * 函数与方法体：参数进入函数作用域，分析后检查返回路径
     */
    private boolean analyzeBody(FunctionDecl node, FunctionType signature, StructType receiver) {
        if (node.getBody() == null) return true;
        TypeDescriptor ret = signature.getReturnType();
        boolean nonDeterministic = node.hasAnnotation(ConcurrencyTierChecker.NON_DETERMINISTIC);
        boolean ok = true;
        try (ContextGuard scope = analyzer.enterScope();
             ContextGuard function = analyzer.enterFunction(
                     new FunctionContext(node, ret, nonDeterministic, receiver))) {
            bindTypeParameters(typeParamNames(node.getTypeParams()), node);
            if (receiver != null && node instanceof MethodDecl && ((MethodDecl) node).isInstanceMethod()) {
                bindSelf((MethodDecl) node, receiver);
            }
            List<Parameter> params = node.getParams();
            List<TypeDescriptor> paramTypes = signature.getParamTypes();
            for (int i = 0; i < params.size() && i < paramTypes.size(); i++) {
                Parameter param = params.get(i);
                // 重复参数已在签名阶段报告
                if (analyzer.getCurrentScope().lookup(param.getName()) != null) continue;
                Symbol symbol = new Symbol(param.getName(), SymbolKind.PARAMETER, paramTypes.get(i),
                        param, Visibility.PRIVATE);
                symbol.setMutable(param.isMutable());
                symbol.setInitialized(true);
                analyzer.declareSymbol(symbol, param.getLocation());
            }

            analyzer.countNode(node.getBody());
            if (!analyzer.statements().analyzeBlockInCurrentScope(node.getBody())) ok = false;

            boolean terminates = analyzer.controlFlow().allPathsReturn(node.getBody());
            if (ret.isNever() && !terminates) {
                analyzer.reportError(ErrorKind.MISSING_RETURN, node.getLocation(),
                        "返回 Never 的函数 '%s' 不能正常结束", node.getName());
                ok = false;
            } else if (!ret.isVoid() && !ret.isNever() && !terminates) {
                analyzer.reportError(ErrorKind.MISSING_RETURN, node.getLocation(),
                        "函数 '%s' 并非所有路径都返回 %s", node.getName(), ret.toDisplayString());
                ok = false;
            }
        }
        return ok;
    }

    /** self 按值为结构体类型，按引用为 *mut 指针 */
    private void bindSelf(MethodDecl method, StructType receiver) {
        TypeDescriptor selfType = method.getSelfKind() == MethodDecl.SelfKind.REFERENCE
                ? TypeDescriptors.createPointer(receiver, true)
                : receiver;
        Symbol self = new Symbol("self", SymbolKind.PARAMETER, selfType, method, Visibility.PRIVATE);
        self.setInitialized(true);
        self.setSelfKind(method.getSelfKind());
        analyzer.declareSymbol(self, method.getLocation());
    }

    // ============ extern ============

    @Override
    public Boolean visitExternDecl(ExternDecl node, Phase phase) {
        if (phase != Phase.SIGNATURES) return true;
        if (!validateAnnotations(node, AnnotationContext.EXTERN)) return false;

        boolean ok = true;
        String name = node.getName();
        AnalyzerConfig config = analyzer.getConfig();
        List<TypeDescriptor> params = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Parameter param : node.getParams()) {
            analyzer.countNode(param);
            if (!names.add(param.getName())) {
                analyzer.reportError(ErrorKind.REDECLARATION, param.getLocation(),
                        "外部函数 '%s' 的参数 '%s' 重复", name, param.getName());
                ok = false;
            }
            if (!analyzer.annotations().validate(param.getAnnotations(), AnnotationContext.EXTERN_PARAMETER)) {
                ok = false;
            }
            TypeDescriptor t = analyzer.typeResolver().analyzeTypeNode(param.getType());
            if (t == null) {
                ok = false;
                continue;
            }
            if (config.isValidateFfi() && !analyzer.ffi().checkParameter(name, param, t)) ok = false;
            if (config.isCheckOwnership() && t instanceof PointerType
                    && !AnnotationAnalyzer.hasTransferAnnotation(param.getAnnotations())) {
                analyzer.reportWarning(ErrorKind.MISSING_ANNOTATION, param.getLocation(),
                        "外部函数 %s 的指针参数 '%s' 缺少所有权注解 (transfer_full/transfer_none/borrowed)",
                        name, param.getName());
            }
            params.add(t);
        }

        if (!analyzer.annotations().validate(node.getReturnAnnotations(), AnnotationContext.EXTERN_RETURN)) {
            ok = false;
        }
        TypeDescriptor ret = node.getReturnType() != null
                ? analyzer.typeResolver().analyzeTypeNode(node.getReturnType())
                : TypeDescriptors.VOID;
        if (ret == null) {
            ok = false;
        } else {
            SourceLocation retLoc = node.getReturnType() != null
                    ? node.getReturnType().getLocation() : node.getLocation();
            if (config.isValidateFfi() && !analyzer.ffi().checkReturn(name, ret, retLoc)) ok = false;
            if (config.isCheckOwnership() && ret instanceof PointerType
                    && !AnnotationAnalyzer.hasTransferAnnotation(node.getReturnAnnotations())) {
                analyzer.reportWarning(ErrorKind.MISSING_ANNOTATION, retLoc,
                        "外部函数 %s 的指针返回值缺少所有权注解", name);
            }
        }
        if (ret == null || params.size() != node.getParams().size()) {
            skipRemaining(node);
            return false;
        }

        Symbol symbol = new Symbol(name, SymbolKind.FUNCTION, TypeDescriptors.createFunction(ret, params),
                node, node.getVisibility());
        symbol.setPredeclared(true);
        symbol.setInitialized(true);
        symbol.setAnnotations(node.getAnnotations());
        if (!analyzer.declareSymbol(symbol, node.getLocation())) return false;
        return ok;
    }

    // ============ impl ============

    @Override
    public Boolean visitImplBlock(ImplBlock node, Phase phase) {
        switch (phase) {
            case SIGNATURES:
                return declareMethods(node);
            case BODIES:
                return analyzeMethodBodies(node);
            default:
                return true;
        }
    }

    private boolean declareMethods(ImplBlock node) {
        if (!validateAnnotations(node, AnnotationContext.IMPL)) return false;
        Symbol target = analyzer.resolve(node.getStructName());
        if (target == null) {
            analyzer.reportError(ErrorKind.UNDECLARED_IDENTIFIER, node.getLocation(),
                    "impl 的目标结构体 '%s' 未声明", node.getStructName());
            skipRemaining(node);
            return false;
        }
        if (target.getKind() != SymbolKind.TYPE || !(target.getType() instanceof StructType)) {
            analyzer.reportError(ErrorKind.INVALID_TYPE, node.getLocation(),
                    "impl 的目标 '%s' 不是结构体", node.getStructName());
            skipRemaining(node);
            return false;
        }
        target.markUsed();
        StructType struct = (StructType) target.getType();
        declaredTypes.put(node, struct);

        boolean ok = true;
        try (ContextGuard impl = analyzer.enterImpl(struct);
             ContextGuard scope = analyzer.enterScope()) {
            bindTypeParameters(struct.getTypeParams(), node);
            for (MethodDecl method : node.getMethods()) {
                analyzer.countNode(method);
                if (!analyzer.annotations().validate(method.getAnnotations(), AnnotationContext.METHOD)) {
                    ok = false;
                    continue;
                }
                FunctionType signature = resolveSignature(method, AnnotationContext.PARAMETER);
                if (signature == null) {
                    ok = false;
                    continue;
                }
                StructMethod entry = new StructMethod(method.getName(), signature, method.getSelfKind(),
                        method.getVisibility() == Visibility.PUBLIC, method);
                if (struct.hasField(method.getName()) || !struct.addMethod(entry)) {
                    analyzer.reportError(ErrorKind.REDECLARATION, method.getLocation(),
                            "结构体 %s 已有名为 '%s' 的成员", struct.getName(), method.getName());
                    // 未被结构体持有的签名由此归还
                    TypeDescriptors.retain(signature);
                    TypeDescriptors.release(signature);
                    ok = false;
                    continue;
                }
                signatures.put(method, signature);
            }
        }
        return ok;
    }

    private boolean analyzeMethodBodies(ImplBlock node) {
        StructType struct = (StructType) declaredTypes.get(node);
        if (struct == null) return false;
        boolean ok = true;
        try (ContextGuard impl = analyzer.enterImpl(struct);
             ContextGuard scope = analyzer.enterScope()) {
            bindTypeParameters(struct.getTypeParams(), node);
            for (MethodDecl method : node.getMethods()) {
                FunctionType signature = signatures.get(method);
                if (signature == null) continue;
                if (!analyzeBody(method, signature, struct)) ok = false;
            }
        }
        return ok;
    }

    // ============ const ============

    @Override
    public Boolean visitConstDecl(ConstDecl node, Phase phase) {
        switch (phase) {
            case SIGNATURES:
                return declareConst(node);
            case BODIES:
                return analyzeConstValue(node);
            default:
                return true;
        }
    }

    private boolean declareConst(ConstDecl node) {
        if (!validateAnnotations(node, AnnotationContext.CONST)) return false;
        TypeDescriptor type = null;
        if (node.getType() != null) {
            type = analyzer.typeResolver().analyzeTypeNode(node.getType());
            if (type == null) {
                skipRemaining(node);
                return false;
            }
            declaredTypes.put(node, type);
        } else {
            // 无类型注解时先按可折叠的值推断，第三阶段再以完整分析为准
            type = inferConstType(analyzer.constEvaluator().tryEvaluate(node.getValue()));
        }
        Symbol symbol = new Symbol(node.getName(), SymbolKind.CONST, type, node, node.getVisibility());
        symbol.setPredeclared(true);
        symbol.setInitialized(true);
        symbol.setExported(node.getVisibility() == Visibility.PUBLIC);
        symbol.setAnnotations(node.getAnnotations());
        if (!analyzer.declareSymbol(symbol, node.getLocation())) {
            skipRemaining(node);
            return false;
        }
        return true;
    }

    private static TypeDescriptor inferConstType(ConstValue value) {
        if (value == null) return null;
        switch (value.getKind()) {
            case INTEGER:
                long v = value.asLong();
                return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? TypeDescriptors.I32 : TypeDescriptors.I64;
            case FLOAT:
                return TypeDescriptors.F64;
            case BOOLEAN:
                return TypeDescriptors.BOOL;
            case STRING:
                return TypeDescriptors.STRING;
            default:
                return null;
        }
    }

    /**
     * 无类型注解的常量被前向引用时，在全局作用域中提前完成其第三阶段。
     * 引用构成环时在 location 报告 INVALID_EXPRESSION。
     *
     * @return 常量的类型，失败返回 null
     */
    TypeDescriptor resolveConstType(Symbol symbol, SourceLocation location) {
        ConstDecl decl = (ConstDecl) symbol.getDeclaration();
        if (resolvingConsts.contains(decl)) {
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, location,
                    "常量 '%s' 存在循环引用", decl.getName());
            return null;
        }
        Phase done = completed.get(decl);
        if (done == null || done.compareTo(Phase.BODIES) < 0) {
            try (ContextGuard global = analyzer.enterGlobalScope()) {
                runPhase(decl, Phase.BODIES);
            }
        }
        return symbol.getType();
    }

    private boolean analyzeConstValue(ConstDecl node) {
        Symbol symbol = analyzer.getGlobalScope().lookup(node.getName());
        if (symbol == null || symbol.getDeclaration() != node) return false;
        resolvingConsts.add(node);
        try {
            return analyzeConstValue(node, symbol);
        } finally {
            resolvingConsts.remove(node);
        }
    }

    private boolean analyzeConstValue(ConstDecl node, Symbol symbol) {
        TypeDescriptor declared = declaredTypes.get(node);

        if (!analyzer.expressions().analyze(node.getValue(), declared != null ? declared : symbol.getType())) {
            return false;
        }
        TypeDescriptor valueType = analyzer.getExpressionType(node.getValue());
        if (declared != null) {
            if (!analyzer.expressions().expectAssignable(declared, valueType, node.getValue().getLocation())) {
                return false;
            }
        } else {
            symbol.setType(valueType);
        }
        try {
            ConstValue value = analyzer.constEvaluator().evaluate(node.getValue());
            ConstEvaluator.checkRange(value, symbol.getType(), node.getValue());
            symbol.setConstValue(value);
        } catch (ConstEvaluationException e) {
            if (e.getKind() == ErrorKind.TYPE_MISMATCH) {
                analyzer.reportErrorWithSuggestion(ErrorKind.TYPE_MISMATCH, e.getLocation(),
                        "改用更宽的整数类型，或用 as 显式截断", "常量 '%s' 溢出: %s", node.getName(), e.getMessage());
                return false;
            }
            analyzer.reportError(ErrorKind.INVALID_EXPRESSION, e.getLocation(),
                    "常量 '%s' 的初始化表达式不是编译期常量: %s", node.getName(), e.getMessage());
            return false;
        }
        return true;
    }

    // ============ 辅助 ============

    private static List<String> typeParamNames(List<TypeParameter> params) {
        List<String> names = new ArrayList<>();
        if (params == null) return names;
        for (TypeParameter p : params) {
            names.add(p.getName());
        }
        return names;
    }

    /** 泛型参数作为 TYPE_PARAMETER 符号进入当前作用域 */
    private void bindTypeParameters(List<String> names, Declaration owner) {
        for (String name : names) {
            Symbol symbol = new Symbol(name, SymbolKind.TYPE_PARAMETER,
                    TypeDescriptors.createTypeParameter(name), owner, Visibility.PRIVATE);
            analyzer.declareSymbol(symbol, owner.getLocation());
        }
    }
}
