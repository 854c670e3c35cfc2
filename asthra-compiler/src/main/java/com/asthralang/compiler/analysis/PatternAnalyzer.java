package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.TypeResolver.BuiltinGenerics;
import com.asthralang.compiler.analysis.types.EnumType;
import com.asthralang.compiler.analysis.types.EnumVariant;
import com.asthralang.compiler.analysis.types.OptionType;
import com.asthralang.compiler.analysis.types.ResultType;
import com.asthralang.compiler.analysis.types.StructField;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TupleType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.pattern.EnumPattern;
import com.asthralang.compiler.ast.pattern.IdentifierPattern;
import com.asthralang.compiler.ast.pattern.LiteralPattern;
import com.asthralang.compiler.ast.pattern.Pattern;
import com.asthralang.compiler.ast.pattern.StructPattern;
import com.asthralang.compiler.ast.pattern.TuplePattern;
import com.asthralang.compiler.ast.pattern.WildcardPattern;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模式检查与绑定。上下文为被匹配值的类型，绑定变量进入当前作用域，
 * 调用方负责为每个分支开启独立作用域。
 */
final class PatternAnalyzer implements AstVisitor<Boolean, TypeDescriptor> {

    private final SemanticAnalyzer analyzer;

    PatternAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    boolean check(Pattern pattern, TypeDescriptor scrutinee) {
        if (pattern == null || scrutinee == null) return false;
        analyzer.countNode(pattern);
        Boolean ok = pattern.accept(this, scrutinee);
        if (ok == null) {
            analyzer.reportError(ErrorKind.UNSUPPORTED_EXPRESSION, pattern.getLocation(),
                    "不支持的模式: %s", pattern.getClass().getSimpleName());
            return false;
        }
        return ok;
    }

    @Override
    public Boolean visitWildcardPattern(WildcardPattern node, TypeDescriptor scrutinee) {
        return true;
    }

    @Override
    public Boolean visitIdentifierPattern(IdentifierPattern node, TypeDescriptor scrutinee) {
        return bind(node.getName(), node.isMutable(), scrutinee, node);
    }

    private boolean bind(String name, boolean mutable, TypeDescriptor type, Pattern node) {
        Symbol symbol = new Symbol(name, SymbolKind.VARIABLE, type, node, Visibility.PRIVATE);
        symbol.setMutable(mutable);
        symbol.setInitialized(true);
        return analyzer.declareSymbol(symbol, node.getLocation());
    }

    @Override
    public Boolean visitLiteralPattern(LiteralPattern node, TypeDescriptor scrutinee) {
        if (!analyzer.expressions().analyze(node.getLiteral(), scrutinee)) return false;
        TypeDescriptor t = analyzer.getExpressionType(node.getLiteral());
        return analyzer.expressions().expectAssignable(scrutinee, t, node.getLocation());
    }

    @Override
    public Boolean visitEnumPattern(EnumPattern node, TypeDescriptor scrutinee) {
        String enumName = node.getEnumName();
        String variantName = node.getVariantName();

        if (BuiltinGenerics.OPTION.equals(enumName) && analyzer.getCurrentScope().resolve(enumName) == null) {
            if (!(scrutinee instanceof OptionType)) return scrutineeMismatch(node, scrutinee);
            if ("Some".equals(variantName)) {
                return checkPayload(node, Collections.singletonList(((OptionType) scrutinee).getValueType()));
            }
            if ("None".equals(variantName)) return checkPayload(node, Collections.<TypeDescriptor>emptyList());
            return unknownVariant(node, enumName);
        }
        if (BuiltinGenerics.RESULT.equals(enumName) && analyzer.getCurrentScope().resolve(enumName) == null) {
            if (!(scrutinee instanceof ResultType)) return scrutineeMismatch(node, scrutinee);
            ResultType result = (ResultType) scrutinee;
            if ("Ok".equals(variantName)) return checkPayload(node, Collections.singletonList(result.getOkType()));
            if ("Err".equals(variantName)) return checkPayload(node, Collections.singletonList(result.getErrType()));
            return unknownVariant(node, enumName);
        }

        EnumType enumType = ExpressionAnalyzer.enumOf(scrutinee);
        if (enumType == null || !enumType.getName().equals(enumName)) {
            return scrutineeMismatch(node, scrutinee);
        }
        EnumVariant variant = enumType.getVariant(variantName);
        if (variant == null) return unknownVariant(node, enumName);

        Map<String, TypeDescriptor> bindings = ExpressionAnalyzer.bindingsOf(scrutinee);
        TypeDescriptor[] types = new TypeDescriptor[variant.getPayloadTypes().size()];
        for (int i = 0; i < types.length; i++) {
            types[i] = ExpressionAnalyzer.substitute(bindings, variant.getPayloadTypes().get(i));
        }
        return checkPayload(node, Arrays.asList(types));
    }

    private boolean checkPayload(EnumPattern node, List<TypeDescriptor> payloadTypes) {
        List<Pattern> payload = node.getPayload();
        if (payload.size() != payloadTypes.size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, node.getLocation(),
                    "变体 %s.%s 需要 %d 个负载模式，实际 %d", node.getEnumName(), node.getVariantName(),
                    payloadTypes.size(), payload.size());
            return false;
        }
        boolean ok = true;
        for (int i = 0; i < payload.size(); i++) {
            if (!check(payload.get(i), payloadTypes.get(i))) ok = false;
        }
        return ok;
    }

    private boolean unknownVariant(EnumPattern node, String enumName) {
        analyzer.reportError(ErrorKind.INVALID_EXPRESSION, node.getLocation(),
                "枚举 %s 没有变体 '%s'", enumName, node.getVariantName());
        return false;
    }

    private boolean scrutineeMismatch(Pattern node, TypeDescriptor scrutinee) {
        analyzer.reportError(ErrorKind.TYPE_MISMATCH, node.getLocation(),
                "模式与被匹配值的类型 %s 不符", scrutinee.toDisplayString());
        return false;
    }

    @Override
    public Boolean visitStructPattern(StructPattern node, TypeDescriptor scrutinee) {
        StructType struct = ExpressionAnalyzer.structOf(scrutinee);
        if (struct == null || !struct.getName().equals(node.getStructName())) {
            return scrutineeMismatch(node, scrutinee);
        }
        Map<String, TypeDescriptor> bindings = ExpressionAnalyzer.bindingsOf(scrutinee);
        boolean ok = true;
        Set<String> seen = new HashSet<String>();
        for (StructPattern.FieldPattern fp : node.getFields()) {
            String fieldName = fp.getFieldName();
            StructField field = struct.getField(fieldName);
            if (field == null) {
                analyzer.reportError(ErrorKind.UNKNOWN_FIELD, fp.getLocation(),
                        "结构体 %s 没有字段 '%s'", struct.getName(), fieldName);
                ok = false;
                continue;
            }
            if (!seen.add(fieldName)) {
                analyzer.reportError(ErrorKind.INVALID_EXPRESSION, fp.getLocation(), "字段 '%s' 在模式中重复", fieldName);
                ok = false;
                continue;
            }
            TypeDescriptor fieldType = ExpressionAnalyzer.substitute(bindings, field.getType());
            if (fp.getPattern() == null) {
                // { x } 简写绑定同名变量
                if (!bind(fieldName, false, fieldType, node)) ok = false;
            } else if (!check(fp.getPattern(), fieldType)) {
                ok = false;
            }
        }
        if (!node.hasRest()) {
            for (StructField field : struct.getFields()) {
                if (!seen.contains(field.getName())) {
                    analyzer.reportErrorWithSuggestion(ErrorKind.MISSING_FIELD, node.getLocation(), "使用 .. 忽略其余字段",
                            "结构体模式 %s 缺少字段 '%s'", struct.getName(), field.getName());
                    ok = false;
                }
            }
        }
        return ok;
    }

    @Override
    public Boolean visitTuplePattern(TuplePattern node, TypeDescriptor scrutinee) {
        if (!(scrutinee instanceof TupleType)) return scrutineeMismatch(node, scrutinee);
        List<TypeDescriptor> elements = ((TupleType) scrutinee).getElementTypes();
        if (elements.size() != node.getElements().size()) {
            analyzer.reportError(ErrorKind.ARITY_MISMATCH, node.getLocation(),
                    "元组模式需要 %d 个元素，实际 %d", elements.size(), node.getElements().size());
            return false;
        }
        boolean ok = true;
        for (int i = 0; i < elements.size(); i++) {
            if (!check(node.getElements().get(i), elements.get(i))) ok = false;
        }
        return ok;
    }

    /**
     * 模式检查失败后，把尚未绑定的名称以未知类型声明到当前作用域。
     * 分支体仍会被分析，引用这些名称时静默失败而不是报告未声明。
     */
    void bindUnresolved(Pattern pattern) {
        if (pattern instanceof IdentifierPattern) {
            declareUnknown(((IdentifierPattern) pattern).getName(), pattern);
        } else if (pattern instanceof StructPattern) {
            for (StructPattern.FieldPattern field : ((StructPattern) pattern).getFields()) {
                if (field.getPattern() == null) {
                    declareUnknown(field.getFieldName(), pattern);
                } else {
                    bindUnresolved(field.getPattern());
                }
            }
        } else if (pattern instanceof TuplePattern) {
            for (Pattern element : ((TuplePattern) pattern).getElements()) {
                bindUnresolved(element);
            }
        } else if (pattern instanceof EnumPattern) {
            for (Pattern element : ((EnumPattern) pattern).getPayload()) {
                bindUnresolved(element);
            }
        }
    }

    private void declareUnknown(String name, Pattern node) {
        SymbolTable scope = analyzer.getCurrentScope();
        if (scope.lookup(name) != null) return;
        Symbol symbol = new Symbol(name, SymbolKind.VARIABLE, null, node, Visibility.PRIVATE);
        symbol.setInitialized(true);
        scope.insert(name, symbol);
    }

    /** 模式是否匹配任意值（通配符或绑定） */
    static boolean isCatchAll(Pattern pattern) {
        return pattern instanceof WildcardPattern || pattern instanceof IdentifierPattern;
    }
}
