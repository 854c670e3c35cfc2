package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.Annotation;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.Identifier;
import com.asthralang.compiler.ast.expr.Literal;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 注解预检：名称、适用位置、参数与互斥关系。
 * 任一注解非法时返回 false，调用方不再分析该节点。
 */
final class AnnotationAnalyzer {

    /**
     * 注解可出现的位置
     */
    enum AnnotationContext {
        FUNCTION("函数"),
        METHOD("方法"),
        STRUCT("结构体"),
        STRUCT_FIELD("结构体字段"),
        ENUM("枚举"),
        EXTERN("外部函数"),
        EXTERN_PARAMETER("外部函数参数"),
        EXTERN_RETURN("外部函数返回值"),
        PARAMETER("参数"),
        CONST("常量"),
        IMPL("impl 块"),
        STATEMENT("语句"),
        EXPRESSION("表达式");

        private final String displayName;

        AnnotationContext(String displayName) {
            this.displayName = displayName;
        }

        String getDisplayName() {
            return displayName;
        }
    }

    private enum ArgRule {
        NONE,
        OPTIONAL_STRING,
        OWNERSHIP_MODE
    }

    private static final class Definition {
        final Set<AnnotationContext> contexts;
        final ArgRule argRule;

        Definition(Set<AnnotationContext> contexts, ArgRule argRule) {
            this.contexts = contexts;
            this.argRule = argRule;
        }
    }

    private static final Set<AnnotationContext> DECLARATIONS = EnumSet.of(
            AnnotationContext.FUNCTION, AnnotationContext.METHOD, AnnotationContext.STRUCT,
            AnnotationContext.STRUCT_FIELD, AnnotationContext.ENUM, AnnotationContext.EXTERN,
            AnnotationContext.CONST, AnnotationContext.IMPL);

    private static final Map<String, Definition> KNOWN = new LinkedHashMap<String, Definition>();

    static {
        KNOWN.put(ConcurrencyTierChecker.NON_DETERMINISTIC,
                new Definition(EnumSet.of(AnnotationContext.FUNCTION, AnnotationContext.METHOD), ArgRule.NONE));
        KNOWN.put("inline",
                new Definition(EnumSet.of(AnnotationContext.FUNCTION, AnnotationContext.METHOD), ArgRule.NONE));
        KNOWN.put("deprecated", new Definition(DECLARATIONS, ArgRule.OPTIONAL_STRING));
        KNOWN.put("constant_time", new Definition(EnumSet.of(AnnotationContext.FUNCTION,
                AnnotationContext.METHOD, AnnotationContext.STATEMENT), ArgRule.NONE));
        KNOWN.put("volatile_memory", new Definition(EnumSet.of(AnnotationContext.STRUCT_FIELD,
                AnnotationContext.PARAMETER, AnnotationContext.EXTERN_PARAMETER), ArgRule.NONE));
        KNOWN.put("transfer_full", new Definition(EnumSet.of(AnnotationContext.EXTERN_PARAMETER,
                AnnotationContext.EXTERN_RETURN), ArgRule.NONE));
        KNOWN.put("transfer_none", new Definition(EnumSet.of(AnnotationContext.EXTERN_PARAMETER,
                AnnotationContext.EXTERN_RETURN), ArgRule.NONE));
        KNOWN.put("borrowed", new Definition(EnumSet.of(AnnotationContext.EXTERN_PARAMETER), ArgRule.NONE));
        KNOWN.put("ownership", new Definition(EnumSet.of(AnnotationContext.STRUCT), ArgRule.OWNERSHIP_MODE));
    }

    /** 所有权转移注解，两两互斥 */
    static final List<String> TRANSFER_ANNOTATIONS =
            Collections.unmodifiableList(Arrays.asList("transfer_full", "transfer_none", "borrowed"));

    private static final Set<String> OWNERSHIP_MODES = new HashSet<String>(Arrays.asList("gc", "c", "pinned"));

    private final SemanticAnalyzer analyzer;

    AnnotationAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    static boolean isKnown(String name) {
        return KNOWN.containsKey(name);
    }

    boolean validate(List<Annotation> annotations, AnnotationContext context) {
        if (annotations == null || annotations.isEmpty()) return true;

        boolean ok = true;
        Map<String, Annotation> seen = new HashMap<String, Annotation>();
        for (Annotation annotation : annotations) {
            String name = annotation.getName();
            if (seen.containsKey(name)) {
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                        "重复的注解 '#[%s]'", name);
                ok = false;
                continue;
            }
            seen.put(name, annotation);

            Definition def = KNOWN.get(name);
            if (def == null) {
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                        "未知注解 '#[%s]'", name);
                ok = false;
                continue;
            }
            if (!def.contexts.contains(context)) {
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                        "注解 '#[%s]' 不能用于%s", name, context.getDisplayName());
                ok = false;
                continue;
            }
            if (!checkArgs(annotation, def.argRule)) {
                ok = false;
            }
        }

        ok &= checkConflicts(seen);
        return ok;
    }

    private boolean checkArgs(Annotation annotation, ArgRule rule) {
        List<Annotation.AnnotationArg> args = annotation.getArgs();
        switch (rule) {
            case NONE:
                if (annotation.hasArgs()) {
                    analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                            "注解 '#[%s]' 不接受参数", annotation.getName());
                    return false;
                }
                return true;
            case OPTIONAL_STRING:
                if (!annotation.hasArgs()) return true;
                if (args.size() == 1 && isStringLiteral(args.get(0).getValue())) return true;
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                        "注解 '#[%s]' 最多接受一个字符串参数", annotation.getName());
                return false;
            case OWNERSHIP_MODE:
                if (args.size() == 1 && OWNERSHIP_MODES.contains(ownershipMode(args.get(0)))) return true;
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, annotation.getLocation(),
                        "ownership 注解的参数只能取 gc/c/pinned");
                return false;
            default:
                return true;
        }
    }

    private static boolean isStringLiteral(Expression value) {
        return value instanceof Literal && ((Literal) value).getKind() == Literal.LiteralKind.STRING;
    }

    /** #[ownership(gc)] 既可能解析为无值参数，也可能解析为标识符值 */
    private static String ownershipMode(Annotation.AnnotationArg arg) {
        Expression value = arg.getValue();
        if (value == null) return arg.getName();
        if (value instanceof Identifier) return ((Identifier) value).getName();
        if (isStringLiteral(value)) return (String) ((Literal) value).getValue();
        return null;
    }

    private boolean checkConflicts(Map<String, Annotation> present) {
        boolean ok = true;
        String firstTransfer = null;
        for (String name : TRANSFER_ANNOTATIONS) {
            if (!present.containsKey(name)) continue;
            if (firstTransfer == null) {
                firstTransfer = name;
            } else {
                analyzer.reportError(ErrorKind.INVALID_ANNOTATION, present.get(name).getLocation(),
                        "注解 '#[%s]' 与 '#[%s]' 互斥", name, firstTransfer);
                ok = false;
            }
        }
        if (present.containsKey("inline") && present.containsKey(ConcurrencyTierChecker.NON_DETERMINISTIC)) {
            analyzer.reportWarning(ErrorKind.INVALID_ANNOTATION, present.get("inline").getLocation(),
                    "'#[inline]' 与 '#[non_deterministic]' 同时使用是多余的");
        }
        return ok;
    }

    /** 是否带有任一所有权转移注解 */
    static boolean hasTransferAnnotation(List<Annotation> annotations) {
        if (annotations == null) return false;
        for (Annotation a : annotations) {
            if (TRANSFER_ANNOTATIONS.contains(a.getName())) return true;
        }
        return false;
    }

    static boolean contains(List<Annotation> annotations, String name) {
        if (annotations == null) return false;
        for (Annotation a : annotations) {
            if (name.equals(a.getName())) return true;
        }
        return false;
    }

    static SourceLocation locationOf(List<Annotation> annotations, SourceLocation fallback) {
        return annotations == null || annotations.isEmpty() ? fallback : annotations.get(0).getLocation();
    }
}
