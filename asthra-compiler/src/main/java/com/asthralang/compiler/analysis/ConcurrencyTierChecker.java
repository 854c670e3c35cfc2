package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 并发特性分级检查
 *
 * <p>第一级（spawn、spawn_with_handle、await）是确定性的，始终允许；
 * 第二级（stdlib/concurrent 下的通道、协调与模式原语）要求外层函数声明
 * {@code #[non_deterministic]}。</p>
 */
final class ConcurrencyTierChecker {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyTierChecker.class);

    static final String NON_DETERMINISTIC = "non_deterministic";
    private static final String TIER2_MODULE_PREFIX = "stdlib/concurrent";

    private final SemanticAnalyzer analyzer;
    private long tier1Uses;
    private long tier2Uses;

    ConcurrencyTierChecker(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    boolean checkTier1(String feature, SourceLocation location) {
        tier1Uses++;
        log.trace("一级并发特性 {} @ {}", feature, location);
        return true;
    }

    boolean checkTier2(String feature, SourceLocation location) {
        tier2Uses++;
        FunctionContext function = analyzer.getCurrentFunction();
        if (function != null && function.isNonDeterministic()) {
            return true;
        }
        String owner = function != null ? function.getName() : "<顶层>";
        analyzer.reportErrorWithSuggestion(ErrorKind.MISSING_ANNOTATION, location,
                "在函数 '" + owner + "' 上添加 #[" + NON_DETERMINISTIC + "]",
                "非确定性并发特性 '%s' 需要外层函数声明 #[%s]", feature, NON_DETERMINISTIC);
        return false;
    }

    /**
     * 经模块别名访问成员时调用；别名指向第二级模块时执行第二级检查
     */
    boolean checkModuleAccess(String alias, String member, SourceLocation location) {
        String path = analyzer.getAliasTable().resolveAlias(alias);
        if (isTier2Module(path)) {
            return checkTier2(alias + "." + member, location);
        }
        return true;
    }

    static boolean isTier2Module(String path) {
        return path != null && path.startsWith(TIER2_MODULE_PREFIX);
    }

    long getTier1Uses() {
        return tier1Uses;
    }

    long getTier2Uses() {
        return tier2Uses;
    }

    void reset() {
        tier1Uses = 0;
        tier2Uses = 0;
    }
}
