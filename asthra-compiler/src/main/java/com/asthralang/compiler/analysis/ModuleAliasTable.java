package com.asthralang.compiler.analysis;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 模块别名表：alias -&gt; 模块路径。
 *
 * <p>独立于词法作用域，可在多个分析器之间显式共享。</p>
 */
public final class ModuleAliasTable {

    private final ConcurrentMap<String, String> aliases = new ConcurrentHashMap<>();

    /** 别名已存在返回 false */
    public boolean registerAlias(String alias, String modulePath) {
        if (alias == null || modulePath == null) return false;
        return aliases.putIfAbsent(alias, modulePath) == null;
    }

    public String resolveAlias(String alias) {
        return alias != null ? aliases.get(alias) : null;
    }

    public boolean hasAlias(String alias) {
        return alias != null && aliases.containsKey(alias);
    }

    public void clearAliases() {
        aliases.clear();
    }

    public int size() {
        return aliases.size();
    }
}
