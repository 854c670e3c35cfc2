package com.asthralang.compiler.analysis;

/**
 * 语义分析配置
 *
 * <p>testMode 会关闭 strictMode 并开启 warning；退出 testMode 时两者恢复为进入前的值。</p>
 */
public class AnalyzerConfig {

    public static final int DEFAULT_MAX_ERRORS = 100;
    public static final int DEFAULT_GENERIC_CACHE_SIZE = 1024;

    private boolean strictMode = true;
    private boolean allowUnsafe = true;
    private boolean checkOwnership = false;
    private boolean validateFfi = true;
    private boolean enableWarnings = true;
    private boolean testMode = false;
    // 进入 testMode 前的值
    private boolean savedStrictMode;
    private boolean savedEnableWarnings;
    private int maxErrors = DEFAULT_MAX_ERRORS;
    private int genericCacheSize = DEFAULT_GENERIC_CACHE_SIZE;

    public AnalyzerConfig() {
    }

    /** 测试用配置 */
    public static AnalyzerConfig forTesting() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setTestMode(true);
        return config;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public boolean isAllowUnsafe() {
        return allowUnsafe;
    }

    public void setAllowUnsafe(boolean allowUnsafe) {
        this.allowUnsafe = allowUnsafe;
    }

    public boolean isCheckOwnership() {
        return checkOwnership;
    }

    public void setCheckOwnership(boolean checkOwnership) {
        this.checkOwnership = checkOwnership;
    }

    public boolean isValidateFfi() {
        return validateFfi;
    }

    public void setValidateFfi(boolean validateFfi) {
        this.validateFfi = validateFfi;
    }

    public boolean isEnableWarnings() {
        return enableWarnings;
    }

    public void setEnableWarnings(boolean enableWarnings) {
        this.enableWarnings = enableWarnings;
    }

    public boolean isTestMode() {
        return testMode;
    }

    public void setTestMode(boolean testMode) {
        if (testMode == this.testMode) return;
        this.testMode = testMode;
        if (testMode) {
            savedStrictMode = strictMode;
            savedEnableWarnings = enableWarnings;
            strictMode = false;
            enableWarnings = true;
        } else {
            strictMode = savedStrictMode;
            enableWarnings = savedEnableWarnings;
        }
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public void setMaxErrors(int maxErrors) {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative");
        }
        this.maxErrors = maxErrors;
    }

    public int getGenericCacheSize() {
        return genericCacheSize;
    }

    public void setGenericCacheSize(int genericCacheSize) {
        if (genericCacheSize <= 0) {
            throw new IllegalArgumentException("genericCacheSize must be positive");
        }
        this.genericCacheSize = genericCacheSize;
    }
}
