package com.asthralang.compiler.analysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerConfigTest {

    @Test
    void testDefaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        assertTrue(config.isStrictMode());
        assertTrue(config.isEnableWarnings());
        assertFalse(config.isTestMode());
        assertEquals(AnalyzerConfig.DEFAULT_MAX_ERRORS, config.getMaxErrors());
    }

    @Test
    void testForTestingRelaxesStrictMode() {
        AnalyzerConfig config = AnalyzerConfig.forTesting();
        assertTrue(config.isTestMode());
        assertFalse(config.isStrictMode());
        assertTrue(config.isEnableWarnings());
    }

    @Test
    void testLeavingTestModeRestoresPreviousValues() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setEnableWarnings(false);
        config.setTestMode(true);
        assertFalse(config.isStrictMode());
        assertTrue(config.isEnableWarnings());

        config.setTestMode(false);
        assertTrue(config.isStrictMode());
        assertFalse(config.isEnableWarnings());
    }

    @Test
    void testRepeatedTestModeKeepsSavedValues() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setTestMode(true);
        // 重复进入不能把已放宽的值当作原值保存
        config.setTestMode(true);
        config.setTestMode(false);
        assertTrue(config.isStrictMode());
    }

    @Test
    void testInvalidLimits() {
        AnalyzerConfig config = new AnalyzerConfig();
        assertThrows(IllegalArgumentException.class, () -> config.setMaxErrors(-1));
        assertThrows(IllegalArgumentException.class, () -> config.setGenericCacheSize(0));
    }
}
