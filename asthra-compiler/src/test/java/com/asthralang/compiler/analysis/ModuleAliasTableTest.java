package com.asthralang.compiler.analysis;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ModuleAliasTableTest {

    @Test
    void testRegisterAndResolve() {
        ModuleAliasTable table = new ModuleAliasTable();
        assertTrue(table.registerAlias("io", "stdlib/io"));
        assertEquals("stdlib/io", table.resolveAlias("io"));
        assertTrue(table.hasAlias("io"));
        assertFalse(table.hasAlias("fs"));
        assertNull(table.resolveAlias("fs"));
        assertEquals(1, table.size());
    }

    @Test
    void testDuplicateAliasKeepsFirst() {
        ModuleAliasTable table = new ModuleAliasTable();
        assertTrue(table.registerAlias("io", "stdlib/io"));
        assertFalse(table.registerAlias("io", "vendor/io"));
        assertEquals("stdlib/io", table.resolveAlias("io"));
    }

    @Test
    void testNullArguments() {
        ModuleAliasTable table = new ModuleAliasTable();
        assertFalse(table.registerAlias(null, "stdlib/io"));
        assertFalse(table.registerAlias("io", null));
        assertNull(table.resolveAlias(null));
        assertFalse(table.hasAlias(null));
    }

    @Test
    void testClear() {
        ModuleAliasTable table = new ModuleAliasTable();
        table.registerAlias("io", "stdlib/io");
        table.registerAlias("fs", "stdlib/fs");
        table.clearAliases();
        assertEquals(0, table.size());
        assertFalse(table.hasAlias("io"));
    }

    @Test
    void testConcurrentRegistrationHasSingleWinner() throws Exception {
        final ModuleAliasTable table = new ModuleAliasTable();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> futures = new ArrayList<Future<Boolean>>();
            for (int i = 0; i < 32; i++) {
                final String path = "stdlib/mod" + i;
                futures.add(pool.submit(new Callable<Boolean>() {
                    @Override
                    public Boolean call() {
                        return table.registerAlias("shared", path);
                    }
                }));
            }
            int winners = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertEquals(1, winners);
            assertEquals(1, table.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testSharedBetweenAnalyzers() {
        ModuleAliasTable shared = new ModuleAliasTable();
        try (SemanticAnalyzer first = new SemanticAnalyzer(AnalyzerConfig.forTesting(), shared);
             SemanticAnalyzer second = new SemanticAnalyzer(AnalyzerConfig.forTesting(), shared)) {
            first.getAliasTable().registerAlias("net", "stdlib/net");
            assertSame(shared, second.getAliasTable());
            assertEquals("stdlib/net", second.getAliasTable().resolveAlias("net"));
        }
    }
}
