package com.asthralang.compiler.analysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 分析器运行统计，全部原子计数
 */
public final class AnalysisStatistics {
    private final AtomicLong nodesAnalyzed = new AtomicLong();
    private final AtomicLong typesChecked = new AtomicLong();
    private final AtomicLong symbolsResolved = new AtomicLong();
    private final AtomicLong errorsFound = new AtomicLong();
    private final AtomicLong warningsIssued = new AtomicLong();
    private final AtomicLong maxScopeDepth = new AtomicLong();
    private final AtomicLong currentScopeDepth = new AtomicLong();

    public void incrementNodesAnalyzed() { nodesAnalyzed.incrementAndGet(); }
    public void incrementTypesChecked() { typesChecked.incrementAndGet(); }
    public void incrementSymbolsResolved() { symbolsResolved.incrementAndGet(); }
    public void incrementErrorsFound() { errorsFound.incrementAndGet(); }
    public void incrementWarningsIssued() { warningsIssued.incrementAndGet(); }

    /** 进入作用域，返回新深度 */
    public long enterScope() {
        long depth = currentScopeDepth.incrementAndGet();
        maxScopeDepth.accumulateAndGet(depth, Math::max);
        return depth;
    }

    public long exitScope() {
        return currentScopeDepth.decrementAndGet();
    }

    public long getNodesAnalyzed() { return nodesAnalyzed.get(); }
    public long getTypesChecked() { return typesChecked.get(); }
    public long getSymbolsResolved() { return symbolsResolved.get(); }
    public long getErrorsFound() { return errorsFound.get(); }
    public long getWarningsIssued() { return warningsIssued.get(); }
    public long getMaxScopeDepth() { return maxScopeDepth.get(); }
    public long getCurrentScopeDepth() { return currentScopeDepth.get(); }

    /** 当前值的独立副本 */
    public AnalysisStatistics snapshot() {
        AnalysisStatistics copy = new AnalysisStatistics();
        copy.nodesAnalyzed.set(nodesAnalyzed.get());
        copy.typesChecked.set(typesChecked.get());
        copy.symbolsResolved.set(symbolsResolved.get());
        copy.errorsFound.set(errorsFound.get());
        copy.warningsIssued.set(warningsIssued.get());
        copy.maxScopeDepth.set(maxScopeDepth.get());
        copy.currentScopeDepth.set(currentScopeDepth.get());
        return copy;
    }

    public void reset() {
        nodesAnalyzed.set(0);
        typesChecked.set(0);
        symbolsResolved.set(0);
        errorsFound.set(0);
        warningsIssued.set(0);
        maxScopeDepth.set(0);
        currentScopeDepth.set(0);
    }

    @Override
    public String toString() {
        return "nodes=" + nodesAnalyzed + ", types=" + typesChecked
                + ", symbols=" + symbolsResolved + ", errors=" + errorsFound
                + ", warnings=" + warningsIssued + ", maxDepth=" + maxScopeDepth;
    }
}
