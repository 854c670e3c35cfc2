package com.asthralang.compiler.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 单个词法作用域的符号表：拉链法哈希桶 + 父作用域链。
 *
 * <p>桶数组始终为 2 的幂，负载因子超过 0.75 时扩容。读写锁保护桶数组，
 * 允许多个线程并发查找；同一作用域的写入由调用方串行化。</p>
 */
public final class SymbolTable {

    private static final int DEFAULT_CAPACITY = 16;
    private static final float LOAD_FACTOR = 0.75f;

    private final SymbolTable parent;
    private final int scopeId;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger count = new AtomicInteger();

    private Entry[] buckets;
    private Entry insertionHead;   // 插入顺序链
    private Entry insertionTail;

    private static final class Entry {
        final String name;
        final Symbol symbol;
        final int hash;
        Entry next;         // 桶内链
        Entry after;        // 插入顺序
        Entry before;

        Entry(String name, Symbol symbol, int hash) {
            this.name = name;
            this.symbol = symbol;
            this.hash = hash;
        }
    }

    public SymbolTable(int initialBucketCount) {
        this(initialBucketCount, null, 0);
    }

    public SymbolTable(int initialBucketCount, SymbolTable parent, int scopeId) {
        this.parent = parent;
        this.scopeId = scopeId;
        this.buckets = new Entry[tableSizeFor(initialBucketCount)];
    }

    private static int tableSizeFor(int requested) {
        int n = Math.max(requested, 1);
        int size = Integer.highestOneBit(n);
        if (size < n) size <<= 1;
        return Math.max(size, 2);
    }

    private static int hash(String name) {
        int h = name.hashCode();
        return h ^ (h >>> 16);
    }

    /** 创建子作用域 */
    public SymbolTable createChild(int childScopeId) {
        return new SymbolTable(DEFAULT_CAPACITY, this, childScopeId);
    }

    public SymbolTable getParent() {
        return parent;
    }

    public int getScopeId() {
        return scopeId;
    }

    public boolean isGlobal() {
        return parent == null;
    }

    /**
     * 插入符号；同名符号已在本表中时返回 false。
     * 父作用域中的同名符号不影响插入（遮蔽）。
     */
    public boolean insert(String name, Symbol symbol) {
        if (name == null || symbol == null) return false;
        int h = hash(name);
        lock.writeLock().lock();
        try {
            int idx = h & (buckets.length - 1);
            for (Entry e = buckets[idx]; e != null; e = e.next) {
                if (e.hash == h && e.name.equals(name)) return false;
            }
            Entry entry = new Entry(name, symbol, h);
            entry.next = buckets[idx];
            buckets[idx] = entry;
            linkLast(entry);
            symbol.setScopeId(scopeId);
            if (count.incrementAndGet() > buckets.length * LOAD_FACTOR) {
                resize();
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void linkLast(Entry entry) {
        if (insertionTail == null) {
            insertionHead = entry;
        } else {
            insertionTail.after = entry;
            entry.before = insertionTail;
        }
        insertionTail = entry;
    }

    private void unlink(Entry entry) {
        if (entry.before == null) insertionHead = entry.after;
        else entry.before.after = entry.after;
        if (entry.after == null) insertionTail = entry.before;
        else entry.after.before = entry.before;
    }

    private void resize() {
        Entry[] old = buckets;
        Entry[] grown = new Entry[old.length << 1];
        int mask = grown.length - 1;
        for (Entry head : old) {
            Entry e = head;
            while (e != null) {
                Entry next = e.next;
                int idx = e.hash & mask;
                e.next = grown[idx];
                grown[idx] = e;
                e = next;
            }
        }
        buckets = grown;
    }

    /** 仅查找本表 */
    public Symbol lookup(String name) {
        if (name == null) return null;
        int h = hash(name);
        lock.readLock().lock();
        try {
            for (Entry e = buckets[h & (buckets.length - 1)]; e != null; e = e.next) {
                if (e.hash == h && e.name.equals(name)) return e.symbol;
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** 从本表向外逐层查找，内层优先 */
    public Symbol resolve(String name) {
        for (SymbolTable t = this; t != null; t = t.parent) {
            Symbol s = t.lookup(name);
            if (s != null) return s;
        }
        return null;
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    /** 移除本表中的符号，不释放其类型 */
    public boolean remove(String name) {
        if (name == null) return false;
        int h = hash(name);
        lock.writeLock().lock();
        try {
            int idx = h & (buckets.length - 1);
            Entry prev = null;
            for (Entry e = buckets[idx]; e != null; prev = e, e = e.next) {
                if (e.hash == h && e.name.equals(name)) {
                    if (prev == null) buckets[idx] = e.next;
                    else prev.next = e.next;
                    unlink(e);
                    count.decrementAndGet();
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** 桶数量 */
    public int capacity() {
        lock.readLock().lock();
        try {
            return buckets.length;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return count.get();
    }

    /** 按插入顺序的快照 */
    public List<Symbol> symbols() {
        lock.readLock().lock();
        try {
            List<Symbol> result = new ArrayList<>(count.get());
            for (Entry e = insertionHead; e != null; e = e.after) {
                result.add(e.symbol);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** 作用域销毁：归还所有符号持有的类型并清空 */
    void destroy() {
        List<Symbol> snapshot = symbols();
        lock.writeLock().lock();
        try {
            buckets = new Entry[buckets.length];
            insertionHead = null;
            insertionTail = null;
            count.set(0);
        } finally {
            lock.writeLock().unlock();
        }
        for (Symbol s : snapshot) {
            s.releaseType();
        }
    }
}
