package com.asthralang.compiler.analysis.types;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 泛型实例化缓存：结构相同的 (base, args) 共享同一个 {@link GenericInstanceType}。
 *
 * <p>缓存对每个实例持有一个引用，条目被淘汰或清空时释放。
 * 移除回调在调用线程同步执行，保证 {@link #clear()} 返回后引用已归还。</p>
 */
public final class GenericInstanceCache {

    private static final Logger log = LoggerFactory.getLogger(GenericInstanceCache.class);

    private final Cache<InstanceKey, GenericInstanceType> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public GenericInstanceCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .removalListener((InstanceKey key, GenericInstanceType value, RemovalCause cause) -> {
                    if (value != null && !value.isReleased()) {
                        value.release();
                    }
                })
                .recordStats()
                .build();
    }

    /**
     * 取得或创建 base&lt;args&gt; 的共享实例
     */
    public GenericInstanceType getOrCreate(TypeDescriptor base, List<TypeDescriptor> args) {
        InstanceKey key = new InstanceKey(base, args);
        return cache.get(key, k -> {
            GenericInstanceType created = TypeDescriptors.createGenericInstance(base, args);
            created.retain();
            if (log.isDebugEnabled()) {
                log.debug("泛型实例化缓存未命中: {}", created.toDisplayString());
            }
            return created;
        });
    }

    public long size() {
        return cache.estimatedSize();
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();  // 立即清理
    }

    /**
     * 结构化缓存键
     */
    private static final class InstanceKey {
        private final TypeDescriptor base;
        private final List<TypeDescriptor> args;
        private final int hash;

        InstanceKey(TypeDescriptor base, List<TypeDescriptor> args) {
            this.base = base;
            this.args = args != null
                    ? Collections.unmodifiableList(new ArrayList<>(args))
                    : Collections.<TypeDescriptor>emptyList();
            this.hash = 31 * base.hashCode() + this.args.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof InstanceKey)) return false;
            InstanceKey that = (InstanceKey) o;
            return base.equals(that.base) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
