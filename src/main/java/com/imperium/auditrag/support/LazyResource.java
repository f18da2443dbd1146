package com.imperium.auditrag.support;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 只初始化一次的懒加载容器（double-checked locking）。
 * <p>
 * 并发首次访问时只会执行一次 initializer；初始化抛出异常时不缓存失败，下次访问重试。
 * 初始化成功后的值视为只读、可在线程间自由共享。
 */
public final class LazyResource<T> {

    private final String name;
    private final Supplier<T> initializer;
    private final Object lock = new Object();

    private volatile T value;

    public LazyResource(String name, Supplier<T> initializer) {
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    public T get() {
        T current = value;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            current = value;
            if (current == null) {
                current = Objects.requireNonNull(initializer.get(), () -> name + " initializer returned null");
                value = current;
            }
            return current;
        }
    }

    public boolean isInitialized() {
        return value != null;
    }
}
