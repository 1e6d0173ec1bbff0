package com.jay.dossier.store;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per ticker. Writes for the same ticker run one at a time; different tickers never wait
 * on each other.
 */
@Component
public class TickerLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String ticker, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(ticker.toUpperCase(Locale.ROOT), k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String ticker, Runnable work) {
        withLock(ticker, () -> {
            work.run();
            return null;
        });
    }

    /** Waits for every in-flight write to finish by taking each lock once. */
    public void drain() {
        locks.values().forEach(lock -> {
            lock.lock();
            lock.unlock();
        });
    }
}
