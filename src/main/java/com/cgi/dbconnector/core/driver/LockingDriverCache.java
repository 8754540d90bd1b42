package com.cgi.dbconnector.core.driver;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link DriverCache} guarded by a single lock around the whole check-then-load sequence.
 */
public class LockingDriverCache implements DriverCache {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<RegistryKey, DriverHandle> handles = new HashMap<>();

    @Override
    public DriverHandle getOrLoad(RegistryKey key, Function<RegistryKey, DriverHandle> loader) {
        lock.lock();
        try {
            DriverHandle handle = handles.get(key);
            if (handle != null) {
                return handle;
            }
            handle = loader.apply(key);
            if (handle != null) {
                handles.put(key, handle);
            }
            return handle;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(RegistryKey key) {
        lock.lock();
        try {
            return handles.get(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<RegistryKey> keys() {
        lock.lock();
        try {
            return Set.copyOf(handles.keySet());
        } finally {
            lock.unlock();
        }
    }
}
