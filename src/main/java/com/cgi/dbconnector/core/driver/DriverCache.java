package com.cgi.dbconnector.core.driver;

import java.util.Set;
import java.util.function.Function;

/**
 * Cache of loaded driver handles.
 */
public interface DriverCache {
    /**
     * Returns the cached handle for the key, loading and storing it when absent.
     * The lookup and the load happen atomically. A loader that throws or returns
     * null leaves the cache unchanged.
     *
     * @param key Registry key
     * @param loader Creates the handle on a cache miss
     * @return The cached or newly loaded handle
     */
    DriverHandle getOrLoad(RegistryKey key, Function<RegistryKey, DriverHandle> loader);

    boolean contains(RegistryKey key);

    Set<RegistryKey> keys();
}
